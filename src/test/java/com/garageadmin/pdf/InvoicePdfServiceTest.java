package com.garageadmin.pdf;

import com.garageadmin.config.GarageProperties;
import com.garageadmin.exception.NotFoundException;
import com.garageadmin.model.Invoice;
import com.garageadmin.model.InvoiceItem;
import com.garageadmin.model.Vehicle;
import com.garageadmin.repository.InvoiceItemRepository;
import com.garageadmin.repository.InvoiceRepository;
import com.garageadmin.repository.VehicleRepository;
import com.garageadmin.service.InvoiceCalculator;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InvoicePdfServiceTest {

    private final InvoiceRepository invoiceRepository = mock(InvoiceRepository.class);
    private final InvoiceItemRepository itemRepository = mock(InvoiceItemRepository.class);
    private final VehicleRepository vehicleRepository = mock(VehicleRepository.class);

    private InvoicePdfService service;

    @BeforeEach
    void setUp() {
        GarageProperties props = new GarageProperties();
        props.getPdf().setLogoPath("no/such/logo.png");
        service = new InvoicePdfService(invoiceRepository, itemRepository, vehicleRepository,
                new InvoiceCalculator(props), props);

        Invoice invoice = new Invoice();
        invoice.setId(7L);
        invoice.setVehicleId(3L);
        invoice.setDaysInGarage(2);
        invoice.setGarageStayRate(new BigDecimal("5000.00"));
        invoice.setSubtotal(new BigDecimal("15000.00"));
        invoice.setTax(new BigDecimal("2700.00"));
        invoice.setTotal(new BigDecimal("17700.00"));
        invoice.setCreatedAt(LocalDateTime.of(2025, 2, 3, 9, 0));
        when(invoiceRepository.findById(7L)).thenReturn(Optional.of(invoice));

        Vehicle v = new Vehicle();
        v.setId(3L);
        v.setPlate("RAD 123 A");
        v.setOwner("Jean Uwase");
        v.setContactNumber("0788000000");
        v.setMake("Toyota");
        v.setYear(2015);
        v.setModelName("RAV4");
        when(vehicleRepository.findById(3L)).thenReturn(Optional.of(v));
    }

    @Test
    void render_containsMetadataItemsAndRecomputedTotals() throws Exception {
        when(itemRepository.findByInvoiceIdOrderByIdAsc(7L)).thenReturn(List.of(
                item("service", "Brake repair", 1, "3000", "3000"),
                item("part", "Brake pad", 2, "1000", "2000")));

        RenderedPdf pdf = service.render(7L);

        assertThat(pdf.getFilename()).isEqualTo("invoice_7.pdf");
        String text = text(pdf);
        assertThat(text)
                .contains("Invoice #7")
                .contains("Vehicle Plate: RAD 123 A")
                .contains("Customer: Jean Uwase")
                .contains("Contact: 0788000000")
                .contains("Model: RAV4")
                .contains("Days in Garage: 2")
                .contains("Garage Stay Rate: RWF 5,000")
                .contains("Brake repair")
                .contains("Brake pad")
                .contains("Garage Stay: RWF 10,000")
                .contains("Subtotal: RWF 15,000")
                .contains("Tax (18%): RWF 2,700")
                .contains("Total: RWF 17,700")
                .doesNotContain("VIN:");
        assertThat(text.indexOf("Brake repair")).isLessThan(text.indexOf("Brake pad"));
    }

    @Test
    void render_longItemListBreaksOntoNewPages() throws Exception {
        List<InvoiceItem> items = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            items.add(item("part", "Filter number " + i + " with a rather long description that needs wrapping",
                    1, "1000", "1000"));
        }
        when(itemRepository.findByInvoiceIdOrderByIdAsc(7L)).thenReturn(items);

        RenderedPdf pdf = service.render(7L);

        try (PDDocument doc = PDDocument.load(pdf.getContent())) {
            assertThat(doc.getNumberOfPages()).isGreaterThan(1);
            assertThat(new PDFTextStripper().getText(doc)).contains("Filter number 79");
        }
    }

    @Test
    void render_survivesCharactersOutsideTheStandardFont() throws Exception {
        when(itemRepository.findByInvoiceIdOrderByIdAsc(7L)).thenReturn(List.of(
                item("service", "Vidange 油 ✓", 1, "3000", "3000")));

        assertThat(text(service.render(7L))).contains("Vidange");
    }

    @Test
    void render_unknownInvoice_isNotFound() {
        when(invoiceRepository.findById(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.render(99L)).isInstanceOf(NotFoundException.class);
    }

    private static InvoiceItem item(String type, String description, int qty, String unit, String total) {
        InvoiceItem it = new InvoiceItem();
        it.setItemType(type);
        it.setDescription(description);
        it.setQuantity(qty);
        it.setUnitPrice(new BigDecimal(unit));
        it.setTotal(new BigDecimal(total));
        return it;
    }

    private static String text(RenderedPdf pdf) throws Exception {
        try (PDDocument doc = PDDocument.load(pdf.getContent())) {
            return new PDFTextStripper().getText(doc);
        }
    }
}
