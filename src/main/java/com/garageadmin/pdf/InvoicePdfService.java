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
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class InvoicePdfService {

    private static final float[] COLS = {50f, 115f, 330f, 370f, 460f};
    private static final float[] WIDTHS = {60f, 210f, 35f, 85f, 85f};

    private final InvoiceRepository invoiceRepository;
    private final InvoiceItemRepository invoiceItemRepository;
    private final VehicleRepository vehicleRepository;
    private final InvoiceCalculator calculator;
    private final Path logoPath;

    public InvoicePdfService(InvoiceRepository invoiceRepository,
                             InvoiceItemRepository invoiceItemRepository,
                             VehicleRepository vehicleRepository,
                             InvoiceCalculator calculator,
                             GarageProperties properties) {
        this.invoiceRepository = invoiceRepository;
        this.invoiceItemRepository = invoiceItemRepository;
        this.vehicleRepository = vehicleRepository;
        this.calculator = calculator;
        this.logoPath = Paths.get(properties.getPdf().getLogoPath());
    }

    @Transactional(readOnly = true)
    public RenderedPdf render(Long invoiceId) throws IOException {
        Invoice invoice = invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new NotFoundException("Invoice not found"));
        Vehicle vehicle = vehicleRepository.findById(invoice.getVehicleId()).orElse(null);
        List<InvoiceItem> items = invoiceItemRepository.findByInvoiceIdOrderByIdAsc(invoiceId);

        int days = invoice.getDaysInGarage() == null ? 0 : invoice.getDaysInGarage();
        BigDecimal rate = invoice.getGarageStayRate() == null ? BigDecimal.ZERO : invoice.getGarageStayRate();
        BigDecimal subtotal = invoice.getSubtotal() == null ? BigDecimal.ZERO : invoice.getSubtotal();
        BigDecimal garageStay = calculator.garageStay(days, rate);
        BigDecimal tax = calculator.taxOn(subtotal);
        BigDecimal total = subtotal.add(tax);

        try (PdfPageWriter pdf = new PdfPageWriter()) {
            pdf.header("Invoice #" + invoice.getId(), logoPath);

            pdf.text("Vehicle Plate: " + orDash(vehicle == null ? null : vehicle.getPlate()));
            pdf.text("Customer: " + orDash(vehicle == null ? null : vehicle.getOwner()));
            if (vehicle != null) {
                if (present(vehicle.getContactNumber())) pdf.text("Contact: " + vehicle.getContactNumber());
                if (present(vehicle.getModelName())) pdf.text("Model: " + vehicle.getModelName());
                String makeYear = Stream.of(vehicle.getMake(), vehicle.getYear() == null ? null : vehicle.getYear().toString())
                        .filter(InvoicePdfService::present)
                        .collect(Collectors.joining(" • "));
                if (!makeYear.isEmpty()) pdf.text("Make/Year: " + makeYear);
                if (present(vehicle.getVin())) pdf.text("VIN: " + vehicle.getVin());
            }
            pdf.text("Days in Garage: " + days);
            pdf.text("Garage Stay Rate: " + MoneyFormat.rwf(rate));
            pdf.moveDown(0.8f);

            pdf.underlined("Items");
            pdf.moveDown(0.4f);
            pdf.font(PdfPageWriter.REGULAR, 11f);
            pdf.row(COLS, WIDTHS, "Type", "Description", "Qty", "Unit (RWF)", "Total (RWF)");
            pdf.moveDown(0.2f);
            pdf.rule();
            pdf.moveDown(0.4f);
            for (InvoiceItem item : items) {
                pdf.row(COLS, WIDTHS,
                        orDash(item.getItemType()),
                        orDash(item.getDescription()),
                        item.getQuantity() == null ? "" : item.getQuantity().toString(),
                        MoneyFormat.rwf(item.getUnitPrice()),
                        MoneyFormat.rwf(item.getTotal()));
                pdf.moveDown(0.3f);
            }

            pdf.moveDown(0.8f);
            pdf.font(PdfPageWriter.REGULAR, 12f);
            pdf.rightAligned("Garage Stay: " + MoneyFormat.rwf(garageStay));
            pdf.rightAligned("Subtotal: " + MoneyFormat.rwf(subtotal));
            pdf.rightAligned("Tax (" + calculator.taxLabel() + "): " + MoneyFormat.rwf(tax));
            pdf.font(PdfPageWriter.BOLD, 12f);
            pdf.rightAligned("Total: " + MoneyFormat.rwf(total));

            return new RenderedPdf("invoice_" + invoice.getId() + ".pdf", pdf.toByteArray());
        }
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }

    private static String orDash(String s) {
        return present(s) ? s : "-";
    }
}
