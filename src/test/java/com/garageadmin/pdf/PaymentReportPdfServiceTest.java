package com.garageadmin.pdf;

import com.garageadmin.model.Worker;
import com.garageadmin.model.WorkerPayment;
import com.garageadmin.repository.WorkerPaymentRepository;
import com.garageadmin.repository.WorkerRepository;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PaymentReportPdfServiceTest {

    private final WorkerRepository workerRepository = mock(WorkerRepository.class);
    private final WorkerPaymentRepository paymentRepository = mock(WorkerPaymentRepository.class);

    // 2025-02-03 09:00 in Kigali (UTC+2)
    private final Clock clock = Clock.fixed(Instant.parse("2025-02-03T07:00:00Z"), ZoneId.of("Africa/Kigali"));

    private final PaymentReportPdfService service =
            new PaymentReportPdfService(workerRepository, paymentRepository, clock);

    @Test
    void render_listsPaymentsAndTotal() throws Exception {
        Worker w = new Worker();
        w.setId(4L);
        w.setName("Eric  Mugisha");
        w.setJobTitle("Mechanic");
        when(workerRepository.findById(4L)).thenReturn(Optional.of(w));
        when(paymentRepository.findHistory(4L)).thenReturn(List.of(
                payment("2000", LocalDateTime.of(2025, 1, 31, 17, 45), "cash", null),
                payment("1000.5", null, null, "advance")));

        RenderedPdf pdf = service.render(4L);

        assertThat(pdf.getFilename()).isEqualTo("Eric_Mugisha_payments.pdf");
        String text;
        try (PDDocument doc = PDDocument.load(pdf.getContent())) {
            text = new PDFTextStripper().getText(doc);
        }
        assertThat(text)
                .contains("Worker Payment Report")
                .contains("(ID: 4)")
                .contains("Job Title: Mechanic")
                .doesNotContain("Phone:")
                .contains("Generated: 2025-02-03 09:00")
                .contains("2025-01-31 17:45")
                .contains("2,000.00")
                .contains("1,000.50")
                .contains("advance")
                .contains("Total Paid: 3,000.50");
    }

    @Test
    void fileName_fallsBackForNamelessWorker() {
        assertThat(PaymentReportPdfService.fileName(new Worker())).isEqualTo("worker_payments.pdf");
    }

    private static WorkerPayment payment(String amount, LocalDateTime date, String method, String notes) {
        WorkerPayment p = new WorkerPayment();
        p.setAmount(new BigDecimal(amount));
        p.setPaymentDate(date);
        p.setMethod(method);
        p.setNotes(notes);
        return p;
    }
}
