package com.garageadmin.pdf;

import com.garageadmin.exception.NotFoundException;
import com.garageadmin.model.Worker;
import com.garageadmin.model.WorkerPayment;
import com.garageadmin.repository.WorkerPaymentRepository;
import com.garageadmin.repository.WorkerRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/** "Worker Payment Report": the worker's ledger, newest payment first. */
@Service
public class PaymentReportPdfService {

    private static final float[] COLS = {50f, 180f, 280f, 380f};
    private static final float[] WIDTHS = {120f, 90f, 90f, 160f};

    private final WorkerRepository workerRepository;
    private final WorkerPaymentRepository paymentRepository;
    private final Clock clock;

    public PaymentReportPdfService(WorkerRepository workerRepository,
                                   WorkerPaymentRepository paymentRepository,
                                   Clock clock) {
        this.workerRepository = workerRepository;
        this.paymentRepository = paymentRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public RenderedPdf render(Long workerId) throws IOException {
        Worker worker = workerRepository.findById(workerId)
                .orElseThrow(() -> new NotFoundException("Worker not found"));
        List<WorkerPayment> payments = paymentRepository.findHistory(workerId);
        BigDecimal total = payments.stream()
                .map(p -> p.getAmount() == null ? BigDecimal.ZERO : p.getAmount())
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        try (PdfPageWriter pdf = new PdfPageWriter()) {
            pdf.font(PdfPageWriter.REGULAR, 18f);
            pdf.centered("Worker Payment Report");
            pdf.moveDown(0.5f);

            pdf.font(PdfPageWriter.REGULAR, 12f);
            pdf.text("Worker: " + (worker.getName() == null ? "" : worker.getName()) + " (ID: " + worker.getId() + ")");
            if (present(worker.getJobTitle())) pdf.text("Job Title: " + worker.getJobTitle());
            if (present(worker.getPhone())) pdf.text("Phone: " + worker.getPhone());
            if (present(worker.getEmail())) pdf.text("Email: " + worker.getEmail());
            pdf.text("Generated: " + MoneyFormat.dateTime(LocalDateTime.now(clock)));
            pdf.moveDown(1f);

            pdf.underlined("Payments");
            pdf.moveDown(0.5f);
            pdf.font(PdfPageWriter.REGULAR, 11f);
            pdf.row(COLS, WIDTHS, "Date/Time", "Amount", "Method", "Notes");
            pdf.moveDown(0.2f);
            pdf.rule();
            pdf.moveDown(0.4f);
            for (WorkerPayment p : payments) {
                pdf.row(COLS, WIDTHS,
                        MoneyFormat.dateTime(p.getPaymentDate()),
                        MoneyFormat.amount(p.getAmount()),
                        present(p.getMethod()) ? p.getMethod() : "-",
                        present(p.getNotes()) ? p.getNotes() : "-");
                pdf.moveDown(0.4f);
            }

            pdf.moveDown(1f);
            pdf.font(PdfPageWriter.REGULAR, 12f);
            pdf.rightAligned("Total Paid: " + MoneyFormat.amount(total));

            return new RenderedPdf(fileName(worker), pdf.toByteArray());
        }
    }

    static String fileName(Worker worker) {
        String name = present(worker.getName()) ? worker.getName() : "worker";
        return name.replaceAll("\\s+", "_") + "_payments.pdf";
    }

    private static boolean present(String s) {
        return s != null && !s.isBlank();
    }
}
