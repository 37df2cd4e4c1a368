package com.garageadmin.service;

import com.garageadmin.dto.PaymentRequest;
import com.garageadmin.dto.WorkerPaymentsDto;
import com.garageadmin.dto.WorkerRequest;
import com.garageadmin.exception.NotFoundException;
import com.garageadmin.model.Worker;
import com.garageadmin.model.WorkerPayment;
import com.garageadmin.repository.RepairServiceRepository;
import com.garageadmin.repository.WorkerPaymentRepository;
import com.garageadmin.repository.WorkerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/** Workers and the payment ledger kept for each of them. */
@Service
@Slf4j
public class WorkerService {

    private final WorkerRepository workerRepository;
    private final WorkerPaymentRepository paymentRepository;
    private final RepairServiceRepository repairServiceRepository;
    private final Clock clock;

    public WorkerService(WorkerRepository workerRepository,
                         WorkerPaymentRepository paymentRepository,
                         RepairServiceRepository repairServiceRepository,
                         Clock clock) {
        this.workerRepository = workerRepository;
        this.paymentRepository = paymentRepository;
        this.repairServiceRepository = repairServiceRepository;
        this.clock = clock;
    }

    public List<Worker> list() {
        return workerRepository.findAllByOrderByNameAsc();
    }

    public Worker get(Long id) {
        return workerRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Worker not found"));
    }

    @Transactional(rollbackFor = Exception.class)
    public Worker create(WorkerRequest request) {
        Worker worker = new Worker();
        apply(worker, request);
        return workerRepository.save(worker);
    }

    @Transactional(rollbackFor = Exception.class)
    public Worker update(Long id, WorkerRequest request) {
        Worker worker = get(id);
        apply(worker, request);
        return workerRepository.save(worker);
    }

    /**
     * Unassigns the worker's services, drops its payments, then the worker
     * itself. Nothing is kept if the worker turns out not to exist.
     */
    @Transactional(rollbackFor = Exception.class)
    public void delete(Long id) {
        int unassigned = repairServiceRepository.unassignWorker(id);
        int payments = paymentRepository.deleteByWorker(id);
        if (workerRepository.deleteWorker(id) == 0) {
            throw new NotFoundException("Worker not found");
        }
        log.info("Worker {} deleted ({} service(s) unassigned, {} payment(s) removed)", id, unassigned, payments);
    }

    // --------------------------------------------------------------- ledger

    @Transactional(rollbackFor = Exception.class)
    public WorkerPayment addPayment(Long workerId, PaymentRequest request) {
        if (!workerRepository.existsById(workerId)) {
            throw new NotFoundException("Worker not found");
        }
        WorkerPayment payment = new WorkerPayment();
        payment.setWorkerId(workerId);
        payment.setAmount(request.getAmount());
        payment.setMethod(request.getMethod());
        payment.setNotes(request.getNotes());
        LocalDateTime paidAt = parsePaymentDate(request.getPaymentDate(), clock.getZone());
        payment.setPaymentDate(paidAt != null ? paidAt : LocalDateTime.now(clock));

        payment = paymentRepository.save(payment);
        log.info("Recorded payment {} of {} for worker {}", payment.getId(), payment.getAmount(), workerId);
        return payment;
    }

    @Transactional(readOnly = true)
    public WorkerPaymentsDto payments(Long workerId) {
        Worker worker = get(workerId);
        return new WorkerPaymentsDto(worker, paymentRepository.findHistory(workerId), totalPaid(workerId));
    }

    /** Sum of every payment recorded for the worker; zero when there are none. */
    @Transactional(readOnly = true)
    public BigDecimal totalPaid(Long workerId) {
        return paymentRepository.sumAmountByWorkerId(workerId);
    }

    private void apply(Worker worker, WorkerRequest request) {
        worker.setName(request.getName());
        worker.setJobTitle(request.getJobTitle());
        worker.setPhone(request.getPhone());
        worker.setEmail(request.getEmail());
    }

    /**
     * Accepts {@code 2024-05-01}, {@code 2024-05-01T10:15[:30]} or an offset
     * date-time, which is moved to {@code zone}. Returns null for anything else
     * so the caller stamps the current time.
     */
    static LocalDateTime parsePaymentDate(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        List<Function<String, LocalDateTime>> parsers = List.of(
                s -> LocalDate.parse(s).atStartOfDay(),
                LocalDateTime::parse,
                s -> OffsetDateTime.parse(s).atZoneSameInstant(zone).toLocalDateTime()
        );
        DateTimeParseException last = null;
        for (Function<String, LocalDateTime> parser : parsers) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                last = e;
            }
        }
        log.warn("Unparseable payment_date '{}' ({}), using the current time", value, last.getMessage());
        return null;
    }
}
