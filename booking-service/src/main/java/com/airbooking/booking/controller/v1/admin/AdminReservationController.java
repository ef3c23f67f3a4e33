package com.airbooking.booking.controller.v1.admin;

import com.airbooking.booking.dto.AdminPaymentRequest;
import com.airbooking.booking.dto.AdminReservationRequest;
import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.dto.PaymentEntry;
import com.airbooking.booking.dto.RecentReservationEntry;
import com.airbooking.booking.dto.ReservationEntry;
import com.airbooking.booking.dto.ReservationUpdateRequest;
import com.airbooking.booking.service.AccessGuard;
import com.airbooking.booking.service.PaymentService;
import com.airbooking.booking.service.ReportingService;
import com.airbooking.booking.service.ReservationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/admin/reservations")
@RequiredArgsConstructor
@Slf4j
public class AdminReservationController {

    private final ReservationService reservationService;
    private final PaymentService paymentService;
    private final ReportingService reportingService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<List<ReservationEntry>> list(CallerIdentity caller) {
        accessGuard.requireAgent(caller);
        log.debug("GET /v1/admin/reservations");
        return ResponseEntity.ok(reservationService.listAll());
    }

    @GetMapping("/recent")
    public ResponseEntity<List<RecentReservationEntry>> recent(CallerIdentity caller,
                                                               @RequestParam(required = false) Integer limit) {
        accessGuard.requireAgent(caller);
        log.debug("GET /v1/admin/reservations/recent - limit={}", limit);
        return ResponseEntity.ok(reportingService.recentReservations(limit));
    }

    @PostMapping
    public ResponseEntity<ReservationEntry> create(CallerIdentity caller,
                                                   @Valid @RequestBody AdminReservationRequest request) {
        accessGuard.requireAgent(caller);
        log.info("POST /v1/admin/reservations - flight={}, seats={}, user={}, agent={}",
                request.getFlightId(), request.getSeats(), request.getUserId(), caller.userId());

        ReservationEntry entry = reservationService.create(request.getFlightId(), request.getSeats(), request.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @PutMapping("/{reservationId}")
    public ResponseEntity<ReservationEntry> amend(CallerIdentity caller, @PathVariable Long reservationId,
                                                  @Valid @RequestBody ReservationUpdateRequest request) {
        accessGuard.requireAgent(caller);
        log.info("PUT /v1/admin/reservations/{} - seats={}, status={}",
                reservationId, request.getSeats(), request.getStatus());
        return ResponseEntity.ok(reservationService.amend(reservationId, request.getSeats(), request.getStatus()));
    }

    @PostMapping("/{reservationId}/confirm")
    public ResponseEntity<ReservationEntry> confirm(CallerIdentity caller, @PathVariable Long reservationId) {
        accessGuard.requireAgent(caller);
        log.info("POST /v1/admin/reservations/{}/confirm", reservationId);
        return ResponseEntity.ok(reservationService.confirm(reservationId));
    }

    @PostMapping("/{reservationId}/cancel")
    public ResponseEntity<ReservationEntry> cancel(CallerIdentity caller, @PathVariable Long reservationId) {
        accessGuard.requireAgent(caller);
        log.info("POST /v1/admin/reservations/{}/cancel", reservationId);
        return ResponseEntity.ok(reservationService.cancel(reservationId));
    }

    @PostMapping("/{reservationId}/payment")
    public ResponseEntity<PaymentEntry> pay(CallerIdentity caller, @PathVariable Long reservationId,
                                            @RequestBody(required = false) AdminPaymentRequest request) {
        accessGuard.requireAgent(caller);
        log.info("POST /v1/admin/reservations/{}/payment - agent={}", reservationId, caller.userId());

        String settlementReference = request != null ? request.getSettlementReference() : null;
        PaymentEntry entry = paymentService.payAsAgent(reservationId, settlementReference);
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }
}
