package com.airbooking.booking.controller.v1;

import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.dto.PaymentEntry;
import com.airbooking.booking.dto.PaymentRequest;
import com.airbooking.booking.service.PaymentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping("/process")
    public ResponseEntity<PaymentEntry> process(CallerIdentity caller, @Valid @RequestBody PaymentRequest request) {
        log.info("POST /v1/payments/process - reservation={}, user={}", request.getReservationId(), caller.userId());

        PaymentEntry entry = paymentService.pay(request.getReservationId(), caller.userId(), request.getPhoneNumber());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping("/reservation/{reservationId}")
    public ResponseEntity<PaymentEntry> findByReservation(CallerIdentity caller, @PathVariable Long reservationId) {
        log.debug("GET /v1/payments/reservation/{} - user={}", reservationId, caller.userId());
        return ResponseEntity.ok(paymentService.findByReservation(reservationId, caller.userId()));
    }
}
