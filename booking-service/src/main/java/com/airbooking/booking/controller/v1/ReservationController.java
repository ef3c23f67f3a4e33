package com.airbooking.booking.controller.v1;

import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.dto.ReservationEntry;
import com.airbooking.booking.dto.ReservationRequest;
import com.airbooking.booking.service.ReservationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/reservations")
@RequiredArgsConstructor
@Slf4j
public class ReservationController {

    private final ReservationService reservationService;

    @PostMapping
    public ResponseEntity<ReservationEntry> create(CallerIdentity caller,
                                                   @Valid @RequestBody ReservationRequest request) {
        log.info("POST /v1/reservations - flight={}, seats={}, user={}",
                request.getFlightId(), request.getSeats(), caller.userId());

        ReservationEntry entry = reservationService.create(request.getFlightId(), request.getSeats(), caller.userId());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping("/{reservationId}")
    public ResponseEntity<ReservationEntry> findById(CallerIdentity caller, @PathVariable Long reservationId) {
        log.debug("GET /v1/reservations/{} - user={}", reservationId, caller.userId());
        return ResponseEntity.ok(reservationService.findForOwner(reservationId, caller.userId()));
    }

    @GetMapping
    public ResponseEntity<List<ReservationEntry>> findMine(CallerIdentity caller) {
        log.debug("GET /v1/reservations - user={}", caller.userId());
        return ResponseEntity.ok(reservationService.findByOwner(caller.userId()));
    }
}
