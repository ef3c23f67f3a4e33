package com.airbooking.booking.controller.v1.admin;

import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.dto.FlightBoard;
import com.airbooking.booking.dto.FlightEntry;
import com.airbooking.booking.dto.FlightRequest;
import com.airbooking.booking.dto.FlightUpdateRequest;
import com.airbooking.booking.service.AccessGuard;
import com.airbooking.booking.service.FlightService;
import com.airbooking.booking.service.ReportingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/admin/flights")
@RequiredArgsConstructor
@Slf4j
public class AdminFlightController {

    private final FlightService flightService;
    private final ReportingService reportingService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<FlightBoard> board(CallerIdentity caller, @RequestParam(required = false) Integer limit) {
        accessGuard.requireAgent(caller);
        log.debug("GET /v1/admin/flights - limit={}", limit);
        return ResponseEntity.ok(reportingService.flightBoard(limit));
    }

    @PostMapping
    public ResponseEntity<FlightEntry> create(CallerIdentity caller, @Valid @RequestBody FlightRequest request) {
        accessGuard.requireAgent(caller);
        log.info("POST /v1/admin/flights - route={}->{}, aircraft={}",
                request.getOrigin(), request.getDestination(), request.getAircraftId());
        return ResponseEntity.status(HttpStatus.CREATED).body(flightService.create(request));
    }

    @PutMapping("/{flightId}")
    public ResponseEntity<FlightEntry> update(CallerIdentity caller, @PathVariable Long flightId,
                                              @Valid @RequestBody FlightUpdateRequest request) {
        accessGuard.requireAgent(caller);
        log.info("PUT /v1/admin/flights/{}", flightId);
        return ResponseEntity.ok(flightService.update(flightId, request));
    }

    @DeleteMapping("/{flightId}")
    public ResponseEntity<Void> delete(CallerIdentity caller, @PathVariable Long flightId) {
        accessGuard.requireAgent(caller);
        log.info("DELETE /v1/admin/flights/{}", flightId);
        flightService.delete(flightId);
        return ResponseEntity.noContent().build();
    }
}
