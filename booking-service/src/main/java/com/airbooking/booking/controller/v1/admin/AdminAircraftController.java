package com.airbooking.booking.controller.v1.admin;

import com.airbooking.booking.dto.AircraftEntry;
import com.airbooking.booking.dto.AircraftRequest;
import com.airbooking.booking.dto.AircraftUpdateRequest;
import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.service.AccessGuard;
import com.airbooking.booking.service.AircraftService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/admin/aircraft")
@RequiredArgsConstructor
@Slf4j
public class AdminAircraftController {

    private final AircraftService aircraftService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<List<AircraftEntry>> list(CallerIdentity caller) {
        accessGuard.requireAgent(caller);
        log.debug("GET /v1/admin/aircraft");
        return ResponseEntity.ok(aircraftService.list());
    }

    @PostMapping
    public ResponseEntity<AircraftEntry> create(CallerIdentity caller, @Valid @RequestBody AircraftRequest request) {
        accessGuard.requireAgent(caller);
        log.info("POST /v1/admin/aircraft - model={}, capacity={}", request.getModel(), request.getCapacity());
        return ResponseEntity.status(HttpStatus.CREATED).body(aircraftService.create(request));
    }

    @PutMapping("/{aircraftId}")
    public ResponseEntity<AircraftEntry> update(CallerIdentity caller, @PathVariable Long aircraftId,
                                                @Valid @RequestBody AircraftUpdateRequest request) {
        accessGuard.requireAgent(caller);
        log.info("PUT /v1/admin/aircraft/{} - capacity={}, status={}",
                aircraftId, request.getCapacity(), request.getStatus());
        return ResponseEntity.ok(aircraftService.update(aircraftId, request));
    }

    @DeleteMapping("/{aircraftId}")
    public ResponseEntity<Void> delete(CallerIdentity caller, @PathVariable Long aircraftId) {
        accessGuard.requireAgent(caller);
        log.info("DELETE /v1/admin/aircraft/{}", aircraftId);
        aircraftService.delete(aircraftId);
        return ResponseEntity.noContent().build();
    }
}
