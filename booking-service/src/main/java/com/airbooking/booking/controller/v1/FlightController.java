package com.airbooking.booking.controller.v1;

import com.airbooking.booking.dto.FlightEntry;
import com.airbooking.booking.dto.PageResponse;
import com.airbooking.booking.service.FlightService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/v1/flights")
@RequiredArgsConstructor
@Slf4j
public class FlightController {

    private final FlightService flightService;

    @GetMapping
    public ResponseEntity<PageResponse<FlightEntry>> search(
            @RequestParam(required = false) String origin,
            @RequestParam(required = false) String destination,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) String sort,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {

        log.debug("GET /v1/flights - origin={}, destination={}, date={}, sort={}, page={}, limit={}",
                origin, destination, date, sort, page, limit);
        return ResponseEntity.ok(flightService.search(origin, destination, date, sort, page, limit));
    }

    @GetMapping("/{flightId}")
    public ResponseEntity<FlightEntry> findById(@PathVariable Long flightId) {
        log.debug("GET /v1/flights/{}", flightId);
        return ResponseEntity.ok(flightService.getActiveFlight(flightId));
    }
}
