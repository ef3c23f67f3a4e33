package com.airbooking.booking.controller.v1.admin;

import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.dto.FlightSummary;
import com.airbooking.booking.dto.StatsOverview;
import com.airbooking.booking.dto.WeeklyBookings;
import com.airbooking.booking.service.AccessGuard;
import com.airbooking.booking.service.ReportingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminStatsController {

    private final ReportingService reportingService;
    private final AccessGuard accessGuard;

    @GetMapping("/stats/overview")
    public ResponseEntity<StatsOverview> overview(CallerIdentity caller) {
        accessGuard.requireAgent(caller);
        log.debug("GET /v1/admin/stats/overview");
        return ResponseEntity.ok(reportingService.overview());
    }

    @GetMapping("/stats/weekly-bookings")
    public ResponseEntity<WeeklyBookings> weeklyBookings(CallerIdentity caller) {
        accessGuard.requireAgent(caller);
        log.debug("GET /v1/admin/stats/weekly-bookings");
        return ResponseEntity.ok(reportingService.weeklyBookings());
    }

    @GetMapping("/flights/summary")
    public ResponseEntity<FlightSummary> flightSummary(
            CallerIdentity caller,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        accessGuard.requireAgent(caller);
        log.debug("GET /v1/admin/flights/summary - date={}", date);
        return ResponseEntity.ok(reportingService.flightSummary(date));
    }
}
