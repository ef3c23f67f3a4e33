package com.airbooking.booking.repository;

import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.model.Flight;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.time.LocalDateTime;

public final class FlightSpecification {

    private FlightSpecification() {
    }

    public static Specification<Flight> searchable(String origin, String destination, LocalDate date) {
        return Specification
                .where(hasStatus(FlightStatus.ACTIVE))
                .and(hasOrigin(origin))
                .and(hasDestination(destination))
                .and(hasDepartureDate(date));
    }

    public static Specification<Flight> hasOrigin(String origin) {
        return (root, query, cb) -> {
            if (!StringUtils.hasText(origin)) {
                return null;
            }
            return cb.equal(cb.upper(root.get("origin")), origin.trim().toUpperCase());
        };
    }

    public static Specification<Flight> hasDestination(String destination) {
        return (root, query, cb) -> {
            if (!StringUtils.hasText(destination)) {
                return null;
            }
            return cb.equal(cb.upper(root.get("destination")), destination.trim().toUpperCase());
        };
    }

    public static Specification<Flight> hasDepartureDate(LocalDate date) {
        return (root, query, cb) -> {
            if (date == null) {
                return null;
            }
            LocalDateTime startOfDay = date.atStartOfDay();
            LocalDateTime nextDay = date.plusDays(1).atStartOfDay();
            return cb.and(
                    cb.greaterThanOrEqualTo(root.get("departureTime"), startOfDay),
                    cb.lessThan(root.get("departureTime"), nextDay));
        };
    }

    public static Specification<Flight> hasStatus(FlightStatus status) {
        return (root, query, cb) -> {
            if (status == null) {
                return null;
            }
            return cb.equal(root.get("status"), status);
        };
    }
}
