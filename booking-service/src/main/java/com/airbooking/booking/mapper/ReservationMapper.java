package com.airbooking.booking.mapper;

import com.airbooking.booking.constants.BookingConstants;
import com.airbooking.booking.dto.RecentReservationEntry;
import com.airbooking.booking.dto.ReservationEntry;
import com.airbooking.booking.model.AppUser;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.model.Reservation;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public final class ReservationMapper {

    private static final String UNKNOWN_PASSENGER = "Unknown";

    private ReservationMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ReservationEntry toEntry(Reservation reservation) {
        if (reservation == null) {
            return null;
        }

        Flight flight = reservation.getFlight();
        AppUser user = reservation.getUser();
        return ReservationEntry.builder()
                .id(reservation.getId())
                .userId(user != null ? user.getId() : null)
                .userName(user != null ? user.getName() : null)
                .flightId(flight != null ? flight.getId() : null)
                .origin(flight != null ? flight.getOrigin() : null)
                .destination(flight != null ? flight.getDestination() : null)
                .departureTime(flight != null ? flight.getDepartureTime() : null)
                .seats(reservation.getSeats())
                .serviceFee(reservation.getServiceFee())
                .totalAmount(reservation.getTotalAmount())
                .status(reservation.getStatus() != null ? reservation.getStatus().name() : null)
                .createdAt(reservation.getCreatedAt())
                .updatedAt(reservation.getUpdatedAt())
                .build();
    }

    public static List<ReservationEntry> toEntryList(List<Reservation> reservations) {
        return reservations.stream().map(ReservationMapper::toEntry).toList();
    }

    public static RecentReservationEntry toRecentEntry(Reservation reservation) {
        AppUser user = reservation.getUser();
        String passengerName = user != null && user.getName() != null && !user.getName().isBlank()
                ? user.getName() : UNKNOWN_PASSENGER;

        return RecentReservationEntry.builder()
                .id(reservation.getId())
                .passengerName(passengerName)
                .initials(initials(passengerName))
                .flightCode(flightCode(reservation))
                .seats(reservation.getSeats())
                .status(reservation.getStatus() != null ? reservation.getStatus().name() : null)
                .amount(reservation.getTotalAmount())
                .createdAt(reservation.getCreatedAt())
                .build();
    }

    /**
     * First letter of the first two name parts, upper-cased.
     */
    static String initials(String name) {
        return Arrays.stream(name.trim().split("\\s+"))
                .limit(2)
                .filter(part -> !part.isEmpty())
                .map(part -> part.substring(0, 1))
                .collect(Collectors.joining())
                .toUpperCase(Locale.ROOT);
    }

    /**
     * Synthetic code such as {@code GOM-KIN-012}: route prefixes plus the zero-padded reservation id.
     */
    static String flightCode(Reservation reservation) {
        Flight flight = reservation.getFlight();
        String number = String.format("%03d", reservation.getId());
        if (flight == null) {
            return number;
        }
        return prefix(flight.getOrigin()) + "-" + prefix(flight.getDestination()) + "-" + number;
    }

    public static String boardCode(Flight flight) {
        return BookingConstants.FLIGHT_CODE_PREFIX + String.format("%03d", flight.getId());
    }

    private static String prefix(String city) {
        String trimmed = city.trim();
        return trimmed.substring(0, Math.min(3, trimmed.length())).toUpperCase(Locale.ROOT);
    }
}
