package com.airbooking.booking.service;

import com.airbooking.booking.constants.BookingConstants;
import com.airbooking.booking.dto.FlightBoard;
import com.airbooking.booking.dto.FlightBoardEntry;
import com.airbooking.booking.dto.FlightSummary;
import com.airbooking.booking.dto.RecentReservationEntry;
import com.airbooking.booking.dto.StatsOverview;
import com.airbooking.booking.dto.WeeklyBookings;
import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.enums.ReservationStatus;
import com.airbooking.booking.exception.InvalidInputException;
import com.airbooking.booking.mapper.ReservationMapper;
import com.airbooking.booking.model.Aircraft;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.repository.FlightRepository;
import com.airbooking.booking.repository.PaymentRepository;
import com.airbooking.booking.repository.ReservationRepository;
import com.airbooking.booking.util.StatusLabels;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Dashboard figures, recomputed from persisted state on every call. Reads may trail
 * concurrent writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ReportingService {

    private final FlightRepository flightRepository;
    private final ReservationRepository reservationRepository;
    private final PaymentRepository paymentRepository;
    private final CapacityLedger capacityLedger;
    private final Clock clock;

    public StatsOverview overview() {
        BigDecimal revenue = paymentRepository.sumAmounts();
        return StatsOverview.builder()
                .activeFlights(flightRepository.countByStatus(FlightStatus.ACTIVE))
                .pendingReservations(reservationRepository.countByStatus(ReservationStatus.PENDING))
                .totalRevenue((revenue != null ? revenue : BigDecimal.ZERO)
                        .setScale(BookingConstants.MONEY_SCALE, RoundingMode.HALF_UP))
                .totalPassengers(reservationRepository.sumAllSeats())
                .build();
    }

    /**
     * Reservations created over the trailing seven days, bucketed Monday to Sunday.
     */
    public WeeklyBookings weeklyBookings() {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(BookingConstants.WEEKLY_WINDOW_DAYS);

        Map<DayOfWeek, Long> counts = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            counts.put(day, 0L);
        }
        for (LocalDateTime createdAt : reservationRepository.findCreationTimesSince(since)) {
            if (createdAt != null) {
                counts.merge(createdAt.getDayOfWeek(), 1L, Long::sum);
            }
        }

        List<WeeklyBookings.DayCount> data = new ArrayList<>(7);
        for (DayOfWeek day : DayOfWeek.values()) {
            data.add(new WeeklyBookings.DayCount(day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH), counts.get(day)));
        }
        return WeeklyBookings.builder().data(data).build();
    }

    /**
     * Flights departing on the given day (today when null), their average load factor, and the
     * number of cancelled flights across all days.
     */
    public FlightSummary flightSummary(LocalDate date) {
        LocalDate day = date != null ? date : LocalDate.now(clock);
        List<Flight> flights = flightRepository.findDepartingBetween(
                day.atStartOfDay(), day.plusDays(1).atStartOfDay());
        Map<Long, Integer> occupied = capacityLedger.occupiedSeatsByFlight(
                flights.stream().map(Flight::getId).toList());

        double total = 0;
        int counted = 0;
        for (Flight flight : flights) {
            Double loadFactor = loadFactor(flight, occupied.getOrDefault(flight.getId(), 0));
            if (loadFactor != null) {
                total += loadFactor;
                counted++;
            }
        }
        double average = counted == 0 ? 0.0 : roundOneDecimal(total / counted);

        return FlightSummary.builder()
                .date(day)
                .totalFlights((long) flights.size())
                .avgLoadFactor(average)
                .cancelledFlights(countCancelledFlights())
                .build();
    }

    public FlightBoard flightBoard(Integer limit) {
        int size = limit != null ? limit : BookingConstants.FLIGHT_BOARD_DEFAULT_LIMIT;
        if (size < 1 || size > BookingConstants.FLIGHT_BOARD_MAX_LIMIT) {
            throw new InvalidInputException("INVALID_LIMIT",
                    "limit must be between 1 and " + BookingConstants.FLIGHT_BOARD_MAX_LIMIT);
        }

        List<Flight> flights = flightRepository.findBoard(PageRequest.of(0, size));
        Map<Long, Integer> occupied = capacityLedger.occupiedSeatsByFlight(
                flights.stream().map(Flight::getId).toList());

        List<FlightBoardEntry> items = new ArrayList<>(flights.size());
        for (Flight flight : flights) {
            Aircraft aircraft = flight.getAircraft();
            int booked = occupied.getOrDefault(flight.getId(), 0);
            Double loadFactor = loadFactor(flight, booked);
            items.add(FlightBoardEntry.builder()
                    .id(flight.getId())
                    .flightCode(ReservationMapper.boardCode(flight))
                    .origin(flight.getOrigin())
                    .destination(flight.getDestination())
                    .departureTime(flight.getDepartureTime())
                    .arrivalTime(flight.getArrivalTime())
                    .fare(flight.getFare())
                    .status(flight.getStatus().name())
                    .aircraftModel(aircraft != null ? aircraft.getModel() : null)
                    .aircraftCapacity(aircraft != null && aircraft.getCapacity() != null ? aircraft.getCapacity() : 0)
                    .seatsBooked(booked)
                    .loadFactor(loadFactor != null ? roundOneDecimal(loadFactor) : 0.0)
                    .build());
        }

        return FlightBoard.builder()
                .items(items)
                .total(flightRepository.count())
                .limit(size)
                .build();
    }

    public List<RecentReservationEntry> recentReservations(Integer limit) {
        int size = limit != null ? limit : BookingConstants.RECENT_RESERVATIONS_DEFAULT_LIMIT;
        if (size < 1 || size > BookingConstants.RECENT_RESERVATIONS_MAX_LIMIT) {
            throw new InvalidInputException("INVALID_LIMIT",
                    "limit must be between 1 and " + BookingConstants.RECENT_RESERVATIONS_MAX_LIMIT);
        }
        return reservationRepository.findRecent(PageRequest.of(0, size)).stream()
                .map(ReservationMapper::toRecentEntry)
                .toList();
    }

    /**
     * Counts on the stored status column so rows written with older spellings are included.
     */
    long countCancelledFlights() {
        long cancelled = 0;
        for (Object[] row : flightRepository.countByRawStatus()) {
            String raw = (String) row[0];
            if (raw != null && BookingConstants.CANCELLED_FLIGHT_LABELS.contains(StatusLabels.normalize(raw))) {
                cancelled += ((Number) row[1]).longValue();
            }
        }
        return cancelled;
    }

    private Double loadFactor(Flight flight, int occupiedSeats) {
        Aircraft aircraft = flight.getAircraft();
        if (aircraft == null || !aircraft.hasUsableCapacity()) {
            return null;
        }
        return occupiedSeats * 100.0 / aircraft.getCapacity();
    }

    private double roundOneDecimal(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
