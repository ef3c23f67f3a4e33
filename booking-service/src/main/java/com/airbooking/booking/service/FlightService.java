package com.airbooking.booking.service;

import com.airbooking.booking.constants.BookingConstants;
import com.airbooking.booking.dto.FlightEntry;
import com.airbooking.booking.dto.FlightRequest;
import com.airbooking.booking.dto.FlightUpdateRequest;
import com.airbooking.booking.dto.PageResponse;
import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.exception.ConflictException;
import com.airbooking.booking.exception.InvalidInputException;
import com.airbooking.booking.exception.ResourceNotFoundException;
import com.airbooking.booking.mapper.FleetMapper;
import com.airbooking.booking.model.Aircraft;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.repository.AircraftRepository;
import com.airbooking.booking.repository.FlightRepository;
import com.airbooking.booking.repository.FlightSpecification;
import com.airbooking.booking.repository.ReservationRepository;
import com.airbooking.booking.service.cache.SeatCacheService;
import com.airbooking.booking.validator.FlightValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class FlightService {

    private final FlightRepository flightRepository;
    private final AircraftRepository aircraftRepository;
    private final ReservationRepository reservationRepository;
    private final CapacityLedger capacityLedger;
    private final SeatCacheService seatCacheService;

    /**
     * Public search over active flights. {@code hasMore} is true when the page came back full.
     */
    @Transactional(readOnly = true)
    public PageResponse<FlightEntry> search(String origin, String destination, LocalDate date,
                                            String sort, Integer page, Integer limit) {
        int pageNumber = page != null ? page : 1;
        int pageSize = limit != null ? limit : BookingConstants.SEARCH_DEFAULT_LIMIT;
        if (pageNumber < 1) {
            throw new InvalidInputException("INVALID_PAGE", "page must be 1 or greater");
        }
        if (pageSize < 1 || pageSize > BookingConstants.SEARCH_MAX_LIMIT) {
            throw new InvalidInputException("INVALID_LIMIT",
                    "limit must be between 1 and " + BookingConstants.SEARCH_MAX_LIMIT);
        }

        PageRequest pageable = PageRequest.of(pageNumber - 1, pageSize, resolveSort(sort));
        List<Flight> flights = flightRepository
                .findAll(FlightSpecification.searchable(origin, destination, date), pageable)
                .getContent();

        Map<Long, Integer> remaining = remainingSeats(flights);
        List<FlightEntry> data = new ArrayList<>(flights.size());
        for (Flight flight : flights) {
            data.add(FleetMapper.toEntry(flight, remaining.get(flight.getId())));
        }

        log.debug("Flight search: origin={}, destination={}, date={}, page={}, results={}",
                origin, destination, date, pageNumber, data.size());
        return PageResponse.<FlightEntry>builder()
                .data(data)
                .page(pageNumber)
                .limit(pageSize)
                .hasMore(data.size() == pageSize)
                .build();
    }

    @Transactional(readOnly = true)
    public FlightEntry getActiveFlight(Long flightId) {
        Flight flight = flightRepository.findWithAircraftByIdAndStatus(flightId, FlightStatus.ACTIVE)
                .orElseThrow(() -> ResourceNotFoundException.flight(flightId));
        return FleetMapper.toEntry(flight, remainingSeats(List.of(flight)).get(flightId));
    }

    @Transactional
    public FlightEntry create(FlightRequest request) {
        FlightValidator.validateRoute(request.getOrigin(), request.getDestination());
        FlightValidator.validateSchedule(request.getDepartureTime(), request.getArrivalTime());
        FlightValidator.validateFare(request.getFare());

        Aircraft aircraft = aircraftRepository.findById(request.getAircraftId())
                .orElseThrow(() -> ResourceNotFoundException.aircraft(request.getAircraftId()));

        Flight flight = FleetMapper.toEntity(request, aircraft);
        applyAircraftAvailability(flight);
        flightRepository.save(flight);

        if (flight.getStatus() == FlightStatus.ACTIVE) {
            seatCacheService.refreshAfterCommit(flight.getId(), capacityLedger.knownRemainingSeats(flight));
        }
        log.info("Flight created: id={}, route={}->{}, departure={}, aircraftId={}, status={}",
                flight.getId(), flight.getOrigin(), flight.getDestination(),
                flight.getDepartureTime(), aircraft.getId(), flight.getStatus());
        return FleetMapper.toEntry(flight, capacityLedger.knownRemainingSeats(flight));
    }

    /**
     * Partial update. Moving to another aircraft requires it to hold the seats already committed.
     * The target aircraft row is locked before the flight row, matching the aircraft then flight
     * order used by fleet updates.
     */
    @Transactional
    public FlightEntry update(Long flightId, FlightUpdateRequest request) {
        Aircraft requestedAircraft = null;
        if (request.getAircraftId() != null) {
            requestedAircraft = aircraftRepository.findByIdForUpdate(request.getAircraftId())
                    .orElseThrow(() -> ResourceNotFoundException.aircraft(request.getAircraftId()));
        }
        Flight flight = flightRepository.findByIdForUpdate(flightId)
                .orElseThrow(() -> ResourceNotFoundException.flight(flightId));

        String origin = StringUtils.hasText(request.getOrigin()) ? request.getOrigin().trim() : flight.getOrigin();
        String destination = StringUtils.hasText(request.getDestination())
                ? request.getDestination().trim() : flight.getDestination();
        FlightValidator.validateRoute(origin, destination);
        FlightValidator.validateSchedule(
                Optional.ofNullable(request.getDepartureTime()).orElse(flight.getDepartureTime()),
                Optional.ofNullable(request.getArrivalTime()).orElse(flight.getArrivalTime()));
        FlightValidator.validateFare(request.getFare());

        flight.setOrigin(origin);
        flight.setDestination(destination);
        if (request.getDepartureTime() != null) {
            flight.setDepartureTime(request.getDepartureTime());
        }
        if (request.getArrivalTime() != null) {
            flight.setArrivalTime(request.getArrivalTime());
        }
        if (request.getFare() != null) {
            flight.setFare(request.getFare());
        }
        if (request.getStatus() != null) {
            flight.setStatus(request.getStatus());
        }

        if (requestedAircraft != null && !requestedAircraft.getId().equals(flight.getAircraft().getId())) {
            Aircraft replacement = requestedAircraft;
            int occupied = capacityLedger.occupiedSeats(flightId);
            if (replacement.getCapacity() == null || occupied > replacement.getCapacity()) {
                throw new ConflictException("CAPACITY_BELOW_OCCUPANCY", String.format(
                        "Flight %d already holds %d seats, aircraft %d only has %s",
                        flightId, occupied, replacement.getId(), replacement.getCapacity()));
            }
            flight.setAircraft(replacement);
        }

        applyAircraftAvailability(flight);
        flightRepository.save(flight);

        Integer remaining = capacityLedger.knownRemainingSeats(flight);
        seatCacheService.refreshAfterCommit(flightId, flight.getStatus() == FlightStatus.ACTIVE ? remaining : null);
        log.info("Flight updated: id={}, status={}, aircraftId={}", flightId, flight.getStatus(),
                flight.getAircraft().getId());
        return FleetMapper.toEntry(flight, remaining);
    }

    @Transactional
    public void delete(Long flightId) {
        if (!flightRepository.existsById(flightId)) {
            throw ResourceNotFoundException.flight(flightId);
        }
        if (reservationRepository.existsByFlightId(flightId)) {
            throw ConflictException.flightHasReservations(flightId);
        }
        flightRepository.deleteById(flightId);
        seatCacheService.refreshAfterCommit(flightId, null);
        log.info("Flight deleted: id={}", flightId);
    }

    private void applyAircraftAvailability(Flight flight) {
        if (flight.getStatus() == FlightStatus.ACTIVE && !flight.getAircraft().getStatus().isAvailable()) {
            log.info("Aircraft {} is {}, storing flight as BLOCKED",
                    flight.getAircraft().getId(), flight.getAircraft().getStatus());
            flight.setStatus(FlightStatus.BLOCKED);
        }
    }

    /**
     * Cached counts first; misses are computed from the ledger in one query.
     */
    private Map<Long, Integer> remainingSeats(List<Flight> flights) {
        Map<Long, Integer> remaining = new HashMap<>();
        List<Long> misses = new ArrayList<>();
        for (Flight flight : flights) {
            Optional<Integer> cached = seatCacheService.getSeats(flight.getId());
            if (cached.isPresent()) {
                remaining.put(flight.getId(), cached.get());
            } else {
                misses.add(flight.getId());
            }
        }
        if (misses.isEmpty()) {
            return remaining;
        }

        Map<Long, Integer> occupied = capacityLedger.occupiedSeatsByFlight(misses);
        for (Flight flight : flights) {
            if (!misses.contains(flight.getId())) {
                continue;
            }
            Aircraft aircraft = flight.getAircraft();
            if (aircraft != null && aircraft.hasUsableCapacity()) {
                int seats = aircraft.getCapacity() - occupied.getOrDefault(flight.getId(), 0);
                remaining.put(flight.getId(), seats);
                seatCacheService.setSeats(flight.getId(), seats);
            }
        }
        return remaining;
    }

    private Sort resolveSort(String sort) {
        if (sort == null || sort.isBlank() || BookingConstants.SORT_PRICE_ASC.equalsIgnoreCase(sort)) {
            return Sort.by(Sort.Order.asc("fare"), Sort.Order.asc("id"));
        }
        if (BookingConstants.SORT_PRICE_DESC.equalsIgnoreCase(sort)) {
            return Sort.by(Sort.Order.desc("fare"), Sort.Order.asc("id"));
        }
        throw new InvalidInputException("INVALID_SORT", "sort must be price_asc or price_desc");
    }
}
