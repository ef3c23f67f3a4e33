package com.airbooking.booking.service;

import com.airbooking.booking.dto.AircraftEntry;
import com.airbooking.booking.dto.AircraftRequest;
import com.airbooking.booking.dto.AircraftUpdateRequest;
import com.airbooking.booking.enums.AircraftStatus;
import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.exception.ConflictException;
import com.airbooking.booking.exception.ResourceNotFoundException;
import com.airbooking.booking.mapper.FleetMapper;
import com.airbooking.booking.model.Aircraft;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.repository.AircraftRepository;
import com.airbooking.booking.repository.FlightRepository;
import com.airbooking.booking.service.cache.SeatCacheService;
import com.airbooking.booking.validator.FlightValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class AircraftService {

    private final AircraftRepository aircraftRepository;
    private final FlightRepository flightRepository;
    private final CapacityLedger capacityLedger;
    private final SeatCacheService seatCacheService;

    @Transactional(readOnly = true)
    public List<AircraftEntry> list() {
        Map<Long, Long> flightCounts = new HashMap<>();
        for (Object[] row : flightRepository.countFlightsPerAircraft()) {
            flightCounts.put((Long) row[0], ((Number) row[1]).longValue());
        }
        return aircraftRepository.findAllByOrderByIdAsc().stream()
                .map(aircraft -> FleetMapper.toEntry(aircraft, flightCounts.getOrDefault(aircraft.getId(), 0L)))
                .toList();
    }

    @Transactional
    public AircraftEntry create(AircraftRequest request) {
        FlightValidator.validateCapacity(request.getCapacity());

        Aircraft aircraft = aircraftRepository.save(FleetMapper.toEntity(request));
        log.info("Aircraft created: id={}, model={}, capacity={}, status={}",
                aircraft.getId(), aircraft.getModel(), aircraft.getCapacity(), aircraft.getStatus());
        return FleetMapper.toEntry(aircraft, 0L);
    }

    /**
     * Partial update. Capacity may not drop below the seats already committed on any flight of this
     * aircraft; a move to a non-available status blocks its active flights in the same transaction.
     */
    @Transactional
    public AircraftEntry update(Long aircraftId, AircraftUpdateRequest request) {
        Aircraft aircraft = aircraftRepository.findByIdForUpdate(aircraftId)
                .orElseThrow(() -> ResourceNotFoundException.aircraft(aircraftId));

        if (StringUtils.hasText(request.getModel())) {
            aircraft.setModel(request.getModel().trim());
        }
        if (request.getAirline() != null) {
            aircraft.setAirline(request.getAirline());
        }

        List<Flight> flights = null;
        if (request.getCapacity() != null && !request.getCapacity().equals(aircraft.getCapacity())) {
            FlightValidator.validateCapacity(request.getCapacity());
            flights = flightRepository.findByAircraftIdForUpdate(aircraftId);
            for (Flight flight : flights) {
                int occupied = capacityLedger.occupiedSeats(flight.getId());
                if (occupied > request.getCapacity()) {
                    log.warn("Capacity change refused: aircraftId={}, flightId={}, occupied={}, requested={}",
                            aircraftId, flight.getId(), occupied, request.getCapacity());
                    throw new ConflictException("CAPACITY_BELOW_OCCUPANCY", String.format(
                            "Flight %d already holds %d seats, capacity cannot be reduced to %d",
                            flight.getId(), occupied, request.getCapacity()));
                }
            }
            aircraft.setCapacity(request.getCapacity());
        }

        AircraftStatus previousStatus = aircraft.getStatus();
        if (request.getStatus() != null && request.getStatus() != previousStatus) {
            aircraft.setStatus(request.getStatus());
            if (!request.getStatus().isAvailable()) {
                blockActiveFlights(aircraftId, request.getStatus());
            }
        }

        aircraftRepository.save(aircraft);

        if (flights != null) {
            for (Flight flight : flights) {
                if (flight.getStatus() == FlightStatus.ACTIVE) {
                    seatCacheService.refreshAfterCommit(flight.getId(),
                            aircraft.getCapacity() - capacityLedger.occupiedSeats(flight.getId()));
                }
            }
        }

        log.info("Aircraft updated: id={}, capacity={}, status {} -> {}",
                aircraftId, aircraft.getCapacity(), previousStatus, aircraft.getStatus());
        return FleetMapper.toEntry(aircraft, null);
    }

    @Transactional
    public void delete(Long aircraftId) {
        if (!aircraftRepository.existsById(aircraftId)) {
            throw ResourceNotFoundException.aircraft(aircraftId);
        }
        if (flightRepository.existsByAircraftId(aircraftId)) {
            throw ConflictException.aircraftInUse(aircraftId);
        }
        aircraftRepository.deleteById(aircraftId);
        log.info("Aircraft deleted: id={}", aircraftId);
    }

    private void blockActiveFlights(Long aircraftId, AircraftStatus newStatus) {
        List<Flight> active = flightRepository.findByAircraftIdAndStatus(aircraftId, FlightStatus.ACTIVE);
        for (Flight flight : active) {
            flight.setStatus(FlightStatus.BLOCKED);
            seatCacheService.refreshAfterCommit(flight.getId(), null);
        }
        flightRepository.saveAll(active);
        log.info("Aircraft {} is now {}, blocked {} active flight(s)", aircraftId, newStatus, active.size());
    }
}
