package com.airbooking.booking.service;

import com.airbooking.booking.dto.AircraftEntry;
import com.airbooking.booking.dto.AircraftRequest;
import com.airbooking.booking.dto.AircraftUpdateRequest;
import com.airbooking.booking.enums.AircraftStatus;
import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.exception.ConflictException;
import com.airbooking.booking.exception.InvalidInputException;
import com.airbooking.booking.exception.ResourceNotFoundException;
import com.airbooking.booking.model.Aircraft;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.repository.AircraftRepository;
import com.airbooking.booking.repository.FlightRepository;
import com.airbooking.booking.service.cache.SeatCacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AircraftService Unit Tests")
class AircraftServiceTest {

    private static final Long AIRCRAFT_ID = 2L;

    @Mock
    private AircraftRepository aircraftRepository;

    @Mock
    private FlightRepository flightRepository;

    @Mock
    private CapacityLedger capacityLedger;

    @Mock
    private SeatCacheService seatCacheService;

    @InjectMocks
    private AircraftService aircraftService;

    private Aircraft aircraft;

    @BeforeEach
    void setUp() {
        aircraft = Aircraft.builder()
                .id(AIRCRAFT_ID)
                .model("Embraer 190")
                .capacity(100)
                .status(AircraftStatus.AVAILABLE)
                .build();
        when(aircraftRepository.findByIdForUpdate(AIRCRAFT_ID)).thenReturn(Optional.of(aircraft));
        when(aircraftRepository.save(any(Aircraft.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private Flight flight(long id, FlightStatus status) {
        return Flight.builder().id(id).status(status).aircraft(aircraft).build();
    }

    @Nested
    @DisplayName("Status Cascade Tests")
    class CascadeTests {

        @Test
        @DisplayName("Should block active flights when the aircraft becomes unavailable")
        void update_ToUnavailable_BlocksActiveFlights() {
            Flight first = flight(10L, FlightStatus.ACTIVE);
            Flight second = flight(11L, FlightStatus.ACTIVE);
            when(flightRepository.findByAircraftIdAndStatus(AIRCRAFT_ID, FlightStatus.ACTIVE))
                    .thenReturn(List.of(first, second));

            AircraftEntry entry = aircraftService.update(AIRCRAFT_ID,
                    AircraftUpdateRequest.builder().status(AircraftStatus.UNAVAILABLE).build());

            assertThat(entry.getStatus()).isEqualTo("UNAVAILABLE");
            assertThat(first.getStatus()).isEqualTo(FlightStatus.BLOCKED);
            assertThat(second.getStatus()).isEqualTo(FlightStatus.BLOCKED);
            verify(flightRepository).saveAll(List.of(first, second));
            verify(seatCacheService).refreshAfterCommit(10L, null);
            verify(seatCacheService).refreshAfterCommit(11L, null);
        }

        @Test
        @DisplayName("Should leave flights untouched when the aircraft becomes available again")
        void update_ToAvailable_DoesNotTouchFlights() {
            aircraft.setStatus(AircraftStatus.BLOCKED);

            aircraftService.update(AIRCRAFT_ID,
                    AircraftUpdateRequest.builder().status(AircraftStatus.AVAILABLE).build());

            verify(flightRepository, never()).findByAircraftIdAndStatus(anyLong(), any());
        }
    }

    @Nested
    @DisplayName("Capacity Change Tests")
    class CapacityTests {

        @Test
        @DisplayName("Should refuse a capacity below the seats a flight already holds")
        void update_CapacityBelowOccupancy_ThrowsConflict() {
            when(flightRepository.findByAircraftIdForUpdate(AIRCRAFT_ID))
                    .thenReturn(List.of(flight(10L, FlightStatus.ACTIVE)));
            when(capacityLedger.occupiedSeats(10L)).thenReturn(60);

            assertThatThrownBy(() -> aircraftService.update(AIRCRAFT_ID,
                    AircraftUpdateRequest.builder().capacity(59).build()))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "CAPACITY_BELOW_OCCUPANCY");

            assertThat(aircraft.getCapacity()).isEqualTo(100);
        }

        @Test
        @DisplayName("Should accept a capacity equal to the occupied seats and refresh the cache")
        void update_CapacityAtOccupancy_RefreshesCache() {
            when(flightRepository.findByAircraftIdForUpdate(AIRCRAFT_ID))
                    .thenReturn(List.of(flight(10L, FlightStatus.ACTIVE)));
            when(capacityLedger.occupiedSeats(10L)).thenReturn(60);

            AircraftEntry entry = aircraftService.update(AIRCRAFT_ID,
                    AircraftUpdateRequest.builder().capacity(60).build());

            assertThat(entry.getCapacity()).isEqualTo(60);
            verify(seatCacheService).refreshAfterCommit(10L, 0);
        }

        @Test
        @DisplayName("Should reject a non-positive capacity")
        void update_ZeroCapacity_ThrowsInvalidInput() {
            assertThatThrownBy(() -> aircraftService.update(AIRCRAFT_ID,
                    AircraftUpdateRequest.builder().capacity(0).build()))
                    .isInstanceOf(InvalidInputException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_CAPACITY");
        }
    }

    @Nested
    @DisplayName("Create, List and Delete Tests")
    class CrudTests {

        @Test
        @DisplayName("Should create an aircraft available by default")
        void create_Valid_Saves() {
            when(aircraftRepository.save(any(Aircraft.class))).thenAnswer(inv -> {
                Aircraft saved = inv.getArgument(0);
                saved.setId(9L);
                return saved;
            });

            AircraftEntry entry = aircraftService.create(
                    AircraftRequest.builder().model(" ATR 72 ").capacity(70).build());

            assertThat(entry.getId()).isEqualTo(9L);
            assertThat(entry.getModel()).isEqualTo("ATR 72");
            assertThat(entry.getStatus()).isEqualTo("AVAILABLE");
            assertThat(entry.getFlightCount()).isZero();
        }

        @Test
        @DisplayName("Should list aircraft with their flight counts")
        void list_IncludesFlightCounts() {
            when(aircraftRepository.findAllByOrderByIdAsc()).thenReturn(List.of(aircraft));
            when(flightRepository.countFlightsPerAircraft()).thenReturn(List.<Object[]>of(new Object[]{AIRCRAFT_ID, 3L}));

            assertThat(aircraftService.list()).singleElement()
                    .extracting(AircraftEntry::getFlightCount)
                    .isEqualTo(3L);
        }

        @Test
        @DisplayName("Should refuse deleting an aircraft that still has flights")
        void delete_WithFlights_ThrowsConflict() {
            when(aircraftRepository.existsById(AIRCRAFT_ID)).thenReturn(true);
            when(flightRepository.existsByAircraftId(AIRCRAFT_ID)).thenReturn(true);

            assertThatThrownBy(() -> aircraftService.delete(AIRCRAFT_ID))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "AIRCRAFT_IN_USE");
            verify(aircraftRepository, never()).deleteById(any());
        }

        @Test
        @DisplayName("Should report a missing aircraft")
        void delete_Unknown_ThrowsNotFound() {
            when(aircraftRepository.existsById(AIRCRAFT_ID)).thenReturn(false);

            assertThatThrownBy(() -> aircraftService.delete(AIRCRAFT_ID))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
