package com.airbooking.booking.service;

import com.airbooking.booking.dto.ReservationEntry;
import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.enums.ReservationStatus;
import com.airbooking.booking.exception.BookingException;
import com.airbooking.booking.exception.CapacityExceededException;
import com.airbooking.booking.exception.ConflictException;
import com.airbooking.booking.exception.InvalidInputException;
import com.airbooking.booking.exception.ResourceNotFoundException;
import com.airbooking.booking.model.Aircraft;
import com.airbooking.booking.model.AppUser;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.model.Reservation;
import com.airbooking.booking.repository.FlightRepository;
import com.airbooking.booking.repository.ReservationRepository;
import com.airbooking.booking.repository.UserRepository;
import com.airbooking.booking.service.cache.SeatCacheService;
import com.airbooking.booking.service.lock.LockOperations;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("ReservationService Unit Tests")
class ReservationServiceTest {

    private static final Long FLIGHT_ID = 7L;
    private static final Long USER_ID = 3L;
    private static final Long RESERVATION_ID = 42L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-08T14:15:00Z"), ZoneOffset.UTC);

    @Mock
    private ReservationRepository reservationRepository;

    @Mock
    private FlightRepository flightRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private CapacityLedger capacityLedger;

    @Mock
    private LockOperations lockOperations;

    @Mock
    private SeatCacheService seatCacheService;

    private SimpleMeterRegistry meterRegistry;
    private ReservationService reservationService;

    private Flight flight;
    private AppUser user;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        reservationService = newService(TransactionOperations.withoutTransaction());

        Aircraft aircraft = Aircraft.builder().id(1L).model("Q400").capacity(100).build();
        flight = Flight.builder()
                .id(FLIGHT_ID)
                .origin("Goma")
                .destination("Kinshasa")
                .fare(new BigDecimal("150.00"))
                .status(FlightStatus.ACTIVE)
                .aircraft(aircraft)
                .build();
        user = AppUser.builder().id(USER_ID).name("Grace Mbala").email("grace@example.com").build();

        when(lockOperations.executeWithLock(anyString(), any()))
                .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(1)).get());
        when(flightRepository.findByIdForUpdate(FLIGHT_ID)).thenReturn(Optional.of(flight));
        when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user));
        when(reservationRepository.save(any(Reservation.class))).thenAnswer(inv -> {
            Reservation saved = inv.getArgument(0);
            if (saved.getId() == null) {
                saved.setId(RESERVATION_ID);
            }
            return saved;
        });
        when(reservationRepository.findFlightIdById(RESERVATION_ID)).thenReturn(Optional.of(FLIGHT_ID));
    }

    private ReservationService newService(TransactionOperations transactionOperations) {
        return new ReservationService(
                reservationRepository,
                flightRepository,
                userRepository,
                capacityLedger,
                new PricingService(new BigDecimal("12.50")),
                lockOperations,
                transactionOperations,
                seatCacheService,
                meterRegistry,
                CLOCK,
                3);
    }

    private Reservation reservation(int seats, ReservationStatus status) {
        return Reservation.builder()
                .id(RESERVATION_ID)
                .user(user)
                .flight(flight)
                .seats(seats)
                .serviceFee(new BigDecimal("12.50"))
                .totalAmount(new BigDecimal("150.00").multiply(BigDecimal.valueOf(seats)).add(new BigDecimal("12.50")))
                .status(status)
                .build();
    }

    @Nested
    @DisplayName("Create Reservation Tests")
    class CreateTests {

        @Test
        @DisplayName("Should create a pending reservation priced as fare times seats plus fee")
        void create_WithinCapacity_CreatesPendingReservation() {
            when(capacityLedger.remainingSeats(flight)).thenReturn(10);

            ReservationEntry entry = reservationService.create(FLIGHT_ID, 3, USER_ID);

            assertThat(entry.getStatus()).isEqualTo("PENDING");
            assertThat(entry.getSeats()).isEqualTo(3);
            assertThat(entry.getTotalAmount()).isEqualByComparingTo("462.50");
            assertThat(entry.getServiceFee()).isEqualByComparingTo("12.50");
            assertThat(entry.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 8, 14, 15));
            verify(seatCacheService).setSeats(FLIGHT_ID, 7);
            assertThat(meterRegistry.counter("reservation.create.total", "result", "success").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should take the flight lock under the flight key")
        void create_UsesPerFlightLock() {
            when(capacityLedger.remainingSeats(flight)).thenReturn(10);

            reservationService.create(FLIGHT_ID, 1, USER_ID);

            verify(lockOperations).executeWithLock(eq("flight:" + FLIGHT_ID), any());
        }

        @Test
        @DisplayName("Should reject a request larger than the remaining seats")
        void create_OverCapacity_ThrowsCapacityExceeded() {
            when(capacityLedger.remainingSeats(flight)).thenReturn(2);

            assertThatThrownBy(() -> reservationService.create(FLIGHT_ID, 3, USER_ID))
                    .isInstanceOf(CapacityExceededException.class)
                    .hasFieldOrPropertyWithValue("remainingSeats", 2)
                    .hasFieldOrPropertyWithValue("requestedSeats", 3);

            verify(reservationRepository, never()).save(any());
            verify(seatCacheService, never()).setSeats(anyLong(), anyInt());
            assertThat(meterRegistry.counter("reservation.create.total", "result", "capacity_exceeded").count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should accept a request for exactly the remaining seats")
        void create_ExactlyRemaining_Succeeds() {
            when(capacityLedger.remainingSeats(flight)).thenReturn(4);

            ReservationEntry entry = reservationService.create(FLIGHT_ID, 4, USER_ID);

            assertThat(entry.getSeats()).isEqualTo(4);
            verify(seatCacheService).setSeats(FLIGHT_ID, 0);
        }

        @Test
        @DisplayName("Should treat a non-active flight as not found")
        void create_BlockedFlight_ThrowsNotFound() {
            flight.setStatus(FlightStatus.BLOCKED);

            assertThatThrownBy(() -> reservationService.create(FLIGHT_ID, 1, USER_ID))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "FLIGHT_NOT_FOUND");
        }

        @Test
        @DisplayName("Should reject an unknown user")
        void create_UnknownUser_ThrowsNotFound() {
            when(userRepository.findById(USER_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> reservationService.create(FLIGHT_ID, 1, USER_ID))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "USER_NOT_FOUND");
        }

        @Test
        @DisplayName("Should reject zero seats before taking any lock")
        void create_ZeroSeats_ThrowsInvalidInput() {
            assertThatThrownBy(() -> reservationService.create(FLIGHT_ID, 0, USER_ID))
                    .isInstanceOf(InvalidInputException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_SEATS");

            verifyNoInteractions(lockOperations);
        }

        @Test
        @DisplayName("Should surface lock timeout as a retryable conflict")
        void create_LockUnavailable_ThrowsRetryableConflict() {
            doThrow(new LockOperations.LockAcquisitionException("busy"))
                    .when(lockOperations).executeWithLock(anyString(), any());

            assertThatThrownBy(() -> reservationService.create(FLIGHT_ID, 1, USER_ID))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "LOCK_UNAVAILABLE")
                    .hasFieldOrPropertyWithValue("retryable", true);
        }

        @Test
        @DisplayName("Should give up after the configured number of concurrency failures")
        void create_RepeatedConcurrencyFailure_ThrowsConflict() {
            TransactionOperations failing = mock(TransactionOperations.class);
            when(failing.execute(any())).thenThrow(new CannotAcquireLockException("deadlock"));
            ReservationService service = newService(failing);

            assertThatThrownBy(() -> service.create(FLIGHT_ID, 1, USER_ID))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "CONCURRENT_MODIFICATION")
                    .hasFieldOrPropertyWithValue("retryable", true);

            verify(failing, times(3)).execute(any());
        }
    }

    @Nested
    @DisplayName("Amend Reservation Tests")
    class AmendTests {

        @Test
        @DisplayName("Should allow growing into the seats this reservation already holds")
        void amend_SeatsWithinRemainingExcludingSelf_Succeeds() {
            Reservation existing = reservation(10, ReservationStatus.PENDING);
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID)).thenReturn(Optional.of(existing));
            when(capacityLedger.remainingSeats(flight, RESERVATION_ID)).thenReturn(50);
            when(capacityLedger.knownRemainingSeats(flight)).thenReturn(0);

            ReservationEntry entry = reservationService.amend(RESERVATION_ID, 50, null);

            assertThat(entry.getSeats()).isEqualTo(50);
            assertThat(entry.getTotalAmount()).isEqualByComparingTo("7512.50");
            verify(seatCacheService).setSeats(FLIGHT_ID, 0);
        }

        @Test
        @DisplayName("Should report remaining seats excluding the amended reservation")
        void amend_SeatsOverRemaining_ThrowsCapacityExceeded() {
            Reservation existing = reservation(10, ReservationStatus.PENDING);
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID)).thenReturn(Optional.of(existing));
            when(capacityLedger.remainingSeats(flight, RESERVATION_ID)).thenReturn(50);

            assertThatThrownBy(() -> reservationService.amend(RESERVATION_ID, 51, null))
                    .isInstanceOf(CapacityExceededException.class)
                    .hasFieldOrPropertyWithValue("remainingSeats", 50);

            assertThat(existing.getSeats()).isEqualTo(10);
            verify(reservationRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should refuse setting PAID outside settlement")
        void amend_ToPaid_ThrowsInvalidInput() {
            assertThatThrownBy(() -> reservationService.amend(RESERVATION_ID, null, ReservationStatus.PAID))
                    .isInstanceOf(InvalidInputException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_STATUS_TRANSITION");
        }

        @Test
        @DisplayName("Should refuse an empty amendment")
        void amend_NothingToChange_ThrowsInvalidInput() {
            assertThatThrownBy(() -> reservationService.amend(RESERVATION_ID, null, null))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        @DisplayName("Should refuse seat changes on a paid reservation")
        void amend_SeatsOnPaid_ThrowsConflict() {
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID))
                    .thenReturn(Optional.of(reservation(2, ReservationStatus.PAID)));

            assertThatThrownBy(() -> reservationService.amend(RESERVATION_ID, 3, null))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "RESERVATION_TERMINAL");
        }

        @Test
        @DisplayName("Should never leave CANCELLED")
        void amend_ReopenCancelled_ThrowsConflict() {
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID))
                    .thenReturn(Optional.of(reservation(2, ReservationStatus.CANCELLED)));

            assertThatThrownBy(() -> reservationService.amend(RESERVATION_ID, null, ReservationStatus.PENDING))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "ILLEGAL_STATUS_TRANSITION");
        }

        @Test
        @DisplayName("Should not move a confirmed reservation back to PENDING")
        void amend_ConfirmedToPending_ThrowsConflict() {
            Reservation existing = reservation(2, ReservationStatus.CONFIRMED);
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID)).thenReturn(Optional.of(existing));

            assertThatThrownBy(() -> reservationService.amend(RESERVATION_ID, null, ReservationStatus.PENDING))
                    .isInstanceOf(ConflictException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "ILLEGAL_STATUS_TRANSITION");
            assertThat(existing.getStatus()).isEqualTo(ReservationStatus.CONFIRMED);
            verify(reservationRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should apply a status-only change without checking capacity")
        void amend_StatusOnly_SkipsCapacityCheck() {
            Reservation existing = reservation(2, ReservationStatus.PENDING);
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID)).thenReturn(Optional.of(existing));
            when(capacityLedger.knownRemainingSeats(flight)).thenReturn(98);

            ReservationEntry entry = reservationService.amend(RESERVATION_ID, null, ReservationStatus.CONFIRMED);

            assertThat(entry.getStatus()).isEqualTo("CONFIRMED");
            verify(capacityLedger, never()).remainingSeats(any(), any());
        }

        @Test
        @DisplayName("Should reject an unknown reservation")
        void amend_UnknownReservation_ThrowsNotFound() {
            when(reservationRepository.findFlightIdById(99L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> reservationService.amend(99L, 2, null))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "RESERVATION_NOT_FOUND");
        }
    }

    @Nested
    @DisplayName("Cancel and Confirm Tests")
    class LifecycleTests {

        @Test
        @DisplayName("Should cancel and publish the freed seats to the cache")
        void cancel_Pending_ReleasesSeats() {
            Reservation existing = reservation(5, ReservationStatus.PENDING);
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID)).thenReturn(Optional.of(existing));
            when(capacityLedger.knownRemainingSeats(flight)).thenReturn(100);

            ReservationEntry entry = reservationService.cancel(RESERVATION_ID);

            assertThat(entry.getStatus()).isEqualTo("CANCELLED");
            ArgumentCaptor<Reservation> saved = ArgumentCaptor.forClass(Reservation.class);
            verify(reservationRepository).save(saved.capture());
            assertThat(saved.getValue().getStatus()).isEqualTo(ReservationStatus.CANCELLED);
            verify(seatCacheService).setSeats(FLIGHT_ID, 100);
        }

        @Test
        @DisplayName("Should return an already cancelled reservation unchanged")
        void cancel_AlreadyCancelled_IsNoOp() {
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID))
                    .thenReturn(Optional.of(reservation(5, ReservationStatus.CANCELLED)));

            ReservationEntry entry = reservationService.cancel(RESERVATION_ID);

            assertThat(entry.getStatus()).isEqualTo("CANCELLED");
            verify(reservationRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should rewrite a legacy cancelled label to the canonical value")
        void cancel_LegacyCancelledLabel_RewritesStatus() {
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID))
                    .thenReturn(Optional.of(reservation(5, ReservationStatus.CANCELLED)));
            when(reservationRepository.rewriteStatusLabel(RESERVATION_ID, "CANCELLED")).thenReturn(1);
            when(capacityLedger.knownRemainingSeats(flight)).thenReturn(100);

            ReservationEntry entry = reservationService.cancel(RESERVATION_ID);

            assertThat(entry.getStatus()).isEqualTo("CANCELLED");
            verify(reservationRepository).rewriteStatusLabel(RESERVATION_ID, "CANCELLED");
            verify(seatCacheService).setSeats(FLIGHT_ID, 100);
        }

        @Test
        @DisplayName("Should skip the cache write when capacity is unknown")
        void cancel_UnusableCapacity_DoesNotFail() {
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID))
                    .thenReturn(Optional.of(reservation(5, ReservationStatus.CONFIRMED)));
            when(capacityLedger.knownRemainingSeats(flight)).thenReturn(null);

            assertThatCode(() -> reservationService.cancel(RESERVATION_ID)).doesNotThrowAnyException();
            verify(seatCacheService, never()).setSeats(anyLong(), anyInt());
        }

        @Test
        @DisplayName("Should confirm a pending reservation")
        void confirm_Pending_BecomesConfirmed() {
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID))
                    .thenReturn(Optional.of(reservation(1, ReservationStatus.PENDING)));

            assertThat(reservationService.confirm(RESERVATION_ID).getStatus()).isEqualTo("CONFIRMED");
        }

        @Test
        @DisplayName("Should not confirm a paid reservation")
        void confirm_Paid_ThrowsConflict() {
            when(reservationRepository.findByIdForUpdate(RESERVATION_ID))
                    .thenReturn(Optional.of(reservation(1, ReservationStatus.PAID)));

            assertThatThrownBy(() -> reservationService.confirm(RESERVATION_ID))
                    .isInstanceOf(BookingException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "ILLEGAL_STATUS_TRANSITION");
        }
    }

    @Nested
    @DisplayName("Lookup Tests")
    class LookupTests {

        @Test
        @DisplayName("Should hide reservations owned by someone else")
        void findForOwner_OtherUser_ThrowsNotFound() {
            when(reservationRepository.findByIdAndUserId(RESERVATION_ID, 8L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> reservationService.findForOwner(RESERVATION_ID, 8L))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
