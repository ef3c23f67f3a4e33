package com.airbooking.booking.service;

import com.airbooking.booking.constants.BookingConstants;
import com.airbooking.booking.constants.ValidationMessages;
import com.airbooking.booking.dto.ReservationEntry;
import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.enums.ReservationStatus;
import com.airbooking.booking.exception.CapacityExceededException;
import com.airbooking.booking.exception.ConflictException;
import com.airbooking.booking.exception.InvalidInputException;
import com.airbooking.booking.exception.ResourceNotFoundException;
import com.airbooking.booking.mapper.ReservationMapper;
import com.airbooking.booking.model.AppUser;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.model.Reservation;
import com.airbooking.booking.repository.FlightRepository;
import com.airbooking.booking.repository.ReservationRepository;
import com.airbooking.booking.repository.UserRepository;
import com.airbooking.booking.service.PricingService.PriceQuote;
import com.airbooking.booking.service.cache.SeatCacheService;
import com.airbooking.booking.service.lock.LockOperations;
import com.airbooking.booking.validator.FlightValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Supplier;

/**
 * Reservation lifecycle. Every path that changes the seats a flight has committed goes through
 * {@link #commitSeatChange}: per-flight lock, then a transaction that row-locks the flight before
 * reading the ledger, then a write of the new remaining count to the seat cache.
 */
@Service
@Slf4j
public class ReservationService {

    private final ReservationRepository reservationRepository;
    private final FlightRepository flightRepository;
    private final UserRepository userRepository;
    private final CapacityLedger capacityLedger;
    private final PricingService pricingService;
    private final LockOperations lockOperations;
    private final TransactionOperations transactionOperations;
    private final SeatCacheService seatCacheService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Timer createTimer;
    private final int maxAttempts;

    public ReservationService(
            ReservationRepository reservationRepository,
            FlightRepository flightRepository,
            UserRepository userRepository,
            CapacityLedger capacityLedger,
            PricingService pricingService,
            LockOperations lockOperations,
            TransactionOperations transactionOperations,
            SeatCacheService seatCacheService,
            MeterRegistry meterRegistry,
            Clock clock,
            @Value("${booking.concurrency.max-attempts:3}") int maxAttempts) {
        this.reservationRepository = reservationRepository;
        this.flightRepository = flightRepository;
        this.userRepository = userRepository;
        this.capacityLedger = capacityLedger;
        this.pricingService = pricingService;
        this.lockOperations = lockOperations;
        this.transactionOperations = transactionOperations;
        this.seatCacheService = seatCacheService;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.createTimer = Timer.builder("reservation.create.duration")
                .description("Time to check capacity and commit a new reservation")
                .register(meterRegistry);
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Books seats on an active flight for the given user. Used by both the end-user and the
     * back-office flows.
     *
     * @throws CapacityExceededException with the remaining count when the flight cannot hold the seats
     */
    public ReservationEntry create(Long flightId, Integer seats, Long userId) {
        if (flightId == null) {
            throw new InvalidInputException(ValidationMessages.FLIGHT_ID_REQUIRED);
        }
        if (userId == null) {
            throw new InvalidInputException(ValidationMessages.USER_ID_REQUIRED);
        }
        FlightValidator.validateSeatCount(seats);

        log.info("Creating reservation: flightId={}, seats={}, userId={}", flightId, seats, userId);

        Timer.Sample sample = Timer.start(meterRegistry);
        String result = "success";
        try {
            ReservationEntry entry = commitSeatChange(flightId, "create", () -> insertReservation(flightId, seats, userId));
            log.info("Reservation created: id={}, flightId={}, seats={}, total={}",
                    entry.getId(), flightId, seats, entry.getTotalAmount());
            return entry;
        } catch (CapacityExceededException e) {
            result = "capacity_exceeded";
            throw e;
        } catch (ConflictException e) {
            result = "conflict";
            throw e;
        } catch (RuntimeException e) {
            result = "rejected";
            throw e;
        } finally {
            sample.stop(createTimer);
            Counter.builder("reservation.create.total")
                    .tag("result", result)
                    .register(meterRegistry)
                    .increment();
        }
    }

    /**
     * Back-office amendment of seats and/or status. Seats are applied first, and are only
     * changeable while the reservation is PENDING or CONFIRMED.
     */
    public ReservationEntry amend(Long reservationId, Integer newSeats, ReservationStatus newStatus) {
        if (newSeats == null && newStatus == null) {
            throw new InvalidInputException(ValidationMessages.NOTHING_TO_UPDATE);
        }
        if (newSeats != null) {
            FlightValidator.validateSeatCount(newSeats);
        }
        if (newStatus == ReservationStatus.PAID) {
            throw new InvalidInputException("INVALID_STATUS_TRANSITION", ValidationMessages.PAID_ONLY_BY_PAYMENT);
        }

        Long flightId = flightIdOf(reservationId);
        log.info("Amending reservation: id={}, flightId={}, seats={}, status={}",
                reservationId, flightId, newSeats, newStatus);

        ReservationEntry entry = commitSeatChange(flightId, "amend",
                () -> applyAmendment(flightId, reservationId, newSeats, newStatus));
        log.info("Reservation amended: id={}, seats={}, status={}, total={}",
                entry.getId(), entry.getSeats(), entry.getStatus(), entry.getTotalAmount());
        return entry;
    }

    /**
     * Cancels a reservation and releases its seats. Cancelling a cancelled reservation returns
     * it unchanged.
     */
    public ReservationEntry cancel(Long reservationId) {
        Long flightId = flightIdOf(reservationId);
        log.info("Cancelling reservation: id={}, flightId={}", reservationId, flightId);

        return commitSeatChange(flightId, "cancel", () -> {
            flightRepository.findByIdForUpdate(flightId)
                    .orElseThrow(() -> ResourceNotFoundException.flight(flightId));
            Reservation reservation = lockReservation(reservationId);
            if (reservation.getStatus() == ReservationStatus.CANCELLED) {
                if (reservationRepository.rewriteStatusLabel(reservationId, ReservationStatus.CANCELLED.name()) > 0) {
                    log.info("Reservation {} stored a legacy cancelled label, rewritten", reservationId);
                } else {
                    log.info("Reservation {} already cancelled, nothing to do", reservationId);
                }
            } else {
                log.info("Reservation {} moved {} -> CANCELLED", reservationId, reservation.getStatus());
                reservation.setStatus(ReservationStatus.CANCELLED);
                reservationRepository.save(reservation);
            }
            return new SeatCommit(ReservationMapper.toEntry(reservation),
                    capacityLedger.knownRemainingSeats(reservation.getFlight()));
        });
    }

    /**
     * PENDING becomes CONFIRMED; confirming a confirmed reservation is a no-op.
     */
    public ReservationEntry confirm(Long reservationId) {
        log.info("Confirming reservation: id={}", reservationId);

        return inTransactionWithRetry("confirm", () -> {
            Reservation reservation = lockReservation(reservationId);
            ReservationStatus current = reservation.getStatus();
            if (current == ReservationStatus.CONFIRMED) {
                return ReservationMapper.toEntry(reservation);
            }
            if (current != ReservationStatus.PENDING) {
                throw ConflictException.illegalTransition(reservationId, current, ReservationStatus.CONFIRMED);
            }
            reservation.setStatus(ReservationStatus.CONFIRMED);
            reservationRepository.save(reservation);
            log.info("Reservation {} confirmed", reservationId);
            return ReservationMapper.toEntry(reservation);
        });
    }

    public ReservationEntry findForOwner(Long reservationId, Long userId) {
        return reservationRepository.findByIdAndUserId(reservationId, userId)
                .map(ReservationMapper::toEntry)
                .orElseThrow(() -> ResourceNotFoundException.reservation(reservationId));
    }

    public List<ReservationEntry> findByOwner(Long userId) {
        return ReservationMapper.toEntryList(reservationRepository.findByUserIdOrderByCreatedAtDesc(userId));
    }

    public List<ReservationEntry> listAll() {
        return ReservationMapper.toEntryList(reservationRepository.findAllByOrderByCreatedAtDesc());
    }

    // ============ Seat commits ============

    private SeatCommit insertReservation(Long flightId, int seats, Long userId) {
        // Flight row lock comes before any other read so the ledger sees every committed reservation
        Flight flight = flightRepository.findByIdForUpdate(flightId)
                .filter(f -> f.getStatus() == FlightStatus.ACTIVE)
                .orElseThrow(() -> ResourceNotFoundException.flight(flightId));
        AppUser user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.user(userId));

        int remaining = capacityLedger.remainingSeats(flight);
        if (seats > remaining) {
            throw new CapacityExceededException(flightId, seats, remaining);
        }

        PriceQuote quote = pricingService.quote(flight.getFare(), seats);
        Reservation reservation = Reservation.builder()
                .user(user)
                .flight(flight)
                .seats(seats)
                .serviceFee(quote.serviceFee())
                .totalAmount(quote.total())
                .status(ReservationStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();
        reservationRepository.save(reservation);

        return new SeatCommit(ReservationMapper.toEntry(reservation), remaining - seats);
    }

    private SeatCommit applyAmendment(Long flightId, Long reservationId, Integer newSeats,
                                      ReservationStatus newStatus) {
        Flight flight = flightRepository.findByIdForUpdate(flightId)
                .orElseThrow(() -> ResourceNotFoundException.flight(flightId));
        Reservation reservation = lockReservation(reservationId);
        ReservationStatus current = reservation.getStatus();

        if (newSeats != null) {
            if (!current.allowsSeatChange()) {
                throw ConflictException.reservationTerminal(reservationId, current);
            }
            int remaining = capacityLedger.remainingSeats(flight, reservationId);
            if (newSeats > remaining) {
                throw new CapacityExceededException(flightId, newSeats, remaining);
            }
            PriceQuote quote = pricingService.quote(flight.getFare(), newSeats);
            reservation.setSeats(newSeats);
            reservation.setServiceFee(quote.serviceFee());
            reservation.setTotalAmount(quote.total());
        }

        if (newStatus != null && newStatus != current) {
            if (!current.canMoveTo(newStatus)) {
                throw ConflictException.illegalTransition(reservationId, current, newStatus);
            }
            log.info("Reservation {} moved {} -> {}", reservationId, current, newStatus);
            reservation.setStatus(newStatus);
        }

        reservationRepository.save(reservation);
        return new SeatCommit(ReservationMapper.toEntry(reservation), capacityLedger.knownRemainingSeats(flight));
    }

    private ReservationEntry commitSeatChange(Long flightId, String operation, Supplier<SeatCommit> work) {
        try {
            return lockOperations.executeWithLock(BookingConstants.LOCK_FLIGHT_PREFIX + flightId, () -> {
                SeatCommit commit = inTransactionWithRetry(operation, work);
                if (commit.remainingSeats() != null) {
                    seatCacheService.setSeats(flightId, commit.remainingSeats());
                }
                return commit.entry();
            });
        } catch (LockOperations.LockAcquisitionException e) {
            log.warn("Seat lock unavailable: flightId={}, operation={}", flightId, operation);
            throw ConflictException.lockUnavailable("flight " + flightId);
        }
    }

    private <T> T inTransactionWithRetry(String operation, Supplier<T> work) {
        ConcurrencyFailureException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionOperations.execute(status -> work.get());
            } catch (ConcurrencyFailureException e) {
                lastFailure = e;
                log.warn("Concurrency conflict during {} (attempt {}/{}): {}",
                        operation, attempt, maxAttempts, e.getMessage());
            }
        }
        throw new ConflictException("CONCURRENT_MODIFICATION",
                "Could not complete " + operation + " because of concurrent changes, please retry", lastFailure);
    }

    private Reservation lockReservation(Long reservationId) {
        return reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> ResourceNotFoundException.reservation(reservationId));
    }

    private Long flightIdOf(Long reservationId) {
        if (reservationId == null) {
            throw new InvalidInputException(ValidationMessages.RESERVATION_ID_REQUIRED);
        }
        return reservationRepository.findFlightIdById(reservationId)
                .orElseThrow(() -> ResourceNotFoundException.reservation(reservationId));
    }

    private record SeatCommit(ReservationEntry entry, Integer remainingSeats) {
    }
}
