package com.airbooking.booking.service;

import com.airbooking.booking.constants.BookingConstants;
import com.airbooking.booking.constants.ValidationMessages;
import com.airbooking.booking.dto.PaymentEntry;
import com.airbooking.booking.dto.ReceiptPayload;
import com.airbooking.booking.enums.ReservationStatus;
import com.airbooking.booking.event.PaymentSettledEvent;
import com.airbooking.booking.exception.ConflictException;
import com.airbooking.booking.exception.DuplicatePaymentException;
import com.airbooking.booking.exception.InvalidInputException;
import com.airbooking.booking.exception.ResourceNotFoundException;
import com.airbooking.booking.mapper.PaymentMapper;
import com.airbooking.booking.model.AppUser;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.model.Payment;
import com.airbooking.booking.model.PaymentMethod;
import com.airbooking.booking.model.Reservation;
import com.airbooking.booking.repository.PaymentRepository;
import com.airbooking.booking.repository.ReservationRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Settlement: records exactly one payment per reservation and moves it to PAID, in one
 * transaction that holds the reservation's row lock. A receipt goes out after commit.
 */
@Service
@Slf4j
public class PaymentService {

    private static final Pattern SETTLEMENT_PHONE = Pattern.compile(BookingConstants.SETTLEMENT_PHONE_PATTERN);

    private final ReservationRepository reservationRepository;
    private final PaymentRepository paymentRepository;
    private final PaymentMethodResolver paymentMethodResolver;
    private final TransactionOperations transactionOperations;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public PaymentService(ReservationRepository reservationRepository,
                          PaymentRepository paymentRepository,
                          PaymentMethodResolver paymentMethodResolver,
                          TransactionOperations transactionOperations,
                          ApplicationEventPublisher eventPublisher,
                          MeterRegistry meterRegistry,
                          Clock clock) {
        this.reservationRepository = reservationRepository;
        this.paymentRepository = paymentRepository;
        this.paymentMethodResolver = paymentMethodResolver;
        this.transactionOperations = transactionOperations;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * End-user flow: the reservation must belong to the payer, who settles by mobile money.
     */
    public PaymentEntry pay(Long reservationId, Long payerId, String phoneNumber) {
        if (payerId == null) {
            throw new InvalidInputException(ValidationMessages.USER_ID_REQUIRED);
        }
        if (phoneNumber == null || !SETTLEMENT_PHONE.matcher(phoneNumber.trim()).matches()) {
            throw new InvalidInputException("INVALID_PHONE", ValidationMessages.PHONE_FORMAT);
        }
        return settle(reservationId, payerId, phoneNumber.trim());
    }

    /**
     * Back-office flow: records the payment without an ownership check.
     */
    public PaymentEntry payAsAgent(Long reservationId, String settlementReference) {
        return settle(reservationId, null, settlementReference);
    }

    public PaymentEntry findByReservation(Long reservationId, Long ownerId) {
        if (ownerId != null && reservationRepository.findByIdAndUserId(reservationId, ownerId).isEmpty()) {
            throw ResourceNotFoundException.reservation(reservationId);
        }
        return transactionOperations.execute(status -> paymentRepository.findByReservationId(reservationId)
                .map(PaymentMapper::toEntry)
                .orElseThrow(() -> ResourceNotFoundException.payment(reservationId)));
    }

    private PaymentEntry settle(Long reservationId, Long ownerId, String settlementReference) {
        if (reservationId == null) {
            throw new InvalidInputException(ValidationMessages.RESERVATION_ID_REQUIRED);
        }
        log.info("Applying payment: reservationId={}, ownerCheck={}", reservationId, ownerId != null);

        try {
            Long methodId = paymentMethodResolver.resolveId(BookingConstants.PAYMENT_METHOD_MOBILE_MONEY);
            PaymentEntry entry = transactionOperations.execute(
                    status -> applyPayment(reservationId, ownerId, settlementReference, methodId));
            record("success");
            log.info("Payment recorded: reference={}, reservationId={}, amount={}",
                    entry.getReferenceCode(), reservationId, entry.getAmount());
            return entry;
        } catch (DuplicatePaymentException e) {
            record("duplicate");
            throw e;
        } catch (DataIntegrityViolationException e) {
            if (paymentRepository.existsByReservationId(reservationId)) {
                record("duplicate");
                log.warn("Payment insert hit the unique reservation constraint: reservationId={}", reservationId);
                throw new DuplicatePaymentException(reservationId);
            }
            record("failed");
            throw e;
        } catch (ConcurrencyFailureException e) {
            record("conflict");
            throw new ConflictException("CONCURRENT_MODIFICATION",
                    "Reservation " + reservationId + " is being modified, please retry", e);
        } catch (RuntimeException e) {
            record("rejected");
            throw e;
        }
    }

    private PaymentEntry applyPayment(Long reservationId, Long ownerId, String settlementReference, Long methodId) {
        Reservation reservation = reservationRepository.findByIdForUpdate(reservationId)
                .orElseThrow(() -> ResourceNotFoundException.reservation(reservationId));

        AppUser payer = reservation.getUser();
        if (ownerId != null && !Objects.equals(payer.getId(), ownerId)) {
            // Do not reveal other users' reservations
            throw ResourceNotFoundException.reservation(reservationId);
        }

        if (paymentRepository.existsByReservationId(reservationId)) {
            throw new DuplicatePaymentException(reservationId);
        }
        if (!reservation.getStatus().isPayable()) {
            throw new ConflictException("RESERVATION_NOT_PAYABLE",
                    "Reservation " + reservationId + " is " + reservation.getStatus() + " and cannot be paid");
        }

        PaymentMethod method = paymentMethodResolver.reference(methodId);
        LocalDateTime paidAt = LocalDateTime.now(clock);

        Payment payment = Payment.builder()
                .referenceCode(generateReferenceCode())
                .amount(reservation.getTotalAmount())
                .reservation(reservation)
                .paymentMethod(method)
                .settlementReference(settlementReference)
                .paidAt(paidAt)
                .build();
        paymentRepository.saveAndFlush(payment);

        reservation.setStatus(ReservationStatus.PAID);
        reservationRepository.save(reservation);

        eventPublisher.publishEvent(new PaymentSettledEvent(this, buildReceipt(payment, reservation, payer)));
        return PaymentMapper.toEntry(payment);
    }

    /**
     * Subtotal and taxes come from the fee stored with the reservation's price, so they always
     * add up to the amount charged.
     */
    ReceiptPayload buildReceipt(Payment payment, Reservation reservation, AppUser payer) {
        Flight flight = reservation.getFlight();
        BigDecimal fee = reservation.getServiceFee() != null ? reservation.getServiceFee() : BigDecimal.ZERO;
        return ReceiptPayload.builder()
                .referenceCode(payment.getReferenceCode())
                .reservationId(reservation.getId())
                .payerName(payer.getName())
                .payerEmail(payer.getEmail())
                .route(flight.getOrigin() + " → " + flight.getDestination())
                .seats(reservation.getSeats())
                .departureTime(flight.getDepartureTime())
                .subtotal(payment.getAmount().subtract(fee))
                .taxes(fee)
                .total(payment.getAmount())
                .paidAt(payment.getPaidAt())
                .build();
    }

    private String generateReferenceCode() {
        return BookingConstants.PAYMENT_REFERENCE_PREFIX + UUID.randomUUID().toString()
                .replace("-", "")
                .substring(0, BookingConstants.PAYMENT_REFERENCE_RANDOM_LENGTH)
                .toUpperCase(Locale.ROOT);
    }

    private void record(String result) {
        meterRegistry.counter("payment.apply.total", "result", result).increment();
    }
}
