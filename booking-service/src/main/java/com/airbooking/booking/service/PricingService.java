package com.airbooking.booking.service;

import com.airbooking.booking.constants.BookingConstants;
import com.airbooking.booking.validator.FlightValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Reservation price: fare times seats, plus one fixed service fee per reservation.
 */
@Service
@Slf4j
public class PricingService {

    private final BigDecimal serviceFee;

    public PricingService(@Value("${booking.pricing.service-fee:" + BookingConstants.DEFAULT_SERVICE_FEE + "}")
                          BigDecimal serviceFee) {
        if (serviceFee.signum() < 0) {
            throw new IllegalArgumentException("Service fee must not be negative: " + serviceFee);
        }
        this.serviceFee = serviceFee.setScale(BookingConstants.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public PriceQuote quote(BigDecimal fare, int seats) {
        FlightValidator.validateFare(fare);
        FlightValidator.validateSeatCount(seats);

        BigDecimal subtotal = fare.multiply(BigDecimal.valueOf(seats))
                .setScale(BookingConstants.MONEY_SCALE, RoundingMode.HALF_UP);
        BigDecimal total = subtotal.add(serviceFee);
        log.debug("Priced reservation: fare={}, seats={}, subtotal={}, fee={}, total={}",
                fare, seats, subtotal, serviceFee, total);
        return new PriceQuote(subtotal, serviceFee, total);
    }

    public record PriceQuote(BigDecimal subtotal, BigDecimal serviceFee, BigDecimal total) {
    }
}
