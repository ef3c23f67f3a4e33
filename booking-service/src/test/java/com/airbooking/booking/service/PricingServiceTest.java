package com.airbooking.booking.service;

import com.airbooking.booking.exception.InvalidInputException;
import com.airbooking.booking.service.PricingService.PriceQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PricingService Unit Tests")
class PricingServiceTest {

    private final PricingService pricingService = new PricingService(new BigDecimal("12.50"));

    @Test
    @DisplayName("Should charge fare times seats plus one service fee")
    void quote_AddsSingleFee() {
        PriceQuote quote = pricingService.quote(new BigDecimal("45000.00"), 3);

        assertThat(quote.subtotal()).isEqualByComparingTo("135000.00");
        assertThat(quote.serviceFee()).isEqualByComparingTo("12.50");
        assertThat(quote.total()).isEqualByComparingTo("135012.50");
        assertThat(quote.total().scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should round the subtotal half-up to cents")
    void quote_RoundsHalfUp() {
        PriceQuote quote = pricingService.quote(new BigDecimal("10.005"), 1);

        assertThat(quote.subtotal()).isEqualByComparingTo("10.01");
    }

    @Test
    @DisplayName("Should give the same price for the same input")
    void quote_IsDeterministic() {
        assertThat(pricingService.quote(new BigDecimal("99.99"), 7))
                .isEqualTo(pricingService.quote(new BigDecimal("99.99"), 7));
    }

    @Test
    @DisplayName("Should charge only the fee on a free fare")
    void quote_ZeroFare_ChargesFee() {
        assertThat(pricingService.quote(BigDecimal.ZERO, 2).total()).isEqualByComparingTo("12.50");
    }

    @Test
    @DisplayName("Should reject negative fares and zero seats")
    void quote_InvalidInput_Throws() {
        assertThatThrownBy(() -> pricingService.quote(new BigDecimal("-1"), 1))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> pricingService.quote(BigDecimal.TEN, 0))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Should refuse a negative configured fee")
    void constructor_NegativeFee_Throws() {
        assertThatThrownBy(() -> new PricingService(new BigDecimal("-0.01")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
