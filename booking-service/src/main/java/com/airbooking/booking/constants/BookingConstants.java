package com.airbooking.booking.constants;

import java.util.List;
import java.util.Set;

public final class BookingConstants {

    private BookingConstants() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String DEFAULT_SERVICE_FEE = "12.50";
    public static final int MONEY_SCALE = 2;

    public static final String PAYMENT_METHOD_MOBILE_MONEY = "Mobile Money";
    public static final String PAYMENT_REFERENCE_PREFIX = "PAY";
    public static final int PAYMENT_REFERENCE_RANDOM_LENGTH = 8;
    public static final String SETTLEMENT_PHONE_PATTERN = "^\\d{9}$";

    public static final String LOCK_FLIGHT_PREFIX = "flight:";

    public static final String REDIS_AVAILABLE_SEATS_PREFIX = "flight:";
    public static final String REDIS_AVAILABLE_SEATS_SUFFIX = ":availableSeats";

    public static final int SEARCH_DEFAULT_LIMIT = 10;
    public static final int SEARCH_MAX_LIMIT = 100;
    public static final String SORT_PRICE_ASC = "price_asc";
    public static final String SORT_PRICE_DESC = "price_desc";

    public static final String FLIGHT_CODE_PREFIX = "JC-";
    public static final int FLIGHT_BOARD_DEFAULT_LIMIT = 200;
    public static final int FLIGHT_BOARD_MAX_LIMIT = 500;
    public static final int RECENT_RESERVATIONS_DEFAULT_LIMIT = 5;
    public static final int RECENT_RESERVATIONS_MAX_LIMIT = 50;
    public static final int WEEKLY_WINDOW_DAYS = 7;

    /**
     * Stored spellings of a cancelled reservation, upper-cased. Ledger queries compare the raw
     * column against these so rows written before the status values were normalised still
     * release their seats.
     */
    public static final List<String> CANCELLED_RESERVATION_LABELS = List.of(
            "CANCELLED", "CANCELED", "ANNULEE", "ANNULÉE", "ANNULE", "ANNULÉ");

    /** Raw status spellings that all mean a cancelled flight, compared after accent and case folding. */
    public static final Set<String> CANCELLED_FLIGHT_LABELS = Set.of(
            "annule", "annulee", "cancelled", "canceled");
}
