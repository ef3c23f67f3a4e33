package com.airbooking.booking.constants;

public final class ValidationMessages {

    private ValidationMessages() {
        throw new UnsupportedOperationException("Constants class cannot be instantiated");
    }

    public static final String FLIGHT_ID_REQUIRED = "Flight ID is required";
    public static final String USER_ID_REQUIRED = "User ID is required";
    public static final String RESERVATION_ID_REQUIRED = "Reservation ID is required";
    public static final String AIRCRAFT_ID_REQUIRED = "Aircraft ID is required";

    public static final String SEATS_REQUIRED = "Number of seats is required";
    public static final String SEATS_MIN = "At least 1 seat is required";

    public static final String CAPACITY_REQUIRED = "Aircraft capacity is required";
    public static final String CAPACITY_POSITIVE = "Aircraft capacity must be greater than zero";
    public static final String MODEL_REQUIRED = "Aircraft model is required";

    public static final String ORIGIN_REQUIRED = "Origin is required";
    public static final String DESTINATION_REQUIRED = "Destination is required";
    public static final String SAME_ORIGIN_DESTINATION = "Origin and destination must differ";
    public static final String DEPARTURE_REQUIRED = "Departure time is required";
    public static final String ARRIVAL_BEFORE_DEPARTURE = "Arrival time must be after departure time";
    public static final String FARE_REQUIRED = "Fare is required";
    public static final String FARE_NON_NEGATIVE = "Fare must not be negative";

    public static final String PHONE_REQUIRED = "Phone number is required";
    public static final String PHONE_FORMAT = "Phone number must contain exactly 9 digits";

    public static final String EMAIL_FORMAT = "Email address is not valid";

    public static final String PAID_ONLY_BY_PAYMENT = "Status PAID can only be reached by recording a payment";
    public static final String NOTHING_TO_UPDATE = "Request contains no changes";
}
