package com.airbooking.booking.mapper;

import com.airbooking.booking.dto.AircraftEntry;
import com.airbooking.booking.dto.FlightEntry;
import com.airbooking.booking.dto.FlightRequest;
import com.airbooking.booking.dto.AircraftRequest;
import com.airbooking.booking.enums.AircraftStatus;
import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.model.Aircraft;
import com.airbooking.booking.model.Flight;

public final class FleetMapper {

    private FleetMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static AircraftEntry toEntry(Aircraft aircraft, Long flightCount) {
        if (aircraft == null) {
            return null;
        }

        return AircraftEntry.builder()
                .id(aircraft.getId())
                .model(aircraft.getModel())
                .capacity(aircraft.getCapacity())
                .status(aircraft.getStatus() != null ? aircraft.getStatus().name() : null)
                .airline(aircraft.getAirline())
                .flightCount(flightCount)
                .createdAt(aircraft.getCreatedAt())
                .build();
    }

    public static Aircraft toEntity(AircraftRequest request) {
        return Aircraft.builder()
                .model(request.getModel().trim())
                .capacity(request.getCapacity())
                .status(request.getStatus() != null ? request.getStatus() : AircraftStatus.AVAILABLE)
                .airline(request.getAirline())
                .build();
    }

    public static Flight toEntity(FlightRequest request, Aircraft aircraft) {
        return Flight.builder()
                .origin(request.getOrigin().trim())
                .destination(request.getDestination().trim())
                .departureTime(request.getDepartureTime())
                .arrivalTime(request.getArrivalTime())
                .fare(request.getFare())
                .status(request.getStatus() != null ? request.getStatus() : FlightStatus.ACTIVE)
                .aircraft(aircraft)
                .build();
    }

    public static FlightEntry toEntry(Flight flight, Integer remainingSeats) {
        if (flight == null) {
            return null;
        }

        Aircraft aircraft = flight.getAircraft();
        return FlightEntry.builder()
                .id(flight.getId())
                .origin(flight.getOrigin())
                .destination(flight.getDestination())
                .departureTime(flight.getDepartureTime())
                .arrivalTime(flight.getArrivalTime())
                .fare(flight.getFare())
                .status(flight.getStatus() != null ? flight.getStatus().name() : null)
                .aircraftId(aircraft != null ? aircraft.getId() : null)
                .aircraftModel(aircraft != null ? aircraft.getModel() : null)
                .capacity(aircraft != null ? aircraft.getCapacity() : null)
                .remainingSeats(remainingSeats)
                .build();
    }
}
