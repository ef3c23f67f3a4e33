package com.airbooking.booking.config;

import com.airbooking.booking.enums.UserRole;
import com.airbooking.booking.model.Aircraft;
import com.airbooking.booking.model.AppUser;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.repository.AircraftRepository;
import com.airbooking.booking.repository.FlightRepository;
import com.airbooking.booking.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Seeds a small fleet, a week of flights and two accounts when the database is empty.
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DevDataLoader implements CommandLineRunner {

    private static final List<String[]> ROUTES = List.of(
            new String[]{"Douala", "Yaounde", "45000.00"},
            new String[]{"Yaounde", "Douala", "45000.00"},
            new String[]{"Douala", "Garoua", "78000.00"},
            new String[]{"Garoua", "Maroua", "39000.00"}
    );

    private final UserRepository userRepository;
    private final AircraftRepository aircraftRepository;
    private final FlightRepository flightRepository;

    @Override
    @Transactional
    public void run(String... args) {
        if (userRepository.count() > 0) {
            log.info("Data already exists, skipping seed");
            return;
        }

        log.info("Seeding dev data...");
        userRepository.saveAll(List.of(
                AppUser.builder().name("Amina Client").email("client@example.com").role(UserRole.CLIENT).status("active").build(),
                AppUser.builder().name("Paul Agent").email("agent@example.com").role(UserRole.AGENT).status("active").build()));

        List<Aircraft> fleet = aircraftRepository.saveAll(List.of(
                Aircraft.builder().model("Boeing 737-700").capacity(149).airline("Camair-Co").build(),
                Aircraft.builder().model("Bombardier Q400").capacity(78).airline("Camair-Co").build()));

        LocalDate today = LocalDate.now();
        int created = 0;
        for (int day = 0; day < 7; day++) {
            for (int i = 0; i < ROUTES.size(); i++) {
                String[] route = ROUTES.get(i);
                LocalDateTime departure = today.plusDays(day).atTime(7 + i * 3, 30);
                flightRepository.save(Flight.builder()
                        .origin(route[0])
                        .destination(route[1])
                        .departureTime(departure)
                        .arrivalTime(departure.plusMinutes(65))
                        .fare(new BigDecimal(route[2]))
                        .aircraft(fleet.get(i % fleet.size()))
                        .build());
                created++;
            }
        }
        log.info("Dev data seeding complete: users=2, aircraft={}, flights={}", fleet.size(), created);
    }
}
