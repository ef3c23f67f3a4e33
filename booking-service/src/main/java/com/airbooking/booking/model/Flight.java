package com.airbooking.booking.model;

import com.airbooking.booking.enums.FlightStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "flights", indexes = {
        @Index(name = "idx_flight_route", columnList = "origin, destination"),
        @Index(name = "idx_flight_departure", columnList = "departure_time"),
        @Index(name = "idx_flight_aircraft", columnList = "aircraft_id")
})
@Check(name = "ck_flight_fare_non_negative", constraints = "fare >= 0")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Flight {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "origin", nullable = false, length = 100)
    String origin;

    @Column(name = "destination", nullable = false, length = 100)
    String destination;

    @Column(name = "departure_time", nullable = false)
    LocalDateTime departureTime;

    @Column(name = "arrival_time")
    LocalDateTime arrivalTime;

    @Column(name = "fare", nullable = false, precision = 10, scale = 2)
    BigDecimal fare;

    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    FlightStatus status = FlightStatus.ACTIVE;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "aircraft_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Aircraft aircraft;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
