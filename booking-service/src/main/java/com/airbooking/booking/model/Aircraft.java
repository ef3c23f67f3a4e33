package com.airbooking.booking.model;

import com.airbooking.booking.enums.AircraftStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Check;

import java.time.LocalDateTime;

@Entity
@Table(name = "aircraft")
@Check(name = "ck_aircraft_capacity_positive", constraints = "capacity > 0")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Aircraft {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "model", nullable = false, length = 100)
    String model;

    @Column(name = "capacity", nullable = false)
    Integer capacity;

    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    AircraftStatus status = AircraftStatus.AVAILABLE;

    @Column(name = "airline", length = 100)
    String airline;

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

    public boolean hasUsableCapacity() {
        return capacity != null && capacity > 0;
    }
}
