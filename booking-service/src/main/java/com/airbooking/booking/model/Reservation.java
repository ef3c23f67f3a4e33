package com.airbooking.booking.model;

import com.airbooking.booking.enums.ReservationStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A block of seats held on one flight for one user. Cancelled rows are kept and simply stop
 * counting towards the flight's occupancy.
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservation_flight_status", columnList = "flight_id, status"),
        @Index(name = "idx_reservation_user", columnList = "user_id"),
        @Index(name = "idx_reservation_created", columnList = "created_at")
})
@Check(name = "ck_reservation_amounts", constraints = "seats > 0 AND total_amount >= 0 AND service_fee >= 0")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Reservation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    AppUser user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "flight_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Flight flight;

    @Column(name = "seats", nullable = false)
    Integer seats;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    BigDecimal totalAmount;

    @Column(name = "service_fee", nullable = false, precision = 10, scale = 2)
    BigDecimal serviceFee;

    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    ReservationStatus status = ReservationStatus.PENDING;

    @Version
    @Column(name = "version")
    Long version;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    // createdAt is stamped by the service clock; the fallback covers rows built elsewhere
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
