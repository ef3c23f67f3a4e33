package com.airbooking.booking.repository;

import com.airbooking.booking.enums.ReservationStatus;
import com.airbooking.booking.model.Reservation;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReservationRepository extends JpaRepository<Reservation, Long> {

    /*
     * Ledger sums run on the raw status column: a legacy spelling of a released status must not
     * keep holding seats.
     */
    @Query(value = "SELECT COALESCE(SUM(r.seats), 0) FROM reservations r " +
            "WHERE r.flight_id = :flightId AND UPPER(TRIM(r.status)) NOT IN (:releasedLabels)",
            nativeQuery = true)
    Number sumSeatsByFlight(@Param("flightId") Long flightId,
                            @Param("releasedLabels") Collection<String> releasedLabels);

    @Query(value = "SELECT COALESCE(SUM(r.seats), 0) FROM reservations r " +
            "WHERE r.flight_id = :flightId AND UPPER(TRIM(r.status)) NOT IN (:releasedLabels) " +
            "AND r.id <> :excludedId",
            nativeQuery = true)
    Number sumSeatsByFlightExcluding(@Param("flightId") Long flightId,
                                     @Param("excludedId") Long excludedId,
                                     @Param("releasedLabels") Collection<String> releasedLabels);

    @Query(value = "SELECT r.flight_id, COALESCE(SUM(r.seats), 0) FROM reservations r " +
            "WHERE r.flight_id IN (:flightIds) AND UPPER(TRIM(r.status)) NOT IN (:releasedLabels) " +
            "GROUP BY r.flight_id",
            nativeQuery = true)
    List<Object[]> sumSeatsByFlights(@Param("flightIds") Collection<Long> flightIds,
                                     @Param("releasedLabels") Collection<String> releasedLabels);

    /**
     * @return 1 when the stored label differed from the canonical one and was rewritten
     */
    @Modifying
    @Query(value = "UPDATE reservations SET status = :canonical WHERE id = :id AND status <> :canonical",
            nativeQuery = true)
    int rewriteStatusLabel(@Param("id") Long id, @Param("canonical") String canonical);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Reservation r WHERE r.id = :id")
    Optional<Reservation> findByIdForUpdate(@Param("id") Long id);

    @Query("SELECT r.flight.id FROM Reservation r WHERE r.id = :id")
    Optional<Long> findFlightIdById(@Param("id") Long id);

    @EntityGraph(attributePaths = {"flight", "flight.aircraft", "user"})
    Optional<Reservation> findByIdAndUserId(Long id, Long userId);

    @EntityGraph(attributePaths = {"flight", "flight.aircraft", "user"})
    List<Reservation> findByUserIdOrderByCreatedAtDesc(Long userId);

    @EntityGraph(attributePaths = {"flight", "flight.aircraft", "user"})
    List<Reservation> findAllByOrderByCreatedAtDesc();

    @EntityGraph(attributePaths = {"flight", "user"})
    @Query("SELECT r FROM Reservation r ORDER BY r.createdAt DESC, r.id DESC")
    List<Reservation> findRecent(Pageable pageable);

    boolean existsByFlightId(Long flightId);

    boolean existsByUserId(Long userId);

    long countByStatus(ReservationStatus status);

    @Query("SELECT COALESCE(SUM(r.seats), 0) FROM Reservation r")
    long sumAllSeats();

    @Query("SELECT r.createdAt FROM Reservation r WHERE r.createdAt >= :from")
    List<LocalDateTime> findCreationTimesSince(@Param("from") LocalDateTime from);
}
