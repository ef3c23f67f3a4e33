package com.airbooking.booking.repository;

import com.airbooking.booking.enums.FlightStatus;
import com.airbooking.booking.model.Flight;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface FlightRepository extends JpaRepository<Flight, Long>, JpaSpecificationExecutor<Flight> {

    /**
     * Row lock that serializes every capacity check and seat commit on one flight.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM Flight f WHERE f.id = :id")
    Optional<Flight> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM Flight f WHERE f.aircraft.id = :aircraftId ORDER BY f.id")
    List<Flight> findByAircraftIdForUpdate(@Param("aircraftId") Long aircraftId);

    @EntityGraph(attributePaths = "aircraft")
    Optional<Flight> findWithAircraftByIdAndStatus(Long id, FlightStatus status);

    List<Flight> findByAircraftIdAndStatus(Long aircraftId, FlightStatus status);

    @EntityGraph(attributePaths = "aircraft")
    List<Flight> findWithAircraftByStatus(FlightStatus status);

    boolean existsByAircraftId(Long aircraftId);

    long countByStatus(FlightStatus status);

    @EntityGraph(attributePaths = "aircraft")
    @Query("SELECT f FROM Flight f WHERE f.departureTime >= :from AND f.departureTime < :to")
    List<Flight> findDepartingBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    @EntityGraph(attributePaths = "aircraft")
    @Query("SELECT f FROM Flight f ORDER BY f.departureTime ASC, f.id ASC")
    List<Flight> findBoard(Pageable pageable);

    @Query("SELECT f.aircraft.id, COUNT(f) FROM Flight f GROUP BY f.aircraft.id")
    List<Object[]> countFlightsPerAircraft();

    /**
     * Status column as stored, so rows written with older spellings are still visible.
     */
    @Query(value = "SELECT f.status, COUNT(*) FROM flights f GROUP BY f.status", nativeQuery = true)
    List<Object[]> countByRawStatus();
}
