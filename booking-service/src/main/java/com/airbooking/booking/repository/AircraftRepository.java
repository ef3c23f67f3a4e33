package com.airbooking.booking.repository;

import com.airbooking.booking.model.Aircraft;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AircraftRepository extends JpaRepository<Aircraft, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Aircraft a WHERE a.id = :id")
    Optional<Aircraft> findByIdForUpdate(@Param("id") Long id);

    List<Aircraft> findAllByOrderByIdAsc();
}
