package com.airbooking.booking.mapper;

import com.airbooking.booking.dto.RecentReservationEntry;
import com.airbooking.booking.enums.ReservationStatus;
import com.airbooking.booking.model.Flight;
import com.airbooking.booking.model.Reservation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ReservationMapper Tests")
class ReservationMapperTest {

    @Test
    @DisplayName("Should take the first letter of the first two name parts")
    void initials() {
        assertThat(ReservationMapper.initials("marie  claire kabila")).isEqualTo("MC");
        assertThat(ReservationMapper.initials("Unknown")).isEqualTo("U");
    }

    @Test
    @DisplayName("Should build a route code padded to three digits")
    void flightCode() {
        Reservation reservation = Reservation.builder()
                .id(7L)
                .flight(Flight.builder().id(1L).origin("Lubumbashi").destination("Goma").build())
                .build();

        assertThat(ReservationMapper.flightCode(reservation)).isEqualTo("LUB-GOM-007");
    }

    @Test
    @DisplayName("Should label a reservation without a passenger name as unknown")
    void toRecentEntry_MissingUser() {
        Reservation reservation = Reservation.builder()
                .id(1L)
                .seats(1)
                .status(ReservationStatus.PENDING)
                .build();

        RecentReservationEntry entry = ReservationMapper.toRecentEntry(reservation);

        assertThat(entry.getPassengerName()).isEqualTo("Unknown");
        assertThat(entry.getInitials()).isEqualTo("U");
        assertThat(entry.getFlightCode()).isEqualTo("001");
    }

    @Test
    @DisplayName("Should prefix board codes")
    void boardCode() {
        assertThat(ReservationMapper.boardCode(Flight.builder().id(42L).build())).isEqualTo("JC-042");
    }
}
