package com.airbooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class FlightBoard {

    List<FlightBoardEntry> items;
    Long total;
    Integer limit;
}
