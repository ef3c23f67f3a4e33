package com.airbooking.booking.mapper;

import com.airbooking.booking.dto.UserEntry;
import com.airbooking.booking.model.AppUser;

public final class UserMapper {

    private UserMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static UserEntry toEntry(AppUser user) {
        if (user == null) {
            return null;
        }

        return UserEntry.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .role(user.getRole() != null ? user.getRole().name() : null)
                .status(user.getStatus())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
