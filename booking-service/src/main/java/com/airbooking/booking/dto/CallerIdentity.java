package com.airbooking.booking.dto;

import com.airbooking.booking.enums.UserRole;

/**
 * Authenticated caller, resolved from the bearer credential of the current request.
 */
public record CallerIdentity(Long userId, UserRole role) {

    public boolean isAgent() {
        return role != null && role.hasAgentCapability();
    }
}
