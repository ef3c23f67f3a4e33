package com.airbooking.booking.service.identity;

import com.airbooking.booking.dto.CallerIdentity;

public interface IdentityProvider {

    /**
     * Resolves the caller from an {@code Authorization} header value.
     *
     * @throws com.airbooking.booking.exception.UnauthorizedException when the credential is missing or invalid
     */
    CallerIdentity authenticate(String authorizationHeader);
}
