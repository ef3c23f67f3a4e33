package com.airbooking.booking.service;

import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.exception.ForbiddenException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class AccessGuard {

    public void requireAgent(CallerIdentity caller) {
        if (caller == null || !caller.isAgent()) {
            log.warn("Back-office access denied: userId={}, role={}",
                    caller != null ? caller.userId() : null, caller != null ? caller.role() : null);
            throw new ForbiddenException("Agent role required");
        }
    }
}
