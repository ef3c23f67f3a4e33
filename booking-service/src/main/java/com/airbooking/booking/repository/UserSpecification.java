package com.airbooking.booking.repository;

import com.airbooking.booking.enums.UserRole;
import com.airbooking.booking.model.AppUser;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

public final class UserSpecification {

    private UserSpecification() {
    }

    public static Specification<AppUser> withFilters(UserRole role, String status) {
        return Specification.where(hasRole(role)).and(hasStatus(status));
    }

    public static Specification<AppUser> hasRole(UserRole role) {
        return (root, query, cb) -> role == null ? null : cb.equal(root.get("role"), role);
    }

    public static Specification<AppUser> hasStatus(String status) {
        return (root, query, cb) -> {
            if (!StringUtils.hasText(status)) {
                return null;
            }
            return cb.equal(cb.lower(root.get("status")), status.trim().toLowerCase());
        };
    }
}
