package com.airbooking.booking.controller.v1.admin;

import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.dto.UserEntry;
import com.airbooking.booking.dto.UserUpdateRequest;
import com.airbooking.booking.enums.UserRole;
import com.airbooking.booking.service.AccessGuard;
import com.airbooking.booking.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/admin/users")
@RequiredArgsConstructor
@Slf4j
public class AdminUserController {

    private final UserService userService;
    private final AccessGuard accessGuard;

    @GetMapping
    public ResponseEntity<List<UserEntry>> list(CallerIdentity caller,
                                                @RequestParam(required = false) String role,
                                                @RequestParam(required = false) String status) {
        accessGuard.requireAgent(caller);
        log.debug("GET /v1/admin/users - role={}, status={}", role, status);

        UserRole roleFilter = role != null && !role.isBlank() ? UserRole.fromLabel(role) : null;
        return ResponseEntity.ok(userService.list(roleFilter, status));
    }

    @PutMapping("/{userId}")
    public ResponseEntity<UserEntry> update(CallerIdentity caller, @PathVariable Long userId,
                                            @Valid @RequestBody UserUpdateRequest request) {
        accessGuard.requireAgent(caller);
        log.info("PUT /v1/admin/users/{}", userId);
        return ResponseEntity.ok(userService.update(userId, request));
    }

    @DeleteMapping("/{userId}")
    public ResponseEntity<Void> delete(CallerIdentity caller, @PathVariable Long userId) {
        accessGuard.requireAgent(caller);
        log.info("DELETE /v1/admin/users/{}", userId);
        userService.delete(userId);
        return ResponseEntity.noContent().build();
    }
}
