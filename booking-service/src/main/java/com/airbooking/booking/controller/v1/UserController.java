package com.airbooking.booking.controller.v1;

import com.airbooking.booking.dto.CallerIdentity;
import com.airbooking.booking.dto.UserEntry;
import com.airbooking.booking.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/users")
@RequiredArgsConstructor
@Slf4j
public class UserController {

    private final UserService userService;

    @GetMapping("/me")
    public ResponseEntity<UserEntry> me(CallerIdentity caller) {
        log.debug("GET /v1/users/me - user={}", caller.userId());
        return ResponseEntity.ok(userService.findById(caller.userId()));
    }
}
