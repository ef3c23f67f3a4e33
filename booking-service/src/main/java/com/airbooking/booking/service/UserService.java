package com.airbooking.booking.service;

import com.airbooking.booking.dto.UserEntry;
import com.airbooking.booking.dto.UserUpdateRequest;
import com.airbooking.booking.enums.UserRole;
import com.airbooking.booking.exception.ConflictException;
import com.airbooking.booking.exception.ResourceNotFoundException;
import com.airbooking.booking.mapper.UserMapper;
import com.airbooking.booking.model.AppUser;
import com.airbooking.booking.repository.ReservationRepository;
import com.airbooking.booking.repository.UserRepository;
import com.airbooking.booking.repository.UserSpecification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final ReservationRepository reservationRepository;

    @Transactional(readOnly = true)
    public UserEntry findById(Long userId) {
        return userRepository.findById(userId)
                .map(UserMapper::toEntry)
                .orElseThrow(() -> ResourceNotFoundException.user(userId));
    }

    @Transactional(readOnly = true)
    public List<UserEntry> list(UserRole role, String status) {
        return userRepository.findAll(UserSpecification.withFilters(role, status), Sort.by("id")).stream()
                .map(UserMapper::toEntry)
                .toList();
    }

    @Transactional
    public UserEntry update(Long userId, UserUpdateRequest request) {
        AppUser user = userRepository.findById(userId)
                .orElseThrow(() -> ResourceNotFoundException.user(userId));

        if (StringUtils.hasText(request.getEmail())) {
            String email = request.getEmail().trim();
            if (userRepository.existsByEmailIgnoreCaseAndIdNot(email, userId)) {
                throw new ConflictException("EMAIL_IN_USE", "Email already used by another account");
            }
            user.setEmail(email);
        }
        if (StringUtils.hasText(request.getName())) {
            user.setName(request.getName().trim());
        }
        if (request.getRole() != null) {
            user.setRole(request.getRole());
        }
        if (request.getStatus() != null) {
            user.setStatus(request.getStatus());
        }

        userRepository.save(user);
        log.info("User updated: id={}, role={}, status={}", userId, user.getRole(), user.getStatus());
        return UserMapper.toEntry(user);
    }

    @Transactional
    public void delete(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw ResourceNotFoundException.user(userId);
        }
        if (reservationRepository.existsByUserId(userId)) {
            throw ConflictException.userHasReservations(userId);
        }
        userRepository.deleteById(userId);
        log.info("User deleted: id={}", userId);
    }
}
