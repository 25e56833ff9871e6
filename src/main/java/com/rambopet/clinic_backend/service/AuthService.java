package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.JwtTokenProvider;
import com.rambopet.clinic_backend.dto.request.ChangePasswordRequest;
import com.rambopet.clinic_backend.dto.request.LoginRequest;
import com.rambopet.clinic_backend.dto.request.RegisterRequest;
import com.rambopet.clinic_backend.dto.response.AuthResponse;
import com.rambopet.clinic_backend.dto.response.UserResponse;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.exception.UnauthorizedException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.UserRepository;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;
    private final UserService userService;

    /**
     * Self-service sign up. Always creates a guardian; staff accounts are created by administrators.
     */
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        log.info("Registering new guardian with email: {}", request.getEmail());

        String email = request.getEmail().trim().toLowerCase();
        if (userRepository.existsByEmail(email)) {
            throw ValidationException.of("register", "email", "Email already registered");
        }
        if (userRepository.existsByUsername(request.getUsername().trim())) {
            throw ValidationException.of("register", "username", "Username already taken");
        }

        User user = User.builder()
                .username(request.getUsername().trim())
                .email(email)
                .password(passwordEncoder.encode(request.getPassword()))
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .phone(request.getPhone())
                .address(request.getAddress())
                .birthDate(request.getBirthDate())
                .role(Role.GUARDIAN)
                .active(true)
                .build();

        User savedUser = userRepository.save(user);
        log.info("Guardian registered successfully with ID: {}", savedUser.getId());

        return issueTokens(savedUser);
    }

    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        log.info("Login attempt for {}", request.getEmail());

        User user = userRepository.findByEmail(request.getEmail().trim().toLowerCase())
                .orElseThrow(() -> new UnauthorizedException("Invalid email or password"));

        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            log.warn("Wrong password for {}", request.getEmail());
            throw new UnauthorizedException("Invalid email or password");
        }

        if (!user.isEnabled()) {
            log.warn("Login rejected for inactive user {}", request.getEmail());
            throw new DisabledException("User account is disabled");
        }

        log.info("Login successful: {}", user.getUsername());
        return issueTokens(user);
    }

    @Transactional(readOnly = true)
    public AuthResponse refreshToken(String refreshToken) {
        log.debug("Refreshing token...");
        User user;
        try {
            if (!jwtTokenProvider.isRefreshToken(refreshToken)) {
                throw new UnauthorizedException("Invalid refresh token");
            }
            String username = jwtTokenProvider.extractUsername(refreshToken);
            user = userRepository.findByUsername(username)
                    .orElseThrow(() -> new UnauthorizedException("Invalid refresh token"));
            if (!jwtTokenProvider.isTokenValid(refreshToken, user)) {
                throw new UnauthorizedException("Invalid refresh token");
            }
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Token refresh failed: {}", e.getMessage());
            throw new UnauthorizedException("Invalid refresh token");
        }

        if (!user.isEnabled()) {
            throw new DisabledException("User account is disabled");
        }

        return AuthResponse.builder()
                .user(userService.mapToUserResponse(user))
                .token(jwtTokenProvider.generateToken(user))
                .refreshToken(refreshToken)
                .expiresIn(jwtTokenProvider.getJwtExpiration())
                .build();
    }

    @Transactional
    public void changePassword(ChangePasswordRequest request) {
        User user = userService.getCurrentUser();
        log.info("Changing password for user: {}", user.getUsername());

        if (!passwordEncoder.matches(request.getCurrentPassword(), user.getPassword())) {
            log.warn("Current password incorrect for user: {}", user.getUsername());
            throw ValidationException.of("changePassword", "currentPassword", "Current password is incorrect");
        }

        user.setPassword(passwordEncoder.encode(request.getNewPassword()));
        userRepository.save(user);

        log.info("Password changed successfully for user: {}", user.getUsername());
    }

    public UserResponse getCurrentUser() {
        return userService.mapToUserResponse(userService.getCurrentUser());
    }

    private AuthResponse issueTokens(User user) {
        return AuthResponse.builder()
                .user(userService.mapToUserResponse(user))
                .token(jwtTokenProvider.generateToken(user))
                .refreshToken(jwtTokenProvider.generateRefreshToken(user))
                .expiresIn(jwtTokenProvider.getJwtExpiration())
                .build();
    }
}
