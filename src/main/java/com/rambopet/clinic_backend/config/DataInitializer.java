package com.rambopet.clinic_backend.config;

import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataInitializer {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final DefaultAdminConfig defaultAdminConfig;

    @Bean
    CommandLineRunner initDatabase() {
        return args -> createOrUpdateDefaultAdmin();
    }

    void createOrUpdateDefaultAdmin() {
        String email = defaultAdminConfig.getEmail();
        String rawPassword = defaultAdminConfig.getPassword();
        if (rawPassword == null || rawPassword.isBlank()) {
            log.warn("admin.default.password is not set; skipping default administrator setup");
            return;
        }

        userRepository.findByEmail(email).ifPresentOrElse(
                existingUser -> {
                    log.info("Admin user with email {} already exists", email);

                    if (!passwordEncoder.matches(rawPassword, existingUser.getPassword())
                            || existingUser.getRole() != Role.ADMIN) {
                        existingUser.setPassword(passwordEncoder.encode(rawPassword));
                        existingUser.setRole(Role.ADMIN);
                        existingUser.setActive(defaultAdminConfig.isEnabled());
                        userRepository.save(existingUser);
                        log.info("Default admin credentials refreshed for {}", email);
                    }
                },
                () -> {
                    User admin = User.builder()
                            .username(defaultAdminConfig.getUsername())
                            .email(email)
                            .password(passwordEncoder.encode(rawPassword))
                            .firstName(defaultAdminConfig.getFirstName())
                            .lastName(defaultAdminConfig.getLastName())
                            .phone(defaultAdminConfig.getPhone())
                            .role(Role.ADMIN)
                            .active(defaultAdminConfig.isEnabled())
                            .build();

                    userRepository.save(admin);
                    log.info("Default admin user created: {} ({})", admin.getUsername(), email);
                }
        );
    }
}
