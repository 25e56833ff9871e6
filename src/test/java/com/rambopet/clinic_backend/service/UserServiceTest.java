package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ClinicProperties;
import com.rambopet.clinic_backend.dto.request.UserRequest;
import com.rambopet.clinic_backend.dto.response.UserResponse;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.exception.ApiException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.UserRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UserServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    private UserService userService;

    private User admin;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        userService = new UserService(userRepository, passwordEncoder, new ClinicProperties());

        admin = User.builder().id(UUID.randomUUID()).username("admin").email("admin@rambopet.mx")
                .firstName("Admin").role(Role.ADMIN).build();
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(admin, null, admin.getAuthorities()));

        when(passwordEncoder.encode(anyString())).thenReturn("hashed");
        when(userRepository.save(any(User.class))).thenAnswer(invocation -> invocation.getArgument(0));
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void create_nonVeterinarian_dropsLicenseAndSpecialty() {
        UserResponse response = userService.createUser(request(Role.RECEPTIONIST, "CED-123", "Surgery"));

        assertNull(response.getProfessionalLicense());
        assertNull(response.getSpecialty());
        verify(userRepository, never()).existsByProfessionalLicense(any());
    }

    @Test
    void create_veterinarian_keepsLicenseAndSpecialty() {
        UserResponse response = userService.createUser(request(Role.VETERINARIAN, " CED-123 ", "Surgery"));

        assertEquals("CED-123", response.getProfessionalLicense());
        assertEquals("Surgery", response.getSpecialty());
    }

    @Test
    void update_vetMovedToReception_losesLicenseAndSpecialty() {
        User vet = User.builder().id(UUID.randomUUID()).username("vet").email("vet@rambopet.mx")
                .firstName("Laura").role(Role.VETERINARIAN).professionalLicense("CED-123").specialty("Surgery").build();
        when(userRepository.findById(vet.getId())).thenReturn(Optional.of(vet));

        UserRequest request = request(Role.RECEPTIONIST, "CED-123", "Surgery");
        request.setUsername("vet");
        request.setEmail("vet@rambopet.mx");
        UserResponse response = userService.updateUser(vet.getId(), request);

        assertEquals(Role.RECEPTIONIST, response.getRole());
        assertNull(vet.getProfessionalLicense());
        assertNull(vet.getSpecialty());
    }

    @Test
    void create_veterinarianWithTakenLicense_isRejectedOnLicenseField() {
        when(userRepository.existsByProfessionalLicense("CED-123")).thenReturn(true);

        ValidationException ex = assertThrows(ValidationException.class,
                () -> userService.createUser(request(Role.VETERINARIAN, "CED-123", null)));

        assertEquals("professionalLicense", ex.getFieldErrors().get(0).getField());
        verify(userRepository, never()).save(any());
    }

    @Test
    void deactivate_marksUserInactive_butNeverTheCallerThemselves() {
        User vet = User.builder().id(UUID.randomUUID()).username("vet").firstName("Laura").role(Role.VETERINARIAN).build();
        when(userRepository.findById(vet.getId())).thenReturn(Optional.of(vet));
        when(userRepository.findById(admin.getId())).thenReturn(Optional.of(admin));

        UserResponse response = userService.deactivateUser(vet.getId());

        assertFalse(response.isActive());
        assertFalse(vet.isEnabled());
        assertThrows(ApiException.class, () -> userService.deactivateUser(admin.getId()));
        assertTrue(admin.isActive());
    }

    private UserRequest request(Role role, String license, String specialty) {
        return UserRequest.builder()
                .username("new.user")
                .email("new.user@rambopet.mx")
                .password("Secret123!")
                .firstName("Laura")
                .lastName("Ruiz")
                .role(role)
                .professionalLicense(license)
                .specialty(specialty)
                .build();
    }
}
