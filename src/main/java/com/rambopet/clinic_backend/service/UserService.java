package com.rambopet.clinic_backend.service;

import com.rambopet.clinic_backend.config.ClinicProperties;
import com.rambopet.clinic_backend.dto.request.ProfileUpdateRequest;
import com.rambopet.clinic_backend.dto.request.UserRequest;
import com.rambopet.clinic_backend.dto.response.PaginatedResponse;
import com.rambopet.clinic_backend.dto.response.UserResponse;
import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.exception.ApiException;
import com.rambopet.clinic_backend.exception.ResourceNotFoundException;
import com.rambopet.clinic_backend.exception.UnauthorizedException;
import com.rambopet.clinic_backend.exception.ValidationException;
import com.rambopet.clinic_backend.model.User;
import com.rambopet.clinic_backend.repository.UserRepository;
import com.rambopet.clinic_backend.util.Constants;
import com.rambopet.clinic_backend.util.FileUploadUtil;
import com.rambopet.clinic_backend.util.PaginationUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final ClinicProperties clinicProperties;

    @Transactional(readOnly = true)
    public UserResponse getUserById(UUID id) {
        return mapToUserResponse(findUser(id));
    }

    @Transactional(readOnly = true)
    public PaginatedResponse<UserResponse> getAllUsers(int page, int limit, String search, Role role, Boolean active) {
        Pageable pageable = PaginationUtil.pageOf(page, limit, Sort.by("createdAt").descending());
        Page<User> usersPage = userRepository.searchUsers(search, role, active, pageable);

        List<UserResponse> userResponses = usersPage.getContent()
                .stream()
                .map(this::mapToUserResponse)
                .collect(Collectors.toList());

        return PaginatedResponse.of(userResponses, page, limit, usersPage.getTotalElements());
    }

    @Transactional
    public UserResponse createUser(UserRequest request) {
        if (request.getPassword() == null || request.getPassword().isBlank()) {
            throw ValidationException.of("user", "password", "Password is required");
        }
        ensureUniqueIdentity(request.getEmail(), request.getUsername(), null);
        ensureUniqueLicense(request.getRole(), request.getProfessionalLicense(), null);

        User user = User.builder()
                .username(request.getUsername().trim())
                .email(request.getEmail().trim().toLowerCase())
                .password(passwordEncoder.encode(request.getPassword()))
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .role(request.getRole())
                .phone(request.getPhone())
                .address(request.getAddress())
                .birthDate(request.getBirthDate())
                .professionalLicense(blankToNull(request.getProfessionalLicense()))
                .specialty(blankToNull(request.getSpecialty()))
                .active(request.getActive() != null ? request.getActive() : true)
                .build();
        user.clearVeterinarianFields();

        User savedUser = userRepository.save(user);
        log.info("User created with ID: {} ({}, role {})", savedUser.getId(), savedUser.getUsername(), savedUser.getRole());

        return mapToUserResponse(savedUser);
    }

    @Transactional
    public UserResponse updateUser(UUID id, UserRequest request) {
        User user = findUser(id);

        ensureUniqueIdentity(request.getEmail(), request.getUsername(), user);
        ensureUniqueLicense(request.getRole(), request.getProfessionalLicense(), user);

        user.setUsername(request.getUsername().trim());
        user.setEmail(request.getEmail().trim().toLowerCase());
        user.setFirstName(request.getFirstName());
        user.setLastName(request.getLastName());
        user.setRole(request.getRole());
        user.setPhone(request.getPhone());
        user.setAddress(request.getAddress());
        user.setBirthDate(request.getBirthDate());
        user.setProfessionalLicense(blankToNull(request.getProfessionalLicense()));
        user.setSpecialty(blankToNull(request.getSpecialty()));

        if (request.getPassword() != null && !request.getPassword().trim().isEmpty()) {
            user.setPassword(passwordEncoder.encode(request.getPassword()));
        }

        if (request.getActive() != null) {
            user.setActive(request.getActive());
        }
        user.clearVeterinarianFields();

        User updatedUser = userRepository.save(user);
        log.info("User updated with ID: {}", id);

        return mapToUserResponse(updatedUser);
    }

    @Transactional
    public UserResponse deactivateUser(UUID id) {
        User user = findUser(id);
        if (user.getId().equals(getCurrentUser().getId())) {
            throw new ApiException("You cannot deactivate your own account", HttpStatus.BAD_REQUEST);
        }

        user.setActive(false);
        User saved = userRepository.save(user);

        log.info("User deactivated with ID: {}", id);
        return mapToUserResponse(saved);
    }

    @Transactional
    public UserResponse activateUser(UUID id) {
        User user = findUser(id);

        user.setActive(true);
        User activatedUser = userRepository.save(user);

        log.info("User activated with ID: {}", id);
        return mapToUserResponse(activatedUser);
    }

    @Transactional(readOnly = true)
    public List<UserResponse> getVeterinarians() {
        return getActiveUsersByRole(Role.VETERINARIAN);
    }

    @Transactional(readOnly = true)
    public List<UserResponse> getGuardians() {
        return getActiveUsersByRole(Role.GUARDIAN);
    }

    @Transactional(readOnly = true)
    public UserResponse getCurrentUserProfile() {
        return mapToUserResponse(getCurrentUser());
    }

    // Role, email and username are not editable from the profile
    @Transactional
    public UserResponse updateCurrentUserProfile(ProfileUpdateRequest request) {
        User currentUser = getCurrentUser();

        currentUser.setFirstName(request.getFirstName());
        currentUser.setLastName(request.getLastName());
        currentUser.setPhone(request.getPhone());
        currentUser.setAddress(request.getAddress());
        currentUser.setBirthDate(request.getBirthDate());
        if (currentUser.isVeterinarian()) {
            currentUser.setSpecialty(blankToNull(request.getSpecialty()));
        }

        User updatedUser = userRepository.save(currentUser);
        log.info("Profile updated for user {}", updatedUser.getUsername());
        return mapToUserResponse(updatedUser);
    }

    @Transactional
    public UserResponse uploadProfilePhoto(MultipartFile file) {
        if (!FileUploadUtil.isValidImageFile(file)) {
            throw ValidationException.of("profile", "file", "Profile photo must be an image");
        }
        User currentUser = getCurrentUser();
        String previous = currentUser.getProfilePhoto();

        String path = FileUploadUtil.saveFile(clinicProperties.getUploadDir(), file, Constants.PROFILE_PHOTO_DIR);
        currentUser.setProfilePhoto(path);
        User saved = userRepository.save(currentUser);
        FileUploadUtil.deleteFile(clinicProperties.getUploadDir(), previous);

        return mapToUserResponse(saved);
    }

    public User getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new UnauthorizedException("User not authenticated");
        }

        if (authentication.getPrincipal() instanceof User user) {
            return user;
        }

        String username = authentication.getName();
        return userRepository.findByUsername(username)
                .orElseThrow(() -> new UnauthorizedException("User not found"));
    }

    public User findUser(UUID id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User", "id", id));
    }

    public UserResponse mapToUserResponse(User user) {
        if (user == null) return null;

        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .firstName(user.getFirstName())
                .lastName(user.getLastName())
                .fullName(user.getFullName())
                .role(user.getRole())
                .phone(user.getPhone())
                .address(user.getAddress())
                .birthDate(user.getBirthDate())
                .professionalLicense(user.getProfessionalLicense())
                .specialty(user.getSpecialty())
                .profilePhoto(user.getProfilePhoto())
                .active(user.isActive())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }

    private List<UserResponse> getActiveUsersByRole(Role role) {
        return userRepository.findByRoleAndActiveTrueOrderByFirstNameAsc(role)
                .stream()
                .map(this::mapToUserResponse)
                .collect(Collectors.toList());
    }

    private void ensureUniqueIdentity(String email, String username, User existing) {
        String normalizedEmail = email.trim().toLowerCase();
        if ((existing == null || !existing.getEmail().equalsIgnoreCase(normalizedEmail))
                && userRepository.existsByEmail(normalizedEmail)) {
            throw ValidationException.of("user", "email", "Email already registered");
        }
        String trimmedUsername = username.trim();
        if ((existing == null || !existing.getUsername().equals(trimmedUsername))
                && userRepository.existsByUsername(trimmedUsername)) {
            throw ValidationException.of("user", "username", "Username already taken");
        }
    }

    private void ensureUniqueLicense(Role role, String license, User existing) {
        String normalized = blankToNull(license);
        if (role != Role.VETERINARIAN || normalized == null) {
            return;
        }
        if ((existing == null || !Objects.equals(existing.getProfessionalLicense(), normalized))
                && userRepository.existsByProfessionalLicense(normalized)) {
            throw ValidationException.of("user", "professionalLicense", "Professional license already registered");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
