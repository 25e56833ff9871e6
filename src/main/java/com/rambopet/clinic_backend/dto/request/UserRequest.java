package com.rambopet.clinic_backend.dto.request;

import com.rambopet.clinic_backend.enums.Role;
import com.rambopet.clinic_backend.util.Constants;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Admin-side user creation and update. The password is optional on update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserRequest {

    @NotBlank(message = "Username is required")
    @Size(max = 150)
    private String username;

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    private String email;

    @Size(min = Constants.MIN_PASSWORD_LENGTH, message = "Password must be at least 8 characters")
    private String password;

    @NotBlank(message = "First name is required")
    @Size(max = Constants.MAX_NAME_LENGTH)
    private String firstName;

    @Size(max = Constants.MAX_NAME_LENGTH)
    private String lastName;

    @NotNull(message = "Role is required")
    private Role role;

    @Pattern(regexp = Constants.PHONE_REGEX, message = Constants.PHONE_MESSAGE)
    private String phone;

    private String address;

    private LocalDate birthDate;

    @Size(max = 50)
    private String professionalLicense;

    @Size(max = 100)
    private String specialty;

    private Boolean active;
}
