package com.rambopet.clinic_backend.dto.request;

import com.rambopet.clinic_backend.util.Constants;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileUpdateRequest {

    @NotBlank(message = "First name is required")
    @Size(max = Constants.MAX_NAME_LENGTH)
    private String firstName;

    @Size(max = Constants.MAX_NAME_LENGTH)
    private String lastName;

    @Pattern(regexp = Constants.PHONE_REGEX, message = Constants.PHONE_MESSAGE)
    private String phone;

    private String address;

    private LocalDate birthDate;

    @Size(max = 100)
    private String specialty;
}
