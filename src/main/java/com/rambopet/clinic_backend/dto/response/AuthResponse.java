package com.rambopet.clinic_backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {
    private UserResponse user;
    private String token;
    private String refreshToken;
    private Long expiresIn;

    @Override
    public String toString() {
        return "AuthResponse{user=" + (user != null ? user.getUsername() : "null") + ", token=***}";
    }
}
