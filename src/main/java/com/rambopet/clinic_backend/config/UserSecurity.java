package com.rambopet.clinic_backend.config;

import com.rambopet.clinic_backend.model.User;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Ownership checks referenced from {@code @PreAuthorize} expressions as {@code @userSecurity}.
 */
@Component("userSecurity")
public class UserSecurity {

    public boolean isCurrentUser(UUID userId) {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || userId == null) {
            return false;
        }
        return authentication.getPrincipal() instanceof User user && userId.equals(user.getId());
    }
}
