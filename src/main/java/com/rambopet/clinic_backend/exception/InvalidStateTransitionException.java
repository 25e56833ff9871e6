package com.rambopet.clinic_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised when a lifecycle action is requested from a state that does not allow it.
 */
public class InvalidStateTransitionException extends ApiException {
    public InvalidStateTransitionException(String resourceName, Object currentState, String action) {
        super(String.format("Cannot %s %s in state %s", action, resourceName, currentState),
                HttpStatus.CONFLICT,
                "INVALID_STATE_TRANSITION");
    }

    public InvalidStateTransitionException(String message) {
        super(message, HttpStatus.CONFLICT, "INVALID_STATE_TRANSITION");
    }
}
