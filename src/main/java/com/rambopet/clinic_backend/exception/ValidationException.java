package com.rambopet.clinic_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;
import org.springframework.validation.FieldError;

import java.util.List;

@Getter
public class ValidationException extends ApiException {
    private final List<FieldError> fieldErrors;

    public ValidationException(String message, List<FieldError> fieldErrors) {
        this(message, fieldErrors, "VALIDATION_ERROR");
    }

    protected ValidationException(String message, List<FieldError> fieldErrors, String errorCode) {
        super(message, HttpStatus.BAD_REQUEST, errorCode);
        this.fieldErrors = fieldErrors;
    }

    public static ValidationException of(String objectName, String field, String message) {
        return new ValidationException(message, List.of(new FieldError(objectName, field, message)));
    }
}
