package com.rambopet.clinic_backend.exception;

import org.springframework.validation.FieldError;

import java.util.List;

public class InsufficientStockException extends ValidationException {
    public InsufficientStockException(String lotNumber, int available, int requested) {
        super(String.format("Insufficient stock in lot %s. Available: %d, Requested: %d",
                        lotNumber, available, requested),
                List.of(new FieldError("stockMovement", "quantity",
                        String.format("Quantity exceeds available stock (%d)", available))),
                "INSUFFICIENT_STOCK");
    }
}
