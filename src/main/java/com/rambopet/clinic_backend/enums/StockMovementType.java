package com.rambopet.clinic_backend.enums;

import java.util.EnumSet;
import java.util.Set;

public enum StockMovementType {
    INTAKE(1),
    SALE(-1),
    CLINICAL_USE(-1),
    POSITIVE_ADJUSTMENT(1),
    NEGATIVE_ADJUSTMENT(-1),
    LOSS(-1),
    RETURN(1);

    /** Outbound types accepted by the "record outbound" shortcut. */
    public static final Set<StockMovementType> DISPENSING = EnumSet.of(SALE, CLINICAL_USE);

    private final int sign;

    StockMovementType(int sign) {
        this.sign = sign;
    }

    /**
     * Stock after moving {@code quantity} units in this direction.
     *
     * @throws ArithmeticException if the result does not fit in an int
     */
    public int apply(int stockBefore, int quantity) {
        return Math.addExact(stockBefore, Math.multiplyExact(sign, quantity));
    }
}
