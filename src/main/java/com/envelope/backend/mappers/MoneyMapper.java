package com.envelope.backend.mappers;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Converts between minor units (cents, as stored and computed) and major units (as shown).
 */
public class MoneyMapper {

    private static final int MINOR_DIGITS = 2;

    private MoneyMapper() {}

    /** 10050 -> 100.50 */
    public static BigDecimal toMajorUnits(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, MINOR_DIGITS);
    }

    /**
     * 100.5 -> 10050.
     *
     * @throws ArithmeticException if the value has more than two decimals or does not fit a long
     */
    public static long toMinorUnits(BigDecimal majorUnits) {
        return majorUnits.setScale(MINOR_DIGITS, RoundingMode.UNNECESSARY)
                .movePointRight(MINOR_DIGITS)
                .longValueExact();
    }
}
