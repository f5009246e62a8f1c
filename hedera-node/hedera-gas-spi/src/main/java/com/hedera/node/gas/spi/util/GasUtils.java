// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.spi.util;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Arithmetic helpers for gas amounts. Gas is an unsigned 64-bit quantity carried in a {@code long}, so every
 * comparison, rendering and overflow check here treats the bits of its arguments as unsigned.
 */
public final class GasUtils {
    /**
     * The largest representable gas amount, {@code 2^64 - 1}.
     */
    public static final long MAX_GAS = 0xFFFF_FFFF_FFFF_FFFFL;

    private GasUtils() {
        throw new UnsupportedOperationException("Utility Class");
    }

    /**
     * Returns whether the unsigned sum of the two amounts would exceed {@link #MAX_GAS}.
     *
     * @param augend the amount already accumulated
     * @param addend the amount to add
     * @return true if the sum does not fit in 64 unsigned bits
     */
    public static boolean sumWouldOverflow(final long augend, final long addend) {
        return Long.compareUnsigned(MAX_GAS - augend, addend) < 0;
    }

    /**
     * Returns whether the unsigned product of the two amounts would exceed {@link #MAX_GAS}.
     *
     * @param multiplier the first factor
     * @param multiplicand the second factor
     * @return true if the product does not fit in 64 unsigned bits
     */
    public static boolean productWouldOverflow(final long multiplier, final long multiplicand) {
        if (multiplicand == 0) {
            return false;
        }
        final var maxMultiplier = Long.divideUnsigned(MAX_GAS, multiplicand);
        return Long.compareUnsigned(multiplier, maxMultiplier) > 0;
    }

    public static boolean isGreaterThan(final long a, final long b) {
        return Long.compareUnsigned(a, b) > 0;
    }

    public static boolean isAtLeast(final long a, final long b) {
        return Long.compareUnsigned(a, b) >= 0;
    }

    /**
     * Renders a gas amount as an unsigned decimal.
     *
     * @param gas the amount
     * @return its unsigned decimal form
     */
    @NonNull
    public static String toDecimal(final long gas) {
        return Long.toUnsignedString(gas);
    }

    /**
     * Parses an unsigned decimal gas amount.
     *
     * @param decimal the decimal text
     * @return the amount
     * @throws IllegalArgumentException if the text is not an unsigned 64-bit decimal
     */
    public static long parseGas(@NonNull final String decimal) {
        try {
            return Long.parseUnsignedLong(decimal.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a valid gas amount: '" + decimal + "'", e);
        }
    }
}
