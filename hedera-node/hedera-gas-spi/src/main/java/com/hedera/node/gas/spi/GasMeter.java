// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Optional;

/**
 * Tracks the gas consumed by a single unit of work, such as one transaction, against a limit.
 *
 * <p>All amounts are unsigned 64-bit quantities carried in a {@code long}; see
 * {@link com.hedera.node.gas.spi.util.GasUtils}. A meter is not thread-safe and is owned by exactly one execution
 * context. Once a meter throws a {@link GasMeterException}, the unit of work it meters is over; callers must let
 * the exception unwind to the boundary that created the meter.
 */
public interface GasMeter {
    /**
     * Returns the cumulative gas consumed, including a charge that pushed the meter past its limit.
     *
     * @return the gas consumed
     */
    long gasConsumed();

    /**
     * Returns the gas consumed, clamped to the limit once the meter is past it.
     *
     * @return the billable gas consumed
     */
    long gasConsumedToLimit();

    /**
     * Returns the configured limit.
     *
     * @return the limit
     */
    long limit();

    /**
     * Charges the given amount under the given descriptor.
     *
     * @param amount the unsigned amount to charge
     * @param descriptor the cost category of the charge
     * @throws GasMeterException with {@link GasStatus#GAS_OVERFLOW} if consumption would wrap, or with
     * {@link GasStatus#OUT_OF_GAS} if consumption now exceeds the limit
     */
    void consumeGas(long amount, @NonNull String descriptor);

    /**
     * Returns the given amount of previously consumed gas.
     *
     * @param amount the unsigned amount to refund
     * @param descriptor the cost category of the refund
     * @throws GasMeterException with {@link GasStatus#NEGATIVE_GAS_CONSUMED} if the amount exceeds the gas consumed
     */
    void refundGas(long amount, @NonNull String descriptor);

    /**
     * Returns whether consumption strictly exceeds the limit.
     *
     * @return true if past the limit
     */
    boolean isPastLimit();

    /**
     * Returns whether consumption has reached the limit.
     *
     * @return true if at or past the limit
     */
    boolean isOutOfGas();

    /**
     * Returns a snapshot of the per-descriptor breakdown, present only if the meter was created with cost breakdown
     * enabled. The snapshot is read-only and does not follow later charges or refunds.
     *
     * @return the breakdown, if tracked
     */
    @NonNull
    Optional<GasReport> report();
}
