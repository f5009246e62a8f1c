// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.impl;

import static com.hedera.node.gas.spi.util.GasUtils.MAX_GAS;
import static com.hedera.node.gas.spi.util.GasUtils.isGreaterThan;
import static com.hedera.node.gas.spi.util.GasUtils.sumWouldOverflow;
import static com.hedera.node.gas.spi.util.GasUtils.toDecimal;
import static java.util.Objects.requireNonNull;

import com.hedera.node.gas.spi.GasMeter;
import com.hedera.node.gas.spi.GasMeterException;
import com.hedera.node.gas.spi.GasReport;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Optional;

/**
 * A {@link GasMeter} without a limit, used where gas should be measured but never stop execution, such as
 * simulation and gas estimation. Only overflow of the consumed total is fatal. It never keeps a report.
 */
public class InfiniteGasMeter implements GasMeter {
    private long consumed;

    @Override
    public long gasConsumed() {
        return consumed;
    }

    @Override
    public long gasConsumedToLimit() {
        return consumed;
    }

    /**
     * Always zero; this meter has no limit.
     */
    @Override
    public long limit() {
        return 0L;
    }

    @Override
    public void consumeGas(final long amount, @NonNull final String descriptor) {
        requireNonNull(descriptor);
        if (sumWouldOverflow(consumed, amount)) {
            consumed = MAX_GAS;
            throw GasMeterException.gasOverflow(descriptor);
        }
        consumed += amount;
    }

    @Override
    public void refundGas(final long amount, @NonNull final String descriptor) {
        requireNonNull(descriptor);
        if (isGreaterThan(amount, consumed)) {
            throw GasMeterException.negativeGasConsumed(descriptor);
        }
        consumed -= amount;
    }

    @Override
    public boolean isPastLimit() {
        return false;
    }

    @Override
    public boolean isOutOfGas() {
        return false;
    }

    @NonNull
    @Override
    public Optional<GasReport> report() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "InfiniteGasMeter:\n  consumed: " + toDecimal(consumed);
    }
}
