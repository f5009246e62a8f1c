// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.impl;

import static com.hedera.node.gas.spi.util.GasUtils.MAX_GAS;
import static com.hedera.node.gas.spi.util.GasUtils.isAtLeast;
import static com.hedera.node.gas.spi.util.GasUtils.isGreaterThan;
import static com.hedera.node.gas.spi.util.GasUtils.sumWouldOverflow;
import static com.hedera.node.gas.spi.util.GasUtils.toDecimal;
import static java.util.Objects.requireNonNull;

import com.hedera.node.gas.spi.GasMeter;
import com.hedera.node.gas.spi.GasMeterException;
import com.hedera.node.gas.spi.GasReport;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Optional;

/**
 * A {@link GasMeter} that enforces a hard limit. A limit of zero permits no charge at all.
 *
 * <p>A charge is applied to the consumed total before the limit is checked, so after an out-of-gas failure
 * {@link #gasConsumed()} includes the failed charge. The optional report only records charges that passed both the
 * overflow and the limit check, so it undercounts the consumed total by the final charge of a unit of work that
 * ran out of gas. {@link #report()} returns a snapshot; only {@link #consumeGas} and {@link #refundGas} change the
 * totals behind it.
 */
public class BasicGasMeter implements GasMeter {
    private final long limit;
    private long consumed;

    @Nullable
    private final GasReportAccumulator report;

    /**
     * Creates a meter with the given limit.
     *
     * @param limit the unsigned limit
     * @param costBreakdownEnabled whether to keep a per-descriptor report
     */
    public BasicGasMeter(final long limit, final boolean costBreakdownEnabled) {
        this.limit = limit;
        this.report = costBreakdownEnabled ? new GasReportAccumulator() : null;
    }

    @Override
    public long gasConsumed() {
        return consumed;
    }

    @Override
    public long gasConsumedToLimit() {
        return isPastLimit() ? limit : consumed;
    }

    @Override
    public long limit() {
        return limit;
    }

    @Override
    public void consumeGas(final long amount, @NonNull final String descriptor) {
        requireNonNull(descriptor);
        if (sumWouldOverflow(consumed, amount)) {
            consumed = MAX_GAS;
            throw GasMeterException.gasOverflow(descriptor);
        }
        consumed += amount;
        if (isPastLimit()) {
            throw GasMeterException.outOfGas(descriptor);
        }
        if (report != null) {
            report.add(descriptor, amount);
        }
    }

    @Override
    public void refundGas(final long amount, @NonNull final String descriptor) {
        requireNonNull(descriptor);
        if (isGreaterThan(amount, consumed)) {
            throw GasMeterException.negativeGasConsumed(descriptor);
        }
        consumed -= amount;
        if (report != null) {
            report.subtract(descriptor, amount);
        }
    }

    @Override
    public boolean isPastLimit() {
        return isGreaterThan(consumed, limit);
    }

    @Override
    public boolean isOutOfGas() {
        return isAtLeast(consumed, limit);
    }

    @NonNull
    @Override
    public Optional<GasReport> report() {
        return report == null ? Optional.empty() : Optional.of(report.snapshot());
    }

    @Override
    public String toString() {
        return "BasicGasMeter:\n  limit: " + toDecimal(limit) + "\n  consumed: " + toDecimal(consumed);
    }
}
