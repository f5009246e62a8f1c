// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.impl;

import static java.util.Objects.requireNonNull;

import com.hedera.node.gas.config.GasMeterConfig;
import com.hedera.node.gas.spi.GasMeter;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Factory methods for the two {@link GasMeter} variants. Every call returns a fresh meter for one unit of work.
 */
public final class GasMeters {
    private GasMeters() {
        throw new UnsupportedOperationException("Utility Class");
    }

    /**
     * Returns a meter that fails once consumption exceeds the given limit.
     *
     * @param limit the unsigned limit; zero permits no charge
     * @param costBreakdownEnabled whether to keep a per-descriptor report
     * @return a new bounded meter
     */
    @NonNull
    public static GasMeter newGasMeter(final long limit, final boolean costBreakdownEnabled) {
        return new BasicGasMeter(limit, costBreakdownEnabled);
    }

    /**
     * Returns a meter that only fails on overflow.
     *
     * @return a new unbounded meter
     */
    @NonNull
    public static GasMeter newInfiniteGasMeter() {
        return new InfiniteGasMeter();
    }

    /**
     * Returns the meter the given settings call for.
     *
     * @param meterConfig the meter settings
     * @return a new meter
     */
    @NonNull
    public static GasMeter fromConfig(@NonNull final GasMeterConfig meterConfig) {
        requireNonNull(meterConfig);
        return meterConfig.infinite()
                ? newInfiniteGasMeter()
                : newGasMeter(meterConfig.limit(), meterConfig.costBreakdownEnabled());
    }
}
