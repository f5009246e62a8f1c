// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.config;

import static java.util.Objects.requireNonNull;

import com.hedera.node.gas.spi.util.GasUtils;
import com.typesafe.config.Config;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * How the gas meter of each unit of work is built, read from {@code gas.meter}.
 *
 * @param limit the unsigned limit of a bounded meter
 * @param costBreakdownEnabled whether a bounded meter keeps a per-descriptor report
 * @param infinite whether units of work get an unbounded meter instead, as in simulation and estimation runs
 */
public record GasMeterConfig(long limit, boolean costBreakdownEnabled, boolean infinite) {
    /**
     * Reads the settings from a {@code gas.meter} block. The limit is an unsigned decimal string.
     *
     * @param block the config block
     * @return the settings
     * @throws com.typesafe.config.ConfigException if a property is missing or of the wrong type
     * @throws IllegalArgumentException if the limit is not an unsigned 64-bit decimal
     */
    public static GasMeterConfig from(@NonNull final Config block) {
        requireNonNull(block);
        return new GasMeterConfig(
                GasUtils.parseGas(block.getString("limit")),
                block.getBoolean("costBreakdownEnabled"),
                block.getBoolean("infinite"));
    }

    @Override
    public String toString() {
        return "GasMeterConfig[limit=" + GasUtils.toDecimal(limit) + ", costBreakdownEnabled=" + costBreakdownEnabled
                + ", infinite=" + infinite + "]";
    }
}
