// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.config;

import static java.util.Objects.requireNonNull;

import com.hedera.node.gas.spi.GasConfig;
import com.hedera.node.gas.spi.util.GasUtils;
import com.typesafe.config.Config;
import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Gas prices of one kind of store, read from a config block such as {@code gas.kvStore}. Prices are unsigned
 * 64-bit amounts, like the meter limit; a price above {@code Long.MAX_VALUE} must be quoted in the config.
 *
 * @param hasCost flat cost of an existence check
 * @param deleteCost flat cost of a delete
 * @param readCostFlat flat cost of a read
 * @param readCostPerByte cost per byte of key and value read
 * @param writeCostFlat flat cost of a write
 * @param writeCostPerByte cost per byte of key and value written
 * @param iterNextCostFlat flat cost of advancing an iterator
 */
public record StoreGasConfig(
        long hasCost,
        long deleteCost,
        long readCostFlat,
        long readCostPerByte,
        long writeCostFlat,
        long writeCostPerByte,
        long iterNextCostFlat) {

    /**
     * Reads the prices from a block holding the seven price properties.
     *
     * @param block the config block
     * @return the prices
     * @throws com.typesafe.config.ConfigException if a property is missing or not a scalar
     * @throws IllegalArgumentException if a price is not an unsigned 64-bit decimal
     */
    public static StoreGasConfig from(@NonNull final Config block) {
        requireNonNull(block);
        return new StoreGasConfig(
                price(block, "hasCost"),
                price(block, "deleteCost"),
                price(block, "readCostFlat"),
                price(block, "readCostPerByte"),
                price(block, "writeCostFlat"),
                price(block, "writeCostPerByte"),
                price(block, "iterNextCostFlat"));
    }

    /**
     * Returns these prices as the {@link GasConfig} a store charges with.
     *
     * @return the gas config
     */
    @NonNull
    public GasConfig toGasConfig() {
        return new GasConfig(
                hasCost, deleteCost, readCostFlat, readCostPerByte, writeCostFlat, writeCostPerByte, iterNextCostFlat);
    }

    private static long price(final Config block, final String name) {
        final var raw = block.getString(name);
        try {
            return GasUtils.parseGas(raw);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Store gas price " + name + " is not an unsigned amount: '" + raw + "'", e);
        }
    }
}
