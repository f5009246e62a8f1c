// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.spi;

/**
 * The gas prices a key-value store charges for its operations. All values are unsigned gas amounts.
 *
 * @param hasCost flat cost of an existence check
 * @param deleteCost flat cost of a delete
 * @param readCostFlat flat cost of a read
 * @param readCostPerByte cost per byte of key and value read
 * @param writeCostFlat flat cost of a write
 * @param writeCostPerByte cost per byte of key and value written
 * @param iterNextCostFlat flat cost of advancing an iterator
 */
public record GasConfig(
        long hasCost,
        long deleteCost,
        long readCostFlat,
        long readCostPerByte,
        long writeCostFlat,
        long writeCostPerByte,
        long iterNextCostFlat) {

    /**
     * Returns the prices of a persistent key-value store.
     *
     * @return the persistent store prices
     */
    public static GasConfig kvGasConfig() {
        return new GasConfig(1000, 1000, 1000, 3, 2000, 30, 30);
    }

    /**
     * Returns the prices of a transient store, which is discarded at the end of each block and so is cheaper.
     *
     * @return the transient store prices
     */
    public static GasConfig transientGasConfig() {
        return new GasConfig(100, 100, 100, 0, 200, 3, 3);
    }
}
