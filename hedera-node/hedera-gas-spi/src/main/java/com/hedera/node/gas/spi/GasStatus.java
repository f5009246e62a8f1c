// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.spi;

/**
 * The outcome of metering a unit of work. Every status except {@link #SUCCESS} is fatal to the unit of work
 * that produced it.
 */
public enum GasStatus {
    /**
     * All charges and refunds were accepted.
     */
    SUCCESS,
    /**
     * A charge made cumulative consumption exceed the meter's limit.
     */
    OUT_OF_GAS,
    /**
     * A charge would have wrapped the unsigned 64-bit consumption counter.
     */
    GAS_OVERFLOW,
    /**
     * A refund exceeded the gas consumed so far.
     */
    NEGATIVE_GAS_CONSUMED
}
