// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.impl;

import static com.hedera.node.gas.spi.util.GasUtils.MAX_GAS;
import static com.hedera.node.gas.spi.util.GasUtils.isGreaterThan;
import static com.hedera.node.gas.spi.util.GasUtils.sumWouldOverflow;
import static com.hedera.node.gas.spi.util.GasUtils.toDecimal;
import static java.util.Objects.requireNonNull;

import com.hedera.node.gas.spi.GasReport;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.HashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The mutable per-descriptor totals behind a meter's {@link GasReport}. Only meters in this package write to it;
 * callers of a meter only ever see {@link #snapshot()}s. Entries saturate at zero and at
 * {@link com.hedera.node.gas.spi.util.GasUtils#MAX_GAS} instead of wrapping.
 */
final class GasReportAccumulator {
    private static final Logger log = LogManager.getLogger(GasReportAccumulator.class);

    private final Map<String, Long> gasByDescriptor = new HashMap<>();

    /**
     * Attributes a charge to the given descriptor.
     *
     * @param descriptor the descriptor
     * @param amount the charged gas
     */
    void add(@NonNull final String descriptor, final long amount) {
        requireNonNull(descriptor);
        final var current = gasByDescriptor.getOrDefault(descriptor, 0L);
        if (sumWouldOverflow(current, amount)) {
            log.warn(
                    "Gas report entry {} saturated at maximum (had {}, adding {})",
                    descriptor,
                    toDecimal(current),
                    toDecimal(amount));
            gasByDescriptor.put(descriptor, MAX_GAS);
        } else {
            gasByDescriptor.put(descriptor, current + amount);
        }
    }

    /**
     * Removes a refund from the given descriptor. A refund larger than what the descriptor was charged leaves
     * the entry at zero.
     *
     * @param descriptor the descriptor
     * @param amount the refunded gas
     */
    void subtract(@NonNull final String descriptor, final long amount) {
        requireNonNull(descriptor);
        final var current = gasByDescriptor.getOrDefault(descriptor, 0L);
        if (isGreaterThan(amount, current)) {
            log.warn(
                    "Refund of {} under {} exceeds its reported {}, entry saturated at zero",
                    toDecimal(amount),
                    descriptor,
                    toDecimal(current));
            gasByDescriptor.put(descriptor, 0L);
        } else {
            gasByDescriptor.put(descriptor, current - amount);
        }
    }

    @NonNull
    GasReport snapshot() {
        return GasReport.of(gasByDescriptor);
    }
}
