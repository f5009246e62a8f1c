// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.impl.workflow;

import static java.util.Objects.requireNonNull;

import com.hedera.node.gas.spi.GasStatus;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Map;

/**
 * The gas accounting of a finished unit of work.
 *
 * @param status the final status, {@link GasStatus#SUCCESS} unless a fatal gas condition aborted the work
 * @param failedDescriptor the descriptor of the charge or refund that aborted the work, null on success
 * @param gasConsumed the gas consumed, including a charge that exceeded the limit
 * @param gasConsumedToLimit the gas consumed clamped to the limit
 * @param report the per-descriptor breakdown, empty if the meter did not keep one
 */
public record WorkOutcome(
        @NonNull GasStatus status,
        @Nullable String failedDescriptor,
        long gasConsumed,
        long gasConsumedToLimit,
        @NonNull Map<String, Long> report) {
    public WorkOutcome {
        requireNonNull(status);
        requireNonNull(report);
        if ((status == GasStatus.SUCCESS) != (failedDescriptor == null)) {
            throw new IllegalArgumentException("Only a failed outcome names a descriptor");
        }
        report = Map.copyOf(report);
    }

    public boolean isSuccess() {
        return status == GasStatus.SUCCESS;
    }
}
