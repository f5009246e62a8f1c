// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.impl.workflow;

import static com.hedera.node.gas.spi.util.GasUtils.toDecimal;
import static java.util.Objects.requireNonNull;

import com.hedera.node.gas.config.GasMeterConfig;
import com.hedera.node.gas.impl.GasMeters;
import com.hedera.node.gas.spi.GasMeter;
import com.hedera.node.gas.spi.GasMeterException;
import com.hedera.node.gas.spi.GasReport;
import com.hedera.node.gas.spi.GasStatus;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.Map;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The boundary of a metered unit of work. Gives each unit of work its own meter, runs it, and turns a
 * {@link GasMeterException} into a failed {@link WorkOutcome}. A fatal gas condition is never retried; any other
 * exception thrown by the work propagates unchanged.
 */
public class MeteredWorkExecutor {
    private static final Logger log = LogManager.getLogger(MeteredWorkExecutor.class);

    private final GasMeterConfig meterConfig;

    public MeteredWorkExecutor(@NonNull final GasMeterConfig meterConfig) {
        this.meterConfig = requireNonNull(meterConfig);
    }

    /**
     * Runs the work against a new meter built from the configured settings.
     *
     * @param work the unit of work
     * @return its gas accounting
     */
    @NonNull
    public WorkOutcome execute(@NonNull final Consumer<GasMeter> work) {
        return execute(GasMeters.fromConfig(meterConfig), work);
    }

    /**
     * Runs the work against a new unbounded meter, to measure the gas it needs without a limit stopping it.
     *
     * @param work the unit of work
     * @return its gas accounting
     */
    @NonNull
    public WorkOutcome simulate(@NonNull final Consumer<GasMeter> work) {
        return execute(GasMeters.newInfiniteGasMeter(), work);
    }

    /**
     * Runs the work against the given meter, which must not be shared with any other unit of work.
     *
     * @param meter the meter of this unit of work
     * @param work the unit of work
     * @return its gas accounting
     */
    @NonNull
    public WorkOutcome execute(@NonNull final GasMeter meter, @NonNull final Consumer<GasMeter> work) {
        requireNonNull(meter);
        requireNonNull(work);
        try {
            work.accept(meter);
        } catch (GasMeterException e) {
            log.debug(
                    "Unit of work aborted with {} at {} after consuming {} of {}",
                    e.getStatus(),
                    e.getDescriptor(),
                    toDecimal(meter.gasConsumed()),
                    toDecimal(meter.limit()));
            return outcomeOf(meter, e.getStatus(), e.getDescriptor());
        }
        return outcomeOf(meter, GasStatus.SUCCESS, null);
    }

    private static WorkOutcome outcomeOf(
            @NonNull final GasMeter meter, @NonNull final GasStatus status, @Nullable final String failedDescriptor) {
        final var report = meter.report().map(GasReport::asMap).orElse(Map.of());
        return new WorkOutcome(status, failedDescriptor, meter.gasConsumed(), meter.gasConsumedToLimit(), report);
    }
}
