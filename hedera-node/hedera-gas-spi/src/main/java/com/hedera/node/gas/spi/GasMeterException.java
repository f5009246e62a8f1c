// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.spi;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A runtime exception that wraps a fatal {@link GasStatus} together with the descriptor of the charge or refund
 * that triggered it. Thrown by a {@link GasMeter} to unwind the whole unit of work it meters; the boundary that
 * created the meter is the only place that should catch it.
 *
 * <p>Retrying the failed charge is never meaningful. An out-of-gas meter stays past its limit, and an overflowed
 * meter stays clamped at the maximum.
 */
public class GasMeterException extends RuntimeException {
    private final GasStatus status;
    private final String descriptor;

    public GasMeterException(@NonNull final GasStatus status, @NonNull final String descriptor) {
        super(requireNonNull(status).name() + " (" + requireNonNull(descriptor) + ")");
        if (status == GasStatus.SUCCESS) {
            throw new IllegalArgumentException("A gas meter exception must carry a failure status");
        }
        this.status = status;
        this.descriptor = descriptor;
    }

    public static GasMeterException outOfGas(@NonNull final String descriptor) {
        return new GasMeterException(GasStatus.OUT_OF_GAS, descriptor);
    }

    public static GasMeterException gasOverflow(@NonNull final String descriptor) {
        return new GasMeterException(GasStatus.GAS_OVERFLOW, descriptor);
    }

    public static GasMeterException negativeGasConsumed(@NonNull final String descriptor) {
        return new GasMeterException(GasStatus.NEGATIVE_GAS_CONSUMED, descriptor);
    }

    /**
     * {@inheritDoc}
     * A gas meter exception is a status carrier and must not have a cause.
     * @throws UnsupportedOperationException always.  This method must not be called.
     */
    @Override
    @SuppressWarnings("java:S3551")
    public Throwable initCause(Throwable cause) {
        throw new UnsupportedOperationException("GasMeterException must not chain a cause");
    }

    @NonNull
    public GasStatus getStatus() {
        return status;
    }

    /**
     * Returns the descriptor of the charge or refund that failed.
     *
     * @return the descriptor
     */
    @NonNull
    public String getDescriptor() {
        return descriptor;
    }

    @Override
    public String toString() {
        return "GasMeterException{" + "status=" + status + ", descriptor='" + descriptor + '\'' + '}';
    }
}
