// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.spi;

import static com.hedera.node.gas.spi.util.GasUtils.toDecimal;
import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * An immutable snapshot of the cumulative gas charged per descriptor by a meter with cost breakdown enabled.
 * Entries are unsigned. Later charges against the meter never change a snapshot already handed out.
 */
public final class GasReport {
    private static final GasReport EMPTY = new GasReport(Map.of());

    private final Map<String, Long> gasByDescriptor;

    private GasReport(@NonNull final Map<String, Long> gasByDescriptor) {
        this.gasByDescriptor = gasByDescriptor;
    }

    /**
     * Returns a report holding a copy of the given entries.
     *
     * @param gasByDescriptor descriptor to gas
     * @return the report
     * @throws NullPointerException if the map, a descriptor or an amount is null
     */
    @NonNull
    public static GasReport of(@NonNull final Map<String, Long> gasByDescriptor) {
        requireNonNull(gasByDescriptor);
        return gasByDescriptor.isEmpty() ? EMPTY : new GasReport(Map.copyOf(gasByDescriptor));
    }

    @NonNull
    public static GasReport empty() {
        return EMPTY;
    }

    /**
     * Returns the gas attributed to the given descriptor, zero if it was never charged.
     *
     * @param descriptor the descriptor
     * @return the attributed gas
     */
    public long gasFor(@NonNull final String descriptor) {
        requireNonNull(descriptor);
        return gasByDescriptor.getOrDefault(descriptor, 0L);
    }

    @NonNull
    public Set<String> descriptors() {
        return gasByDescriptor.keySet();
    }

    /**
     * Returns the entries as an unmodifiable map.
     *
     * @return descriptor to gas
     */
    @NonNull
    public Map<String, Long> asMap() {
        return gasByDescriptor;
    }

    public boolean isEmpty() {
        return gasByDescriptor.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GasReport that)) {
            return false;
        }
        return gasByDescriptor.equals(that.gasByDescriptor);
    }

    @Override
    public int hashCode() {
        return gasByDescriptor.hashCode();
    }

    @Override
    public String toString() {
        final var sb = new StringBuilder("GasReport{");
        var first = true;
        for (final var entry : new TreeMap<>(gasByDescriptor).entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(toDecimal(entry.getValue()));
            first = false;
        }
        return sb.append('}').toString();
    }
}
