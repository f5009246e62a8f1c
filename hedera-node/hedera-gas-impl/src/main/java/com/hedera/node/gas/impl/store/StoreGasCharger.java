// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.impl.store;

import static com.hedera.node.gas.spi.GasDescriptors.DELETE;
import static com.hedera.node.gas.spi.GasDescriptors.HAS;
import static com.hedera.node.gas.spi.GasDescriptors.ITER_NEXT_FLAT;
import static com.hedera.node.gas.spi.GasDescriptors.READ_FLAT;
import static com.hedera.node.gas.spi.GasDescriptors.READ_PER_BYTE;
import static com.hedera.node.gas.spi.GasDescriptors.VALUE_PER_BYTE;
import static com.hedera.node.gas.spi.GasDescriptors.WRITE_FLAT;
import static com.hedera.node.gas.spi.GasDescriptors.WRITE_PER_BYTE;
import static com.hedera.node.gas.spi.util.GasUtils.productWouldOverflow;
import static java.util.Objects.requireNonNull;

import com.hedera.node.gas.spi.GasConfig;
import com.hedera.node.gas.spi.GasMeter;
import com.hedera.node.gas.spi.GasMeterException;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Charges a {@link GasMeter} for key-value store operations at the prices of a {@link GasConfig}.
 *
 * <p>A store calls the flat charge of an operation before touching its backing data and the per-byte charges once
 * the sizes are known. A missing value counts as zero bytes and is still charged, so the sequence of charges does
 * not depend on whether a key exists.
 */
public class StoreGasCharger {
    private final GasConfig gasConfig;

    public StoreGasCharger(@NonNull final GasConfig gasConfig) {
        this.gasConfig = requireNonNull(gasConfig);
    }

    @NonNull
    public GasConfig gasConfig() {
        return gasConfig;
    }

    public void chargeHas(@NonNull final GasMeter meter) {
        meter.consumeGas(gasConfig.hasCost(), HAS);
    }

    public void chargeDelete(@NonNull final GasMeter meter) {
        meter.consumeGas(gasConfig.deleteCost(), DELETE);
    }

    /**
     * Charges the flat cost of a read, before the backing store is consulted.
     *
     * @param meter the meter to charge
     */
    public void chargeReadFlat(@NonNull final GasMeter meter) {
        meter.consumeGas(gasConfig.readCostFlat(), READ_FLAT);
    }

    /**
     * Charges the per-byte cost of a completed read.
     *
     * @param meter the meter to charge
     * @param key the key read
     * @param value the value found, or null if there was none
     */
    public void chargeReadPerByte(
            @NonNull final GasMeter meter, @NonNull final byte[] key, @Nullable final byte[] value) {
        requireNonNull(key);
        consumePerByte(meter, gasConfig.readCostPerByte(), key.length, READ_PER_BYTE);
        consumePerByte(meter, gasConfig.readCostPerByte(), lengthOf(value), READ_PER_BYTE);
    }

    /**
     * Charges a whole read in one go.
     *
     * @param meter the meter to charge
     * @param key the key read
     * @param value the value found, or null if there was none
     */
    public void chargeRead(@NonNull final GasMeter meter, @NonNull final byte[] key, @Nullable final byte[] value) {
        chargeReadFlat(meter);
        chargeReadPerByte(meter, key, value);
    }

    /**
     * Charges a write, before the backing store is modified.
     *
     * @param meter the meter to charge
     * @param key the key to write
     * @param value the value to write
     */
    public void chargeWrite(@NonNull final GasMeter meter, @NonNull final byte[] key, @NonNull final byte[] value) {
        requireNonNull(key);
        requireNonNull(value);
        meter.consumeGas(gasConfig.writeCostFlat(), WRITE_FLAT);
        consumePerByte(meter, gasConfig.writeCostPerByte(), key.length, WRITE_PER_BYTE);
        consumePerByte(meter, gasConfig.writeCostPerByte(), value.length, WRITE_PER_BYTE);
    }

    /**
     * Charges for moving an iterator to its next position. If the iterator is positioned on an entry, the key and
     * value bytes are charged first at the read price.
     *
     * @param meter the meter to charge
     * @param key the key of the current entry, or null if the iterator is exhausted
     * @param value the value of the current entry, or null if the iterator is exhausted
     */
    public void chargeIteratorNext(
            @NonNull final GasMeter meter, @Nullable final byte[] key, @Nullable final byte[] value) {
        if (key != null) {
            consumePerByte(meter, gasConfig.readCostPerByte(), key.length, VALUE_PER_BYTE);
            consumePerByte(meter, gasConfig.readCostPerByte(), lengthOf(value), VALUE_PER_BYTE);
        }
        meter.consumeGas(gasConfig.iterNextCostFlat(), ITER_NEXT_FLAT);
    }

    private static void consumePerByte(
            @NonNull final GasMeter meter, final long price, final long length, @NonNull final String descriptor) {
        if (productWouldOverflow(price, length)) {
            throw GasMeterException.gasOverflow(descriptor);
        }
        meter.consumeGas(price * length, descriptor);
    }

    private static int lengthOf(@Nullable final byte[] bytes) {
        return bytes == null ? 0 : bytes.length;
    }
}
