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
import static com.hedera.node.gas.spi.util.GasUtils.MAX_GAS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;

import com.hedera.node.gas.impl.GasMeters;
import com.hedera.node.gas.spi.GasConfig;
import com.hedera.node.gas.spi.GasMeter;
import com.hedera.node.gas.spi.GasMeterException;
import com.hedera.node.gas.spi.GasStatus;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StoreGasChargerTest {
    private static final byte[] KEY = new byte[] {1, 2, 3, 4};
    private static final byte[] VALUE = new byte[] {5, 6, 7, 8, 9, 10};

    @Mock
    private GasMeter meter;

    private final StoreGasCharger subject = new StoreGasCharger(GasConfig.kvGasConfig());

    @Test
    void chargesHasAndDeleteAtFlatPrices() {
        subject.chargeHas(meter);
        subject.chargeDelete(meter);

        final var inOrder = inOrder(meter);
        inOrder.verify(meter).consumeGas(1000, HAS);
        inOrder.verify(meter).consumeGas(1000, DELETE);
        verifyNoMoreInteractions(meter);
    }

    @Test
    void chargesReadFlatThenKeyThenValueBytes() {
        subject.chargeRead(meter, KEY, VALUE);

        final var inOrder = inOrder(meter);
        inOrder.verify(meter).consumeGas(1000, READ_FLAT);
        inOrder.verify(meter).consumeGas(12, READ_PER_BYTE);
        inOrder.verify(meter).consumeGas(18, READ_PER_BYTE);
        verifyNoMoreInteractions(meter);
    }

    @Test
    void missingValueIsChargedAsZeroBytes() {
        subject.chargeReadPerByte(meter, KEY, null);

        final var inOrder = inOrder(meter);
        inOrder.verify(meter).consumeGas(12, READ_PER_BYTE);
        inOrder.verify(meter).consumeGas(0, READ_PER_BYTE);
        verifyNoMoreInteractions(meter);
    }

    @Test
    void chargesWriteFlatThenKeyThenValueBytes() {
        subject.chargeWrite(meter, KEY, VALUE);

        final var inOrder = inOrder(meter);
        inOrder.verify(meter).consumeGas(2000, WRITE_FLAT);
        inOrder.verify(meter).consumeGas(120, WRITE_PER_BYTE);
        inOrder.verify(meter).consumeGas(180, WRITE_PER_BYTE);
        verifyNoMoreInteractions(meter);
    }

    @Test
    void chargesIteratorBytesBeforeTheFlatCost() {
        subject.chargeIteratorNext(meter, KEY, VALUE);

        final var inOrder = inOrder(meter);
        inOrder.verify(meter).consumeGas(12, VALUE_PER_BYTE);
        inOrder.verify(meter).consumeGas(18, VALUE_PER_BYTE);
        inOrder.verify(meter).consumeGas(30, ITER_NEXT_FLAT);
        verifyNoMoreInteractions(meter);
    }

    @Test
    void exhaustedIteratorOnlyPaysTheFlatCost() {
        subject.chargeIteratorNext(meter, null, null);

        verify(meter).consumeGas(30, ITER_NEXT_FLAT);
        verifyNoMoreInteractions(meter);
    }

    @Test
    void perByteProductOverflowIsAGasOverflow() {
        final var charger = new StoreGasCharger(new GasConfig(0, 0, 0, MAX_GAS, 0, 0, 0));

        assertThatThrownBy(() -> charger.chargeReadPerByte(meter, KEY, VALUE))
                .isInstanceOfSatisfying(GasMeterException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(GasStatus.GAS_OVERFLOW);
                    assertThat(e.getDescriptor()).isEqualTo(READ_PER_BYTE);
                });
        verify(meter, never()).consumeGas(anyLong(), anyString());
    }

    @Test
    void transientPricesAreCheaper() {
        final var transientCharger = new StoreGasCharger(GasConfig.transientGasConfig());
        final var realMeter = GasMeters.newGasMeter(10_000, true);

        transientCharger.chargeRead(realMeter, KEY, VALUE);
        transientCharger.chargeWrite(realMeter, KEY, VALUE);
        transientCharger.chargeIteratorNext(realMeter, KEY, VALUE);

        assertThat(realMeter.gasConsumed()).isEqualTo(100L + 200 + 12 + 18 + 3);
        assertThat(realMeter.report().orElseThrow().asMap())
                .isEqualTo(Map.of(
                        READ_FLAT, 100L,
                        READ_PER_BYTE, 0L,
                        WRITE_FLAT, 200L,
                        WRITE_PER_BYTE, 30L,
                        VALUE_PER_BYTE, 0L,
                        ITER_NEXT_FLAT, 3L));
    }

    @Test
    void stopsChargingOnceOutOfGas() {
        final var realMeter = GasMeters.newGasMeter(1_010, true);

        assertThatThrownBy(() -> subject.chargeRead(realMeter, KEY, VALUE))
                .isInstanceOfSatisfying(GasMeterException.class, e -> {
                    assertThat(e.getStatus()).isEqualTo(GasStatus.OUT_OF_GAS);
                    assertThat(e.getDescriptor()).isEqualTo(READ_PER_BYTE);
                });
        assertThat(realMeter.gasConsumed()).isEqualTo(1_012L);
        assertThat(realMeter.gasConsumedToLimit()).isEqualTo(1_010L);
        assertThat(realMeter.report().orElseThrow().asMap()).isEqualTo(Map.of(READ_FLAT, 1000L));
    }

    @Test
    void requiresGasConfig() {
        assertThatThrownBy(() -> new StoreGasCharger(null)).isInstanceOf(NullPointerException.class);
        assertThat(subject.gasConfig()).isEqualTo(GasConfig.kvGasConfig());
    }
}
