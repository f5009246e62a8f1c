// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.impl.workflow;

import static com.hedera.node.gas.spi.GasDescriptors.READ_FLAT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hedera.node.gas.spi.GasStatus;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WorkOutcomeTest {
    @Test
    void onlyFailuresNameADescriptor() {
        assertThatThrownBy(() -> new WorkOutcome(GasStatus.SUCCESS, READ_FLAT, 1, 1, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkOutcome(GasStatus.OUT_OF_GAS, null, 1, 1, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportIsCopied() {
        final var report = new HashMap<String, Long>();
        report.put(READ_FLAT, 5L);

        final var subject = new WorkOutcome(GasStatus.SUCCESS, null, 5, 5, report);
        report.put(READ_FLAT, 6L);

        assertThat(subject.report()).isEqualTo(Map.of(READ_FLAT, 5L));
    }
}
