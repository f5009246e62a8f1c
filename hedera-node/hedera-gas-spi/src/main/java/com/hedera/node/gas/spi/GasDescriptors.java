// SPDX-License-Identifier: Apache-2.0
package com.hedera.node.gas.spi;

/**
 * The descriptors the store layer charges gas under. Meters accept any descriptor; these are only the ones the
 * store pricing rules use.
 */
public final class GasDescriptors {
    public static final String ITER_NEXT_FLAT = "IterNextFlat";
    public static final String VALUE_PER_BYTE = "ValuePerByte";
    public static final String WRITE_PER_BYTE = "WritePerByte";
    public static final String READ_PER_BYTE = "ReadPerByte";
    public static final String WRITE_FLAT = "WriteFlat";
    public static final String READ_FLAT = "ReadFlat";
    public static final String HAS = "Has";
    public static final String DELETE = "Delete";

    private GasDescriptors() {
        throw new UnsupportedOperationException("Utility Class");
    }
}
