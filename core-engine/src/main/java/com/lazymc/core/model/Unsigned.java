package com.lazymc.core.model;

/**
 * Range checks for the unsigned 16 and 32 bit fields of the configuration.
 */
final class Unsigned {

    static final long U16_MAX = 0xFFFFL;
    static final long U32_MAX = 0xFFFF_FFFFL;

    private Unsigned() {
        // utility class
    }

    static long requireU32(String name, long value) {
        if (value < 0 || value > U32_MAX) {
            throw new IllegalArgumentException(
                    name + " must be in [0, " + U32_MAX + "], got: " + value);
        }
        return value;
    }

    static int requireU16(String name, long value) {
        if (value < 0 || value > U16_MAX) {
            throw new IllegalArgumentException(
                    name + " must be in [0, " + U16_MAX + "], got: " + value);
        }
        return (int) value;
    }
}
