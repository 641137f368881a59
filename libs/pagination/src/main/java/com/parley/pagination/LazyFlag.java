package com.parley.pagination;

import java.util.function.BooleanSupplier;

/**
 * A boolean computed on first read and memoized.
 * <p>
 * A supplier that throws is not memoized; the next read tries again.
 */
final class LazyFlag {

    private final BooleanSupplier supplier;
    private volatile Boolean value;

    LazyFlag(BooleanSupplier supplier) {
        this.supplier = supplier;
    }

    static LazyFlag constant(boolean value) {
        LazyFlag flag = new LazyFlag(() -> value);
        flag.value = value;
        return flag;
    }

    boolean get() {
        Boolean result = value;
        if (result == null) {
            synchronized (this) {
                result = value;
                if (result == null) {
                    result = supplier.getAsBoolean();
                    value = result;
                }
            }
        }
        return result;
    }

    boolean isEvaluated() {
        return value != null;
    }
}
