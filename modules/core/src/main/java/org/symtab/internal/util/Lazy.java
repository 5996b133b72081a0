/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.symtab.internal.util;

import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;

/**
 * Value which is computed on the first {@link #get()} call and cached afterwards. The supplier is invoked at most once, even
 * under concurrent access.
 *
 * @param <T> Type of the value.
 */
public class Lazy<T> {
    private static final Supplier<?> EMPTY = () -> {
        throw new IllegalStateException("Should not be called");
    };

    private volatile Supplier<T> supplier;

    // Safe race: single read of the field plus initialization under the monitor.
    @SuppressWarnings("FieldAccessedSynchronizedAndUnsynchronized")
    private @Nullable T val;

    /**
     * Creates the lazy value with the given value supplier.
     *
     * @param supplier A supplier of the value.
     */
    public Lazy(Supplier<@Nullable T> supplier) {
        this.supplier = supplier;
    }

    /** Returns the value. */
    @SuppressWarnings("unchecked")
    public @Nullable T get() {
        T v = val;

        if (v == null) {
            if (supplier != EMPTY) {
                synchronized (this) {
                    if (supplier != EMPTY) {
                        v = supplier.get();
                        val = v;
                        supplier = (Supplier<T>) EMPTY; // Lets GC collect whatever the supplier's closure holds.
                    }
                }
            }

            v = val;
        }

        return v;
    }
}
