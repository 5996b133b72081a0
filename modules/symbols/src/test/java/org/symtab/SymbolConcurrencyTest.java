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

package org.symtab;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.symtab.internal.testframework.SymtabTestUtils.runMultiThreaded;
import static org.symtab.internal.testframework.SymtabTestUtils.runRace;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.symtab.internal.testframework.RunnableX;

/**
 * Interning from many threads at once.
 */
@Timeout(value = 60, unit = TimeUnit.SECONDS)
class SymbolConcurrencyTest {
    private static final int THREADS = 16;

    @Test
    void concurrentInterningOfSameContentCreatesOneEntry() throws Exception {
        String text = "concurrent-" + UUID.randomUUID();

        int before = Symbol.internedCount();

        Set<Symbol> observed = ConcurrentHashMap.newKeySet();

        runMultiThreaded(() -> {
            // A fresh String instance per thread, so deduplication can't rely on the caller passing the same object.
            observed.add(Symbol.of(new StringBuilder(text).toString()));

            return null;
        }, THREADS, "symbol-intern-");

        assertThat(observed.size(), is(1));
        assertThat(observed.iterator().next(), sameInstance(Symbol.of(text)));
        assertThat(Symbol.internedCount(), is(before + 1));
    }

    @Test
    void racingThreadsAgreeOnEverySymbol() {
        String prefix = UUID.randomUUID().toString();

        int keys = 1_024;

        Symbol[][] results = new Symbol[THREADS][keys];

        int before = Symbol.internedCount();

        runRace(IntStream.range(0, THREADS).<RunnableX>mapToObj(t -> () -> {
            // Odd multipliers permute a power-of-two key space, so each thread visits every key in its own order.
            for (int i = 0; i < keys; i++) {
                int key = (i * (2 * t + 1)) % keys;

                results[t][key] = Symbol.of(prefix + '-' + key);
            }
        }).toArray(RunnableX[]::new));

        for (int key = 0; key < keys; key++) {
            Symbol expected = Symbol.of(prefix + '-' + key);

            for (int t = 0; t < THREADS; t++) {
                assertThat(results[t][key], sameInstance(expected));
            }
        }

        assertThat(Symbol.internedCount(), is(before + keys));
    }

    @Test
    void readersSeeStableTextWhileWritersGrowTable() {
        Symbol stable = Symbol.of("stable-" + UUID.randomUUID());

        String expected = stable.asText();

        String prefix = UUID.randomUUID().toString();

        runRace(
                () -> {
                    for (int i = 0; i < 5_000; i++) {
                        Symbol.of(prefix + "-w1-" + i);
                    }
                },
                () -> {
                    for (int i = 0; i < 5_000; i++) {
                        Symbol.of(prefix + "-w2-" + i);
                    }
                },
                () -> {
                    for (int i = 0; i < 5_000; i++) {
                        assertThat(stable.asText(), is(expected));
                        assertThat(Symbol.find(expected), sameInstance(stable));
                    }
                }
        );
    }
}
