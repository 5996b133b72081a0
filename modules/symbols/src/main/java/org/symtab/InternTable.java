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

import static org.symtab.internal.lang.SymtabSystemProperties.SYMTAB_INTERN_TABLE_INITIAL_CAPACITY;
import static org.symtab.internal.lang.SymtabSystemProperties.SYMTAB_INTERN_TABLE_SIZE_WARNING_THRESHOLD;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.jetbrains.annotations.Nullable;
import org.symtab.internal.lang.SymtabSystemProperties;
import org.symtab.internal.logger.Loggers;
import org.symtab.internal.logger.SymtabLogger;
import org.symtab.internal.util.Lazy;

/**
 * Store of unique string contents. Every distinct content is kept exactly once, by the {@link Symbol} which was created for it
 * first; entries are never removed or replaced, so the table only grows.
 *
 * <p>The table is guarded by a single read-write lock. Interning takes the write lock, lookups without insertion take the read
 * lock. Reading the text of an already obtained {@link Symbol} needs no lock at all: the canonical string is immutable and is
 * strongly reachable from the table for the rest of the process life.
 *
 * <p>Nothing bounds the size of the table. Interning high-cardinality or untrusted input grows it without limit, which is why
 * a warning is logged once the size crosses {@link SymtabSystemProperties#SYMTAB_INTERN_TABLE_SIZE_WARNING_THRESHOLD}.
 */
final class InternTable {
    /** Default initial capacity. */
    static final int DFLT_INITIAL_CAPACITY = 1024;

    /** Smallest initial capacity accepted from the configuration. */
    static final int MIN_INITIAL_CAPACITY = 16;

    /** Default size after which the growth warning is logged. */
    static final long DFLT_SIZE_WARNING_THRESHOLD = 1_000_000L;

    /** Process-wide table, created on first use. */
    private static final Lazy<InternTable> GLOBAL = new Lazy<>(() -> fromSystemProperties(Loggers.forClass(InternTable.class)));

    private final SymtabLogger log;

    /** Content to canonical symbol. Guarded by {@link #lock}. */
    private final Map<String, Symbol> symbols;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final long sizeWarningThreshold;

    /** Whether the growth warning has been logged. Guarded by the write lock. */
    private boolean sizeWarningLogged;

    /**
     * Constructor.
     *
     * @param initialCapacity Initial capacity of the content index.
     * @param sizeWarningThreshold Size after which a warning is logged once, {@code 0} or less to never warn.
     * @param log Logger.
     */
    InternTable(int initialCapacity, long sizeWarningThreshold, SymtabLogger log) {
        this.symbols = new HashMap<>(Math.max(initialCapacity, MIN_INITIAL_CAPACITY));
        this.sizeWarningThreshold = sizeWarningThreshold;
        this.log = Objects.requireNonNull(log, "log");

        log.info("Intern table created [initialCapacity={}, sizeWarningThreshold={}]",
                Math.max(initialCapacity, MIN_INITIAL_CAPACITY), sizeWarningThreshold);
    }

    /**
     * Creates a table configured from system properties or environment variables.
     *
     * @param log Logger.
     * @return New table.
     */
    static InternTable fromSystemProperties(SymtabLogger log) {
        int initialCapacity = SymtabSystemProperties.getInteger(SYMTAB_INTERN_TABLE_INITIAL_CAPACITY, DFLT_INITIAL_CAPACITY);

        long threshold = SymtabSystemProperties.getLong(SYMTAB_INTERN_TABLE_SIZE_WARNING_THRESHOLD, DFLT_SIZE_WARNING_THRESHOLD);

        return new InternTable(initialCapacity, threshold, log);
    }

    /** Returns the process-wide table. */
    static InternTable global() {
        return GLOBAL.get();
    }

    /**
     * Returns the canonical symbol for the given content, creating it if there is none yet.
     *
     * @param value Content.
     * @return Canonical symbol.
     */
    Symbol intern(CharSequence value) {
        // Non-String input is copied: the caller may mutate it later.
        String text = value.toString();

        lock.writeLock().lock();

        try {
            Symbol existing = symbols.get(text);

            if (existing != null) {
                return existing;
            }

            Symbol created = new Symbol(text);

            symbols.put(text, created);

            onInserted(created);

            return created;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns the canonical symbol for the given content if it has been interned, never inserts.
     *
     * @param value Content.
     * @return Canonical symbol or {@code null} if the content has not been interned.
     */
    @Nullable Symbol find(CharSequence value) {
        String text = value.toString();

        lock.readLock().lock();

        try {
            return symbols.get(text);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Returns the number of interned entries. */
    int size() {
        lock.readLock().lock();

        try {
            return symbols.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Must be called under the write lock. */
    private void onInserted(Symbol created) {
        int size = symbols.size();

        if (log.isDebugEnabled()) {
            log.debug("Interned new entry [text={}, size={}]", created.toDebugString(), size);
        }

        if (!sizeWarningLogged && sizeWarningThreshold > 0 && size >= sizeWarningThreshold) {
            sizeWarningLogged = true;

            log.warn("Intern table has reached {} entries. Interned strings are never released, interning high-cardinality "
                    + "or untrusted input grows memory usage without limit [threshold={}]", size, sizeWarningThreshold);
        }
    }
}
