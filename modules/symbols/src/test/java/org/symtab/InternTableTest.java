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
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.symtab.internal.lang.SymtabSystemProperties.SYMTAB_INTERN_TABLE_INITIAL_CAPACITY;
import static org.symtab.internal.lang.SymtabSystemProperties.SYMTAB_INTERN_TABLE_SIZE_WARNING_THRESHOLD;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.symtab.internal.logger.SymtabLogger;

/**
 * Tests for {@link InternTable} instances created apart from the process-wide one.
 */
@ExtendWith(MockitoExtension.class)
class InternTableTest {
    @Mock
    private SymtabLogger log;

    @AfterEach
    void clearProperties() {
        System.clearProperty(SYMTAB_INTERN_TABLE_INITIAL_CAPACITY);
        System.clearProperty(SYMTAB_INTERN_TABLE_SIZE_WARNING_THRESHOLD);
    }

    @Test
    void internsEachContentOnce() {
        InternTable table = new InternTable(16, 0, log);

        Symbol first = table.intern("alpha");
        Symbol second = table.intern(new StringBuilder("al").append("pha"));

        assertThat(second, sameInstance(first));
        assertThat(table.size(), is(1));

        Symbol other = table.intern("beta");

        assertThat(other, not(sameInstance(first)));
        assertThat(table.size(), is(2));
    }

    @Test
    void storesCopyOfMutableInput() {
        InternTable table = new InternTable(16, 0, log);

        StringBuilder sb = new StringBuilder("mutable");

        Symbol sym = table.intern(sb);

        sb.setLength(0);
        sb.append("changed");

        assertThat(sym.asText(), is("mutable"));
        assertThat(table.find("mutable"), sameInstance(sym));
        assertThat(table.find("changed"), is(nullValue()));
    }

    @Test
    void findDoesNotInsert() {
        InternTable table = new InternTable(16, 0, log);

        assertThat(table.find("missing"), is(nullValue()));
        assertThat(table.size(), is(0));

        Symbol sym = table.intern("missing");

        assertThat(table.find(new StringBuilder("missing")), sameInstance(sym));
        assertThat(table.size(), is(1));
    }

    @Test
    void warnsOnceWhenThresholdIsReached() {
        InternTable table = new InternTable(16, 3, log);

        table.intern("a");
        table.intern("b");

        verify(log, never()).warn(anyString(), eq(2), eq(3L));

        table.intern("c");
        table.intern("d");
        table.intern("a");

        verify(log, times(1)).warn(startsWith("Intern table has reached"), eq(3), eq(3L));
        verify(log, never()).warn(anyString(), eq(4), eq(3L));
    }

    @Test
    void nonPositiveThresholdDisablesWarning() {
        InternTable table = new InternTable(16, 0, log);

        for (int i = 0; i < 100; i++) {
            table.intern("value-" + i);
        }

        assertThat(table.size(), is(100));

        verify(log, never()).warn(anyString(), eq(1), eq(0L));
        verify(log, never()).warn(anyString(), eq(100), eq(0L));
    }

    @Test
    void readsConfigurationFromSystemProperties() {
        System.setProperty(SYMTAB_INTERN_TABLE_INITIAL_CAPACITY, "4096");
        System.setProperty(SYMTAB_INTERN_TABLE_SIZE_WARNING_THRESHOLD, "2");

        InternTable table = InternTable.fromSystemProperties(log);

        verify(log).info(startsWith("Intern table created"), eq(4096), eq(2L));

        table.intern("x");
        table.intern("y");

        verify(log).warn(startsWith("Intern table has reached"), eq(2), eq(2L));
    }

    @Test
    void usesDefaultsForMissingOrMalformedConfiguration() {
        System.setProperty(SYMTAB_INTERN_TABLE_INITIAL_CAPACITY, "a lot");

        InternTable.fromSystemProperties(log);

        verify(log).info(
                startsWith("Intern table created"),
                eq(InternTable.DFLT_INITIAL_CAPACITY),
                eq(InternTable.DFLT_SIZE_WARNING_THRESHOLD)
        );
    }

    @Test
    void raisesTooSmallInitialCapacity() {
        new InternTable(1, 0, log);

        verify(log).info(startsWith("Intern table created"), eq(InternTable.MIN_INITIAL_CAPACITY), eq(0L));
    }
}
