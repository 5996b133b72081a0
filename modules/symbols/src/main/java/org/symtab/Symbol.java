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

import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.Serializable;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;
import org.symtab.internal.util.StringUtils;

/**
 * Interned string. A symbol is a small immutable handle to one entry of the process-wide intern table, which keeps every
 * distinct content exactly once and never releases it.
 *
 * <p>Because the table holds a single canonical symbol per content, two symbols are equal if and only if they are the same
 * instance. {@link #equals(Object)} and {@link #hashCode()} are therefore identity based and cost the same for any text
 * length, while {@link #compareTo(Symbol)} orders symbols by their text. Both agree: equal text means the same instance.
 *
 * <p>The only way to obtain a symbol is {@link #of(CharSequence)} (or {@link #empty()}), which looks the content up and
 * creates the entry on a miss. Deserialization goes through the same path, see {@link #writeReplace()}.
 *
 * <p>Symbols are meant for bounded sets of long-lived names: identifiers, tags, enum-like labels. Interned entries are
 * never freed, so interning arbitrary or untrusted strings grows memory usage without limit.
 */
public final class Symbol implements CharSequence, Comparable<Symbol>, Serializable {
    private static final long serialVersionUID = 0L;

    /** Canonical text. */
    private final String text;

    /**
     * Constructor. Only the intern table creates symbols.
     *
     * @param text Canonical text.
     */
    Symbol(String text) {
        this.text = text;
    }

    /**
     * Interns the given value.
     *
     * <p>Returns the existing symbol if one with identical content has already been interned, otherwise stores the content
     * (copied unless it is a {@link String}) and returns a new symbol for it. Any content is accepted, including the empty
     * one. If the value is a symbol already, it is returned as is.
     *
     * @param value Value to intern.
     * @return Canonical symbol for the value's content.
     */
    public static Symbol of(CharSequence value) {
        Objects.requireNonNull(value, "value");

        if (value instanceof Symbol) {
            return (Symbol) value;
        }

        return InternTable.global().intern(value);
    }

    /**
     * Returns the symbol for the empty string. It is interned the same way as any other value, so
     * {@code Symbol.empty() == Symbol.of("")}.
     *
     * @return Empty symbol.
     */
    public static Symbol empty() {
        return of("");
    }

    /**
     * Looks up the symbol for the given content without interning it.
     *
     * @param value Content to look up.
     * @return Canonical symbol, or {@code null} if the content has never been interned.
     */
    public static @Nullable Symbol find(CharSequence value) {
        Objects.requireNonNull(value, "value");

        if (value instanceof Symbol) {
            return (Symbol) value;
        }

        return InternTable.global().find(value);
    }

    /**
     * Returns the number of distinct contents interned in this process so far.
     *
     * @return Number of interned entries.
     */
    public static int internedCount() {
        return InternTable.global().size();
    }

    /**
     * Returns the interned text. The returned string is the canonical one: the same instance for every call on equal symbols.
     *
     * @return Text.
     */
    public String asText() {
        return text;
    }

    /**
     * Returns the text quoted and escaped as a Java string literal, e.g. {@code "foo"} with the quotes.
     *
     * @return Debug representation.
     */
    public String toDebugString() {
        return StringUtils.quote(text);
    }

    @Override
    public int length() {
        return text.length();
    }

    @Override
    public char charAt(int index) {
        return text.charAt(index);
    }

    @Override
    public boolean isEmpty() {
        return text.isEmpty();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return text.subSequence(start, end);
    }

    @Override
    public int compareTo(Symbol o) {
        return this == o ? 0 : text.compareTo(o.text);
    }

    /** Identity comparison, see the class description. */
    @Override
    public boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(this);
    }

    /** Returns the interned text as is. */
    @Override
    public String toString() {
        return text;
    }

    /**
     * Replaces the symbol with its serialized form which carries only the text.
     *
     * @return Serialized form.
     */
    private Object writeReplace() {
        return new SerializedForm(text);
    }

    private void readObject(ObjectInputStream in) throws InvalidObjectException {
        throw new InvalidObjectException("Symbol must be deserialized from its serialized form");
    }

    /**
     * Serialized form of a symbol. Resolves to the canonical symbol on deserialization, so a deserialized symbol is equal to
     * the one interned in this process for the same text.
     */
    private static final class SerializedForm implements Serializable {
        private static final long serialVersionUID = 0L;

        private final String text;

        SerializedForm(String text) {
            this.text = text;
        }

        private Object readResolve() {
            return of(text);
        }
    }
}
