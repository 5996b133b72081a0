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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

import org.junit.jupiter.api.Test;

class StringUtilsTest {
    @Test
    void quotesPlainText() {
        assertThat(StringUtils.quote("foo"), is("\"foo\""));
        assertThat(StringUtils.quote(""), is("\"\""));
    }

    @Test
    void escapesSpecialCharacters() {
        assertThat(StringUtils.quote("a\"b"), is("\"a\\\"b\""));
        assertThat(StringUtils.quote("a\\b"), is("\"a\\\\b\""));
        assertThat(StringUtils.quote("line\nnext\ttab\r"), is("\"line\\nnext\\ttab\\r\""));
        assertThat(StringUtils.quote("\b\f"), is("\"\\b\\f\""));
    }

    @Test
    void escapesOtherControlCharactersAsUnicode() {
        assertThat(StringUtils.quote("\0"), is("\"\\u0000\""));
        assertThat(StringUtils.quote(String.valueOf((char) 0x7f)), is("\"\\u007f\""));
    }

    @Test
    void keepsNonAsciiCharacters() {
        assertThat(StringUtils.quote("héllo wörld"), is("\"héllo wörld\""));
    }
}
