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

package org.symtab.internal.lang;

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/**
 * Formats messages with {@code {}} anchors, e.g. {@code format("Table size is {}", 42)} gives {@code "Table size is 42"}.
 *
 * <p>Anchors without a matching parameter are left as is, parameters without a matching anchor are ignored.
 */
public final class SymtabStringFormatter {
    private static final String ANCHOR = "{}";

    private SymtabStringFormatter() {
    }

    /**
     * Substitutes parameters in place of anchors in the given pattern.
     *
     * @param pattern Message pattern.
     * @param params Parameters.
     * @return Formatted message.
     */
    public static String format(@Nullable String pattern, Object... params) {
        if (pattern == null || params == null || params.length == 0) {
            return String.valueOf(pattern);
        }

        StringBuilder sb = new StringBuilder(pattern.length() + 16 * params.length);

        int from = 0;
        int paramIdx = 0;

        while (paramIdx < params.length) {
            int anchorIdx = pattern.indexOf(ANCHOR, from);

            if (anchorIdx < 0) {
                break;
            }

            sb.append(pattern, from, anchorIdx);

            appendParam(sb, params[paramIdx++]);

            from = anchorIdx + ANCHOR.length();
        }

        return sb.append(pattern, from, pattern.length()).toString();
    }

    private static void appendParam(StringBuilder sb, @Nullable Object param) {
        if (param instanceof Object[]) {
            sb.append(Arrays.deepToString((Object[]) param));
        } else {
            sb.append(param);
        }
    }
}
