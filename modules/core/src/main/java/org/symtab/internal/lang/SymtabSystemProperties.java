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

import org.jetbrains.annotations.Nullable;

/**
 * Contains constants for all system properties and environmental variables in Symtab. A system property takes precedence over
 * an environment variable with the same name.
 */
public final class SymtabSystemProperties {
    /** Initial capacity of the process-wide intern table. */
    public static final String SYMTAB_INTERN_TABLE_INITIAL_CAPACITY = "SYMTAB_INTERN_TABLE_INITIAL_CAPACITY";

    /**
     * Number of interned entries after which a warning about unbounded table growth is logged once. Zero or a negative value
     * disables the warning.
     */
    public static final String SYMTAB_INTERN_TABLE_SIZE_WARNING_THRESHOLD = "SYMTAB_INTERN_TABLE_SIZE_WARNING_THRESHOLD";

    /**
     * Enforces singleton.
     */
    private SymtabSystemProperties() {
        // No-op.
    }

    /**
     * Gets either system property or environment variable with given name.
     *
     * @param name Name of the system property or environment variable.
     * @return Value of the system property or environment variable. Returns {@code null} if neither can be found for given name.
     */
    @Nullable
    public static String getString(String name) {
        assert name != null;

        String v = System.getProperty(name);

        if (v == null) {
            v = System.getenv(name);
        }

        return v;
    }

    /**
     * Gets either system property or environment variable with given name.
     *
     * @param name Name of the system property or environment variable.
     * @param dflt Default value.
     * @return Value of the system property or environment variable. Returns {@code dflt} if neither can be found for given name.
     */
    public static String getString(String name, String dflt) {
        String val = getString(name);

        return val == null ? dflt : val;
    }

    /**
     * Gets either system property or environment variable with given name. The result is transformed to {@code boolean} using
     * {@link Boolean#parseBoolean(String)}.
     *
     * @param name Name of the system property or environment variable.
     * @param dflt Default value.
     * @return Boolean value of the property, or the default one if the property is not set.
     */
    public static boolean getBoolean(String name, boolean dflt) {
        String val = getString(name);

        return val == null ? dflt : Boolean.parseBoolean(val.trim());
    }

    /**
     * Gets either system property or environment variable with given name. The result is transformed to {@code int} using
     * {@link Integer#parseInt(String)}.
     *
     * @param name Name of the system property or environment variable.
     * @param dflt Default value.
     * @return Integer value of the property. Returns the default value if the property is not set or is not a valid integer.
     */
    public static int getInteger(String name, int dflt) {
        String s = getString(name);

        if (s == null) {
            return dflt;
        }

        int res;

        try {
            res = Integer.parseInt(s.trim());
        } catch (NumberFormatException ignore) {
            res = dflt;
        }

        return res;
    }

    /**
     * Gets either system property or environment variable with given name. The result is transformed to {@code long} using
     * {@link Long#parseLong(String)}.
     *
     * @param name Name of the system property or environment variable.
     * @param dflt Default value.
     * @return Long value of the property. Returns the default value if the property is not set or is not a valid long.
     */
    public static long getLong(String name, long dflt) {
        String s = getString(name);

        if (s == null) {
            return dflt;
        }

        long res;

        try {
            res = Long.parseLong(s.trim());
        } catch (NumberFormatException ignore) {
            res = dflt;
        }

        return res;
    }
}
