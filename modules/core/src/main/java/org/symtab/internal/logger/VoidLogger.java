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

package org.symtab.internal.logger;

import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;

/**
 * Logger which does nothing.
 */
final class VoidLogger implements SymtabLogger {
    static final VoidLogger INSTANCE = new VoidLogger();

    private VoidLogger() {
    }

    @Override
    public void info(String msg, Object... params) {
    }

    @Override
    public void info(String msg, @Nullable Throwable th, Object... params) {
    }

    @Override
    public void debug(String msg, Object... params) {
    }

    @Override
    public void debug(Supplier<String> msgSupplier) {
    }

    @Override
    public void warn(String msg, Object... params) {
    }

    @Override
    public void warn(String msg, @Nullable Throwable th, Object... params) {
    }

    @Override
    public void error(String msg, Object... params) {
    }

    @Override
    public void error(String msg, @Nullable Throwable th, Object... params) {
    }

    @Override
    public void trace(String msg, Object... params) {
    }

    @Override
    public boolean isTraceEnabled() {
        return false;
    }

    @Override
    public boolean isDebugEnabled() {
        return false;
    }

    @Override
    public boolean isInfoEnabled() {
        return false;
    }

    @Override
    public boolean isWarnEnabled() {
        return false;
    }
}
