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

package org.symtab.jackson;

import com.fasterxml.jackson.databind.module.SimpleModule;
import org.symtab.Symbol;

/**
 * Jackson module which maps {@link Symbol} to a JSON string, both as a value and as a map key.
 *
 * <p>The module is registered as a service, so {@link com.fasterxml.jackson.databind.ObjectMapper#findAndRegisterModules()}
 * picks it up.
 */
public class SymbolModule extends SimpleModule {
    private static final long serialVersionUID = 0L;

    /**
     * Constructor.
     */
    public SymbolModule() {
        super(SymbolModule.class.getSimpleName());

        addSerializer(Symbol.class, SymbolSerializer.INSTANCE);
        addDeserializer(Symbol.class, SymbolDeserializer.INSTANCE);
        addKeySerializer(Symbol.class, SymbolKeySerializer.INSTANCE);
        addKeyDeserializer(Symbol.class, SymbolKeyDeserializer.INSTANCE);
    }
}
