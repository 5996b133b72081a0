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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.type.LogicalType;
import java.io.IOException;
import org.symtab.Symbol;

/**
 * Reads a {@link Symbol} from a JSON string by interning its text, so symbols coming from external data share the entries
 * of the symbols created in-process.
 *
 * <p>Only string tokens are accepted. Anything else is reported through {@link DeserializationContext#handleUnexpectedToken},
 * which fails with a {@link com.fasterxml.jackson.databind.exc.MismatchedInputException} unless a problem handler is set up.
 */
public class SymbolDeserializer extends StdScalarDeserializer<Symbol> {
    private static final long serialVersionUID = 0L;

    /** Shared instance. */
    public static final SymbolDeserializer INSTANCE = new SymbolDeserializer();

    private SymbolDeserializer() {
        super(Symbol.class);
    }

    @Override
    public Symbol deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.hasToken(JsonToken.VALUE_STRING)) {
            return Symbol.of(p.getText());
        }

        return (Symbol) ctxt.handleUnexpectedToken(Symbol.class, p);
    }

    @Override
    public LogicalType logicalType() {
        return LogicalType.Textual;
    }
}
