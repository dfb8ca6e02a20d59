/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.pddl.lsp.syntax;

import java.util.Objects;

/**
 * A single PDDL token. Offsets are {@code String} indices, i.e. UTF-16 code units,
 * which is what LSP positions are expressed in.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int start;

    public Token(TokenType type, String text, int start) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = Objects.requireNonNull(text, "text");
        this.start = start;
    }

    public TokenType getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public int getStart() {
        return start;
    }

    /** Index just after the last character of the token. */
    public int getEnd() {
        return start + text.length();
    }

    public boolean includesIndex(int index) {
        return index >= start && index <= getEnd();
    }

    @Override
    public String toString() {
        return "Token{type=" + type + ", text='" + text.replace("\n", "\\n") + "', range=" + start + "~" + getEnd() + "}";
    }
}
