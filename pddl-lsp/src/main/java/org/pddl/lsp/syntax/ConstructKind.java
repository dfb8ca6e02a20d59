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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Language construct a node opens. Assigned once when the tree is built, so scope
 * checks compare tags instead of matching token text.
 */
public enum ConstructKind {

    DEFINE("define", TokenType.OPEN_BRACKET_OPERATOR, false),
    DOMAIN("domain", TokenType.OPEN_BRACKET_OPERATOR, false),
    PROBLEM("problem", TokenType.OPEN_BRACKET_OPERATOR, false),
    DOMAIN_REFERENCE(":domain", TokenType.OPEN_BRACKET_OPERATOR, false),
    REQUIREMENTS(":requirements", TokenType.OPEN_BRACKET_OPERATOR, false),
    TYPES(":types", TokenType.OPEN_BRACKET_OPERATOR, false),
    CONSTANTS(":constants", TokenType.OPEN_BRACKET_OPERATOR, false),
    PREDICATES(":predicates", TokenType.OPEN_BRACKET_OPERATOR, false),
    FUNCTIONS(":functions", TokenType.OPEN_BRACKET_OPERATOR, false),
    CONSTRAINTS(":constraints", TokenType.OPEN_BRACKET_OPERATOR, false),
    OBJECTS(":objects", TokenType.OPEN_BRACKET_OPERATOR, false),
    INIT(":init", TokenType.OPEN_BRACKET_OPERATOR, false),
    GOAL(":goal", TokenType.OPEN_BRACKET_OPERATOR, false),
    METRIC(":metric", TokenType.OPEN_BRACKET_OPERATOR, false),
    DERIVED(":derived", TokenType.OPEN_BRACKET_OPERATOR, true),
    ACTION(":action", TokenType.OPEN_BRACKET_OPERATOR, true),
    DURATIVE_ACTION(":durative-action", TokenType.OPEN_BRACKET_OPERATOR, true),
    PROCESS(":process", TokenType.OPEN_BRACKET_OPERATOR, true),
    EVENT(":event", TokenType.OPEN_BRACKET_OPERATOR, true),
    JOB(":job", TokenType.OPEN_BRACKET_OPERATOR, true),
    PARAMETERS(":parameters", TokenType.KEYWORD, false),
    PRECONDITION(":precondition", TokenType.KEYWORD, false),
    CONDITION(":condition", TokenType.KEYWORD, false),
    EFFECT(":effect", TokenType.KEYWORD, false),
    DURATION(":duration", TokenType.KEYWORD, false),
    AT_START("at start", TokenType.OPEN_BRACKET_OPERATOR, false),
    AT_END("at end", TokenType.OPEN_BRACKET_OPERATOR, false),
    OVER_ALL("over all", TokenType.OPEN_BRACKET_OPERATOR, false),
    FORALL("forall", TokenType.OPEN_BRACKET_OPERATOR, true),
    EXISTS("exists", TokenType.OPEN_BRACKET_OPERATOR, true),
    NONE(null, null, false);

    private static final Map<String, ConstructKind> BY_NAME = new HashMap<>();

    static {
        for (ConstructKind kind : values()) {
            if (kind.sourceName != null) {
                BY_NAME.put(kind.tokenType + "|" + kind.sourceName, kind);
            }
        }
    }

    private final String sourceName;
    private final TokenType tokenType;
    private final boolean parametrisable;

    ConstructKind(String sourceName, TokenType tokenType, boolean parametrisable) {
        this.sourceName = sourceName;
        this.tokenType = tokenType;
        this.parametrisable = parametrisable;
    }

    /** Whether the construct declares {@code ?parameters} visible to its body. */
    public boolean isParametrisable() {
        return parametrisable;
    }

    /** Whether the parameters are declared by a {@code :parameters} keyword rather than a leading bracket. */
    public boolean declaresParametersByKeyword() {
        return this == ACTION || this == DURATIVE_ACTION || this == PROCESS || this == EVENT || this == JOB;
    }

    public static ConstructKind of(Token token) {
        TokenType type = token.getType();
        if (type != TokenType.OPEN_BRACKET_OPERATOR && type != TokenType.KEYWORD) {
            return NONE;
        }
        String name = type == TokenType.OPEN_BRACKET_OPERATOR ? stripBracket(token.getText()) : token.getText();
        name = name.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return BY_NAME.getOrDefault(type + "|" + name, NONE);
    }

    /** Removes the opening bracket and surrounding whitespace, e.g. {@code "( :action"} becomes {@code ":action"}. */
    public static String stripBracket(String tokenText) {
        return tokenText.replace("(", "").trim();
    }
}
