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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits PDDL text into tokens. Text that no token pattern recognizes is reported as
 * {@link TokenType#OTHER}, so the token stream always covers the whole input.
 */
public final class PddlTokenizer {

    private static final Pattern PDDL_PATTERN = Pattern.compile(
            "\\(\\s*(:\\w[\\w-]*|[-/+*]|[><]=?|define|domain|problem|and|or|not|at start|at end|over all|at|=|assign"
                    + "|increase|decrease|always|sometime|forall|exists|when|within|at-most-once|sometime-before"
                    + "|always-within|supply-demand)(?![\\w-])"
                    + "|\\(|:[\\w-]+|\\)|;|\\?\\w[\\w-]*|[-+]?[0-9]*\\.?[0-9]+|-|#t|\\w[\\w-]*|\\s+");

    private static final Pattern KEYWORD = Pattern.compile("^:[\\w-]+$");
    private static final Pattern PARAMETER = Pattern.compile("^\\?\\w[\\w-]*$");

    private PddlTokenizer() {
    }

    public static List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        tokenize(text, Integer.MAX_VALUE, tokens::add);
        return tokens;
    }

    /**
     * Tokenizes the text, stopping after the first token that reaches past
     * {@code lastIndexOfInterest}.
     */
    public static void tokenize(String text, int lastIndexOfInterest, Consumer<Token> callback) {
        Matcher matcher = PDDL_PATTERN.matcher(text);
        int endOfLastToken = 0;
        int searchFrom = 0;

        while (searchFrom <= text.length() && matcher.find(searchFrom)) {
            int matchStart = matcher.start();
            String matched = matcher.group();
            if (matchStart > endOfLastToken) {
                callback.accept(new Token(TokenType.OTHER, text.substring(endOfLastToken, matchStart), endOfLastToken));
            }

            int tokenEnd = matcher.end();
            if (matched.equals(";")) {
                tokenEnd = endOfLine(text, matchStart);
                callback.accept(new Token(TokenType.COMMENT, text.substring(matchStart, tokenEnd), matchStart));
            } else {
                callback.accept(new Token(classify(matched), matched, matchStart));
            }

            endOfLastToken = tokenEnd;
            searchFrom = tokenEnd;
            if (tokenEnd > lastIndexOfInterest) {
                return;
            }
        }

        if (endOfLastToken < text.length() && lastIndexOfInterest >= endOfLastToken) {
            callback.accept(new Token(TokenType.OTHER, text.substring(endOfLastToken), endOfLastToken));
        }
    }

    private static TokenType classify(String matched) {
        if (matched.equals("-")) {
            return TokenType.DASH;
        } else if (matched.equals("(")) {
            return TokenType.OPEN_BRACKET;
        } else if (matched.startsWith("(")) {
            return TokenType.OPEN_BRACKET_OPERATOR;
        } else if (matched.equals(")")) {
            return TokenType.CLOSE_BRACKET;
        } else if (PARAMETER.matcher(matched).matches()) {
            return TokenType.PARAMETER;
        } else if (KEYWORD.matcher(matched).matches()) {
            return TokenType.KEYWORD;
        } else if (matched.isBlank()) {
            return TokenType.WHITESPACE;
        }
        return TokenType.OTHER;
    }

    private static int endOfLine(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                return i;
            }
        }
        return text.length();
    }
}
