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
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PddlTokenizerTest {

    @Test
    void shouldSplitDefineHeader() {
        List<Token> tokens = PddlTokenizer.tokenize("(define (domain d))");

        assertThat(tokens).extracting(Token::getType).containsExactly(
                TokenType.OPEN_BRACKET_OPERATOR, TokenType.WHITESPACE, TokenType.OPEN_BRACKET_OPERATOR,
                TokenType.WHITESPACE, TokenType.OTHER, TokenType.CLOSE_BRACKET, TokenType.CLOSE_BRACKET);
        assertThat(tokens).extracting(Token::getText).containsExactly(
                "(define", " ", "(domain", " ", "d", ")", ")");
    }

    @Test
    void commentShouldRunToEndOfLine() {
        List<Token> tokens = PddlTokenizer.tokenize("(:action a ; (not a bracket)\n)");

        Token comment = tokens.stream().filter(t -> t.getType() == TokenType.COMMENT).findFirst().orElseThrow();
        assertThat(comment.getText()).isEqualTo("; (not a bracket)");
        assertThat(comment.getStart()).isEqualTo(11);
        assertThat(tokens.get(tokens.size() - 1).getType()).isEqualTo(TokenType.CLOSE_BRACKET);
    }

    @Test
    void shouldRecognizeParametersDashesAndKeywords() {
        List<Token> tokens = PddlTokenizer.tokenize(":parameters ?x - truck");

        assertThat(tokens).extracting(Token::getType).containsExactly(
                TokenType.KEYWORD, TokenType.WHITESPACE, TokenType.PARAMETER, TokenType.WHITESPACE,
                TokenType.DASH, TokenType.WHITESPACE, TokenType.OTHER);
    }

    @Test
    void timeQualifierShouldBeSingleToken() {
        List<Token> tokens = PddlTokenizer.tokenize("(at start (p))(over all (q))");

        assertThat(tokens.get(0).getText()).isEqualTo("(at start");
        assertThat(tokens.get(0).getType()).isEqualTo(TokenType.OPEN_BRACKET_OPERATOR);
        assertThat(tokens).extracting(Token::getText).contains("(over all");
    }

    @Test
    void unrecognizedTextShouldBecomeOtherTokens() {
        List<Token> tokens = PddlTokenizer.tokenize("a @@ b");

        assertThat(tokens).extracting(Token::getText).containsExactly("a", " ", "@@", " ", "b");
        assertThat(tokens.get(2).getType()).isEqualTo(TokenType.OTHER);
        assertThat(tokens.get(2).getStart()).isEqualTo(2);
    }

    @Test
    void tokensShouldCoverWholeInput() {
        String text = "(define (domain d)\n  (:requirements :strips) ; c\n  (:action a :effect (and (increase (f) (* #t 2.5)))))";

        String joined = PddlTokenizer.tokenize(text).stream()
                .map(Token::getText)
                .collect(Collectors.joining());

        assertThat(joined).isEqualTo(text);
    }

    @Test
    void shouldStopAfterLastIndexOfInterest() {
        List<Token> tokens = new ArrayList<>();
        PddlTokenizer.tokenize("(define (domain d))", 3, tokens::add);

        assertThat(tokens).extracting(Token::getText).containsExactly("(define");
    }

    @Test
    void tokenShouldIncludeItsEndOffset() {
        Token token = new Token(TokenType.OTHER, "abc", 4);

        assertThat(token.getEnd()).isEqualTo(7);
        assertThat(token.includesIndex(4)).isTrue();
        assertThat(token.includesIndex(7)).isTrue();
        assertThat(token.includesIndex(8)).isFalse();
    }
}
