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

import java.util.List;
import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SyntaxTreeBuilderTest {

    @Test
    void keywordShouldOwnFollowingNodesUntilNextKeyword() {
        SyntaxTree tree = SyntaxTree.parse("(:action a :parameters (?x) :effect (p ?x))");

        SyntaxNode action = tree.getRootNode().getChildren().get(0);
        List<SyntaxNode> keywords = action.getChildrenOfType(TokenType.KEYWORD, Pattern.compile(".*"));
        assertThat(keywords).extracting(node -> node.getToken().getText()).containsExactly(":parameters", ":effect");

        SyntaxNode parameters = keywords.get(0);
        assertThat(parameters.getNonWhitespaceChildren()).singleElement()
                .satisfies(bracket -> assertThat(bracket.getText()).isEqualTo("(?x)"));
        assertThat(keywords.get(1).getNonWhitespaceChildren()).singleElement()
                .satisfies(bracket -> assertThat(bracket.getText()).isEqualTo("(p ?x)"));
    }

    @Test
    void closeBracketShouldExtendRangeWithoutBecomingChild() {
        SyntaxTree tree = SyntaxTree.parse("(p ?x)");

        SyntaxNode bracket = tree.getRootNode().getChildren().get(0);
        assertThat(bracket).isInstanceOf(BracketNode.class);
        assertThat(((BracketNode) bracket).isClosed()).isTrue();
        assertThat(bracket.getChildren()).noneMatch(child -> child.isType(TokenType.CLOSE_BRACKET));
        assertThat(bracket.getStart()).isZero();
        assertThat(bracket.getEnd()).isEqualTo(6);
    }

    @Test
    void balancedTextShouldBeReproducedFromTree() {
        String text = "(define (domain d)\n  (:predicates (at ?x))\n  ; note\n  (:action a :effect (and)))";

        SyntaxTree tree = SyntaxTree.parse(text);

        assertThat(tree.getRootNode().getText()).isEqualTo(text);
        assertThat(tree.getOffendingTokens()).isEmpty();
        assertThat(tree.getUnclosedBrackets()).isEmpty();
    }

    @Test
    void unmatchedCloseBracketShouldBeReported() {
        SyntaxTree tree = SyntaxTree.parse("())");

        assertThat(tree.getOffendingTokens()).singleElement()
                .satisfies(token -> assertThat(token.getStart()).isEqualTo(2));
    }

    @Test
    void unclosedBracketsShouldBeReportedInDocumentOrder() {
        SyntaxTree tree = SyntaxTree.parse("(define (domain d)\n(:action a");

        assertThat(tree.getUnclosedBrackets()).extracting(node -> node.getToken().getText())
                .containsExactly("(define", "(:action");
    }

    @Test
    void shouldFindInnermostNodeAtOffset() {
        String text = "(define (domain d)\n(:predicates (at ?x)))";
        SyntaxTree tree = SyntaxTree.parse(text);

        SyntaxNode node = tree.getNodeAt(text.indexOf("?x") + 1);

        assertThat(node.getType()).isEqualTo(TokenType.PARAMETER);
        assertThat(node.getParent().getConstructKind()).isEqualTo(ConstructKind.NONE);
        assertThat(node.findAncestor(ConstructKind.PREDICATES)).isNotNull();
    }

    @Test
    void offsetOutsideDocumentShouldYieldNoNode() {
        SyntaxTree tree = SyntaxTree.parse("(a)");

        assertThat(tree.getNodeAt(10)).isNull();
        assertThat(tree.getNodeAt(0)).isSameAs(tree.getRootNode());
    }

    @Test
    void shouldTagConstructs() {
        SyntaxTree tree = SyntaxTree.parse("(define (domain d) (:durative-action a :condition (at start (p))))");

        SyntaxNode define = tree.getDefineNode();
        assertThat(define).isNotNull();
        SyntaxNode durative = define.getFirstChild(ConstructKind.DURATIVE_ACTION);
        assertThat(durative).isNotNull();
        assertThat(durative.getFirstChild(ConstructKind.CONDITION)).isNotNull();
    }

    @Test
    void lastIndexOfInterestShouldCutTheTree() {
        String text = "(define (domain d) (:action a))";

        SyntaxTree tree = new SyntaxTreeBuilder(text, text.indexOf("(domain")).build();

        assertThat(tree.getDefineNode().getFirstChild(ConstructKind.ACTION)).isNull();
    }

    @Test
    void treeDumpShouldIndentChildren() {
        SyntaxTreeBuilder builder = new SyntaxTreeBuilder("(a)");

        assertThat(builder.getTreeAsString()).isEqualTo(
                "DOCUMENT: text: '', range: 0~3\n"
                        + "  OPEN_BRACKET: text: '(', range: 0~3\n"
                        + "    OTHER: text: 'a', range: 1~2");
    }
}
