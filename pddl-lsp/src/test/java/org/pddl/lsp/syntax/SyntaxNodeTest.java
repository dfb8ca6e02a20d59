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

import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SyntaxNodeTest {

    private static final String DOMAIN = String.join("\n",
            "(define (domain d)",
            "(:action a",
            "  :parameters (?from ?to - place)",
            "  :effect (forall (?y - thing) (p ?y))",
            ")",
            "(:derived (q ?z) (p ?z))",
            ")");

    private final SyntaxTree tree = SyntaxTree.parse(DOMAIN);

    @Test
    void expandShouldReturnEnclosingBracket() {
        SyntaxNode parameter = tree.getNodeAt(DOMAIN.indexOf("?from") + 1);

        assertThat(parameter.expand().getText()).isEqualTo("(?from ?to - place)");
        assertThat(parameter.expand().expand()).isSameAs(parameter.expand());
    }

    @Test
    void expandAtDocumentLevelShouldReturnNull() {
        assertThat(tree.getRootNode().expand()).isNull();
    }

    @Test
    void actionShouldDeclareParametersByKeyword() {
        SyntaxNode action = tree.getDefineNode().getFirstChild(ConstructKind.ACTION);

        assertThat(action.getParameterDefinition().getText()).isEqualTo("(?from ?to - place)");
    }

    @Test
    void nestedScopesShouldBeListedInnermostFirst() {
        SyntaxNode node = tree.getNodeAt(DOMAIN.indexOf("(p ?y)") + 4);

        assertThat(node.findAllParametrisableScopes()).extracting(SyntaxNode::getConstructKind)
                .containsExactly(ConstructKind.FORALL, ConstructKind.ACTION);
        assertThat(node.findAllParametrisableScopes().get(0).getParameterDefinition().getText())
                .isEqualTo("(?y - thing)");
    }

    @Test
    void ancestorShouldMatchTypeAndTokenText() {
        SyntaxNode node = tree.getNodeAt(DOMAIN.indexOf("(p ?y)") + 4);

        assertThat(node.findAncestor(TokenType.KEYWORD, Pattern.compile(":effect")).getStart())
                .isEqualTo(DOMAIN.indexOf(":effect"));
        assertThat(node.findAncestor(TokenType.OPEN_BRACKET_OPERATOR, Pattern.compile("^\\(\\s*:action")).getConstructKind())
                .isEqualTo(ConstructKind.ACTION);
        assertThat(node.findAncestor(TokenType.OPEN_BRACKET_OPERATOR, Pattern.compile(":durative-action"))).isNull();
    }

    @Test
    void derivedShouldDeclareParametersInLeadingBracket() {
        SyntaxNode derived = tree.getDefineNode().getFirstChild(ConstructKind.DERIVED);

        assertThat(derived.getParameterDefinition().getText()).isEqualTo("(q ?z)");
    }

    @Test
    void siblingsShouldBeSplitByStartOffset() {
        SyntaxNode define = tree.getDefineNode();
        SyntaxNode action = define.getFirstChild(ConstructKind.ACTION);

        assertThat(action.getPrecedingSiblings(TokenType.OPEN_BRACKET_OPERATOR, action))
                .extracting(SyntaxNode::getConstructKind).containsExactly(ConstructKind.DOMAIN);
        assertThat(action.getFollowingSiblings(TokenType.OPEN_BRACKET_OPERATOR, action))
                .extracting(SyntaxNode::getConstructKind).containsExactly(ConstructKind.DERIVED);
    }

    @Test
    void rootShouldHaveNoSiblings() {
        SyntaxNode root = tree.getRootNode();

        assertThat(root.getPrecedingSiblings(TokenType.OPEN_BRACKET_OPERATOR, root)).isEmpty();
        assertThat(root.getFollowingSiblings(TokenType.OPEN_BRACKET_OPERATOR, root)).isEmpty();
    }
}
