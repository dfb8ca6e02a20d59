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
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Builds a {@link SyntaxTree} from the token stream. Keywords like {@code :effect} own the
 * nodes that follow them until the next keyword or the enclosing close bracket.
 */
public class SyntaxTreeBuilder {

    private static final Set<TokenType> LEAF_TYPES = EnumSet.of(
            TokenType.COMMENT, TokenType.OTHER, TokenType.PARAMETER, TokenType.DASH, TokenType.WHITESPACE);

    private final SyntaxNode root = SyntaxNode.createRoot();
    private final List<Token> offendingTokens = new ArrayList<>();
    private final int lastIndexOfInterest;
    private SyntaxNode currentLeaf = root;

    public SyntaxTreeBuilder(String text) {
        this(text, Integer.MAX_VALUE);
    }

    /**
     * @param lastIndexOfInterest tokens starting after this offset are not added to the tree
     */
    public SyntaxTreeBuilder(String text, int lastIndexOfInterest) {
        this.lastIndexOfInterest = lastIndexOfInterest;
        PddlTokenizer.tokenize(text, lastIndexOfInterest, this::onToken);
    }

    public SyntaxTree build() {
        return new SyntaxTree(root, offendingTokens);
    }

    /** Indented dump of the tree, one node per line. */
    public String getTreeAsString() {
        return nodeAsString(root);
    }

    private String nodeAsString(SyntaxNode node) {
        String children = node.getChildren().stream()
                .map(this::nodeAsString)
                .flatMap(String::lines)
                .map(line -> "  " + line)
                .collect(Collectors.joining("\n"));
        return children.isEmpty() ? node.toString() : node + "\n" + children;
    }

    private void onToken(Token token) {
        if (token.getStart() > lastIndexOfInterest) {
            return;
        }
        switch (token.getType()) {
            case KEYWORD -> {
                closeSibling(t -> t.getType() == TokenType.KEYWORD, t -> t.getType().isOpenBracket());
                addChild(token);
            }
            case CLOSE_BRACKET -> closeBracket(token);
            default -> {
                if (LEAF_TYPES.contains(currentLeaf.getType())) {
                    currentLeaf = currentLeaf.getParent();
                }
                addChild(token);
            }
        }
    }

    private void addChild(Token token) {
        SyntaxNode child = token.getType().isOpenBracket()
                ? new BracketNode(token, currentLeaf)
                : new SyntaxNode(token, currentLeaf);
        currentLeaf.addChild(child);
        currentLeaf = child;
    }

    private void closeBracket(Token closeToken) {
        SyntaxNode openBracket = closeSibling(t -> t.getType().isOpenBracket(), t -> false);
        if (openBracket instanceof BracketNode bracket) {
            bracket.setCloseBracket(closeToken);
        } else {
            offendingTokens.add(closeToken);
        }
    }

    /**
     * Climbs out of nested nodes up to the nearest sibling or parent candidate. When a
     * sibling is reached, the cursor moves to its parent and the sibling is returned.
     */
    private SyntaxNode closeSibling(Predicate<Token> isSibling, Predicate<Token> isParent) {
        SyntaxNode node = currentLeaf;
        while (!isSibling.test(node.getToken()) && !isParent.test(node.getToken())) {
            if (node.getParent() == null) {
                currentLeaf = node;
                return null;
            }
            node = node.getParent();
        }
        currentLeaf = node;

        if (isSibling.test(node.getToken()) && !isParent.test(node.getToken())) {
            currentLeaf = node.getParent();
            return node;
        }
        return null;
    }
}
