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
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Single node of the PDDL syntax tree, wrapping one token. Nodes are only mutated by
 * {@link SyntaxTreeBuilder}; once the tree is handed out it is treated as read-only.
 */
public class SyntaxNode {

    private static final Pattern ANY = Pattern.compile(".*", Pattern.DOTALL);

    private final Token token;
    private final SyntaxNode parent;
    private final ConstructKind constructKind;
    private final List<SyntaxNode> children = new ArrayList<>();
    private int maxChildEnd;

    SyntaxNode(Token token, SyntaxNode parent) {
        this.token = token;
        this.parent = parent;
        this.constructKind = ConstructKind.of(token);
        this.maxChildEnd = token.getEnd();
    }

    static SyntaxNode createRoot() {
        return new SyntaxNode(new Token(TokenType.DOCUMENT, "", 0), null);
    }

    void addChild(SyntaxNode child) {
        children.add(child);
        recalculateEnd(child.getEnd());
    }

    void recalculateEnd(int end) {
        maxChildEnd = Math.max(maxChildEnd, end);
        if (parent != null) {
            parent.recalculateEnd(maxChildEnd);
        }
    }

    public Token getToken() {
        return token;
    }

    public TokenType getType() {
        return token.getType();
    }

    public ConstructKind getConstructKind() {
        return constructKind;
    }

    public SyntaxNode getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public boolean isDocument() {
        return isType(TokenType.DOCUMENT);
    }

    public boolean isType(TokenType type) {
        return token.getType() == type;
    }

    public boolean isNotType(TokenType type) {
        return token.getType() != type;
    }

    public boolean isOpenBracket() {
        return token.getType().isOpenBracket();
    }

    public List<SyntaxNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<SyntaxNode> getNonWhitespaceChildren() {
        return children.stream()
                .filter(c -> c.isNotType(TokenType.WHITESPACE))
                .toList();
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public List<SyntaxNode> getChildrenOfType(TokenType type, Pattern pattern) {
        return children.stream()
                .filter(c -> c.isType(type))
                .filter(c -> pattern.matcher(c.getToken().getText()).find())
                .toList();
    }

    public SyntaxNode getFirstChild(TokenType type, Pattern pattern) {
        return getChildrenOfType(type, pattern).stream().findFirst().orElse(null);
    }

    public SyntaxNode getFirstChild(ConstructKind kind) {
        return children.stream()
                .filter(c -> c.getConstructKind() == kind)
                .findFirst()
                .orElse(null);
    }

    public List<SyntaxNode> getChildren(ConstructKind kind) {
        return children.stream()
                .filter(c -> c.getConstructKind() == kind)
                .toList();
    }

    /**
     * Finds the bracket nested inside a keyword child, e.g. the {@code (?a - t)} in
     * {@code :parameters (?a - t)}.
     */
    public SyntaxNode getKeywordOpenBracket(ConstructKind keyword) {
        SyntaxNode keywordNode = getFirstChild(keyword);
        if (keywordNode == null) {
            return null;
        }
        return keywordNode.getNonWhitespaceChildren().stream()
                .filter(SyntaxNode::isOpenBracket)
                .findFirst()
                .orElse(null);
    }

    public String getNestedText() {
        return children.stream()
                .map(SyntaxNode::getText)
                .collect(Collectors.joining());
    }

    public String getText() {
        return token.getText() + getNestedText();
    }

    public int getStart() {
        return token.getStart();
    }

    public int getEnd() {
        return maxChildEnd;
    }

    public boolean includesIndex(int index) {
        return index >= getStart() && index <= getEnd();
    }

    /**
     * Walks the ancestors, innermost first, up to (excluding) the document root.
     *
     * @return the first ancestor of the given type whose token text matches, or {@code null}
     */
    public SyntaxNode findAncestor(TokenType type, Pattern pattern) {
        SyntaxNode ancestor = parent;
        while (ancestor != null && !ancestor.isDocument()) {
            if (ancestor.isType(type) && pattern.matcher(ancestor.getToken().getText()).find()) {
                return ancestor;
            }
            ancestor = ancestor.parent;
        }
        return null;
    }

    public SyntaxNode findAncestor(ConstructKind kind) {
        SyntaxNode ancestor = parent;
        while (ancestor != null && !ancestor.isDocument()) {
            if (ancestor.getConstructKind() == kind) {
                return ancestor;
            }
            ancestor = ancestor.parent;
        }
        return null;
    }

    public boolean hasAncestor(ConstructKind kind) {
        return findAncestor(kind) != null;
    }

    /**
     * Widens this node to the nearest enclosing bracket (or itself, when it is a bracket).
     *
     * @return the bracket node, or {@code null} when the node sits directly in the document
     */
    public SyntaxNode expand() {
        SyntaxNode node = this;
        while (node != null && !node.isOpenBracket() && !node.isDocument()) {
            node = node.parent;
        }
        if (node == null || node.isDocument()) {
            return null;
        }
        return node;
    }

    /** Siblings of the given type that start before {@code centralNode}. */
    public List<SyntaxNode> getPrecedingSiblings(TokenType type, SyntaxNode centralNode) {
        int centralStart = centralNode.getStart();
        return getSiblings(type).stream()
                .filter(sibling -> sibling.getStart() < centralStart)
                .toList();
    }

    /** Siblings of the given type that start after {@code centralNode}. */
    public List<SyntaxNode> getFollowingSiblings(TokenType type, SyntaxNode centralNode) {
        int centralStart = centralNode.getStart();
        return getSiblings(type).stream()
                .filter(sibling -> sibling.getStart() > centralStart)
                .toList();
    }

    private List<SyntaxNode> getSiblings(TokenType type) {
        if (isRoot()) {
            return List.of();
        }
        return parent.getChildrenOfType(type, ANY);
    }

    /** Enclosing scopes declaring parameters, innermost first. */
    public List<SyntaxNode> findAllParametrisableScopes() {
        List<SyntaxNode> scopes = new ArrayList<>();
        SyntaxNode ancestor = parent;
        while (ancestor != null && !ancestor.isDocument()) {
            if (ancestor.getConstructKind().isParametrisable()) {
                scopes.add(ancestor);
            }
            ancestor = ancestor.parent;
        }
        return scopes;
    }

    /**
     * Returns the bracket holding the parameter declarations of this scope node: the
     * {@code :parameters} bracket for actions, otherwise the first nested bracket.
     */
    public SyntaxNode getParameterDefinition() {
        if (constructKind.declaresParametersByKeyword()) {
            return getKeywordOpenBracket(ConstructKind.PARAMETERS);
        }
        List<SyntaxNode> nonWhitespace = getNonWhitespaceChildren();
        if (nonWhitespace.isEmpty() || !nonWhitespace.get(0).isOpenBracket()) {
            return null;
        }
        return nonWhitespace.get(0);
    }

    @Override
    public String toString() {
        return token.getType() + ": text: '" + token.getText().replace("\n", "\\n") + "', range: "
                + getStart() + "~" + getEnd();
    }
}
