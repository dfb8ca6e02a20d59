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

/**
 * Syntax tree of one PDDL document, together with the bracket problems found while
 * building it.
 */
public class SyntaxTree {

    private final SyntaxNode root;
    private final List<Token> offendingTokens;

    SyntaxTree(SyntaxNode root, List<Token> offendingTokens) {
        this.root = root;
        this.offendingTokens = List.copyOf(offendingTokens);
    }

    public static SyntaxTree parse(String text) {
        return new SyntaxTreeBuilder(text).build();
    }

    public SyntaxNode getRootNode() {
        return root;
    }

    /** Close brackets without a matching open bracket. */
    public List<Token> getOffendingTokens() {
        return offendingTokens;
    }

    /**
     * Finds the innermost node at the given offset.
     *
     * @return the node, or {@code null} if the offset lies outside the document
     */
    public SyntaxNode getNodeAt(int offset) {
        if (!root.includesIndex(offset)) {
            return null;
        }
        SyntaxNode node = root;
        while (node.hasChildren() && !node.getToken().includesIndex(offset)) {
            SyntaxNode child = firstChildIncluding(node, offset);
            if (child == null) {
                return node;
            }
            node = child;
        }
        return node;
    }

    private static SyntaxNode firstChildIncluding(SyntaxNode parent, int offset) {
        for (SyntaxNode child : parent.getChildren()) {
            if (child.includesIndex(offset)) {
                return child;
            }
        }
        return null;
    }

    /** The {@code (define} bracket, or {@code null} when the document has none. */
    public SyntaxNode getDefineNode() {
        return root.getFirstChild(ConstructKind.DEFINE);
    }

    /** Open brackets that were never closed, in document order. */
    public List<BracketNode> getUnclosedBrackets() {
        List<BracketNode> unclosed = new ArrayList<>();
        collectUnclosed(root, unclosed);
        return unclosed;
    }

    private static void collectUnclosed(SyntaxNode node, List<BracketNode> unclosed) {
        if (node instanceof BracketNode bracket && !bracket.isClosed()) {
            unclosed.add(bracket);
        }
        for (SyntaxNode child : node.getChildren()) {
            collectUnclosed(child, unclosed);
        }
    }
}
