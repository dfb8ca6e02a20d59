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
package org.pddl.lsp.completion;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.pddl.lsp.syntax.ConstructKind;
import org.pddl.lsp.syntax.SyntaxNode;
import org.pddl.lsp.syntax.TokenType;

/**
 * Narrows a grammar table to the sections that may still be inserted at a cursor,
 * given the sections already written before and after it.
 */
public final class EligibilityCalculator {

    private EligibilityCalculator() {
    }

    public static List<String> getSupportedSectionsHere(SyntaxNode referenceNode, SyntaxNode currentNode,
                                                        TokenType siblingType, GrammarTable table) {
        return getSupportedSectionsHere(referenceNode, currentNode, siblingType,
                table.orderedSections(), table.structureSections());
    }

    /**
     * Computes the sections insertable at {@code currentNode}.
     *
     * @param referenceNode node whose siblings are scanned
     * @param currentNode node marking the cursor; siblings are split by its start offset
     * @param siblingType only siblings of this token type count
     * @param orderedSections sections with a fixed relative order
     * @param structures sections that trail the ordered ones and may repeat
     * @return eligible ordered sections in grammar order, followed by the structures when
     * nothing but structures follows the cursor
     */
    public static List<String> getSupportedSectionsHere(SyntaxNode referenceNode, SyntaxNode currentNode,
                                                        TokenType siblingType, List<String> orderedSections,
                                                        List<String> structures) {
        List<String> precedingNames = names(referenceNode.getPrecedingSiblings(siblingType, currentNode));
        List<String> followingNames = names(referenceNode.getFollowingSiblings(siblingType, currentNode));

        List<String> eligible = orderedSections;
        for (String preceding : precedingNames) {
            eligible = SectionGrammar.sectionsAfter(preceding, eligible);
        }
        for (int i = followingNames.size() - 1; i >= 0; i--) {
            eligible = SectionGrammar.sectionsBefore(followingNames.get(i), eligible);
        }

        if (followingNames.stream().allMatch(structures::contains)) {
            List<String> withStructures = new ArrayList<>(eligible);
            withStructures.addAll(structures);
            eligible = withStructures;
        }

        // once a structure is written, the ordered sections are closed for this scope
        if (precedingNames.stream().anyMatch(structures::contains)) {
            eligible = structures;
        }

        return List.copyOf(eligible);
    }

    private static List<String> names(List<SyntaxNode> siblings) {
        return siblings.stream()
                .map(sibling -> ConstructKind.stripBracket(sibling.getToken().getText()).toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Nearest keyword enclosing the node within its bracket, e.g. the {@code :effect} owning a
     * cursor inside the effect expression.
     *
     * @return that keyword, or the node itself when no keyword lies between it and the bracket
     */
    public static SyntaxNode getPrecedingKeywordOrSelf(SyntaxNode node) {
        SyntaxNode candidate = node;
        while (candidate != null && !candidate.isDocument() && !candidate.isOpenBracket()) {
            if (candidate.isType(TokenType.KEYWORD)) {
                return candidate;
            }
            candidate = candidate.getParent();
        }
        return node;
    }
}
