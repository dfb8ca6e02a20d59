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

import java.util.List;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.Range;
import org.pddl.lsp.syntax.SyntaxNode;
import org.pddl.lsp.syntax.TokenType;

/**
 * Completion for a file that is neither a domain nor a problem yet: domain and problem
 * skeletons at the top level.
 */
public class UnknownFileCompletionProvider {

    static final String DOMAIN_SKELETON = String.join("\n",
            "(define (domain ${1:domain_name})",
            "",
            "(:requirements :strips $2)",
            "",
            "(:types $3",
            ")",
            "",
            "(:predicates $4",
            ")",
            "",
            "(:action ${5:action_name}",
            "    :parameters ($6)",
            "    :precondition (and $7)",
            "    :effect (and $0)",
            ")",
            ")",
            "");

    static final String PROBLEM_SKELETON = String.join("\n",
            "(define (problem ${1:problem_name}) (:domain ${2:domain_name})",
            "",
            "(:objects $3",
            ")",
            "",
            "(:init $4",
            ")",
            "",
            "(:goal (and $0",
            "))",
            ")",
            "");

    public List<CompletionItem> provide(CursorContext cursor, StructuralPosition position) {
        if (position != StructuralPosition.BEFORE_DEFINE) {
            return List.of();
        }
        SyntaxNode node = cursor.node();
        if (node.isDocument() || node.isType(TokenType.WHITESPACE)) {
            return List.of(
                    createSkeleton("domain", "domain", "Domain skeleton", DOMAIN_SKELETON, null, 0),
                    createSkeleton("problem", "problem", "Problem skeleton", PROBLEM_SKELETON, null, 1));
        } else if (cursor.request().isTriggeredBy("(")) {
            Range range = cursor.rangeFrom(node);
            return List.of(
                    createSkeleton("(define domain...", "(define domain", "Domain skeleton", DOMAIN_SKELETON, range, 0),
                    createSkeleton("(define problem...", "(define problem", "Problem skeleton", PROBLEM_SKELETON, range, 1));
        }
        return List.of();
    }

    private static CompletionItem createSkeleton(String label, String filterText, String detail, String snippet,
                                                 Range range, int index) {
        CompletionItem item = SuggestionBuilder.createTemplateItem(label, snippet, detail, CompletionItemKind.Module, range, index);
        item.setFilterText(filterText);
        return item;
    }
}
