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

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.Range;
import org.pddl.lsp.model.DomainDeclarations;
import org.pddl.lsp.model.Variable;
import org.pddl.lsp.syntax.SyntaxNode;

/**
 * Effect and durative condition expressions. Which effects are offered depends on the
 * enclosing structure: instantaneous actions and events take discrete effects, processes
 * take continuous ones, and durative actions take either depending on the time qualifier.
 */
class EffectCompletionProvider {

    private final SuggestionBuilder durativeEffects = new SuggestionBuilder(SuggestionDocumentation.DURATIVE_EFFECTS);
    private final SuggestionBuilder discreteEffects = new SuggestionBuilder(SuggestionDocumentation.DISCRETE_EFFECTS);
    private final SuggestionBuilder continuousEffects = new SuggestionBuilder(SuggestionDocumentation.CONTINUOUS_EFFECTS);
    private final SuggestionBuilder durativeConditions = new SuggestionBuilder(SuggestionDocumentation.DURATIVE_CONDITIONS);

    List<CompletionItem> provideEffects(CursorContext cursor, DomainDeclarations declarations) {
        if (!isOffered(cursor.request())) {
            return List.of();
        }
        SyntaxNode node = cursor.node();
        Range range = rangeOf(cursor);
        ItemCollector items = new ItemCollector(cursor.request(), range);

        if (ScopeClassifier.isInsideDurativeUnqualifiedEffect(node)) {
            items.add(durativeEffects, "at start", "(at start $0)");
            items.add(durativeEffects, "at end", "(at end $0)");
        }
        if (ScopeClassifier.isInsideActionOrEvent(node) || ScopeClassifier.isInsideDurativeDiscreteEffect(node)) {
            String predicates = "(" + SuggestionBuilder.toSelection(1, typeLessNames(declarations.getPredicates()), "new_predicate");
            String function = "(" + SuggestionBuilder.toSelection(1, typeLessNames(declarations.getFunctions()), "new_function") + ")";
            items.add(discreteEffects, "not", "(not " + predicates + "))$0");
            items.add(discreteEffects, "assign", "(assign " + function + " ${2:0})$0");
            items.add(discreteEffects, "increase", "(increase " + function + " ${2:1})$0");
            items.add(discreteEffects, "decrease", "(decrease " + function + " ${2:1})$0");
            items.add(discreteEffects, "forall", "(forall ($1) $2)$0");
            items.add(discreteEffects, "when", "(when ${1:condition} ${2:effect})$0");
        }
        if (ScopeClassifier.isInsideProcess(node) || ScopeClassifier.isInsideDurativeUnqualifiedEffect(node)) {
            String function = "(" + SuggestionBuilder.toSelection(1, typeLessNames(declarations.getFunctions()), "new_function") + ")";
            items.add(continuousEffects, "increase", "(increase " + function + " (* #t ${2:1.0}))$0");
            items.add(continuousEffects, "decrease", "(decrease " + function + " (* #t ${2:1.0}))$0");
            items.add(continuousEffects, "forall", "(forall ($1) $2)$0");
        }
        return items.getItems();
    }

    List<CompletionItem> provideConditions(CursorContext cursor) {
        if (!isOffered(cursor.request())) {
            return List.of();
        }
        ItemCollector items = new ItemCollector(cursor.request(), rangeOf(cursor));
        items.add(durativeConditions, "at start", "(at start $0)");
        items.add(durativeConditions, "at end", "(at end $0)");
        items.add(durativeConditions, "over all", "(over all $0)");
        return items.getItems();
    }

    private static boolean isOffered(CompletionRequest request) {
        return request.isInvoked() || request.isTriggeredBy("(");
    }

    private static Range rangeOf(CursorContext cursor) {
        return cursor.request().isTriggeredBy("(") ? cursor.rangeFrom(cursor.node()) : null;
    }

    private static List<String> typeLessNames(List<Variable> variables) {
        return variables.stream()
                .map(Variable::declaredNameWithoutTypes)
                .toList();
    }

    /** Accumulates items, numbering them in the order they are offered. */
    private static final class ItemCollector {

        private final CompletionRequest request;
        private final Range range;
        private final List<CompletionItem> items = new ArrayList<>();

        private ItemCollector(CompletionRequest request, Range range) {
            this.request = request;
            this.range = range;
        }

        void add(SuggestionBuilder builder, String label, String snippet) {
            Suggestion.from(label, request, "(")
                    .map(suggestion -> builder.createSnippetItem(suggestion, snippet, range, items.size()))
                    .ifPresent(items::add);
        }

        List<CompletionItem> getItems() {
            return items;
        }
    }
}
