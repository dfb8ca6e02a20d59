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
import java.util.Optional;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.Range;
import org.pddl.lsp.config.CompletionSettings;
import org.pddl.lsp.model.DomainDeclarations;
import org.pddl.lsp.syntax.SyntaxNode;
import org.pddl.lsp.syntax.TokenType;

/**
 * Completion inside a domain file: top level sections and structures, action body
 * keywords, requirement flags, effects and conditions.
 */
public class DomainCompletionProvider {

    static final String DURATION_SNIPPET =
            ":duration ${2|(= ?duration 1),(> ?duration 0),(<= ?duration 10),(and (>= ?duration 1)(<= ?duration 2))|}";

    private final SuggestionBuilder builder = new SuggestionBuilder(SuggestionDocumentation.DOMAIN);
    private final RequirementsCompletions requirementsCompletions = new RequirementsCompletions();
    private final EffectCompletionProvider effectCompletionProvider = new EffectCompletionProvider();
    private final SymbolCompletionProvider symbolCompletionProvider = new SymbolCompletionProvider();

    public List<CompletionItem> provide(CursorContext cursor, StructuralPosition position,
                                        CompletionSettings settings, DomainDeclarations declarations) {
        return switch (position) {
            case INSIDE_DEFINE -> defineItems(cursor, settings);
            case INSIDE_REQUIREMENTS -> requirementsCompletions.provide(cursor, settings);
            case INSIDE_ACTION_BODY, INSIDE_DURATIVE_ACTION_BODY -> bodyItems(cursor);
            case INSIDE_EFFECT -> effectCompletionProvider.provideEffects(cursor, declarations);
            case INSIDE_CONDITION -> effectCompletionProvider.provideConditions(cursor);
            case PARAMETER_REFERENCE, TYPE_REFERENCE, OPERATOR_POSITION ->
                    symbolCompletionProvider.provide(cursor, position, declarations);
            case BEFORE_DEFINE, UNKNOWN -> List.of();
        };
    }

    private List<CompletionItem> defineItems(CursorContext cursor, CompletionSettings settings) {
        SyntaxNode currentNode = cursor.node();
        if (cursor.request().isTriggerCharacter()) {
            currentNode = currentNode.expand();
        }
        List<String> supportedSectionsHere = EligibilityCalculator.getSupportedSectionsHere(currentNode, currentNode,
                TokenType.OPEN_BRACKET_OPERATOR, SectionGrammar.domainTable(settings));
        Range range = cursor.request().replacesTriggerText() ? cursor.rangeFrom(currentNode) : null;

        List<CompletionItem> items = new ArrayList<>();
        for (int index = 0; index < supportedSectionsHere.size(); index++) {
            int sortIndex = index;
            Suggestion.from(supportedSectionsHere.get(index), cursor.request(), "(")
                    .map(suggestion -> createDefineItem(suggestion, range, sortIndex))
                    .ifPresent(items::add);
        }
        return items;
    }

    private CompletionItem createDefineItem(Suggestion suggestion, Range range, int index) {
        return defineSnippet(suggestion.sectionName())
                .map(snippet -> builder.createSnippetItem(suggestion, snippet, range, index))
                .orElseGet(() -> builder.createKeywordItem(suggestion, true, range, index));
    }

    private static Optional<String> defineSnippet(String sectionName) {
        String snippet = switch (sectionName) {
            case SectionGrammar.DOMAIN -> "(domain ${1:domain_name})";
            case SectionGrammar.REQUIREMENTS -> "(:requirements :strips $0)";
            case SectionGrammar.TYPES, SectionGrammar.CONSTANTS, SectionGrammar.PREDICATES, SectionGrammar.FUNCTIONS ->
                    "(" + sectionName + "\n\t$0\n)";
            case SectionGrammar.CONSTRAINTS -> "(" + sectionName + " (and\n\t$0\n))";
            case SectionGrammar.ACTION -> String.join("\n",
                    "(:action ${1:action_name}",
                    "    :parameters ($0)",
                    "    :precondition (and )",
                    "    :effect (and )",
                    ")",
                    "");
            case SectionGrammar.DURATIVE_ACTION -> String.join("\n",
                    "(:durative-action ${1:action_name}",
                    "    :parameters ($0)",
                    "    " + DURATION_SNIPPET,
                    "    :condition (and ",
                    "        (at start (and ",
                    "        ))",
                    "        (over all (and ",
                    "        ))",
                    "        (at end (and ",
                    "        ))",
                    "    )",
                    "    :effect (and ",
                    "        (at start (and ",
                    "        ))",
                    "        (at end (and ",
                    "        ))",
                    "    )",
                    ")",
                    "");
            case SectionGrammar.JOB -> String.join("\n",
                    "(:job ${1:job_name}",
                    "    :parameters ($0)",
                    "    :condition (and ",
                    "        (at start (and ",
                    "        ))",
                    "    )",
                    "    :effect (and ",
                    "        (at start (and ",
                    "        ))",
                    "        (at end (and ",
                    "        ))",
                    "    )",
                    ")",
                    "");
            case SectionGrammar.PROCESS -> String.join("\n",
                    "(:process ${1:process_name}",
                    "    :parameters ($0)",
                    "    :precondition (and",
                    "        ; activation condition",
                    "    )",
                    "    :effect (and",
                    "        ; continuous effect(s)",
                    "    )",
                    ")",
                    "");
            case SectionGrammar.EVENT -> String.join("\n",
                    "(:event ${1:event_name}",
                    "    :parameters ($0)",
                    "    :precondition (and",
                    "        ; trigger condition",
                    "    )",
                    "    :effect (and",
                    "        ; discrete effect(s)",
                    "    )",
                    ")",
                    "");
            default -> null;
        };
        return Optional.ofNullable(snippet);
    }

    private List<CompletionItem> bodyItems(CursorContext cursor) {
        SyntaxNode currentNode = cursor.node();
        SyntaxNode scope = currentNode.expand();
        GrammarTable table = switch (scope.getConstructKind()) {
            case DURATIVE_ACTION -> SectionGrammar.DURATIVE_ACTION_TABLE;
            case JOB -> SectionGrammar.JOB_TABLE;
            default -> SectionGrammar.ACTION_TABLE;
        };

        SyntaxNode nearestPrecedingKeyword = EligibilityCalculator.getPrecedingKeywordOrSelf(currentNode);
        List<String> supportedSectionsHere = EligibilityCalculator.getSupportedSectionsHere(nearestPrecedingKeyword,
                currentNode, TokenType.KEYWORD, table);
        Range range = cursor.request().replacesTriggerText() ? cursor.rangeFrom(currentNode) : null;

        List<CompletionItem> items = new ArrayList<>();
        for (int index = 0; index < supportedSectionsHere.size(); index++) {
            int sortIndex = index;
            Suggestion.from(supportedSectionsHere.get(index), cursor.request(), "")
                    .map(suggestion -> createBodyItem(suggestion, range, sortIndex))
                    .ifPresent(items::add);
        }
        return items;
    }

    private CompletionItem createBodyItem(Suggestion suggestion, Range range, int index) {
        String sectionName = suggestion.sectionName();
        return switch (sectionName) {
            case SectionGrammar.PARAMETERS -> builder.createSnippetItem(suggestion, ":parameters ($0)", range, index);
            case SectionGrammar.DURATION -> builder.createSnippetItem(suggestion, DURATION_SNIPPET, range, index);
            case SectionGrammar.PRECONDITION, SectionGrammar.CONDITION, SectionGrammar.EFFECT ->
                    builder.createSnippetItem(suggestion, sectionName + " (and \n\t$0\n)", range, index);
            default -> builder.createKeywordItem(suggestion, false, range, index);
        };
    }
}
