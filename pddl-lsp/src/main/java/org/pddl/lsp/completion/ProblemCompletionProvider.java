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
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.Range;
import org.pddl.lsp.config.CompletionSettings;
import org.pddl.lsp.model.DomainDeclarations;
import org.pddl.lsp.syntax.SyntaxNode;
import org.pddl.lsp.syntax.TokenType;

/**
 * Completion inside a problem file: pre-parsing directives at the top of the file,
 * problem sections inside {@code (define}, requirement flags, and symbols of the domain
 * the problem refers to.
 */
public class ProblemCompletionProvider {

    private final SuggestionBuilder builder = new SuggestionBuilder(SuggestionDocumentation.PROBLEM);
    private final RequirementsCompletions requirementsCompletions = new RequirementsCompletions();
    private final SymbolCompletionProvider symbolCompletionProvider = new SymbolCompletionProvider();

    /**
     * @param domainNames names of the open domains, offered in {@code (:domain}
     * @param declarations symbols of the domain this problem refers to, empty when it is not open
     */
    public List<CompletionItem> provide(CursorContext cursor, StructuralPosition position, CompletionSettings settings,
                                        List<String> domainNames, DomainDeclarations declarations) {
        return switch (position) {
            case BEFORE_DEFINE -> preParsingItems(cursor);
            case INSIDE_DEFINE -> defineItems(cursor, domainNames);
            case INSIDE_REQUIREMENTS -> requirementsCompletions.provide(cursor, settings);
            case PARAMETER_REFERENCE, TYPE_REFERENCE, OPERATOR_POSITION ->
                    symbolCompletionProvider.provide(cursor, position, declarations);
            case INSIDE_ACTION_BODY, INSIDE_DURATIVE_ACTION_BODY, INSIDE_EFFECT, INSIDE_CONDITION, UNKNOWN -> List.of();
        };
    }

    private List<CompletionItem> preParsingItems(CursorContext cursor) {
        SyntaxNode node = cursor.node();
        Range range = node.isType(TokenType.COMMENT) ? cursor.rangeFrom(node) : null;
        return List.of(
                createDirective(";;!pre-parsing:command",
                        ";;!pre-parsing:{type: \"command\", command: \"${1:program}\", args: [${2:\"data.json\", \"1234\"}]}\n$0",
                        "Pre-parsing problem file transformation via a shell command.", range, 0),
                createDirective(";;!pre-parsing:python",
                        ";;!pre-parsing:{type: \"python\", command: \"${1:your_script.py}\", args: [${2:\"data.json\", \"1234\"}]}\n$0",
                        "Pre-parsing problem file transformation via a python script.", range, 1),
                createDirective(";;!pre-parsing:",
                        ";;!pre-parsing:{type: \"${1|nunjucks,jinja2|}\", data: \"${2:case1.json}\"}\n$0",
                        "Pre-parsing problem file transformation via Nunjucks or Jinja2.", range, 2));
    }

    private static CompletionItem createDirective(String label, String snippet, String detail, Range range, int index) {
        return SuggestionBuilder.createTemplateItem(label, snippet, detail, CompletionItemKind.Snippet, range, index);
    }

    private List<CompletionItem> defineItems(CursorContext cursor, List<String> domainNames) {
        SyntaxNode currentNode = cursor.node();
        if (cursor.request().isTriggerCharacter()) {
            currentNode = currentNode.expand();
        }
        List<String> supportedSectionsHere = EligibilityCalculator.getSupportedSectionsHere(currentNode, currentNode,
                TokenType.OPEN_BRACKET_OPERATOR, SectionGrammar.PROBLEM_TABLE);
        Range range = cursor.request().replacesTriggerText() ? cursor.rangeFrom(currentNode) : null;

        List<CompletionItem> items = new ArrayList<>();
        for (int index = 0; index < supportedSectionsHere.size(); index++) {
            int sortIndex = index;
            Suggestion.from(supportedSectionsHere.get(index), cursor.request(), "(")
                    .map(suggestion -> defineSnippet(suggestion.sectionName(), domainNames)
                            .map(snippet -> builder.createSnippetItem(suggestion, snippet, range, sortIndex))
                            .orElseGet(() -> builder.createKeywordItem(suggestion, true, range, sortIndex)))
                    .ifPresent(items::add);
        }
        return items;
    }

    private static Optional<String> defineSnippet(String sectionName, List<String> domainNames) {
        String snippet = switch (sectionName) {
            case SectionGrammar.PROBLEM -> "(problem ${1:problem_name})";
            case SectionGrammar.DOMAIN_REFERENCE ->
                    "(:domain " + SuggestionBuilder.toSelection(1, domainNames, "domain_name") + ")";
            case SectionGrammar.REQUIREMENTS -> "(:requirements :strips $0)";
            case SectionGrammar.OBJECTS, SectionGrammar.INIT -> "(" + sectionName + "\n\t$0\n)";
            case SectionGrammar.GOAL, SectionGrammar.CONSTRAINTS -> "(" + sectionName + " (and\n\t$0\n))";
            case SectionGrammar.METRIC -> "(:metric ${1|minimize,maximize|} ($0))";
            default -> null;
        };
        return Optional.ofNullable(snippet);
    }
}
