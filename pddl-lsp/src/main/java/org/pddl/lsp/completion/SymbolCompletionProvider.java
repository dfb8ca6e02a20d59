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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionItemKind;
import org.eclipse.lsp4j.Range;
import org.pddl.lsp.model.DomainDeclarations;
import org.pddl.lsp.model.Variable;
import org.pddl.lsp.syntax.SyntaxNode;
import org.pddl.lsp.syntax.TokenType;

/**
 * Names the user refers to rather than declares: parameters of the enclosing scopes,
 * declared types, operators and the predicates and functions of the domain.
 */
class SymbolCompletionProvider {

    private static final Pattern ANY = Pattern.compile(".*");

    private static final List<String> OPERATORS = List.of(
            "and", "not", "at start", "at end", "over all", "=", ">", "<", ">=", "<=", "+", "-", "/", "*", "forall", "exists");

    private final SuggestionBuilder operators = new SuggestionBuilder(SuggestionDocumentation.OPERATORS);
    private final SuggestionBuilder parameters = new SuggestionBuilder(SuggestionDocumentation.NONE);

    List<CompletionItem> provide(CursorContext cursor, StructuralPosition position, DomainDeclarations declarations) {
        return switch (position) {
            case PARAMETER_REFERENCE -> parameterItems(cursor);
            case TYPE_REFERENCE -> typeItems(declarations);
            case OPERATOR_POSITION -> operatorAndVariableItems(cursor, declarations);
            default -> List.of();
        };
    }

    List<CompletionItem> parameterItems(CursorContext cursor) {
        SyntaxNode node = cursor.node();
        Set<String> parameterNames = new LinkedHashSet<>();
        for (SyntaxNode scope : node.findAllParametrisableScopes()) {
            SyntaxNode parameterDefinition = scope.getParameterDefinition();
            if (parameterDefinition != null) {
                parameterDefinition.getChildrenOfType(TokenType.PARAMETER, ANY).stream()
                        .map(parameter -> parameter.getToken().getText())
                        .forEach(parameterNames::add);
            }
        }

        Range range = cursor.rangeFrom(node);
        List<CompletionItem> items = new ArrayList<>();
        for (String parameterName : parameterNames) {
            int index = items.size();
            Suggestion.from(parameterName, cursor.request(), "")
                    .map(suggestion -> parameters.createSnippetItem(suggestion, SuggestionBuilder.escape(parameterName), range, index))
                    .ifPresent(item -> {
                        item.setKind(CompletionItemKind.Variable);
                        item.setDetail("Parameter");
                        items.add(item);
                    });
        }
        return items;
    }

    List<CompletionItem> typeItems(DomainDeclarations declarations) {
        List<CompletionItem> items = new ArrayList<>();
        for (String type : declarations.getTypes()) {
            // leading space keeps "- type" formatted
            items.add(SuggestionBuilder.createSymbolItem(type, " " + type, "Type", "", CompletionItemKind.Class, items.size()));
        }
        return items;
    }

    List<CompletionItem> operatorAndVariableItems(CursorContext cursor, DomainDeclarations declarations) {
        List<CompletionItem> items = new ArrayList<>();
        for (String operator : OPERATORS) {
            int index = items.size();
            Suggestion.from(operator, cursor.request(), "(")
                    .map(suggestion -> operators.createSnippetItem(suggestion, SuggestionBuilder.escape(operator), null, index))
                    .ifPresent(items::add);
        }
        for (Variable predicate : declarations.getPredicates()) {
            items.add(createVariableItem(predicate, "Predicate", CompletionItemKind.Value, items.size()));
        }
        for (Variable function : declarations.getFunctions()) {
            items.add(createVariableItem(function, "Function", CompletionItemKind.Unit, items.size()));
        }
        for (Variable derived : declarations.getDerived()) {
            items.add(createVariableItem(derived, "Derived predicate/function", CompletionItemKind.Interface, items.size()));
        }
        return items;
    }

    private static CompletionItem createVariableItem(Variable variable, String title, CompletionItemKind kind, int index) {
        String documentation = "```pddl\n(" + variable.declaredName() + ")\n```";
        return SuggestionBuilder.createSymbolItem(variable.declaredName(), variable.declaredNameWithoutTypes(),
                title, documentation, kind, index);
    }
}
