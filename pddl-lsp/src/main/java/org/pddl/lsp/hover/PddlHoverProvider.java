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
package org.pddl.lsp.hover;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.MarkupContent;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.pddl.lsp.completion.SuggestionDetails;
import org.pddl.lsp.completion.SuggestionDocumentation;
import org.pddl.lsp.model.DomainDeclarations;
import org.pddl.lsp.model.PddlDocumentModel;
import org.pddl.lsp.model.PddlWorkspace;
import org.pddl.lsp.model.Variable;

public class PddlHoverProvider {

    private final PddlWorkspace workspace;

    public PddlHoverProvider(PddlWorkspace workspace) {
        this.workspace = workspace;
    }

    public Hover getHover(PddlDocumentModel model, Position position) {
        String word = model.getWordAt(position.getLine(), position.getCharacter()).toLowerCase(Locale.ROOT);
        if (word.isEmpty()) {
            return null;
        }

        String content = tryKeywordHover(model, word).orElse(null);
        if (content == null) {
            PddlDocumentModel domain = workspace.findDomainFor(model);
            if (domain != null) {
                content = trySymbolHover(domain.getDeclarations(), word);
            }
        }

        if (content == null) {
            return null;
        }

        MarkupContent markup = new MarkupContent();
        markup.setKind(MarkupKind.MARKDOWN);
        markup.setValue(content);
        return new Hover(markup);
    }

    private Optional<String> tryKeywordHover(PddlDocumentModel model, String word) {
        SuggestionDocumentation sections = switch (model.getFileKind()) {
            case DOMAIN -> SuggestionDocumentation.DOMAIN;
            case PROBLEM -> SuggestionDocumentation.PROBLEM;
            case UNKNOWN -> SuggestionDocumentation.NONE;
        };
        return sections.get(word)
                .or(() -> SuggestionDocumentation.OPERATORS.get(word))
                .map(PddlHoverProvider::buildKeywordHover);
    }

    private static String buildKeywordHover(SuggestionDetails details) {
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(details.label()).append("** - ").append(details.detail());
        if (!details.documentation().isEmpty()) {
            sb.append("\n\n").append(details.documentation());
        }
        return sb.toString();
    }

    private String trySymbolHover(DomainDeclarations declarations, String word) {
        String content = tryVariableHover("Predicate", declarations.getPredicates(), word);
        if (content == null) {
            content = tryVariableHover("Function", declarations.getFunctions(), word);
        }
        if (content == null) {
            content = tryVariableHover("Derived", declarations.getDerived(), word);
        }
        if (content == null && declarations.getTypes().contains(word)) {
            content = "### Type: `" + word + "`\n";
        }
        return content;
    }

    private String tryVariableHover(String title, List<Variable> variables, String word) {
        for (Variable variable : variables) {
            if (word.equals(variable.name())) {
                return buildVariableHover(title, variable);
            }
        }
        return null;
    }

    private String buildVariableHover(String title, Variable variable) {
        StringBuilder sb = new StringBuilder();
        sb.append("### ").append(title).append(": `").append(variable.name()).append("`\n\n");
        sb.append("```pddl\n(").append(variable.declaredName()).append(")\n```\n");
        if (!variable.parameters().isEmpty()) {
            sb.append("\n**Parameters**: ");
            sb.append(variable.parameters().stream()
                    .map(p -> "`" + p.name() + " - " + p.type() + "`")
                    .collect(Collectors.joining(", ")));
            sb.append("\n");
        }
        return sb.toString();
    }
}
