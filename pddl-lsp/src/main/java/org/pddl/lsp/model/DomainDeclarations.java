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
package org.pddl.lsp.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.pddl.lsp.syntax.ConstructKind;
import org.pddl.lsp.syntax.SyntaxNode;
import org.pddl.lsp.syntax.SyntaxTree;
import org.pddl.lsp.syntax.TokenType;

/**
 * Symbols a domain declares: predicates, functions, derived predicates and types.
 * Extracted from the syntax tree without further validation.
 */
public final class DomainDeclarations {

    public static final DomainDeclarations EMPTY = new DomainDeclarations(List.of(), List.of(), List.of(), List.of());

    private final List<Variable> predicates;
    private final List<Variable> functions;
    private final List<Variable> derived;
    private final List<String> types;

    private DomainDeclarations(List<Variable> predicates, List<Variable> functions, List<Variable> derived, List<String> types) {
        this.predicates = List.copyOf(predicates);
        this.functions = List.copyOf(functions);
        this.derived = List.copyOf(derived);
        this.types = List.copyOf(types);
    }

    public static DomainDeclarations extract(SyntaxTree tree) {
        SyntaxNode define = tree.getDefineNode();
        if (define == null) {
            return EMPTY;
        }
        return new DomainDeclarations(
                declaredIn(define.getFirstChild(ConstructKind.PREDICATES)),
                declaredIn(define.getFirstChild(ConstructKind.FUNCTIONS)),
                define.getChildren(ConstructKind.DERIVED).stream()
                        .map(DomainDeclarations::derivedSignature)
                        .filter(Objects::nonNull)
                        .toList(),
                typesIn(define.getFirstChild(ConstructKind.TYPES)));
    }

    private static List<Variable> declaredIn(SyntaxNode section) {
        if (section == null) {
            return List.of();
        }
        return section.getNonWhitespaceChildren().stream()
                .filter(SyntaxNode::isOpenBracket)
                .map(DomainDeclarations::innerText)
                .filter(text -> !text.isBlank())
                .map(Variable::parse)
                .toList();
    }

    private static Variable derivedSignature(SyntaxNode derivedNode) {
        SyntaxNode signature = derivedNode.getParameterDefinition();
        if (signature == null) {
            return null;
        }
        String text = innerText(signature);
        return text.isBlank() ? null : Variable.parse(text);
    }

    private static List<String> typesIn(SyntaxNode section) {
        if (section == null) {
            return List.of();
        }
        Set<String> types = new LinkedHashSet<>();
        for (SyntaxNode child : section.getNonWhitespaceChildren()) {
            if (child.isType(TokenType.OTHER)) {
                for (String word : child.getToken().getText().trim().split("\\s+")) {
                    if (!word.isEmpty()) {
                        types.add(word.toLowerCase(Locale.ROOT));
                    }
                }
            }
        }
        return List.copyOf(types);
    }

    /** Bracket content without the surrounding parentheses, e.g. {@code at ?x} for {@code (at ?x)}. */
    private static String innerText(SyntaxNode bracket) {
        String text = bracket.getText().trim();
        if (text.startsWith("(")) {
            text = text.substring(1);
        }
        if (text.endsWith(")")) {
            text = text.substring(0, text.length() - 1);
        }
        return text.trim();
    }

    public List<Variable> getPredicates() {
        return predicates;
    }

    public List<Variable> getFunctions() {
        return functions;
    }

    public List<Variable> getDerived() {
        return derived;
    }

    public List<String> getTypes() {
        return types;
    }
}
