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
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.junit.jupiter.api.Test;
import org.pddl.lsp.config.CompletionSettings;
import org.pddl.lsp.model.DomainDeclarations;
import org.pddl.lsp.model.PddlDocumentModel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pddl.lsp.completion.CompletionFixtures.cursor;
import static org.pddl.lsp.completion.CompletionFixtures.labels;

class ProblemCompletionProviderTest {

    private final ProblemCompletionProvider provider = new ProblemCompletionProvider();
    private final ScopeClassifier classifier = new ScopeClassifier();

    @Test
    void shouldOfferProblemSectionsAfterHeader() {
        String text = "(define (problem p1) (:domain logistics)\n  \n)";

        List<CompletionItem> items = complete(cursor(text, "logistics)\n "), List.of());

        assertThat(labels(items)).containsExactly(":requirements", ":objects", ":init", ":goal", ":constraints", ":metric");
        assertThat(items.get(items.size() - 1).getInsertText()).isEqualTo("(:metric ${1|minimize,maximize|} ($0))");
        assertThat(items.get(1).getDetail()).isEqualTo("Objects");
    }

    @Test
    void domainReferenceShouldOfferOpenDomains() {
        String text = "(define (problem p1)\n  \n)";

        List<CompletionItem> items = complete(cursor(text, "(problem p1)\n "), List.of("logistics", "rovers"));

        assertThat(labels(items)).startsWith(":domain", ":requirements");
        assertThat(items.get(0).getInsertText()).isEqualTo("(:domain ${1|logistics,rovers|})");
    }

    @Test
    void domainReferenceShouldUsePlaceholderWithoutOpenDomains() {
        String text = "(define (problem p1)\n  \n)";

        List<CompletionItem> items = complete(cursor(text, "(problem p1)\n "), List.of());

        assertThat(items.get(0).getInsertText()).isEqualTo("(:domain ${1:domain_name})");
    }

    @Test
    void topLevelCommentShouldOfferPreParsingDirectives() {
        String text = ";; \n(define (problem p1) (:domain logistics)\n)";

        List<CompletionItem> items = complete(cursor(text, ";;"), List.of());

        assertThat(labels(items)).containsExactly(";;!pre-parsing:command", ";;!pre-parsing:python", ";;!pre-parsing:");
        assertThat(items).allMatch(item -> item.getKind() == CompletionItemKind.Snippet);
        assertThat(items.get(0).getTextEdit().getLeft().getRange())
                .isEqualTo(new Range(new Position(0, 0), new Position(0, 2)));
    }

    @Test
    void problemShouldOfferDomainSymbols() {
        String domain = "(define (domain logistics)\n(:predicates (at ?t ?p)))";
        DomainDeclarations declarations = new PddlDocumentModel("file:///domain.pddl", domain)
                .getDeclarations();
        String text = "(define (problem p1) (:domain logistics)\n(:goal (and ()))\n)";
        CursorContext cursor = cursor(text, "(and (", CompletionRequest.triggeredBy("("));

        List<CompletionItem> items = provider.provide(cursor, classifier.classify(cursor), CompletionSettings.defaults(),
                List.of("logistics"), declarations);

        assertThat(labels(items)).contains("and", "at ?t ?p");
    }

    @Test
    void effectPositionsShouldOfferNothingInProblem() {
        String text = "(define (problem p1) (:domain logistics)\n  \n)";

        assertThat(provider.provide(cursor(text, "logistics)\n "), StructuralPosition.INSIDE_EFFECT,
                CompletionSettings.defaults(), List.of(), DomainDeclarations.EMPTY)).isEmpty();
    }

    private List<CompletionItem> complete(CursorContext cursor, List<String> domainNames) {
        return provider.provide(cursor, classifier.classify(cursor), CompletionSettings.defaults(), domainNames,
                DomainDeclarations.EMPTY);
    }
}
