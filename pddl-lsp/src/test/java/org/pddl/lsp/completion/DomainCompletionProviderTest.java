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
import org.eclipse.lsp4j.InsertTextFormat;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Test;
import org.pddl.lsp.config.CompletionSettings;
import org.pddl.lsp.model.DomainDeclarations;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pddl.lsp.completion.CompletionFixtures.cursor;
import static org.pddl.lsp.completion.CompletionFixtures.labels;

class DomainCompletionProviderTest {

    private final DomainCompletionProvider provider = new DomainCompletionProvider();
    private final ScopeClassifier classifier = new ScopeClassifier();

    @Test
    void emptyDomainShouldOfferSectionsInGrammarOrder() {
        List<CompletionItem> items = complete(cursor("(define (domain d)\n  \n)", "(domain d)\n "));

        assertThat(labels(items)).containsExactly(":requirements", ":types", ":constants", ":predicates", ":functions",
                ":constraints", ":derived", ":action", ":durative-action", ":process", ":event");
        assertThat(items).extracting(CompletionItem::getSortText).startsWith("item000", "item001", "item002");
    }

    @Test
    void sectionItemShouldInsertSnippet() {
        List<CompletionItem> items = complete(cursor("(define (domain d)\n  \n)", "(domain d)\n "));

        CompletionItem requirements = items.get(0);
        assertThat(requirements.getInsertText()).isEqualTo("(:requirements :strips $0)");
        assertThat(requirements.getInsertTextFormat()).isEqualTo(InsertTextFormat.Snippet);
        assertThat(requirements.getFilterText()).isEqualTo("(:requirements");
        assertThat(requirements.getDetail()).isEqualTo("Requirements");
        assertThat(requirements.getKind()).isEqualTo(CompletionItemKind.Keyword);
        assertThat(requirements.getTextEdit()).isNull();

        CompletionItem process = items.get(labels(items).indexOf(":process"));
        assertThat(process.getKind()).isEqualTo(CompletionItemKind.Struct);
        assertThat(process.getInsertText()).startsWith("(:process ${1:process_name}");
    }

    @Test
    void writtenStructureShouldCloseOrderedSections() {
        List<CompletionItem> items = complete(cursor("(define (domain d)\n(:action a)\n  \n)", "(:action a)\n "));

        assertThat(labels(items)).containsExactly(":derived", ":action", ":durative-action", ":process", ":event");
    }

    @Test
    void typedBracketShouldBeReplaced() {
        List<CompletionItem> items = complete(cursor("(define (domain d)\n  ()\n)", "\n  (", CompletionRequest.triggeredBy("(")));

        assertThat(labels(items)).startsWith(":requirements", ":types");
        TextEdit edit = items.get(1).getTextEdit().getLeft();
        assertThat(edit.getRange()).isEqualTo(new Range(new Position(1, 2), new Position(1, 3)));
        assertThat(edit.getNewText()).isEqualTo("(:types\n\t$0\n)");
        assertThat(items.get(1).getInsertText()).isNull();
    }

    @Test
    void typedColonShouldOnlyOfferColonSections() {
        String text = "(define\n  (:)\n)";

        List<CompletionItem> invoked = provider.provide(cursor(text, "\n  (:"), StructuralPosition.INSIDE_DEFINE,
                CompletionSettings.defaults(), DomainDeclarations.EMPTY);
        List<CompletionItem> colon = complete(cursor(text, "\n  (:", CompletionRequest.triggeredBy(":")));

        assertThat(labels(invoked)).contains("domain");
        assertThat(labels(colon)).hasSize(11).doesNotContain("domain").allMatch(label -> label.startsWith(":"));
        assertThat(colon.get(0).getTextEdit().getLeft().getRange())
                .isEqualTo(new Range(new Position(1, 2), new Position(1, 4)));
    }

    @Test
    void jobSchedulingShouldOfferJob() {
        CompletionSettings settings = CompletionSettings.builder().jobScheduling(true).build();

        List<CompletionItem> items = complete(cursor("(define (domain d)\n(:action a)\n  \n)", "(:action a)\n "), settings);

        assertThat(labels(items)).endsWith(":job");
        assertThat(items.get(items.size() - 1).getInsertText()).startsWith("(:job ${1:job_name}");
    }

    @Test
    void actionBodyShouldOfferRemainingKeywords() {
        String text = "(define (domain d)\n(:action a\n  :parameters (?x)\n  \n)\n)";

        List<CompletionItem> items = complete(cursor(text, "(?x)\n "));

        assertThat(labels(items)).containsExactly(":precondition", ":effect");
        assertThat(items.get(0).getInsertText()).isEqualTo(":precondition (and \n\t$0\n)");
        assertThat(items.get(0).getDetail()).isEqualTo("Instantaneous action precondition");
    }

    @Test
    void emptyActionBodyShouldStartWithParameters() {
        String text = "(define (domain d)\n(:action a\n  \n)\n)";

        List<CompletionItem> items = complete(cursor(text, "(:action a\n "));

        assertThat(labels(items)).containsExactly(":parameters", ":precondition", ":effect");
        assertThat(items.get(0).getInsertText()).isEqualTo(":parameters ($0)");
    }

    @Test
    void durativeBodyShouldOfferSectionsBetweenWrittenOnes() {
        String text = "(define (domain d)\n(:durative-action a\n  :parameters (?x)\n  \n  :effect (and )\n)\n)";

        List<CompletionItem> items = complete(cursor(text, "(?x)\n "));

        assertThat(labels(items)).containsExactly(":duration", ":condition");
        assertThat(items.get(0).getInsertText()).isEqualTo(DomainCompletionProvider.DURATION_SNIPPET);
    }

    @Test
    void jobBodyShouldHaveNoDuration() {
        String text = "(define (domain d)\n(:job j\n  :parameters (?x)\n  \n)\n)";

        List<CompletionItem> items = complete(cursor(text, "(?x)\n "), CompletionSettings.builder().jobScheduling(true).build());

        assertThat(labels(items)).containsExactly(":condition", ":effect");
    }

    @Test
    void requirementsShouldOfferFlags() {
        List<CompletionItem> items = complete(cursor("(define (domain d)\n(:requirements :strips )\n)", ":strips "));

        assertThat(labels(items)).hasSize(25).startsWith(":strips", ":typing").doesNotContain(":job-scheduling");
        assertThat(items.get(0).getInsertText()).isEqualTo(":strips");
    }

    @Test
    void typedColonInRequirementsShouldBeReplaced() {
        String text = "(define (domain d)\n(:requirements :)\n)";

        List<CompletionItem> items = complete(cursor(text, "(:requirements :", CompletionRequest.triggeredBy(":")),
                CompletionSettings.builder().jobScheduling(true).build());

        assertThat(labels(items)).hasSize(26).endsWith(":job-scheduling");
        assertThat(items.get(0).getTextEdit().getLeft().getRange())
                .isEqualTo(new Range(new Position(1, 15), new Position(1, 16)));
    }

    @Test
    void documentLevelShouldOfferNothing() {
        assertThat(complete(cursor(";; c\n(define (domain d))", ";;"))).isEmpty();
    }

    private List<CompletionItem> complete(CursorContext cursor) {
        return complete(cursor, CompletionSettings.defaults());
    }

    private List<CompletionItem> complete(CursorContext cursor, CompletionSettings settings) {
        return provider.provide(cursor, classifier.classify(cursor), settings,
                cursor.document().getDeclarations());
    }
}
