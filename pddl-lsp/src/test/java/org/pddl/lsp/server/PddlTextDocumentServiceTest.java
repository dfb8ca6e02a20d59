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
package org.pddl.lsp.server;

import java.util.List;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.pddl.lsp.model.FileKind;
import org.pddl.lsp.model.PddlWorkspace;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PddlTextDocumentServiceTest {

    private static final String URI = "file:///domain.pddl";

    private final PddlWorkspace workspace = new PddlWorkspace();
    private final PddlTextDocumentService service = new PddlTextDocumentService(workspace);
    private final LanguageClient client = mock(LanguageClient.class);

    @BeforeEach
    void connectClient() {
        service.connect(client);
    }

    @Test
    void openShouldParseAndPublishDiagnostics() {
        open("(define (domain d)\n  \n");

        assertThat(service.getDocument(URI).getFileKind()).isEqualTo(FileKind.DOMAIN);
        ArgumentCaptor<PublishDiagnosticsParams> captor = ArgumentCaptor.forClass(PublishDiagnosticsParams.class);
        verify(client).publishDiagnostics(captor.capture());
        assertThat(captor.getValue().getDiagnostics()).hasSize(1);
    }

    @Test
    void changeShouldReplaceDocumentText() {
        open("");
        TextDocumentContentChangeEvent change = new TextDocumentContentChangeEvent("(define (problem p))");

        service.didChange(new DidChangeTextDocumentParams(new VersionedTextDocumentIdentifier(URI, 2), List.of(change)));

        assertThat(service.getDocument(URI).getFileKind()).isEqualTo(FileKind.PROBLEM);
        verify(client, times(2)).publishDiagnostics(any());
    }

    @Test
    void closeShouldForgetDocumentAndClearDiagnostics() {
        open("(define (domain d)");

        service.didClose(new DidCloseTextDocumentParams(new TextDocumentIdentifier(URI)));

        assertThat(service.getDocument(URI)).isNull();
        verify(client).publishDiagnostics(new PublishDiagnosticsParams(URI, List.of()));
    }

    @Test
    void completionShouldAnswerForOpenDocument() throws Exception {
        open("(define (domain d)\n  \n)");

        Either<List<CompletionItem>, CompletionList> result =
                service.completion(new CompletionParams(new TextDocumentIdentifier(URI), new Position(1, 1))).get();

        assertThat(result.getLeft()).extracting(CompletionItem::getLabel).startsWith(":requirements");
    }

    @Test
    void completionForUnknownDocumentShouldBeEmpty() throws Exception {
        Either<List<CompletionItem>, CompletionList> result = service.completion(
                new CompletionParams(new TextDocumentIdentifier("file:///missing.pddl"), new Position(0, 0))).get();

        assertThat(result.getLeft()).isEmpty();
    }

    @Test
    void hoverShouldDescribeKeyword() throws Exception {
        open("(define (domain d)\n  (:action a)\n)");

        Hover hover = service.hover(new HoverParams(new TextDocumentIdentifier(URI), new Position(1, 5))).get();

        assertThat(hover.getContents().getRight().getValue()).startsWith("**:action**");
    }

    private void open(String text) {
        service.didOpen(new DidOpenTextDocumentParams(new TextDocumentItem(URI, "pddl", 1, text)));
    }
}
