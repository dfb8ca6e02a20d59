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
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.CompletionList;
import org.eclipse.lsp4j.CompletionParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.Hover;
import org.eclipse.lsp4j.HoverParams;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.jsonrpc.CompletableFutures;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.pddl.lsp.completion.CompletionRequest;
import org.pddl.lsp.completion.PddlCompletionProvider;
import org.pddl.lsp.diagnostic.PddlDiagnosticProvider;
import org.pddl.lsp.hover.PddlHoverProvider;
import org.pddl.lsp.model.PddlDocumentModel;
import org.pddl.lsp.model.PddlWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PddlTextDocumentService implements TextDocumentService {

    private static final Logger LOG = LoggerFactory.getLogger(PddlTextDocumentService.class);

    private final PddlWorkspace workspace;
    private final PddlCompletionProvider completionProvider;
    private final PddlDiagnosticProvider diagnosticProvider = new PddlDiagnosticProvider();
    private final PddlHoverProvider hoverProvider;
    private LanguageClient client;

    public PddlTextDocumentService(PddlWorkspace workspace) {
        this.workspace = workspace;
        this.completionProvider = new PddlCompletionProvider(workspace);
        this.hoverProvider = new PddlHoverProvider(workspace);
    }

    public void connect(LanguageClient client) {
        this.client = client;
    }

    PddlCompletionProvider getCompletionProvider() {
        return completionProvider;
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        LOG.debug("Document opened: {}", uri);

        PddlDocumentModel model = workspace.upsert(uri, params.getTextDocument().getText());
        diagnosticProvider.publishDiagnostics(client, model);
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        if (params.getContentChanges().isEmpty()) {
            return;
        }
        // full sync: the last change carries the whole text
        String text = params.getContentChanges().get(params.getContentChanges().size() - 1).getText();
        LOG.debug("Document changed: {}", uri);

        PddlDocumentModel model = workspace.upsert(uri, text);
        diagnosticProvider.publishDiagnostics(client, model);
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        LOG.debug("Document closed: {}", uri);
        workspace.remove(uri);
        if (client != null) {
            client.publishDiagnostics(new PublishDiagnosticsParams(uri, List.of()));
        }
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        LOG.debug("Document saved: {}", params.getTextDocument().getUri());
    }

    @Override
    public CompletableFuture<Either<List<CompletionItem>, CompletionList>> completion(CompletionParams params) {
        PddlDocumentModel model = workspace.get(params.getTextDocument().getUri());
        if (model == null) {
            return CompletableFuture.completedFuture(Either.forLeft(List.of()));
        }
        CompletionRequest request = CompletionRequest.from(params.getContext());
        return CompletableFutures.computeAsync(cancelChecker -> Either.forLeft(
                completionProvider.getCompletions(model, params.getPosition(), request, cancelChecker)));
    }

    @Override
    public CompletableFuture<Hover> hover(HoverParams params) {
        PddlDocumentModel model = workspace.get(params.getTextDocument().getUri());
        if (model == null) {
            return CompletableFuture.completedFuture(null);
        }
        Hover hover = hoverProvider.getHover(model, params.getPosition());
        return CompletableFuture.completedFuture(hover);
    }

    public PddlDocumentModel getDocument(String uri) {
        return workspace.get(uri);
    }
}
