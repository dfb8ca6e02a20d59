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

import org.eclipse.lsp4j.CompletionOptions;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.pddl.lsp.config.CompletionSettings;
import org.pddl.lsp.model.PddlWorkspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PddlLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger LOG = LoggerFactory.getLogger(PddlLanguageServer.class);

    static final List<String> TRIGGER_CHARACTERS = List.of("(", ":", "?", "-");

    private final PddlWorkspace workspace = new PddlWorkspace();
    private final PddlTextDocumentService textDocumentService;
    private final PddlWorkspaceService workspaceService;
    private LanguageClient client;
    private int exitCode = 1;

    public PddlLanguageServer() {
        this.textDocumentService = new PddlTextDocumentService(workspace);
        this.workspaceService = new PddlWorkspaceService(this);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        LOG.info("PDDL Language Server initializing");
        applySettings(CompletionSettings.fromJson(params.getInitializationOptions()));

        ServerCapabilities capabilities = new ServerCapabilities();
        capabilities.setTextDocumentSync(TextDocumentSyncKind.Full);
        capabilities.setCompletionProvider(new CompletionOptions(false, TRIGGER_CHARACTERS));
        capabilities.setHoverProvider(true);

        InitializeResult result = new InitializeResult(capabilities, new ServerInfo("pddl-lsp", "1.0.0-SNAPSHOT"));
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        LOG.info("PDDL Language Server shutting down");
        exitCode = 0;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void exit() {
        System.exit(exitCode);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return textDocumentService;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return workspaceService;
    }

    @Override
    public void connect(LanguageClient client) {
        this.client = client;
        this.textDocumentService.connect(client);
    }

    public LanguageClient getClient() {
        return client;
    }

    public PddlWorkspace getWorkspace() {
        return workspace;
    }

    /** Settings apply to completion requests received after this call. */
    void applySettings(CompletionSettings settings) {
        LOG.info("Using completion settings {}", settings);
        textDocumentService.getCompletionProvider().setSettings(settings);
    }
}
