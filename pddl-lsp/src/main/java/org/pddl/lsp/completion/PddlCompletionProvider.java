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
import java.util.Objects;
import java.util.concurrent.CancellationException;

import org.eclipse.lsp4j.CompletionItem;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.jsonrpc.CancelChecker;
import org.pddl.lsp.config.CompletionSettings;
import org.pddl.lsp.model.DomainDeclarations;
import org.pddl.lsp.model.FileKind;
import org.pddl.lsp.model.PddlDocumentModel;
import org.pddl.lsp.model.PddlWorkspace;
import org.pddl.lsp.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of structural completion. Locates the cursor node, classifies the scope and
 * hands over to the provider for the kind of file being edited.
 */
public class PddlCompletionProvider {

    private static final Logger LOG = LoggerFactory.getLogger(PddlCompletionProvider.class);

    private final PddlWorkspace workspace;
    private final ScopeClassifier scopeClassifier = new ScopeClassifier();
    private final DomainCompletionProvider domainCompletionProvider = new DomainCompletionProvider();
    private final ProblemCompletionProvider problemCompletionProvider = new ProblemCompletionProvider();
    private final UnknownFileCompletionProvider unknownFileCompletionProvider = new UnknownFileCompletionProvider();
    private volatile CompletionSettings settings = CompletionSettings.defaults();

    public PddlCompletionProvider(PddlWorkspace workspace) {
        this.workspace = workspace;
    }

    public CompletionSettings getSettings() {
        return settings;
    }

    public void setSettings(CompletionSettings settings) {
        this.settings = Objects.requireNonNull(settings);
    }

    public List<CompletionItem> getCompletions(PddlDocumentModel document, Position position) {
        return getCompletions(document, position, CompletionRequest.INVOKED, () -> { });
    }

    /**
     * Computes the suggestions for the cursor position. A cancelled request yields an empty
     * list, as does any failure while analysing the document.
     */
    public List<CompletionItem> getCompletions(PddlDocumentModel document, Position position,
                                               CompletionRequest request, CancelChecker cancelChecker) {
        try {
            cancelChecker.checkCanceled();
            int offset = document.offsetAt(position);
            SyntaxNode node = document.getTree().getNodeAt(offset);
            if (node == null) {
                return List.of();
            }
            CursorContext cursor = new CursorContext(document, offset, node, request);
            StructuralPosition structuralPosition = scopeClassifier.classify(cursor);
            LOG.debug("Completing {} at {} in {}", document.getUri(), offset, structuralPosition);

            List<CompletionItem> items = switch (document.getFileKind()) {
                case DOMAIN -> domainCompletionProvider.provide(cursor, structuralPosition, settings,
                        document.getDeclarations());
                case PROBLEM -> problemCompletionProvider.provide(cursor, structuralPosition, settings,
                        openDomainNames(), referencedDomainDeclarations(document));
                case UNKNOWN -> unknownFileCompletionProvider.provide(cursor, structuralPosition);
            };
            cancelChecker.checkCanceled();
            return items;
        } catch (CancellationException e) {
            LOG.debug("Completion cancelled for {}", document.getUri());
            return List.of();
        } catch (RuntimeException e) {
            LOG.warn("Failed to compute completions for {} at {}", document.getUri(), position, e);
            return List.of();
        }
    }

    private List<String> openDomainNames() {
        return workspace.getDocuments().stream()
                .filter(model -> model.getFileKind() == FileKind.DOMAIN)
                .map(PddlDocumentModel::getName)
                .filter(Objects::nonNull)
                .sorted()
                .toList();
    }

    private DomainDeclarations referencedDomainDeclarations(PddlDocumentModel problem) {
        PddlDocumentModel domain = workspace.findDomainFor(problem);
        return domain == null ? DomainDeclarations.EMPTY : domain.getDeclarations();
    }
}
