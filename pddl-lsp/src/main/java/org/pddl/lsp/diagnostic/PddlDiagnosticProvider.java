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
package org.pddl.lsp.diagnostic;

import java.util.ArrayList;
import java.util.List;

import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.services.LanguageClient;
import org.pddl.lsp.model.PddlDocumentModel;
import org.pddl.lsp.syntax.BracketNode;
import org.pddl.lsp.syntax.Token;

/**
 * Reports bracket structure problems found while building the syntax tree.
 */
public class PddlDiagnosticProvider {

    private static final String SOURCE = "pddl-lsp";

    public void publishDiagnostics(LanguageClient client, PddlDocumentModel model) {
        if (client == null) {
            return;
        }
        List<Diagnostic> diagnostics = computeDiagnostics(model);
        client.publishDiagnostics(new PublishDiagnosticsParams(model.getUri(), diagnostics));
    }

    public List<Diagnostic> computeDiagnostics(PddlDocumentModel model) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Token token : model.getTree().getOffendingTokens()) {
            diagnostics.add(toDiagnostic(model, token, DiagnosticSeverity.Error, "Unmatched closing bracket"));
        }
        for (BracketNode bracket : model.getTree().getUnclosedBrackets()) {
            diagnostics.add(toDiagnostic(model, bracket.getToken(), DiagnosticSeverity.Warning,
                    "Unclosed bracket " + bracket.getToken().getText().trim()));
        }
        return diagnostics;
    }

    private Diagnostic toDiagnostic(PddlDocumentModel model, Token token, DiagnosticSeverity severity, String message) {
        Range range = new Range(model.positionAt(token.getStart()), model.positionAt(token.getEnd()));

        Diagnostic diagnostic = new Diagnostic();
        diagnostic.setRange(range);
        diagnostic.setSeverity(severity);
        diagnostic.setSource(SOURCE);
        diagnostic.setMessage(message);
        return diagnostic;
    }
}
