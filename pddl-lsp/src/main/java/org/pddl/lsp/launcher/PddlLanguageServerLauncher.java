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
package org.pddl.lsp.launcher;

import java.io.InputStream;
import java.io.OutputStream;

import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.pddl.lsp.server.PddlLanguageServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the server over stdio. Logging goes to stderr so it never mixes with the protocol
 * stream on stdout.
 */
public class PddlLanguageServerLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(PddlLanguageServerLauncher.class);

    public static void main(String[] args) {
        launch(System.in, System.out);
    }

    public static PddlLanguageServer launch(InputStream in, OutputStream out) {
        PddlLanguageServer server = new PddlLanguageServer();
        Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(server, in, out);
        server.connect(launcher.getRemoteProxy());
        launcher.startListening();
        LOG.info("PDDL Language Server started");
        return server;
    }
}
