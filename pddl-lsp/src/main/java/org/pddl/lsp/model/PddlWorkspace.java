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

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Open PDDL documents keyed by URI. Each edit replaces the document model wholesale.
 */
public class PddlWorkspace {

    private final Map<String, PddlDocumentModel> documents = new ConcurrentHashMap<>();

    public PddlDocumentModel upsert(String uri, String text) {
        PddlDocumentModel model = new PddlDocumentModel(uri, text);
        documents.put(uri, model);
        return model;
    }

    public PddlDocumentModel get(String uri) {
        return documents.get(uri);
    }

    public void remove(String uri) {
        documents.remove(uri);
    }

    public Collection<PddlDocumentModel> getDocuments() {
        return documents.values();
    }

    /**
     * Finds the domain whose symbols apply to the given document: the document itself
     * when it is a domain, otherwise an open domain named by the problem's
     * {@code (:domain name)}.
     *
     * @return the domain model, or {@code null} when none is open
     */
    public PddlDocumentModel findDomainFor(PddlDocumentModel document) {
        return switch (document.getFileKind()) {
            case DOMAIN -> document;
            case PROBLEM -> findDomainByName(document.getDomainReference());
            case UNKNOWN -> null;
        };
    }

    private PddlDocumentModel findDomainByName(String domainName) {
        if (domainName == null) {
            return null;
        }
        String expected = domainName.toLowerCase(Locale.ROOT);
        return documents.values().stream()
                .filter(model -> model.getFileKind() == FileKind.DOMAIN)
                .filter(model -> Objects.equals(expected, lowerCase(model.getName())))
                .findFirst()
                .orElse(null);
    }

    private static String lowerCase(String name) {
        return name == null ? null : name.toLowerCase(Locale.ROOT);
    }
}
