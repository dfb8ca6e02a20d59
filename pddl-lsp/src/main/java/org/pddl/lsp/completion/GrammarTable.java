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

/**
 * Grammar of one construct: sections that keep a fixed relative order, and structures
 * that may repeat in any order once every ordered section is behind them.
 */
public record GrammarTable(List<String> orderedSections, List<String> structureSections) {

    public GrammarTable {
        orderedSections = List.copyOf(orderedSections);
        structureSections = List.copyOf(structureSections);
        for (String structure : structureSections) {
            if (orderedSections.contains(structure)) {
                throw new IllegalArgumentException("Section " + structure + " cannot be both ordered and a structure");
            }
        }
    }

    public boolean isStructure(String sectionName) {
        return structureSections.contains(sectionName);
    }
}
