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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Predicate, function or derived symbol declared in a domain.
 *
 * @param name lower-cased symbol name, e.g. {@code at}
 * @param declaredName declaration as written, e.g. {@code at ?v - vehicle ?p - place}
 * @param parameters typed parameters in declaration order
 */
public record Variable(String name, String declaredName, List<Parameter> parameters) {

    public Variable {
        parameters = List.copyOf(parameters);
    }

    /** Declaration with the type annotations removed, e.g. {@code at ?v ?p}. */
    public String declaredNameWithoutTypes() {
        StringBuilder sb = new StringBuilder(name);
        for (Parameter parameter : parameters) {
            sb.append(' ').append(parameter.name());
        }
        return sb.toString();
    }

    static Variable parse(String declaration) {
        String normalized = declaration.trim().replaceAll("\\s+", " ");
        String[] words = normalized.split(" ");
        String name = words[0].toLowerCase(Locale.ROOT);

        List<Parameter> parameters = new ArrayList<>();
        List<String> untyped = new ArrayList<>();
        for (int i = 1; i < words.length; i++) {
            String word = words[i];
            if (word.equals("-") && i + 1 < words.length) {
                String type = words[++i];
                untyped.forEach(p -> parameters.add(new Parameter(p, type)));
                untyped.clear();
            } else if (word.startsWith("?")) {
                untyped.add(word);
            }
        }
        untyped.forEach(p -> parameters.add(new Parameter(p, Parameter.DEFAULT_TYPE)));
        return new Variable(name, normalized, parameters);
    }
}
