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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.pddl.lsp.syntax.SyntaxTree;

import static org.assertj.core.api.Assertions.assertThat;

class DomainDeclarationsTest {

    @Test
    void shouldExtractDeclarationsFromDomain() throws IOException {
        DomainDeclarations declarations = DomainDeclarations.extract(SyntaxTree.parse(resource("/logistics-domain.pddl")));

        assertThat(declarations.getTypes()).containsExactly("truck", "place", "object");
        assertThat(declarations.getPredicates()).extracting(Variable::name).containsExactly("at", "connected");
        assertThat(declarations.getFunctions()).extracting(Variable::declaredNameWithoutTypes).containsExactly("fuel ?t");
        assertThat(declarations.getDerived()).isEmpty();
    }

    @Test
    void shouldExtractDerivedSignatures() {
        DomainDeclarations declarations = DomainDeclarations.extract(SyntaxTree.parse(
                "(define (domain d)\n(:derived (reachable ?a ?b - place) (or (at ?a) (at ?b)))\n(:derived)\n)"));

        assertThat(declarations.getDerived()).singleElement()
                .satisfies(derived -> assertThat(derived.declaredName()).isEqualTo("reachable ?a ?b - place"));
    }

    @Test
    void typeNamesShouldBeLowerCased() {
        DomainDeclarations declarations = DomainDeclarations.extract(SyntaxTree.parse(
                "(define (domain d)\n(:types Truck Place - Object)\n)"));

        assertThat(declarations.getTypes()).containsExactly("truck", "place", "object");
    }

    @Test
    void documentWithoutDefineShouldDeclareNothing() {
        assertThat(DomainDeclarations.extract(SyntaxTree.parse("; nothing here"))).isSameAs(DomainDeclarations.EMPTY);
    }

    @Test
    void variableShouldAssignTypesToParameterGroups() {
        Variable variable = Variable.parse("  At ?v ?w - vehicle\n ?p ");

        assertThat(variable.name()).isEqualTo("at");
        assertThat(variable.declaredName()).isEqualTo("At ?v ?w - vehicle ?p");
        assertThat(variable.parameters()).containsExactly(
                new Parameter("?v", "vehicle"), new Parameter("?w", "vehicle"), new Parameter("?p", Parameter.DEFAULT_TYPE));
        assertThat(variable.declaredNameWithoutTypes()).isEqualTo("at ?v ?w ?p");
    }

    private static String resource(String name) throws IOException {
        try (InputStream in = DomainDeclarationsTest.class.getResourceAsStream(name)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
