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
import java.util.stream.Stream;

import org.pddl.lsp.config.CompletionSettings;

/**
 * Section names of the PDDL grammar, spelled as they appear after the opening bracket
 * (or as keywords inside action bodies), and the grammar tables built from them.
 */
public final class SectionGrammar {

    public static final String DOMAIN = "domain";
    public static final String REQUIREMENTS = ":requirements";
    public static final String TYPES = ":types";
    public static final String CONSTANTS = ":constants";
    public static final String PREDICATES = ":predicates";
    public static final String FUNCTIONS = ":functions";
    public static final String CONSTRAINTS = ":constraints";

    public static final String DERIVED = ":derived";
    public static final String ACTION = ":action";
    public static final String DURATIVE_ACTION = ":durative-action";
    public static final String PROCESS = ":process";
    public static final String EVENT = ":event";
    public static final String JOB = ":job";

    public static final String PROBLEM = "problem";
    public static final String DOMAIN_REFERENCE = ":domain";
    public static final String OBJECTS = ":objects";
    public static final String INIT = ":init";
    public static final String GOAL = ":goal";
    public static final String METRIC = ":metric";

    public static final String PARAMETERS = ":parameters";
    public static final String PRECONDITION = ":precondition";
    public static final String EFFECT = ":effect";
    public static final String DURATION = ":duration";
    public static final String CONDITION = ":condition";

    public static final GrammarTable DOMAIN_TABLE = new GrammarTable(
            List.of(DOMAIN, REQUIREMENTS, TYPES, CONSTANTS, PREDICATES, FUNCTIONS, CONSTRAINTS),
            List.of(DERIVED, ACTION, DURATIVE_ACTION, PROCESS, EVENT));

    /** Domain table with the {@code :job} structure of job-scheduling domains. */
    public static final GrammarTable JOB_SCHEDULING_DOMAIN_TABLE = new GrammarTable(
            DOMAIN_TABLE.orderedSections(),
            Stream.concat(DOMAIN_TABLE.structureSections().stream(), Stream.of(JOB)).toList());

    public static final GrammarTable PROBLEM_TABLE = new GrammarTable(
            List.of(PROBLEM, DOMAIN_REFERENCE, REQUIREMENTS, OBJECTS, INIT, GOAL, CONSTRAINTS, METRIC),
            List.of());

    public static final GrammarTable ACTION_TABLE = new GrammarTable(
            List.of(PARAMETERS, PRECONDITION, EFFECT),
            List.of());

    public static final GrammarTable DURATIVE_ACTION_TABLE = new GrammarTable(
            List.of(PARAMETERS, DURATION, CONDITION, EFFECT),
            List.of());

    /** Job bodies are durative actions without an explicit duration. */
    public static final GrammarTable JOB_TABLE = new GrammarTable(
            List.of(PARAMETERS, CONDITION, EFFECT),
            List.of());

    private static final List<String> REQUIREMENT_FLAGS = Stream.of(
                    "strips", "typing", "negative-preconditions", "disjunctive-preconditions", "equality",
                    "existential-preconditions", "universal-preconditions", "quantified-preconditions",
                    "conditional-effects", "fluents", "numeric-fluents", "object-fluents", "adl",
                    "durative-actions", "duration-inequalities", "continuous-effects", "derived-predicates",
                    "derived-functions", "timed-initial-literals", "timed-effects", "preferences", "constraints",
                    "action-costs", "timed-initial-fluents", "time")
            .map(flag -> ":" + flag)
            .toList();

    private static final String JOB_SCHEDULING_REQUIREMENT = ":job-scheduling";

    private SectionGrammar() {
    }

    public static GrammarTable domainTable(CompletionSettings settings) {
        return settings.isJobScheduling() ? JOB_SCHEDULING_DOMAIN_TABLE : DOMAIN_TABLE;
    }

    /** Requirement flags with their leading colon, in the order they are suggested. */
    public static List<String> requirements(CompletionSettings settings) {
        if (!settings.isJobScheduling()) {
            return REQUIREMENT_FLAGS;
        }
        return Stream.concat(REQUIREMENT_FLAGS.stream(), Stream.of(JOB_SCHEDULING_REQUIREMENT)).toList();
    }

    /**
     * Sections that must precede {@code sectionName}.
     *
     * @return the prefix strictly before the name, or the whole list when the name is absent
     */
    public static List<String> sectionsBefore(String sectionName, List<String> orderedSections) {
        int index = orderedSections.indexOf(sectionName);
        if (index < 0) {
            return orderedSections;
        }
        return orderedSections.subList(0, index);
    }

    /**
     * Sections that must follow {@code sectionName}.
     *
     * @return the suffix strictly after the name, or the whole list when the name is absent
     */
    public static List<String> sectionsAfter(String sectionName, List<String> orderedSections) {
        int index = orderedSections.indexOf(sectionName);
        if (index < 0) {
            return orderedSections;
        }
        return orderedSections.subList(index + 1, orderedSections.size());
    }
}
