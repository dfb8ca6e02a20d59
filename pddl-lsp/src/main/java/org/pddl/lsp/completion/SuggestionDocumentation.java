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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.eclipse.lsp4j.CompletionItemKind;

/**
 * Immutable label to documentation tables. Each table is built once and shared by every
 * provider and request that renders its labels.
 */
public final class SuggestionDocumentation {

    private static final String DURATIVE_ACTION_EXAMPLE = "(:durative-action\n:condition (and (%1$s (...) ) )\n:effect (and (%1$s (...) ) ) \n)";

    public static final SuggestionDocumentation NONE = builder().build();

    public static final SuggestionDocumentation DOMAIN = builder()
            .add(SectionGrammar.REQUIREMENTS, "Requirements", "Required planning engine features.")
            .add(SectionGrammar.TYPES, "Types", "Types of objects and their hierarchy. Example:" + codeblock("car - vehicle"))
            .add(SectionGrammar.CONSTANTS, "Constants", "Constant objects that will be part of all problems defined for this domain"
                    + " in addition to the objects defined in the `:objects` section.")
            .add(SectionGrammar.PREDICATES, "Predicates", "Predicates are things that are either true or false.")
            .add(SectionGrammar.FUNCTIONS, "Functions", "Functions are used to define numeric values.")
            .add(SectionGrammar.CONSTRAINTS, "Constraints", "Constraints.... you may want to stay away from those.")
            .add(SectionGrammar.DERIVED, "Derived predicate/function",
                    "Derived predicate/function can be defined to simplify action declaration. Example derived predicate:"
                            + codeblock("(:derived (p_and_q) \n\t(and (p) (q))\n)")
                            + "Example derived function: " + codeblock("(:derived (c) (+ (a) (b))"))
            .add(SectionGrammar.ACTION, "Instantaneous action", "Actions that change state of the world. Example:"
                    + codeblock("(:action action_name\n\t:parameters (?t - type1)\n\t:precondition (and (p ?t))\n\t:effect (and (q ?t))\n)"))
            .add(SectionGrammar.DURATIVE_ACTION, "Durative action",
                    "Actions that change the state of the world when they start, then they last for a defined duration period,"
                            + " while changing the world continuously and finally change the state when they end.")
            .add(SectionGrammar.PROCESS, "PDDL+ Process",
                    "Process is activated and continues running when its condition is met. It may only have continuous effects. Example:"
                            + codeblock(String.join("\n",
                                    "(:process HEAT",
                                    "    :parameters (?r - room)",
                                    "    :precondition (and",
                                    "        (too_cold ?r)",
                                    "        (< (temperature ?r) 22)",
                                    "    )",
                                    "    :effect (and",
                                    "        (increase (temperature ?b) (* #t 3))",
                                    "    )",
                                    ")"))
                            + "Note that `:process` and `:event` require the `:time` requirement.",
                    CompletionItemKind.Struct)
            .add(SectionGrammar.EVENT, "PDDL+ Effect",
                    "Effect is triggered when its condition is met. It may only have continuous effects. Example:"
                            + codeblock(String.join("\n",
                                    "(:event BOUNCE",
                                    "    :parameters (?b - ball)",
                                    "    :precondition (and",
                                    "        (not (held ?b))",
                                    "        (<= (distance-to-floor ?b) 0)",
                                    "    )",
                                    "    :effect (and",
                                    "        (assign (velocity ?b) (* -0.8 (velocity ?b)))",
                                    "    )",
                                    ")"))
                            + "Note that `:process` and `:event` require the `:time` requirement.",
                    CompletionItemKind.Event)
            .add(SectionGrammar.JOB, "Job (simplified durative action)",
                    "Durative Action simplified for specifying job-scheduling problems.")
            .add(SectionGrammar.PARAMETERS, "Action parameters",
                    "Parameters such as:" + codeblock(":parameters (?v - vehicle ?from ?to - place)"))
            .add(SectionGrammar.PRECONDITION, "Instantaneous action precondition", "")
            .add(SectionGrammar.EFFECT, "Action effect", "")
            .add(SectionGrammar.DURATION, "Durative action duration", "Examples:"
                    + codeblock(":duration (= ?duration 1)\n:duration (and (>= ?duration (min_duration))(<= ?duration (max_duration)))"))
            .add(SectionGrammar.CONDITION, "Durative action condition", "")
            .build();

    public static final SuggestionDocumentation PROBLEM = builder()
            .add(SectionGrammar.PROBLEM, "Problem name", "Name of the problem, e.g. `(problem p1)`.")
            .add(SectionGrammar.DOMAIN_REFERENCE, "Domain", "Name of the domain this problem is defined for, e.g. `(:domain blocksworld)`.")
            .add(SectionGrammar.REQUIREMENTS, "Requirements", "Required planning engine features.")
            .add(SectionGrammar.OBJECTS, "Objects", "Objects of the problem and their types. Example:" + codeblock("truck1 truck2 - truck"))
            .add(SectionGrammar.INIT, "Initial state", "Facts and function values that hold in the initial state. Example:"
                    + codeblock("(:init\n\t(at truck1 depot)\n\t(= (fuel truck1) 100)\n)"))
            .add(SectionGrammar.GOAL, "Goal", "Condition the plan must achieve. Example:" + codeblock("(:goal (and\n\t(at truck1 store)\n))"))
            .add(SectionGrammar.CONSTRAINTS, "Constraints", "Constraints.... you may want to stay away from those.")
            .add(SectionGrammar.METRIC, "Metric", "Plan quality metric. Example:" + codeblock("(:metric minimize (total-cost))"))
            .build();

    public static final SuggestionDocumentation DISCRETE_EFFECTS = discreteEffects();

    public static final SuggestionDocumentation CONTINUOUS_EFFECTS = continuousEffects();

    public static final SuggestionDocumentation DURATIVE_EFFECTS = builder()
            .add("at start", "At start effect", "Effect that takes place at the *start* point of a durative action."
                            + " Only use this inside a `:durative-action`."
                            + codeblock(DURATIVE_ACTION_EXAMPLE.formatted("at start"))
                            + requires(":durative-actions"),
                    CompletionItemKind.Property)
            .add("at end", "At end effect", "Effect that takes place at the *end* point of a durative action."
                            + " Only use this inside a `:durative-action`."
                            + codeblock(DURATIVE_ACTION_EXAMPLE.formatted("at end"))
                            + requires(":durative-actions"),
                    CompletionItemKind.Property)
            .build();

    public static final SuggestionDocumentation DURATIVE_CONDITIONS = builder()
            .add("at start", "At start condition", "Condition that applies at the *start* point of a durative action."
                            + " Only use this inside a `:durative-action`."
                            + codeblock("(:durative-action\n\t:condition (and (at start (...) ) )\n\t:effect (and (at start (...) ) ) \n)")
                            + requires(":durative-actions"),
                    CompletionItemKind.Property)
            .add("at end", "At end condition", "Condition that applies at the *end* point of a durative action."
                            + " Only use this inside a `:durative-action`."
                            + codeblock("(:durative-action\n\t:condition (and (at end (...) ) )\n\t:effect (and (at end (...) ) ) \n)")
                            + requires(":durative-actions"),
                    CompletionItemKind.Property)
            .add("over all", "Over all condition", "Over-all (a.k.a. _invariant_) condition that applies for the entire"
                            + " duration of the durative action. Only use this inside a `:durative-action`."
                            + codeblock("(:durative-action\n\t:condition (and (over all (...) ) )\n)")
                            + requires(":durative-actions"),
                    CompletionItemKind.Property)
            .build();

    public static final SuggestionDocumentation OPERATORS = builder()
            .add("and", "Logical conjunction", "Example:" + codeblock("(and (fact1)(fact2))"), CompletionItemKind.Function)
            .add("not", "Logical negation", "Example:" + codeblock("(not (fact1))"), CompletionItemKind.Function)
            .add("at start", "At start condition or effect", "Condition or effect that takes place at the *start* point of a"
                    + " durative action. Only use this inside a `:durative-action`."
                    + codeblock(DURATIVE_ACTION_EXAMPLE.formatted("at start")), CompletionItemKind.Function)
            .add("at end", "At end condition or effect", "Condition or effect that takes place at the *end* point of a"
                    + " durative action. Only use this inside a `:durative-action`."
                    + codeblock(DURATIVE_ACTION_EXAMPLE.formatted("at end")), CompletionItemKind.Function)
            .add("over all", "Over all condition", "Overall condition (aka the invariant) is the condition that must hold true"
                    + " for as long as action is executing. Only use this inside a `:durative-action`.", CompletionItemKind.Function)
            .add("=", "Equality", "Evaluates whether two numeric values are equal.", CompletionItemKind.Function)
            .add(">", "Greater than", "", CompletionItemKind.Function)
            .add("<", "Less than", "", CompletionItemKind.Function)
            .add(">=", "Greater than or equal", "", CompletionItemKind.Function)
            .add("<=", "Less than or equal", "", CompletionItemKind.Function)
            .add("+", "Numerical addition", "Example:" + codeblock("(+ (function1) 1.0)"), CompletionItemKind.Function)
            .add("-", "Numerical subtraction", "Example:" + codeblock("(- (function1) 1.0)"), CompletionItemKind.Function)
            .add("/", "Numerical division", "Example:" + codeblock("(/ (function1) 2)"), CompletionItemKind.Function)
            .add("*", "Numerical multiplication", "Example:" + codeblock("(* (function1) 2)"), CompletionItemKind.Function)
            .add("forall", "For all", "Effect or condition that applies to all objects of specified type. For example:"
                    + codeblock("(forall (?p - product)(sold_out ?p))"), CompletionItemKind.Function)
            .add("exists", "Existential condition", "Condition such as" + codeblock("(exists (?p - product)(available ?p))"),
                    CompletionItemKind.Function)
            .build();

    private final Map<String, SuggestionDetails> details;

    private SuggestionDocumentation(Map<String, SuggestionDetails> details) {
        this.details = Map.copyOf(details);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<SuggestionDetails> get(String label) {
        return Optional.ofNullable(details.get(label));
    }

    /** Fenced PDDL code block, surrounded by blank lines. */
    public static String codeblock(String code) {
        return "\n\n```pddl\n" + code + "\n```\n\n";
    }

    /** Markdown note listing the requirements a construct needs. */
    public static String requires(String... requirements) {
        String csv = Arrays.stream(requirements)
                .map(requirement -> "`" + requirement + "`")
                .collect(Collectors.joining(", "));
        return "\n\nThis language feature requires " + csv + ".";
    }

    private static SuggestionDocumentation discreteEffects() {
        String hint = "Use this either in instantaneous `:action`'s `:effect`, or in `:durative-action`'s"
                + " `(at start ...)` or `(at end ...)` effect.";
        String requiresFluents = requires(":fluents");
        return builder()
                .add("not", "Assigns `false` to a predicate", "Makes predicate false:"
                        + codeblock("(not (at ?location))") + hint, CompletionItemKind.Function)
                .add("assign", "Numeric assign effect", "Assigns value to the function, for example:"
                        + codeblock("(assign (function1) 3.14)") + hint + requiresFluents, CompletionItemKind.Method)
                .add("increase", "Discrete numeric increase effect", "For example to increment a function value by `3.14`, use"
                        + codeblock("(increase (function1) 3.14)") + hint + requiresFluents, CompletionItemKind.Method)
                .add("decrease", "Discrete numeric decrease effect", "For example to decrement a function value by `3.14`, use"
                        + codeblock("(decrease (function1) 3.14)") + hint + requiresFluents, CompletionItemKind.Method)
                .add("forall", "For all effect", "Effect that shall be applied to all objects of specified type. For example:"
                        + codeblock("(forall (?p - product) (sold_out ?p))"), CompletionItemKind.TypeParameter)
                .add("when", "Conditional effect", "Effect that shall only be applied when a condition is met. For example:"
                        + codeblock("(when (at ?location) (not (at ?location)))") + hint + requires(":conditional-effects"),
                        CompletionItemKind.Method)
                .build();
    }

    private static SuggestionDocumentation continuousEffects() {
        String hint = "Use this in `:durative-action`'s `:effect` block. Do not use it inside `(at start ...)`"
                + " or `(at end ...)` effect. Example usage:";
        String example = String.join("\n",
                "(:durative-action",
                "...",
                ":effect (and ",
                "    (at start ...)",
                "    (increase (function1) (* #t 2.0))",
                "    (decrease (function2) (* #t 3.0))",
                "    (at end ...)",
                ")");
        String requiresContinuousEffects = requires(":continuous-effects");
        return builder()
                .add("increase", "Continuous numeric increase effect", "For example to increment a function value by *twice*"
                        + " the amount of time that elapsed since action started, use:" + codeblock("(increase (function1) (* #t 2.0))")
                        + hint + codeblock(example) + requiresContinuousEffects, CompletionItemKind.Method)
                .add("decrease", "Continuous numeric decrease effect", "For example to decrement a function value by *twice*"
                        + " the amount of time that elapsed since action started, use:" + codeblock("(decrease (function1) (* #t 2.0))")
                        + hint + codeblock(example) + requiresContinuousEffects, CompletionItemKind.Method)
                .add("forall", "For all duration-dependent effect", "Effect that shall be applied to all objects of specified type."
                        + " For example:" + codeblock("(forall (?p - product) (increase (stock ?p) (* #t 2.0))))"),
                        CompletionItemKind.TypeParameter)
                .build();
    }

    public static final class Builder {

        private final Map<String, SuggestionDetails> details = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder add(String label, String detail, String documentation) {
            return add(label, detail, documentation, null);
        }

        public Builder add(String label, String detail, String documentation, CompletionItemKind kind) {
            if (details.containsKey(label)) {
                throw new IllegalArgumentException("Duplicate documentation for " + label);
            }
            details.put(label, new SuggestionDetails(label, detail, documentation, kind));
            return this;
        }

        public SuggestionDocumentation build() {
            return new SuggestionDocumentation(details);
        }
    }
}
