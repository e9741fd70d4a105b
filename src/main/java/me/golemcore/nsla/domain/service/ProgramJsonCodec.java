package me.golemcore.nsla.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.nsla.domain.model.Axiom;
import me.golemcore.nsla.domain.model.ConstantDecl;
import me.golemcore.nsla.domain.model.Expression;
import me.golemcore.nsla.domain.model.Fact;
import me.golemcore.nsla.domain.model.ParseException;
import me.golemcore.nsla.domain.model.PredicateDecl;
import me.golemcore.nsla.domain.model.Program;
import me.golemcore.nsla.domain.model.Rule;
import me.golemcore.nsla.domain.model.SortDecl;
import me.golemcore.nsla.domain.model.StructuralException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSON form of {@link Program}.
 *
 * <p>
 * Writes the canonical list form with snake_case keys. Reads the canonical
 * form and the map forms proposers commonly emit ({@code "sorts": {"Persona":
 * {}}}, {@code "facts": {"P(a,b)": true}}, {@code "query": {"pred": ..,
 * "args": [..]}}). Unknown fields are ignored. A missing {@code version} or
 * {@code predicates} section raises {@link StructuralException}, as does any
 * item without its identity field.
 */
public class ProgramJsonCodec {

    private static final String VERSION = "version";
    private static final String LEGACY_VERSION = "dsl_version";
    private static final String SORTS = "sorts";
    private static final String CONSTANTS = "constants";
    private static final String PREDICATES = "predicates";
    private static final String FACTS = "facts";
    private static final String RULES = "rules";
    private static final String AXIOMS = "axioms";
    private static final String QUERY = "query";
    private static final String NAME = "name";
    private static final String PARENT = "parent";
    private static final String SORT = "sort";
    private static final String ARITY = "arity";
    private static final String ARG_SORTS = "arg_sorts";
    private static final String ALLOW_UNDECLARED = "allow_undeclared_instances";

    private final ObjectMapper objectMapper;
    private final ExpressionParser parser;

    public ProgramJsonCodec(ObjectMapper objectMapper, ExpressionParser parser) {
        this.objectMapper = objectMapper;
        this.parser = parser;
    }

    // ==================== Reading ====================

    public Program read(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StructuralException("Malformed program JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    public Program read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new StructuralException("Program JSON must be an object");
        }
        String version = text(root.has(VERSION) ? root.get(VERSION) : root.get(LEGACY_VERSION));
        if (version == null || version.isBlank()) {
            throw new StructuralException("Program JSON is missing '" + VERSION + "'");
        }
        if (!root.has(PREDICATES) || root.get(PREDICATES).isNull()) {
            throw new StructuralException("Program JSON is missing '" + PREDICATES + "'");
        }

        return Program.builder()
                .version(version)
                .sorts(readSorts(root.get(SORTS)))
                .constants(readConstants(root.get(CONSTANTS)))
                .predicates(readPredicates(root.get(PREDICATES)))
                .facts(readFacts(root.get(FACTS)))
                .rules(readRules(root.get(RULES)))
                .axioms(readAxioms(root.get(AXIOMS)))
                .query(readQuery(root.get(QUERY)))
                .build();
    }

    private List<SortDecl> readSorts(JsonNode node) {
        List<SortDecl> sorts = new ArrayList<>();
        forEachNamed(node, SORTS, (name, item) -> sorts.add(new SortDecl(name, text(item.get(PARENT)))));
        return sorts;
    }

    private List<ConstantDecl> readConstants(JsonNode node) {
        List<ConstantDecl> constants = new ArrayList<>();
        forEachNamed(node, CONSTANTS, (name, item) -> {
            String sort = item.isTextual() ? item.asText() : text(item.get(SORT));
            if (sort == null || sort.isBlank()) {
                throw new StructuralException("Constant '" + name + "' is missing '" + SORT + "'");
            }
            constants.add(new ConstantDecl(name, sort));
        });
        return constants;
    }

    private List<PredicateDecl> readPredicates(JsonNode node) {
        List<PredicateDecl> predicates = new ArrayList<>();
        forEachNamed(node, PREDICATES, (name, item) -> {
            JsonNode sortsNode = item.has(ARG_SORTS) ? item.get(ARG_SORTS) : item.get(SORTS);
            List<String> argSorts = sortsNode == null || sortsNode.isNull() ? null : textList(sortsNode, ARG_SORTS);
            int arity;
            if (item.isInt()) {
                arity = item.asInt();
            } else if (item.hasNonNull(ARITY)) {
                if (!item.get(ARITY).canConvertToInt()) {
                    throw new StructuralException("Predicate '" + name + "' has a non-integer arity");
                }
                arity = item.get(ARITY).asInt();
            } else if (argSorts != null) {
                arity = argSorts.size();
            } else {
                throw new StructuralException("Predicate '" + name + "' is missing '" + ARITY + "'");
            }
            boolean allowUndeclared = item.path(ALLOW_UNDECLARED).asBoolean(false);
            predicates.add(new PredicateDecl(name, arity, argSorts, allowUndeclared));
        });
        return predicates;
    }

    private List<Fact> readFacts(JsonNode node) {
        List<Fact> facts = new ArrayList<>();
        if (node == null || node.isNull()) {
            return facts;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Expression.Atom atom = parseFactKey(field.getKey());
                facts.add(new Fact(atom.predicate(), atom.args(), field.getValue().asBoolean(true)));
            }
            return facts;
        }
        requireArray(node, FACTS);
        for (JsonNode item : node) {
            String predicate = text(item.get("predicate"));
            if (predicate == null) {
                throw new StructuralException("Fact is missing 'predicate': " + item);
            }
            List<String> args = item.hasNonNull("args") ? textList(item.get("args"), "args") : List.of();
            facts.add(new Fact(predicate, args, item.path("value").asBoolean(true)));
        }
        return facts;
    }

    private Expression.Atom parseFactKey(String key) {
        Expression parsed;
        try {
            parsed = parser.parse(key);
        } catch (ParseException e) {
            throw new StructuralException("Fact key is not an atom: " + key, e);
        }
        if (parsed instanceof Expression.Atom atom) {
            return atom;
        }
        throw new StructuralException("Fact key is not an atom: " + key);
    }

    private List<Rule> readRules(JsonNode node) {
        List<Rule> rules = new ArrayList<>();
        if (node == null || node.isNull()) {
            return rules;
        }
        requireArray(node, RULES);
        for (JsonNode item : node) {
            rules.add(new Rule(text(item.get("id")), text(item.get("condition")), text(item.get("conclusion"))));
        }
        return rules;
    }

    private List<Axiom> readAxioms(JsonNode node) {
        List<Axiom> axioms = new ArrayList<>();
        if (node == null || node.isNull()) {
            return axioms;
        }
        requireArray(node, AXIOMS);
        for (JsonNode item : node) {
            axioms.add(new Axiom(text(item.get("id")), text(item.get("formula"))));
        }
        return axioms;
    }

    private String readQuery(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isObject() && node.hasNonNull("pred")) {
            List<String> args = node.hasNonNull("args") ? textList(node.get("args"), "args") : List.of();
            return new Expression.Atom(node.get("pred").asText(), args).render();
        }
        throw new StructuralException("Unsupported query form: " + node);
    }

    private void forEachNamed(JsonNode node, String section, NamedItemConsumer consumer) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue() == null || field.getValue().isNull()
                        ? objectMapper.createObjectNode()
                        : field.getValue();
                consumer.accept(field.getKey(), value);
            }
            return;
        }
        requireArray(node, section);
        for (JsonNode item : node) {
            String name = text(item.get(NAME));
            if (name == null || name.isBlank()) {
                throw new StructuralException("Item in '" + section + "' is missing '" + NAME + "': " + item);
            }
            consumer.accept(name, item);
        }
    }

    private static void requireArray(JsonNode node, String section) {
        if (!node.isArray()) {
            throw new StructuralException("'" + section + "' must be an array or an object");
        }
    }

    private static List<String> textList(JsonNode node, String field) {
        if (!node.isArray()) {
            throw new StructuralException("'" + field + "' must be an array");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode value : node) {
            values.add(value.asText());
        }
        return values;
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    @FunctionalInterface
    private interface NamedItemConsumer {
        void accept(String name, JsonNode item);
    }

    // ==================== Writing ====================

    public ObjectNode toTree(Program program) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(VERSION, program.getVersion());

        ArrayNode sorts = root.putArray(SORTS);
        for (SortDecl sort : program.getSorts()) {
            ObjectNode item = sorts.addObject().put(NAME, sort.name());
            if (sort.hasParent()) {
                item.put(PARENT, sort.parent());
            }
        }

        ArrayNode constants = root.putArray(CONSTANTS);
        for (ConstantDecl constant : program.getConstants()) {
            constants.addObject().put(NAME, constant.name()).put(SORT, constant.sort());
        }

        ArrayNode predicates = root.putArray(PREDICATES);
        for (PredicateDecl predicate : program.getPredicates()) {
            ObjectNode item = predicates.addObject()
                    .put(NAME, predicate.name())
                    .put(ARITY, predicate.arity());
            ArrayNode argSorts = item.putArray(ARG_SORTS);
            predicate.argSorts().forEach(argSorts::add);
            item.put(ALLOW_UNDECLARED, predicate.allowUndeclaredInstances());
        }

        ArrayNode facts = root.putArray(FACTS);
        for (Fact fact : program.getFacts()) {
            ObjectNode item = facts.addObject().put("predicate", fact.predicate());
            ArrayNode args = item.putArray("args");
            fact.args().forEach(args::add);
            item.put("value", fact.value());
        }

        ArrayNode rules = root.putArray(RULES);
        for (Rule rule : program.getRules()) {
            rules.addObject()
                    .put("id", rule.id())
                    .put("condition", rule.condition())
                    .put("conclusion", rule.conclusion());
        }

        ArrayNode axioms = root.putArray(AXIOMS);
        for (Axiom axiom : program.getAxioms()) {
            axioms.addObject().put("id", axiom.id()).put("formula", axiom.formula());
        }

        if (program.getQuery() != null) {
            root.put(QUERY, program.getQuery());
        }
        return root;
    }

    public String write(Program program) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toTree(program));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize program", e);
        }
    }
}
