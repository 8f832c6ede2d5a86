package com.querygen.compiler.program;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.Fragment;
import com.querygen.compiler.ir.Operation;
import com.querygen.compiler.schema.Schema;

/**
 * Immutable set of type-checked definitions indexed by name, in insertion order.
 *
 * Transforms never modify a Program; they derive a new one with {@link #withDefinitions(List)}.
 */
public final class Program {

    private final Schema schema;
    private final Map<String, ExecutableDefinition> definitions;

    private Program(Schema schema, Map<String, ExecutableDefinition> definitions) {
        this.schema = schema;
        this.definitions = Collections.unmodifiableMap(definitions);
    }

    /**
     * One program definition per IR definition, in the given order.
     *
     * @throws IllegalArgumentException if two definitions share a name
     */
    public static Program fromDefinitions(Schema schema, List<? extends ExecutableDefinition> ir) {
        Map<String, ExecutableDefinition> indexed = new LinkedHashMap<>();
        for (ExecutableDefinition definition : ir) {
            if (indexed.putIfAbsent(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate definition '" + definition.getName() + "'");
            }
        }
        return new Program(schema, indexed);
    }

    public Program withDefinitions(List<? extends ExecutableDefinition> replacement) {
        return fromDefinitions(schema, replacement);
    }

    public Schema getSchema() {
        return schema;
    }

    public Collection<ExecutableDefinition> getDefinitions() {
        return definitions.values();
    }

    public Optional<ExecutableDefinition> get(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public Optional<Fragment> getFragment(String name) {
        ExecutableDefinition definition = definitions.get(name);
        return definition instanceof Fragment fragment ? Optional.of(fragment) : Optional.empty();
    }

    public List<Operation> getOperations() {
        return definitions.values().stream()
                .filter(Operation.class::isInstance)
                .map(Operation.class::cast)
                .toList();
    }

    public List<Fragment> getFragments() {
        return definitions.values().stream()
                .filter(Fragment.class::isInstance)
                .map(Fragment.class::cast)
                .toList();
    }

    public int documentCount() {
        return definitions.size();
    }

    @Override
    public String toString() {
        return "Program" + definitions.keySet();
    }
}
