package com.querygen.compiler.ir;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.StageResult;
import com.querygen.compiler.error.ValidationError;
import com.querygen.compiler.model.ArgumentNode;
import com.querygen.compiler.model.DirectiveNode;
import com.querygen.compiler.model.ExecutableDefinitionNode;
import com.querygen.compiler.model.ExecutableDocument;
import com.querygen.compiler.model.FieldSelectionNode;
import com.querygen.compiler.model.FragmentDefinitionNode;
import com.querygen.compiler.model.FragmentSpreadNode;
import com.querygen.compiler.model.InlineFragmentNode;
import com.querygen.compiler.model.OperationDefinitionNode;
import com.querygen.compiler.model.SelectionNode;
import com.querygen.compiler.model.TypeKind;
import com.querygen.compiler.model.TypeRef;
import com.querygen.compiler.model.ValueNode;
import com.querygen.compiler.model.VariableDefinitionNode;
import com.querygen.compiler.schema.Schema;
import com.querygen.compiler.schema.SchemaArgument;
import com.querygen.compiler.schema.SchemaDirective;
import com.querygen.compiler.schema.SchemaField;
import com.querygen.compiler.schema.SchemaType;
import com.querygen.compiler.source.Location;
import com.querygen.compiler.state.AstSets;

/**
 * Default {@link IrBuilder}. Walks every document of the project, resolving fields, fragments,
 * arguments and directives against the schema, and collects every error it can find.
 *
 * Fragments of the base project are type-checked only when the project spreads them.
 */
public class TypeCheckingIrBuilder implements IrBuilder {
    private static final Logger log = LoggerFactory.getLogger(TypeCheckingIrBuilder.class);

    @Override
    public StageResult<BuildIrResult> build(ProjectConfig project, Schema schema, AstSets astSets) {
        List<ExecutableDocument> projectDocuments = astSets.get(project.getName());
        List<ExecutableDocument> baseDocuments = project.getBaseProject()
                .map(astSets::get)
                .orElse(List.of());

        Check check = new Check(schema);
        check.index(projectDocuments, baseDocuments);

        List<ExecutableDefinition> definitions = new ArrayList<>();
        for (ExecutableDocument document : projectDocuments) {
            for (ExecutableDefinitionNode node : document.getDefinitions()) {
                check.definition(node).ifPresent(definitions::add);
            }
        }

        // Pull in base fragments reachable from the project's own definitions.
        Set<String> baseFragmentNames = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(check.baseReferences);
        while (!pending.isEmpty()) {
            String name = pending.poll();
            if (!baseFragmentNames.add(name)) {
                continue;
            }
            check.baseReferences.clear();
            check.definition(check.baseFragments.get(name)).ifPresent(definitions::add);
            pending.addAll(check.baseReferences);
        }
        check.fragmentCycles(definitions);

        if (!check.errors.isEmpty()) {
            log.debug("Project {}: {} type error(s)", project.getName(), check.errors.size());
            return StageResult.failed(check.errors);
        }
        log.debug("Project {}: built IR with {} definition(s), {} base fragment(s)", project.getName(),
                definitions.size(), baseFragmentNames.size());
        return StageResult.ok(new BuildIrResult(definitions, baseFragmentNames));
    }

    /**
     * Per-call checking state.
     */
    private static final class Check {
        private final Schema schema;
        private final List<ValidationError> errors = new ArrayList<>();
        private final Map<String, FragmentDefinitionNode> fragments = new HashMap<>();
        private final Map<String, FragmentDefinitionNode> baseFragments = new HashMap<>();
        private final Set<String> baseReferences = new LinkedHashSet<>();

        /** Variables of the operation being checked; null inside fragments. */
        private Scope scope;

        Check(Schema schema) {
            this.schema = schema;
        }

        void index(List<ExecutableDocument> projectDocuments, List<ExecutableDocument> baseDocuments) {
            Map<String, Location> seen = new HashMap<>();
            for (ExecutableDocument document : projectDocuments) {
                for (ExecutableDefinitionNode node : document.getDefinitions()) {
                    if (node.getName() == null) {
                        errors.add(ValidationError.of("Operations must be named", node.getLocation()));
                        continue;
                    }
                    Location previous = seen.putIfAbsent(node.getName(), node.getLocation());
                    if (previous != null) {
                        errors.add(ValidationError.of("Duplicate definitions for '" + node.getName() + "'",
                                previous, node.getLocation()));
                        continue;
                    }
                    if (node instanceof FragmentDefinitionNode fragment) {
                        fragments.put(fragment.getName(), fragment);
                    }
                }
            }
            for (ExecutableDocument document : baseDocuments) {
                for (ExecutableDefinitionNode node : document.getDefinitions()) {
                    if (node instanceof FragmentDefinitionNode fragment) {
                        Location projectDefinition = seen.get(fragment.getName());
                        if (projectDefinition != null) {
                            errors.add(ValidationError.of("'" + fragment.getName()
                                            + "' is also defined as a fragment in the base project",
                                    projectDefinition, fragment.getLocation()));
                        } else {
                            baseFragments.putIfAbsent(fragment.getName(), fragment);
                        }
                    }
                }
            }
        }

        Optional<ExecutableDefinition> definition(ExecutableDefinitionNode node) {
            if (node.getName() == null) {
                return Optional.empty();
            }
            if (node instanceof OperationDefinitionNode operation) {
                return operation(operation);
            }
            return fragment((FragmentDefinitionNode) node);
        }

        private Optional<ExecutableDefinition> operation(OperationDefinitionNode node) {
            Optional<SchemaType> root = schema.getRootType(node.getKind());
            if (root.isEmpty()) {
                errors.add(ValidationError.of("Schema does not support " + node.getKind().keyword() + " operations",
                        node.getLocation()));
                return Optional.empty();
            }

            Operation.OperationBuilder operation = Operation.builder()
                    .kind(node.getKind())
                    .name(node.getName())
                    .rootType(root.get().getName())
                    .location(node.getLocation());

            Map<String, VariableDefinitionNode> variables = new LinkedHashMap<>();
            for (VariableDefinitionNode variable : node.getVariableDefinitions()) {
                if (variables.putIfAbsent(variable.getName(), variable) != null) {
                    errors.add(ValidationError.of("Duplicate variable '$" + variable.getName() + "'",
                            variables.get(variable.getName()).getLocation(), variable.getLocation()));
                    continue;
                }
                Optional<SchemaType> type = schema.getType(variable.getType().getNamedType());
                if (type.isEmpty()) {
                    errors.add(ValidationError.of("Unknown type '" + variable.getType().getNamedType() + "'",
                            variable.getTypeLocation()));
                } else if (!type.get().isInputType()) {
                    errors.add(ValidationError.of("Variable '$" + variable.getName()
                            + "' cannot be of non-input type '" + variable.getType() + "'", variable.getTypeLocation()));
                } else {
                    ValueNode defaultValue = variable.getDefaultValue();
                    if (defaultValue != null && !defaultValue.isConstant()) {
                        errors.add(ValidationError.of("Default value of variable '$" + variable.getName()
                                        + "' must be a constant",
                                defaultValue.getLocation() != null ? defaultValue.getLocation() : variable.getLocation()));
                    } else if (defaultValue != null) {
                        value(defaultValue, variable.getType(), variable.getLocation());
                    }
                    operation.variableDefinition(new VariableDefinition(variable.getName(), variable.getType(),
                            variable.getDefaultValue(), variable.getLocation()));
                }
            }

            scope = new Scope(node.getName(), variables.keySet());
            try {
                operation.directives(directives(node.getDirectives()));
                operation.selections(selections(root.get(), node.getSelections()));
            } finally {
                scope = null;
            }
            return Optional.of(operation.build());
        }

        private Optional<ExecutableDefinition> fragment(FragmentDefinitionNode node) {
            Optional<SchemaType> type = compositeType(node.getTypeCondition(), node.getTypeConditionLocation());
            if (type.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(Fragment.builder()
                    .name(node.getName())
                    .typeCondition(type.get().getName())
                    .directives(directives(node.getDirectives()))
                    .selections(selections(type.get(), node.getSelections()))
                    .location(node.getLocation())
                    .build());
        }

        private List<Selection> selections(SchemaType parent, List<SelectionNode> nodes) {
            List<Selection> selections = new ArrayList<>();
            for (SelectionNode node : nodes) {
                Selection selection = null;
                if (node instanceof FieldSelectionNode field) {
                    selection = field(parent, field);
                } else if (node instanceof FragmentSpreadNode spread) {
                    selection = spread(parent, spread);
                } else if (node instanceof InlineFragmentNode inline) {
                    selection = inlineFragment(parent, inline);
                }
                if (selection != null) {
                    selections.add(selection);
                }
            }
            return selections;
        }

        private Selection field(SchemaType parent, FieldSelectionNode node) {
            Optional<SchemaField> schemaField = schema.getField(parent.getName(), node.getName());
            if (schemaField.isEmpty()) {
                errors.add(ValidationError.of("Unknown field '" + node.getName() + "' on type '" + parent.getName() + "'",
                        node.getLocation()));
                return null;
            }
            SchemaField definition = schemaField.get();
            SchemaType fieldType = schema.getType(definition.getType().getNamedType())
                    .orElseThrow(() -> new IllegalStateException("Schema references undeclared type "
                            + definition.getType().getNamedType()));

            List<Argument> arguments = arguments(node.getArguments(), definition.getArguments(),
                    "field '" + parent.getName() + "." + node.getName() + "'", node.getLocation());
            List<Directive> directives = directives(node.getDirectives());

            if (fieldType.getKind().isComposite()) {
                if (!node.isHasSelectionSet()) {
                    errors.add(ValidationError.of("Field '" + node.getName() + "' of type '" + definition.getType()
                            + "' must have a selection of subfields", node.getLocation()));
                    return null;
                }
                return LinkedField.builder()
                        .alias(node.getAlias())
                        .aliasLocation(node.getAliasLocation())
                        .name(node.getName())
                        .type(definition.getType())
                        .arguments(arguments)
                        .directives(directives)
                        .selections(selections(fieldType, node.getSelections()))
                        .location(node.getLocation())
                        .build();
            }

            if (node.isHasSelectionSet()) {
                errors.add(ValidationError.of("Field '" + node.getName() + "' must not have a selection since type '"
                        + definition.getType() + "' has no subfields", node.getLocation()));
                return null;
            }
            return ScalarField.builder()
                    .alias(node.getAlias())
                    .aliasLocation(node.getAliasLocation())
                    .name(node.getName())
                    .type(definition.getType())
                    .arguments(arguments)
                    .directives(directives)
                    .location(node.getLocation())
                    .build();
        }

        private Selection spread(SchemaType parent, FragmentSpreadNode node) {
            FragmentDefinitionNode fragment = fragments.get(node.getName());
            if (fragment == null) {
                fragment = baseFragments.get(node.getName());
                if (fragment != null) {
                    baseReferences.add(fragment.getName());
                }
            }
            if (fragment == null) {
                errors.add(ValidationError.of("Unknown fragment '" + node.getName() + "'", node.getLocation()));
                return null;
            }
            if (schema.getType(fragment.getTypeCondition()).isPresent()
                    && !schema.typesOverlap(parent.getName(), fragment.getTypeCondition())) {
                errors.add(ValidationError.of("Fragment '" + node.getName() + "' cannot be spread here: type '"
                        + fragment.getTypeCondition() + "' can never match '" + parent.getName() + "'",
                        node.getLocation()));
                return null;
            }
            return FragmentSpread.builder()
                    .name(node.getName())
                    .directives(directives(node.getDirectives()))
                    .location(node.getLocation())
                    .build();
        }

        private Selection inlineFragment(SchemaType parent, InlineFragmentNode node) {
            SchemaType type = parent;
            if (node.getTypeCondition() != null) {
                Optional<SchemaType> condition = compositeType(node.getTypeCondition(), node.getLocation());
                if (condition.isEmpty()) {
                    return null;
                }
                if (!schema.typesOverlap(parent.getName(), condition.get().getName())) {
                    errors.add(ValidationError.of("Inline fragment on '" + node.getTypeCondition()
                            + "' can never match '" + parent.getName() + "'", node.getLocation()));
                    return null;
                }
                type = condition.get();
            }
            return InlineFragment.builder()
                    .typeCondition(type.getName())
                    .directives(directives(node.getDirectives()))
                    .selections(selections(type, node.getSelections()))
                    .location(node.getLocation())
                    .build();
        }

        private Optional<SchemaType> compositeType(String name, Location location) {
            Optional<SchemaType> type = schema.getType(name);
            if (type.isEmpty()) {
                errors.add(ValidationError.of("Unknown type '" + name + "'", location));
                return Optional.empty();
            }
            if (!type.get().getKind().isComposite()) {
                errors.add(ValidationError.of("Type condition '" + name + "' is not a composite type", location));
                return Optional.empty();
            }
            return type;
        }

        private List<Directive> directives(List<DirectiveNode> nodes) {
            List<Directive> directives = new ArrayList<>();
            for (DirectiveNode node : nodes) {
                Optional<SchemaDirective> definition = schema.getDirective(node.getName());
                if (definition.isEmpty()) {
                    errors.add(ValidationError.of("Unknown directive '@" + node.getName() + "'", node.getLocation()));
                    continue;
                }
                directives.add(Directive.builder()
                        .name(node.getName())
                        .arguments(arguments(node.getArguments(), definition.get().getArguments(),
                                "directive '@" + node.getName() + "'", node.getLocation()))
                        .location(node.getLocation())
                        .build());
            }
            return directives;
        }

        private List<Argument> arguments(List<ArgumentNode> nodes, List<SchemaArgument> definitions,
                                         String owner, Location ownerLocation) {
            Map<String, SchemaArgument> byName = new LinkedHashMap<>();
            definitions.forEach(d -> byName.put(d.getName(), d));

            List<Argument> arguments = new ArrayList<>();
            Set<String> provided = new HashSet<>();
            for (ArgumentNode node : nodes) {
                SchemaArgument definition = byName.get(node.getName());
                if (definition == null) {
                    errors.add(ValidationError.of("Unknown argument '" + node.getName() + "' on " + owner,
                            node.getLocation()));
                    continue;
                }
                if (!provided.add(node.getName())) {
                    errors.add(ValidationError.of("Argument '" + node.getName() + "' is provided more than once",
                            node.getLocation()));
                    continue;
                }
                value(node.getValue(), definition.getType(), node.getLocation());
                arguments.add(new Argument(node.getName(), definition.getType(), node.getValue(), node.getLocation()));
            }
            for (SchemaArgument definition : definitions) {
                if (definition.isRequired() && !provided.contains(definition.getName())) {
                    errors.add(ValidationError.of("Missing required argument '" + definition.getName() + "' on "
                            + owner, ownerLocation));
                }
            }
            return arguments;
        }

        private void value(ValueNode value, TypeRef expected, Location fallback) {
            Location location = value.getLocation() != null ? value.getLocation() : fallback;

            if (value.getKind() == ValueNode.Kind.VARIABLE) {
                if (scope != null && !scope.variables.contains(value.getRaw())) {
                    errors.add(ValidationError.of("Variable '$" + value.getRaw() + "' is not defined by operation '"
                            + scope.operationName + "'", location));
                }
                return;
            }
            if (value.getKind() == ValueNode.Kind.NULL) {
                if (expected.isNonNull()) {
                    errors.add(ValidationError.of("Expected non-null value of type '" + expected + "', found null",
                            location));
                }
                return;
            }

            TypeRef type = expected.isNonNull() ? expected.getOfType() : expected;
            if (type.getWrapper() == TypeRef.Wrapper.LIST) {
                if (value.getKind() == ValueNode.Kind.LIST) {
                    value.getItems().forEach(item -> value(item, type.getOfType(), location));
                } else {
                    value(value, type.getOfType(), location);
                }
                return;
            }

            Optional<SchemaType> named = schema.getType(type.getName());
            if (named.isEmpty()) {
                return;
            }
            SchemaType schemaType = named.get();
            boolean accepted = switch (schemaType.getKind()) {
                case ENUM -> value.getKind() == ValueNode.Kind.ENUM
                        && schemaType.getEnumValues().contains(value.getRaw());
                case INPUT_OBJECT -> value.getKind() == ValueNode.Kind.OBJECT;
                case SCALAR -> acceptsScalar(schemaType.getName(), value.getKind());
                default -> false;
            };
            if (!accepted) {
                errors.add(ValidationError.of("Expected value of type '" + expected + "', found " + value.print(),
                        location));
                return;
            }
            if (schemaType.getKind() == TypeKind.INPUT_OBJECT) {
                inputObject(value, schemaType, location);
            }
        }

        private void inputObject(ValueNode value, SchemaType type, Location location) {
            value.getFields().forEach((name, fieldValue) -> {
                SchemaArgument field = type.getInputFields().get(name);
                if (field == null) {
                    errors.add(ValidationError.of("Unknown field '" + name + "' on input type '" + type.getName() + "'",
                            fieldValue.getLocation() != null ? fieldValue.getLocation() : location));
                } else {
                    value(fieldValue, field.getType(), location);
                }
            });
            for (SchemaArgument field : type.getInputFields().values()) {
                if (field.isRequired() && !value.getFields().containsKey(field.getName())) {
                    errors.add(ValidationError.of("Missing required field '" + field.getName() + "' of input type '"
                            + type.getName() + "'", location));
                }
            }
        }

        /**
         * Report every fragment that can reach itself through spreads.
         */
        void fragmentCycles(List<ExecutableDefinition> definitions) {
            Map<String, Fragment> byName = new LinkedHashMap<>();
            for (ExecutableDefinition definition : definitions) {
                if (definition instanceof Fragment fragment) {
                    byName.putIfAbsent(fragment.getName(), fragment);
                }
            }
            for (Fragment fragment : byName.values()) {
                if (reaches(fragment.getName(), fragment.getSelections(), byName, new HashSet<>())) {
                    errors.add(ValidationError.of("Fragment '" + fragment.getName() + "' spreads itself",
                            fragment.getLocation()));
                }
            }
        }

        private static boolean reaches(String target, List<Selection> selections, Map<String, Fragment> fragments,
                                       Set<String> visited) {
            for (Selection selection : selections) {
                if (selection instanceof FragmentSpread spread) {
                    if (spread.getName().equals(target)) {
                        return true;
                    }
                    Fragment next = fragments.get(spread.getName());
                    if (next != null && visited.add(next.getName())
                            && reaches(target, next.getSelections(), fragments, visited)) {
                        return true;
                    }
                } else if (selection instanceof LinkedField linked) {
                    if (reaches(target, linked.getSelections(), fragments, visited)) {
                        return true;
                    }
                } else if (selection instanceof InlineFragment inline) {
                    if (reaches(target, inline.getSelections(), fragments, visited)) {
                        return true;
                    }
                }
            }
            return false;
        }

        private static boolean acceptsScalar(String scalar, ValueNode.Kind kind) {
            return switch (scalar) {
                case "Int" -> kind == ValueNode.Kind.INT;
                case "Float" -> kind == ValueNode.Kind.INT || kind == ValueNode.Kind.FLOAT;
                case "String" -> kind == ValueNode.Kind.STRING;
                case "Boolean" -> kind == ValueNode.Kind.BOOLEAN;
                case "ID" -> kind == ValueNode.Kind.STRING || kind == ValueNode.Kind.INT;
                default -> kind != ValueNode.Kind.LIST && kind != ValueNode.Kind.OBJECT;
            };
        }
    }

    private static final class Scope {
        private final String operationName;
        private final Set<String> variables;

        Scope(String operationName, Set<String> variables) {
            this.operationName = operationName;
            this.variables = Set.copyOf(variables);
        }
    }
}
