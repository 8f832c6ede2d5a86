package com.querygen.compiler.codegen.ast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.querygen.compiler.ir.Argument;
import com.querygen.compiler.ir.Directive;
import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.FragmentSpread;
import com.querygen.compiler.ir.InlineFragment;
import com.querygen.compiler.ir.LinkedField;
import com.querygen.compiler.ir.Operation;
import com.querygen.compiler.ir.ScalarField;
import com.querygen.compiler.ir.Selection;
import com.querygen.compiler.ir.VariableDefinition;
import com.querygen.compiler.model.TypeKind;
import com.querygen.compiler.model.ValueNode;
import com.querygen.compiler.schema.Schema;

/**
 * Serialises IR into the JSON node trees embedded in artifacts.
 *
 * {@code @include} and {@code @skip} with a variable condition become {@code Condition} nodes; with a
 * literal condition the selection is kept or dropped outright.
 */
public class AstJsonSerializer {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper mapper;

    public AstJsonSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Reader AST of a fragment or operation, read by the runtime to extract data from the store.
     */
    public ObjectNode readerFragment(Schema schema, ExecutableDefinition definition) {
        ObjectNode node = NODES.objectNode();
        node.putNull("argumentDefinitions");
        node.put("kind", "Fragment");
        node.put("name", definition.getName());
        node.set("selections", selections(schema, definition.getSelections()));
        node.put("type", definition.getTypeName());
        if (definition instanceof Operation operation) {
            node.set("argumentDefinitions", argumentDefinitions(operation.getVariableDefinitions()));
        }
        return node;
    }

    /**
     * Request AST of an operation: reader fragment, normalization operation and request parameters.
     */
    public ObjectNode request(Schema schema, ExecutableDefinition reader, Operation normalization,
                              RequestParameters params) {
        ObjectNode operation = NODES.objectNode();
        operation.set("argumentDefinitions", argumentDefinitions(normalization.getVariableDefinitions()));
        operation.put("kind", "Operation");
        operation.put("name", normalization.getName());
        operation.set("selections", selections(schema, normalization.getSelections()));

        ObjectNode paramsNode = NODES.objectNode();
        paramsNode.put("cacheID", params.getCacheId());
        paramsNode.put("id", params.getId());
        paramsNode.set("metadata", NODES.objectNode());
        paramsNode.put("name", params.getName());
        paramsNode.put("operationKind", params.getOperationKind().keyword());
        paramsNode.put("text", params.getText());

        ObjectNode request = NODES.objectNode();
        request.set("fragment", readerFragment(schema, reader));
        request.put("kind", "Request");
        request.set("operation", operation);
        request.set("params", paramsNode);
        return request;
    }

    public String write(JsonNode node) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise AST", e);
        }
    }

    private ArrayNode argumentDefinitions(List<VariableDefinition> variables) {
        ArrayNode definitions = NODES.arrayNode();
        for (VariableDefinition variable : variables) {
            ObjectNode definition = definitions.addObject();
            definition.set("defaultValue", variable.getDefaultValue() == null
                    ? NODES.nullNode()
                    : literal(variable.getDefaultValue()));
            definition.put("kind", "LocalArgument");
            definition.put("name", variable.getName());
        }
        return definitions;
    }

    private ArrayNode selections(Schema schema, List<Selection> selections) {
        ArrayNode array = NODES.arrayNode();
        for (Selection selection : selections) {
            selection(schema, selection).ifPresent(array::add);
        }
        return array;
    }

    private Optional<JsonNode> selection(Schema schema, Selection selection) {
        ObjectNode node = NODES.objectNode();
        if (selection instanceof ScalarField field) {
            node.put("alias", field.getAlias());
            node.set("args", arguments(field.getArguments()));
            node.put("kind", "ScalarField");
            node.put("name", field.getName());
            node.put("storageKey", storageKey(field.getName(), field.getArguments()));
        } else if (selection instanceof LinkedField field) {
            String typeName = field.getType().getNamedType();
            boolean concrete = schema.getType(typeName).map(t -> t.getKind() == TypeKind.OBJECT).orElse(false);
            node.put("alias", field.getAlias());
            node.set("args", arguments(field.getArguments()));
            node.put("concreteType", concrete ? typeName : null);
            node.put("kind", "LinkedField");
            node.put("name", field.getName());
            node.put("plural", field.getType().isList());
            node.set("selections", selections(schema, field.getSelections()));
            node.put("storageKey", storageKey(field.getName(), field.getArguments()));
        } else if (selection instanceof FragmentSpread spread) {
            node.set("args", NODES.nullNode());
            node.put("kind", "FragmentSpread");
            node.put("name", spread.getName());
        } else if (selection instanceof InlineFragment inline) {
            node.put("kind", "InlineFragment");
            node.set("selections", selections(schema, inline.getSelections()));
            node.put("type", inline.getTypeCondition());
        }
        return applyConditions(selection.getDirectives(), node);
    }

    private Optional<JsonNode> applyConditions(List<Directive> directives, JsonNode node) {
        JsonNode current = node;
        for (int i = directives.size() - 1; i >= 0; i--) {
            Directive directive = directives.get(i);
            boolean include = "include".equals(directive.getName());
            if (!include && !"skip".equals(directive.getName())) {
                continue;
            }
            ValueNode condition = directive.getArguments().stream()
                    .filter(argument -> "if".equals(argument.getName()))
                    .map(Argument::getValue)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("@" + directive.getName() + " without 'if'"));

            if (condition.getKind() == ValueNode.Kind.BOOLEAN) {
                if (Boolean.parseBoolean(condition.getRaw()) != include) {
                    return Optional.empty();
                }
                continue;
            }
            ObjectNode wrapper = NODES.objectNode();
            wrapper.put("condition", condition.getRaw());
            wrapper.put("kind", "Condition");
            wrapper.put("passingValue", include);
            wrapper.set("selections", NODES.arrayNode().add(current));
            current = wrapper;
        }
        return Optional.of(current);
    }

    private JsonNode arguments(List<Argument> arguments) {
        if (arguments.isEmpty()) {
            return NODES.nullNode();
        }
        ArrayNode array = NODES.arrayNode();
        arguments.stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .forEach(argument -> {
                    ObjectNode node = array.addObject();
                    node.put("kind", argument.getValue().getKind() == ValueNode.Kind.VARIABLE ? "Variable" : "Literal");
                    node.put("name", argument.getName());
                    if (argument.getValue().getKind() == ValueNode.Kind.VARIABLE) {
                        node.put("variableName", argument.getValue().getRaw());
                    } else {
                        node.set("value", literal(argument.getValue()));
                    }
                });
        return array;
    }

    /**
     * Store key of a field whose arguments are all literals, e.g. {@code friends(first:10)}; null otherwise.
     */
    private static String storageKey(String name, List<Argument> arguments) {
        if (arguments.isEmpty() || arguments.stream().anyMatch(a -> !a.getValue().isConstant())) {
            return null;
        }
        return name + arguments.stream()
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .map(a -> a.getName() + ":" + a.getValue().printCompact())
                .collect(Collectors.joining(",", "(", ")"));
    }

    private static JsonNode literal(ValueNode value) {
        switch (value.getKind()) {
            case INT:
                return NODES.numberNode(new BigInteger(value.getRaw()));
            case FLOAT:
                return NODES.numberNode(new BigDecimal(value.getRaw()));
            case BOOLEAN:
                return NODES.booleanNode(Boolean.parseBoolean(value.getRaw()));
            case NULL:
                return NODES.nullNode();
            case LIST:
                ArrayNode items = NODES.arrayNode();
                value.getItems().forEach(item -> items.add(literal(item)));
                return items;
            case OBJECT:
                ObjectNode fields = NODES.objectNode();
                for (Map.Entry<String, ValueNode> entry : value.getFields().entrySet()) {
                    fields.set(entry.getKey(), literal(entry.getValue()));
                }
                return fields;
            case VARIABLE:
                return NODES.objectNode().put("variableName", value.getRaw());
            default:
                return NODES.textNode(value.getRaw());
        }
    }
}
