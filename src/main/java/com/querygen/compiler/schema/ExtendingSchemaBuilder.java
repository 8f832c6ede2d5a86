package com.querygen.compiler.schema;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.querygen.compiler.config.ProjectConfig;
import com.querygen.compiler.error.SchemaBuildException;
import com.querygen.compiler.model.DirectiveDefinitionNode;
import com.querygen.compiler.model.FieldDefinitionNode;
import com.querygen.compiler.model.InputValueDefinitionNode;
import com.querygen.compiler.model.OperationKind;
import com.querygen.compiler.model.SchemaDocument;
import com.querygen.compiler.model.TypeDefinitionNode;
import com.querygen.compiler.model.TypeKind;
import com.querygen.compiler.model.TypeRef;
import com.querygen.compiler.parser.ParseException;
import com.querygen.compiler.parser.SchemaParser;
import com.querygen.compiler.source.Location;
import com.querygen.compiler.source.Sources;
import com.querygen.compiler.state.CompilerState;
import com.querygen.compiler.state.ProjectSourceSet;

/**
 * Builds a project schema by merging the base SDL with the project's extension SDL.
 *
 * Types declared in extension files, and fields added to base types by {@code extend} blocks,
 * are flagged as client extensions.
 */
public class ExtendingSchemaBuilder implements SchemaBuilder {
    private static final Logger log = LoggerFactory.getLogger(ExtendingSchemaBuilder.class);

    private static final List<String> BUILTIN_SCALARS = List.of("ID", "String", "Int", "Float", "Boolean");

    @Override
    public Schema build(CompilerState state, ProjectConfig project) {
        ProjectSourceSet sourceSet = state.requireProject(project.getName());
        Sources sources = state.getSources();
        Merge merge = new Merge(sources);

        List<SchemaDocument> baseDocuments = parseAll(sourceSet.getSchemaKeys(), sources, merge.problems);
        List<SchemaDocument> extensionDocuments = parseAll(sourceSet.getExtensionKeys(), sources, merge.problems);

        if (sourceSet.getSchemaKeys().isEmpty()) {
            merge.problems.add("Project '" + project.getName() + "' has no schema files.");
        }

        for (SchemaDocument document : baseDocuments) {
            merge.applyDefinitions(document, false);
            document.getRootTypes().forEach(merge.rootTypes::put);
        }
        for (SchemaDocument document : baseDocuments) {
            merge.applyExtensions(document, false);
        }
        for (SchemaDocument document : extensionDocuments) {
            merge.applyDefinitions(document, true);
            if (!document.getRootTypes().isEmpty()) {
                merge.problems.add("Schema extensions of project '" + project.getName()
                        + "' may not redefine root operation types (" + document.getSourceKey() + ").");
            }
        }
        for (SchemaDocument document : extensionDocuments) {
            merge.applyExtensions(document, true);
        }

        Schema schema = merge.finish();
        log.debug("Built schema for {} with {} type(s)", project.getName(), schema.getTypes().size());
        return schema;
    }

    private static List<SchemaDocument> parseAll(List<String> keys, Sources sources, List<String> problems) {
        List<SchemaDocument> documents = new ArrayList<>();
        for (String key : keys) {
            String text = sources.get(key).orElse(null);
            if (text == null) {
                problems.add("Schema source not loaded: " + key);
                continue;
            }
            try {
                documents.add(new SchemaParser(text, key).parse());
            } catch (ParseException e) {
                problems.add("Syntax error in " + describe(sources, e.getLocation()) + ": " + e.getMessage());
            }
        }
        return documents;
    }

    private static String describe(Sources sources, Location location) {
        return sources.resolve(location).map(Object::toString).orElse(location.toString());
    }

    /**
     * Mutable working state of one merge. Never escapes {@link #build}.
     */
    private static final class Merge {
        private final Sources sources;
        private final List<String> problems = new ArrayList<>();
        private final Map<String, TypeDraft> types = new LinkedHashMap<>();
        private final Map<String, SchemaDirective> directives = new LinkedHashMap<>();
        private final Map<OperationKind, String> rootTypes = new EnumMap<>(OperationKind.class);

        private Merge(Sources sources) {
            this.sources = sources;
            for (String scalar : BUILTIN_SCALARS) {
                TypeDraft draft = new TypeDraft(TypeKind.SCALAR, scalar, false);
                draft.builtin = true;
                types.put(scalar, draft);
            }
            for (String conditional : List.of("include", "skip")) {
                directives.put(conditional, SchemaDirective.builder()
                        .name(conditional)
                        .argument(SchemaArgument.builder()
                                .name("if")
                                .type(TypeRef.nonNull(TypeRef.named("Boolean")))
                                .build())
                        .location("FIELD")
                        .location("FRAGMENT_SPREAD")
                        .location("INLINE_FRAGMENT")
                        .build());
            }
        }

        void applyDefinitions(SchemaDocument document, boolean clientExtension) {
            for (TypeDefinitionNode node : document.getTypes()) {
                if (node.isExtension()) {
                    continue;
                }
                TypeDraft existing = types.get(node.getName());
                if (existing != null) {
                    if (existing.builtin && node.getKind() == TypeKind.SCALAR) {
                        continue;
                    }
                    problems.add("Type '" + node.getName() + "' is declared more than once ("
                            + describe(sources, node.getLocation()) + ").");
                    continue;
                }
                TypeDraft draft = new TypeDraft(node.getKind(), node.getName(), clientExtension);
                draft.merge(node, clientExtension, this);
                types.put(node.getName(), draft);
            }
            for (DirectiveDefinitionNode node : document.getDirectives()) {
                if (directives.containsKey(node.getName())) {
                    problems.add("Directive '@" + node.getName() + "' is declared more than once ("
                            + describe(sources, node.getLocation()) + ").");
                    continue;
                }
                SchemaDirective.SchemaDirectiveBuilder directive = SchemaDirective.builder().name(node.getName());
                node.getArguments().forEach(arg -> directive.argument(toArgument(arg)));
                node.getDirectiveLocations().forEach(directive::location);
                directives.put(node.getName(), directive.build());
            }
        }

        void applyExtensions(SchemaDocument document, boolean clientExtension) {
            for (TypeDefinitionNode node : document.getTypes()) {
                if (!node.isExtension()) {
                    continue;
                }
                TypeDraft existing = types.get(node.getName());
                if (existing == null) {
                    problems.add("Cannot extend unknown type '" + node.getName() + "' ("
                            + describe(sources, node.getLocation()) + ").");
                    continue;
                }
                if (existing.kind != node.getKind()) {
                    problems.add("Cannot extend " + existing.kind + " '" + node.getName() + "' as "
                            + node.getKind() + " (" + describe(sources, node.getLocation()) + ").");
                    continue;
                }
                existing.merge(node, clientExtension, this);
            }
        }

        Schema finish() {
            if (!rootTypes.containsKey(OperationKind.QUERY) && types.containsKey("Query")) {
                rootTypes.put(OperationKind.QUERY, "Query");
            }
            if (!rootTypes.containsKey(OperationKind.MUTATION) && types.containsKey("Mutation")) {
                rootTypes.put(OperationKind.MUTATION, "Mutation");
            }
            if (!rootTypes.containsKey(OperationKind.SUBSCRIPTION) && types.containsKey("Subscription")) {
                rootTypes.put(OperationKind.SUBSCRIPTION, "Subscription");
            }

            if (!rootTypes.containsKey(OperationKind.QUERY)) {
                problems.add("Schema does not define a query root type.");
            }
            rootTypes.forEach((kind, name) -> {
                TypeDraft root = types.get(name);
                if (root == null || root.kind != TypeKind.OBJECT) {
                    problems.add("Root " + kind.keyword() + " type '" + name + "' must be a declared object type.");
                }
            });

            checkReferences();

            if (!problems.isEmpty()) {
                throw new SchemaBuildException(problems);
            }

            Map<String, SchemaType> built = new LinkedHashMap<>();
            for (TypeDraft draft : types.values()) {
                built.put(draft.name, draft.toSchemaType(implementorsOf(draft)));
            }
            return new Schema(built, directives, rootTypes);
        }

        private void checkReferences() {
            for (TypeDraft draft : types.values()) {
                for (FieldDraft field : draft.fields.values()) {
                    TypeDraft target = types.get(field.type.getNamedType());
                    if (target == null) {
                        problems.add("Field '" + draft.name + "." + field.name + "' has unknown type '"
                                + field.type.getNamedType() + "'.");
                    } else if (target.kind == TypeKind.INPUT_OBJECT) {
                        problems.add("Field '" + draft.name + "." + field.name + "' cannot have input type '"
                                + target.name + "'.");
                    }
                    for (SchemaArgument argument : field.arguments) {
                        checkInputType(argument, "Argument '" + draft.name + "." + field.name + "(" + argument.getName() + ")'");
                    }
                }
                for (SchemaArgument inputField : draft.inputFields.values()) {
                    checkInputType(inputField, "Input field '" + draft.name + "." + inputField.getName() + "'");
                }
                for (String iface : draft.interfaces) {
                    TypeDraft target = types.get(iface);
                    if (target == null || target.kind != TypeKind.INTERFACE) {
                        problems.add("Type '" + draft.name + "' implements unknown interface '" + iface + "'.");
                    }
                }
                for (String member : draft.members) {
                    TypeDraft target = types.get(member);
                    if (target == null || target.kind != TypeKind.OBJECT) {
                        problems.add("Union '" + draft.name + "' has member '" + member + "' that is not an object type.");
                    }
                }
            }
        }

        private void checkInputType(SchemaArgument argument, String description) {
            TypeDraft target = types.get(argument.getType().getNamedType());
            if (target == null) {
                problems.add(description + " has unknown type '" + argument.getType().getNamedType() + "'.");
            } else if (!target.kind.equals(TypeKind.SCALAR) && !target.kind.equals(TypeKind.ENUM)
                    && !target.kind.equals(TypeKind.INPUT_OBJECT)) {
                problems.add(description + " must have an input type, got '" + target.name + "'.");
            }
        }

        private List<String> implementorsOf(TypeDraft draft) {
            if (draft.kind == TypeKind.UNION) {
                return new ArrayList<>(draft.members);
            }
            if (draft.kind != TypeKind.INTERFACE) {
                return List.of();
            }
            List<String> implementors = new ArrayList<>();
            for (TypeDraft candidate : types.values()) {
                if (candidate.kind == TypeKind.OBJECT && candidate.interfaces.contains(draft.name)) {
                    implementors.add(candidate.name);
                }
            }
            return implementors;
        }
    }

    private static SchemaArgument toArgument(InputValueDefinitionNode node) {
        return SchemaArgument.builder()
                .name(node.getName())
                .type(node.getType())
                .defaultValue(node.getDefaultValue())
                .build();
    }

    private static final class FieldDraft {
        final String name;
        final TypeRef type;
        final List<SchemaArgument> arguments;
        final boolean clientExtension;

        FieldDraft(FieldDefinitionNode node, boolean clientExtension) {
            this.name = node.getName();
            this.type = node.getType();
            this.arguments = node.getArguments().stream().map(ExtendingSchemaBuilder::toArgument).toList();
            this.clientExtension = clientExtension;
        }
    }

    private static final class TypeDraft {
        final TypeKind kind;
        final String name;
        final boolean clientExtension;
        boolean builtin;
        final Map<String, FieldDraft> fields = new LinkedHashMap<>();
        final Map<String, SchemaArgument> inputFields = new LinkedHashMap<>();
        final Set<String> interfaces = new LinkedHashSet<>();
        final Set<String> members = new LinkedHashSet<>();
        final Set<String> enumValues = new LinkedHashSet<>();

        TypeDraft(TypeKind kind, String name, boolean clientExtension) {
            this.kind = kind;
            this.name = name;
            this.clientExtension = clientExtension;
        }

        void merge(TypeDefinitionNode node, boolean fromExtension, Merge merge) {
            for (FieldDefinitionNode field : node.getFields()) {
                if (fields.containsKey(field.getName())) {
                    merge.problems.add("Field '" + name + "." + field.getName() + "' is already declared ("
                            + describe(merge.sources, field.getLocation()) + ").");
                    continue;
                }
                fields.put(field.getName(), new FieldDraft(field, fromExtension));
            }
            for (InputValueDefinitionNode inputField : node.getInputFields()) {
                if (inputFields.containsKey(inputField.getName())) {
                    merge.problems.add("Input field '" + name + "." + inputField.getName() + "' is already declared ("
                            + describe(merge.sources, inputField.getLocation()) + ").");
                    continue;
                }
                inputFields.put(inputField.getName(), toArgument(inputField));
            }
            interfaces.addAll(node.getInterfaces());
            members.addAll(node.getMembers());
            for (String value : node.getEnumValues()) {
                if (!enumValues.add(value)) {
                    merge.problems.add("Enum value '" + name + "." + value + "' is already declared.");
                }
            }
        }

        SchemaType toSchemaType(List<String> possibleTypes) {
            SchemaType.SchemaTypeBuilder type = SchemaType.builder()
                    .kind(kind)
                    .name(name)
                    .clientExtension(clientExtension)
                    .interfaces(interfaces)
                    .possibleTypes(possibleTypes)
                    .enumValues(enumValues)
                    .inputFields(inputFields);
            for (FieldDraft field : fields.values()) {
                type.field(field.name, SchemaField.builder()
                        .name(field.name)
                        .type(field.type)
                        .arguments(field.arguments)
                        .clientExtension(field.clientExtension)
                        .build());
            }
            return type.build();
        }
    }
}
