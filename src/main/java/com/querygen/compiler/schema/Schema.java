package com.querygen.compiler.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.querygen.compiler.model.OperationKind;
import com.querygen.compiler.model.TypeKind;
import com.querygen.compiler.model.TypeRef;

/**
 * Immutable typed universe of one project: base declarations plus project extensions.
 */
public final class Schema {

    public static final String TYPENAME_FIELD = "__typename";

    private static final SchemaField TYPENAME = SchemaField.builder()
            .name(TYPENAME_FIELD)
            .type(TypeRef.nonNull(TypeRef.named("String")))
            .build();

    private final Map<String, SchemaType> types;
    private final Map<String, SchemaDirective> directives;
    private final Map<OperationKind, String> rootTypes;

    Schema(Map<String, SchemaType> types, Map<String, SchemaDirective> directives,
           Map<OperationKind, String> rootTypes) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
        this.directives = Collections.unmodifiableMap(new LinkedHashMap<>(directives));
        this.rootTypes = Collections.unmodifiableMap(new LinkedHashMap<>(rootTypes));
    }

    public Optional<SchemaType> getType(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public Collection<SchemaType> getTypes() {
        return types.values();
    }

    public Optional<SchemaDirective> getDirective(String name) {
        return Optional.ofNullable(directives.get(name));
    }

    public Optional<SchemaType> getRootType(OperationKind kind) {
        String name = rootTypes.get(kind);
        return name == null ? Optional.empty() : getType(name);
    }

    /**
     * Look up a field on a composite type, including the implicit {@code __typename}.
     */
    public Optional<SchemaField> getField(String typeName, String fieldName) {
        SchemaType type = types.get(typeName);
        if (type == null || !type.getKind().isComposite()) {
            return Optional.empty();
        }
        if (TYPENAME_FIELD.equals(fieldName)) {
            return Optional.of(TYPENAME);
        }
        return type.getField(fieldName);
    }

    /**
     * Concrete object types a value of the named type may have.
     */
    public Set<String> getPossibleTypes(String typeName) {
        SchemaType type = types.get(typeName);
        if (type == null) {
            return Set.of();
        }
        if (type.getKind() == TypeKind.OBJECT) {
            return Set.of(typeName);
        }
        return new LinkedHashSet<>(type.getPossibleTypes());
    }

    /**
     * True when some object could satisfy both type conditions.
     */
    public boolean typesOverlap(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        Set<String> possible = new LinkedHashSet<>(getPossibleTypes(a));
        possible.retainAll(getPossibleTypes(b));
        return !possible.isEmpty();
    }

    /**
     * True when the type has an {@code id} field of type {@code ID} or {@code ID!}.
     */
    public boolean hasIdField(String typeName) {
        return getType(typeName)
                .flatMap(t -> t.getField("id"))
                .map(f -> "ID".equals(f.getType().getNamedType()) && !f.getType().isList())
                .orElse(false);
    }
}
