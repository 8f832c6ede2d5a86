package com.querygen.compiler.transform.transforms;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.querygen.compiler.ir.ExecutableDefinition;
import com.querygen.compiler.ir.InlineFragment;
import com.querygen.compiler.ir.LinkedField;
import com.querygen.compiler.ir.ScalarField;
import com.querygen.compiler.ir.Selection;
import com.querygen.compiler.program.Program;
import com.querygen.compiler.schema.Schema;
import com.querygen.compiler.schema.SchemaField;
import com.querygen.compiler.transform.ProgramTransform;

/**
 * Adds an {@code id} selection to every linked field whose type declares {@code id: ID}.
 */
public class GenerateIdField implements ProgramTransform {

    private static final String ID = "id";

    @Override
    public String getName() {
        return "generate_id_field";
    }

    @Override
    public Program apply(Program program, Set<String> baseFragmentNames) {
        Schema schema = program.getSchema();
        List<ExecutableDefinition> definitions = new ArrayList<>();
        for (ExecutableDefinition definition : program.getDefinitions()) {
            definitions.add(definition.withSelections(visit(schema, definition.getSelections())));
        }
        return program.withDefinitions(definitions);
    }

    private List<Selection> visit(Schema schema, List<Selection> selections) {
        List<Selection> result = new ArrayList<>(selections.size());
        for (Selection selection : selections) {
            if (selection instanceof LinkedField linked) {
                result.add(withId(schema, linked));
            } else if (selection instanceof InlineFragment inline) {
                result.add(inline.withSelections(visit(schema, inline.getSelections())));
            } else {
                result.add(selection);
            }
        }
        return result;
    }

    private LinkedField withId(Schema schema, LinkedField linked) {
        List<Selection> children = visit(schema, linked.getSelections());
        String typeName = linked.getType().getNamedType();
        if (schema.hasIdField(typeName) && !selectsId(children)) {
            SchemaField idField = schema.getField(typeName, ID)
                    .orElseThrow(() -> new IllegalStateException("Type " + typeName + " lost its id field"));
            List<Selection> withId = new ArrayList<>(children);
            withId.add(ScalarField.builder()
                    .name(ID)
                    .type(idField.getType())
                    .location(linked.getLocation())
                    .build());
            children = withId;
        }
        return linked.withSelections(children);
    }

    private static boolean selectsId(List<Selection> selections) {
        return selections.stream().anyMatch(selection -> selection instanceof ScalarField field
                && ID.equals(field.getResponseKey())
                && ID.equals(field.getName())
                && field.getDirectives().isEmpty());
    }
}
