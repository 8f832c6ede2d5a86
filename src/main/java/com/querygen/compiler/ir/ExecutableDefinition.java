package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.source.Location;

/**
 * A type-checked operation or fragment.
 */
public interface ExecutableDefinition {

    String getName();

    /** Type the top-level selections are made on: the root type or the fragment's type condition. */
    String getTypeName();

    List<Directive> getDirectives();

    List<Selection> getSelections();

    /** Spans the definition's name. */
    Location getLocation();

    ExecutableDefinition withSelections(List<Selection> selections);
}
