package com.querygen.compiler.model;

import java.util.List;

import com.querygen.compiler.source.Location;

/**
 * A field, fragment spread or inline fragment inside a selection set.
 */
public interface SelectionNode {

    Location getLocation();

    List<DirectiveNode> getDirectives();
}
