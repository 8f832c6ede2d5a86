package com.querygen.compiler.model;

import java.util.List;

import com.querygen.compiler.source.Location;

/**
 * Top-level definition of an executable document: an operation or a fragment.
 */
public interface ExecutableDefinitionNode {

    String getName();

    Location getLocation();

    List<DirectiveNode> getDirectives();

    List<SelectionNode> getSelections();
}
