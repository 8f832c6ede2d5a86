package com.querygen.compiler.ir;

import java.util.List;

import com.querygen.compiler.source.Location;

/**
 * A type-checked selection: {@link ScalarField}, {@link LinkedField}, {@link FragmentSpread} or
 * {@link InlineFragment}.
 */
public interface Selection {

    Location getLocation();

    List<Directive> getDirectives();
}
