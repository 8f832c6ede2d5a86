package com.querygen.compiler.ir;

import java.util.List;
import java.util.function.Consumer;

/**
 * Helpers for walking selection trees.
 */
public final class Selections {

    private Selections() {
    }

    /**
     * Visit every selection depth-first, parents before children. Fragment spreads are not followed.
     */
    public static void forEach(List<Selection> selections, Consumer<Selection> action) {
        for (Selection selection : selections) {
            action.accept(selection);
            List<Selection> children = children(selection);
            if (!children.isEmpty()) {
                forEach(children, action);
            }
        }
    }

    public static List<Selection> children(Selection selection) {
        if (selection instanceof LinkedField linked) {
            return linked.getSelections();
        }
        if (selection instanceof InlineFragment inline) {
            return inline.getSelections();
        }
        return List.of();
    }
}
