package me.christianrobert.cpp2py.transformation.builder;

import me.christianrobert.cpp2py.transformation.tree.SourceLocation;

/**
 * Raised while converting a construct outside the supported subset. Caught at the
 * nearest enclosing statement or declaration, which then becomes an opaque node.
 */
class UnsupportedConstructException extends RuntimeException {

    private final SourceLocation location;

    UnsupportedConstructException(String reason, SourceLocation location) {
        super(reason);
        this.location = location;
    }

    SourceLocation getLocation() {
        return location;
    }
}
