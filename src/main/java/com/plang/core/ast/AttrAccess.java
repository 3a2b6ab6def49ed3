package com.plang.core.ast;

import java.util.Optional;

/**
 * {@code target.attribute}, e.g. {@code request.user.role}.
 */
public record AttrAccess(Expr target, String attribute, Position position) implements Expr {

    public AttrAccess {
        position = position == null ? Position.UNKNOWN : position;
    }

    public AttrAccess(Expr target, String attribute) {
        this(target, attribute, Position.UNKNOWN);
    }

    /**
     * The dotted path ("request.user.role") when the target chain consists only of
     * identifiers and attribute accesses.
     */
    public Optional<String> dottedPath() {
        if (target instanceof Ident ident) {
            return Optional.of(ident.name() + "." + attribute);
        }
        if (target instanceof AttrAccess inner) {
            return inner.dottedPath().map(p -> p + "." + attribute);
        }
        return Optional.empty();
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitAttrAccess(this);
    }
}
