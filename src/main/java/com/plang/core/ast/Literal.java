package com.plang.core.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Constant value: null, Boolean, Long, Double, String, or an immutable list of those.
 */
public record Literal(Object value, Position position) implements Expr {

    public Literal {
        if (value instanceof List<?> list) {
            value = Collections.unmodifiableList(new ArrayList<>(list));
        }
        position = position == null ? Position.UNKNOWN : position;
    }

    public Literal(Object value) {
        this(value, Position.UNKNOWN);
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }
}
