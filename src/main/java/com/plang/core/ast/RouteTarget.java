package com.plang.core.ast;

public record RouteTarget(String targetName, Position position) implements Node {

    public RouteTarget {
        position = position == null ? Position.UNKNOWN : position;
    }

    @Override
    public <R> R accept(AstVisitor<R> visitor) {
        return visitor.visitRouteTarget(this);
    }
}
