package db.algebra.exec;

import db.algebra.storage.Relation;

/**
 * Operator with exactly one child. The child is evaluated first; {@link #apply(Relation)} then
 * transforms its result into a new relation.
 */
public abstract class UnaryOperator implements Operator {
    private final Operator child;

    protected UnaryOperator(Operator child) {
        if (child == null) throw new IllegalArgumentException("child operator must not be null");
        this.child = child;
    }

    public Operator child() { return child; }

    @Override
    public final Relation evaluateOrThrow() {
        Relation input = child.evaluateOrThrow();
        return apply(input);
    }

    protected abstract Relation apply(Relation input);
}
