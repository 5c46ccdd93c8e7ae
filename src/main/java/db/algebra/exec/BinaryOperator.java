package db.algebra.exec;

import db.algebra.storage.Relation;

/**
 * Operator with two children, evaluated left then right before {@link #apply(Relation, Relation)}.
 */
public abstract class BinaryOperator implements Operator {
    private final Operator left;
    private final Operator right;

    protected BinaryOperator(Operator left, Operator right) {
        if (left == null || right == null) throw new IllegalArgumentException("both child operators are required");
        this.left = left;
        this.right = right;
    }

    public Operator left() { return left; }

    public Operator right() { return right; }

    @Override
    public final Relation evaluateOrThrow() {
        Relation l = left.evaluateOrThrow();
        Relation r = right.evaluateOrThrow();
        return apply(l, r);
    }

    protected abstract Relation apply(Relation left, Relation right);
}
