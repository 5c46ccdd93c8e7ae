package db.algebra.exec;

import java.util.Arrays;
import java.util.List;

import db.algebra.catalog.Schema;
import db.algebra.storage.Tuple;

/**
 * Boolean combination of selection predicates: AND / OR over two or more children, NOT over one.
 * {@link #validate(Schema)} checks every child against the input schema, so a bad column in a branch
 * that would never be reached still fails the selection. {@link #test(Tuple, Schema)} stops at the
 * first child that decides the result.
 */
public final class CompoundPredicate implements Predicate {
    public enum Type { AND, OR, NOT }

    private final Type type;
    private final List<Predicate> children; // for NOT size == 1

    private CompoundPredicate(Type type, List<Predicate> children) {
        if (type == Type.NOT && children.size() != 1) {
            throw new IllegalArgumentException("NOT requires exactly one child predicate");
        }
        if ((type == Type.AND || type == Type.OR) && children.size() < 2) {
            throw new IllegalArgumentException(type + " requires at least two child predicates");
        }
        for (Predicate p : children) {
            if (p == null) throw new IllegalArgumentException("child predicate must not be null");
        }
        this.type = type;
        this.children = List.copyOf(children);
    }

    public static CompoundPredicate and(Predicate... predicates) {
        return new CompoundPredicate(Type.AND, Arrays.asList(predicates));
    }

    public static CompoundPredicate or(Predicate... predicates) {
        return new CompoundPredicate(Type.OR, Arrays.asList(predicates));
    }

    public static CompoundPredicate not(Predicate predicate) {
        return new CompoundPredicate(Type.NOT, Arrays.asList(predicate));
    }

    @Override
    public void validate(Schema schema) {
        for (Predicate p : children) p.validate(schema);
    }

    @Override
    public boolean test(Tuple tuple, Schema schema) {
        return switch (type) {
            case AND -> {
                for (Predicate p : children) if (!p.test(tuple, schema)) { yield false; }
                yield true;
            }
            case OR -> {
                for (Predicate p : children) if (p.test(tuple, schema)) { yield true; }
                yield false;
            }
            case NOT -> !children.get(0).test(tuple, schema);
        };
    }

    @Override
    public String toString() {
        if (type == Type.NOT) return "NOT(" + children.get(0) + ")";
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(' ').append(type).append(' ');
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
