package db.algebra.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import db.algebra.catalog.Value;

/**
 * Immutable ordered list of values, positionally aligned with a schema.
 * Two tuples are equal when their value sequences are equal.
 */
public final class Tuple {
    private final List<Value> values;

    public Tuple(List<Value> values) {
        if (values == null) throw new IllegalArgumentException("values must not be null");
        List<Value> copy = new ArrayList<>(values.size());
        for (Value v : values) {
            if (v == null) throw new IllegalArgumentException("tuple values must not be null");
            copy.add(v);
        }
        this.values = Collections.unmodifiableList(copy);
    }

    /** Builds a tuple from plain Java objects, see {@link Value#of(Object)}. */
    public static Tuple of(Object... values) {
        List<Value> converted = new ArrayList<>(values.length);
        for (Object o : values) converted.add(Value.of(o));
        return new Tuple(converted);
    }

    public Value get(int index) { return values.get(index); }

    public int size() { return values.size(); }

    public List<Value> values() { return values; }

    /** New tuple holding the values at the given positions, in that order. */
    public Tuple project(int[] columnIndexes) {
        List<Value> projected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) projected.add(values.get(idx));
        return new Tuple(projected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tuple)) return false;
        return values.equals(((Tuple) o).values);
    }

    @Override
    public int hashCode() { return values.hashCode(); }

    @Override
    public String toString() { return "Tuple" + values; }
}
