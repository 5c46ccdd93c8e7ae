package db.algebra.catalog;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import db.algebra.storage.ErrorKind;
import db.algebra.storage.RelationException;
import db.algebra.storage.Tuple;

/**
 * Ordered, immutable list of attributes describing the shape of every tuple in a relation.
 * Attribute names are unique; the position of an attribute is its column index.
 */
public final class Schema {
    private final List<Attribute> attributes;

    public Schema(List<Attribute> attributes) {
        if (attributes == null) throw new IllegalArgumentException("attributes must not be null");
        Set<String> seen = new HashSet<>();
        for (Attribute a : attributes) {
            if (a == null) throw new IllegalArgumentException("attributes must not contain null");
            if (!seen.add(a.name())) {
                throw new RelationException(ErrorKind.DUPLICATE_ATTRIBUTE_NAME, "Duplicate attribute name: " + a.name());
            }
        }
        this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));
    }

    public static Schema of(Attribute... attributes) { return new Schema(Arrays.asList(attributes)); }

    public List<Attribute> attributes() { return attributes; }

    public Attribute attribute(int index) { return attributes.get(index); }

    public int arity() { return attributes.size(); }

    /** Position of the named attribute, or -1 when the schema has no such attribute. */
    public int indexOf(String name) {
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).name().equals(name)) return i;
        }
        return -1;
    }

    public boolean contains(String name) { return indexOf(name) >= 0; }

    /** Schema made of the attributes at the given positions, in that order. */
    public Schema project(int[] columnIndexes) {
        List<Attribute> selected = new ArrayList<>(columnIndexes.length);
        for (int idx : columnIndexes) selected.add(attributes.get(idx));
        return new Schema(selected);
    }

    /**
     * Checks arity and per-position types of a tuple.
     * Returns a description of the first violation, or empty when the tuple fits.
     */
    public Optional<String> validate(Tuple tuple) {
        if (tuple.size() != arity()) {
            return Optional.of("arity mismatch: expected " + arity() + " values but got " + tuple.size());
        }
        for (int i = 0; i < attributes.size(); i++) {
            Attribute a = attributes.get(i);
            Value v = tuple.get(i);
            if (!v.is(a.type())) {
                return Optional.of("type mismatch at '" + a.name() + "': expected " + a.type() + " but got " + v.type());
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema)) return false;
        return attributes.equals(((Schema) o).attributes);
    }

    @Override
    public int hashCode() { return attributes.hashCode(); }

    @Override
    public String toString() { return "Schema" + attributes; }
}
