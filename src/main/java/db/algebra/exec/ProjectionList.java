package db.algebra.exec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import db.algebra.catalog.Attribute;
import db.algebra.catalog.DataType;
import db.algebra.catalog.Schema;
import db.algebra.storage.ErrorKind;
import db.algebra.storage.RelationException;

/**
 * Ordered attribute selection of a projection; list order is output column order.
 * A selector may pin the attribute type, in which case the input column must have that type too.
 * {@link #all()} selects every input column in schema order.
 */
public final class ProjectionList {
    /** Selected column name, with an optional expected type (null accepts any). */
    public record Selector(String name, DataType type) {
        public Selector {
            if (name == null || name.isEmpty()) throw new IllegalArgumentException("selector name must be non-empty");
        }

        boolean matches(Attribute a) {
            return a.name().equals(name) && (type == null || a.type() == type);
        }

        @Override
        public String toString() { return type == null ? name : name + ":" + type; }
    }

    private static final ProjectionList ALL = new ProjectionList(Collections.emptyList());

    private final List<Selector> selectors; // empty only for ALL

    private ProjectionList(List<Selector> selectors) {
        this.selectors = selectors;
    }

    public static ProjectionList all() { return ALL; }

    public static ProjectionList of(String... names) { return of(Arrays.asList(names)); }

    public static ProjectionList of(List<String> names) {
        if (names == null || names.isEmpty()) throw new IllegalArgumentException("columnNames must be non-empty");
        List<Selector> sel = new ArrayList<>(names.size());
        for (String n : names) sel.add(new Selector(n, null));
        return new ProjectionList(List.copyOf(sel));
    }

    /** Selection matching both name and type of each attribute. */
    public static ProjectionList ofAttributes(Attribute... attributes) {
        if (attributes.length == 0) throw new IllegalArgumentException("attributes must be non-empty");
        List<Selector> sel = new ArrayList<>(attributes.length);
        for (Attribute a : attributes) sel.add(new Selector(a.name(), a.type()));
        return new ProjectionList(List.copyOf(sel));
    }

    public boolean isAll() { return this == ALL; }

    public List<Selector> selectors() { return selectors; }

    /**
     * Column positions in the input schema, in output order.
     *
     * @throws RelationException UNKNOWN_ATTRIBUTE when a selector matches no input column
     */
    public int[] resolve(Schema input) {
        if (isAll()) {
            int[] idxs = new int[input.arity()];
            for (int i = 0; i < idxs.length; i++) idxs[i] = i;
            return idxs;
        }
        int[] idxs = new int[selectors.size()];
        for (int i = 0; i < selectors.size(); i++) {
            Selector s = selectors.get(i);
            int found = input.indexOf(s.name());
            if (found == -1 || !s.matches(input.attribute(found))) {
                throw new RelationException(ErrorKind.UNKNOWN_ATTRIBUTE,
                    "Selected attribute " + s + " does not exist in " + input);
            }
            idxs[i] = found;
        }
        return idxs;
    }

    @Override
    public String toString() { return isAll() ? "*" : selectors.toString(); }
}
