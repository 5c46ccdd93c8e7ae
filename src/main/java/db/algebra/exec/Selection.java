package db.algebra.exec;

import java.util.ArrayList;
import java.util.List;

import db.algebra.catalog.Schema;
import db.algebra.storage.Relation;
import db.algebra.storage.Tuple;

/**
 * Selection (σ): keeps the input tuples that satisfy a predicate, in input key order.
 * The predicate is validated against the input schema before any tuple is read.
 */
public class Selection extends UnaryOperator {
    private final Predicate predicate;

    public Selection(Operator child, Predicate predicate) {
        super(child);
        if (predicate == null) throw new IllegalArgumentException("predicate must not be null");
        this.predicate = predicate;
    }

    public Selection(Relation input, Predicate predicate) {
        this(new RelationScan(input), predicate);
    }

    public Predicate predicate() { return predicate; }

    @Override
    protected Relation apply(Relation input) {
        Schema schema = input.schema();
        predicate.validate(schema);
        List<Tuple> kept = new ArrayList<>();
        for (Tuple t : input.tuples()) {
            if (predicate.test(t, schema)) kept.add(t);
        }
        return Relation.derive(schema, kept);
    }

    @Override
    public String toString() { return "Selection[" + predicate + "](" + child() + ")"; }
}
