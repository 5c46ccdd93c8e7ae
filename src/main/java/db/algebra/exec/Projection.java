package db.algebra.exec;

import java.util.ArrayList;
import java.util.List;

import db.algebra.catalog.Schema;
import db.algebra.storage.Relation;
import db.algebra.storage.Tuple;

/**
 * Projection (π): keeps the selected columns of every input tuple, in selection order,
 * and drops tuples that become duplicates.
 * <p>
 * Input tuples are read in the input's key order; the first occurrence of a projected tuple is kept.
 * The result is a new sequentially keyed relation named "derived" whose schema is exactly the
 * selected attributes. An empty input gives an empty result.
 */
public class Projection extends UnaryOperator {
    private final ProjectionList columns;

    public Projection(Operator child, ProjectionList columns) {
        super(child);
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        this.columns = columns;
    }

    public Projection(Relation input, ProjectionList columns) {
        this(new RelationScan(input), columns);
    }

    /** Projection of the child onto the named columns. */
    public static Projection forColumnNames(Operator child, List<String> columnNames) {
        return new Projection(child, ProjectionList.of(columnNames));
    }

    public ProjectionList columns() { return columns; }

    @Override
    protected Relation apply(Relation input) {
        int[] columnIndexes = columns.resolve(input.schema());
        Schema outSchema = input.schema().project(columnIndexes);
        List<Tuple> projected = new ArrayList<>(input.size());
        for (Tuple t : input.tuples()) {
            projected.add(t.project(columnIndexes));
        }
        return Relation.derive(outSchema, projected);
    }

    @Override
    public String toString() { return "Projection" + columns + "(" + child() + ")"; }
}
