package db.algebra.exec;

import db.algebra.storage.ErrorKind;
import db.algebra.storage.Relation;
import db.algebra.storage.RelationException;

/**
 * Leaf operator: yields a base or previously derived relation as-is.
 * Holds a reference only; the caller keeps the relation alive and unmodified during evaluation.
 */
public final class RelationScan implements Operator {
    private final Relation relation;

    public RelationScan(Relation relation) {
        this.relation = relation;
    }

    @Override
    public Relation evaluateOrThrow() {
        if (relation == null) throw new RelationException(ErrorKind.MISSING_INPUT, "No input relation");
        return relation;
    }

    public Relation relation() { return relation; }

    @Override
    public String toString() { return relation == null ? "Scan(<none>)" : "Scan(" + relation.name() + ")"; }
}
