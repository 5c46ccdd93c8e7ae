package db.algebra.exec;

import java.util.ArrayList;
import java.util.List;

import db.algebra.catalog.Schema;
import db.algebra.storage.ErrorKind;
import db.algebra.storage.Relation;
import db.algebra.storage.RelationException;
import db.algebra.storage.Tuple;

/**
 * Set union of two union-compatible relations: same arity and the same type at every position.
 * Column names come from the left input. Left tuples come first, then right tuples not already present.
 */
public class Union extends BinaryOperator {

    public Union(Operator left, Operator right) {
        super(left, right);
    }

    public Union(Relation left, Relation right) {
        this(new RelationScan(left), new RelationScan(right));
    }

    @Override
    protected Relation apply(Relation left, Relation right) {
        Schema ls = left.schema();
        Schema rs = right.schema();
        if (ls.arity() != rs.arity()) {
            throw new RelationException(ErrorKind.SCHEMA_VIOLATION,
                "Union inputs differ in arity: " + ls.arity() + " vs " + rs.arity());
        }
        for (int i = 0; i < ls.arity(); i++) {
            if (ls.attribute(i).type() != rs.attribute(i).type()) {
                throw new RelationException(ErrorKind.SCHEMA_VIOLATION,
                    "Union inputs differ in type at column " + i + ": " + ls.attribute(i) + " vs " + rs.attribute(i));
            }
        }
        List<Tuple> all = new ArrayList<>(left.size() + right.size());
        all.addAll(left.tuples());
        all.addAll(right.tuples());
        return Relation.derive(ls, all);
    }

    @Override
    public String toString() { return "Union(" + left() + ", " + right() + ")"; }
}
