package db.algebra.exec;

import db.algebra.catalog.Attribute;
import db.algebra.catalog.Schema;
import db.algebra.catalog.Value;
import db.algebra.storage.ErrorKind;
import db.algebra.storage.RelationException;
import db.algebra.storage.Tuple;

/**
 * Compares one column against a literal of the same type.
 * Supports operators: EQ, NE, LT, LTE, GT, GTE, using {@link Value} ordering.
 */
public class ComparisonPredicate implements Predicate {
    public enum Op { EQ, NE, LT, LTE, GT, GTE }

    private final String columnName;
    private final Op op;
    private final Value literal;

    public ComparisonPredicate(String columnName, Op op, Value literal) {
        if (columnName == null || op == null || literal == null) {
            throw new IllegalArgumentException("column, operator and literal are required");
        }
        this.columnName = columnName;
        this.op = op;
        this.literal = literal;
    }

    public static ComparisonPredicate of(String columnName, Op op, Object literal) {
        return new ComparisonPredicate(columnName, op, Value.of(literal));
    }

    public static ComparisonPredicate eq(String columnName, Object literal) { return of(columnName, Op.EQ, literal); }

    @Override
    public void validate(Schema schema) {
        int idx = schema.indexOf(columnName);
        if (idx < 0) throw new RelationException(ErrorKind.UNKNOWN_ATTRIBUTE, "Column not found: " + columnName);
        Attribute a = schema.attribute(idx);
        if (!literal.is(a.type())) {
            throw new RelationException(ErrorKind.SCHEMA_VIOLATION,
                "Expected literal of type " + a.type() + " for column '" + columnName + "' but got " + literal.type());
        }
    }

    @Override
    public boolean test(Tuple tuple, Schema schema) {
        int c = tuple.get(schema.indexOf(columnName)).compareTo(literal);
        return switch (op) {
            case EQ -> c == 0;
            case NE -> c != 0;
            case LT -> c < 0;
            case LTE -> c <= 0;
            case GT -> c > 0;
            case GTE -> c >= 0;
        };
    }

    @Override
    public String toString() { return columnName + " " + op + " " + literal; }
}
