package db.algebra.exec;

import db.algebra.catalog.Schema;
import db.algebra.storage.RelationException;
import db.algebra.storage.Tuple;

/**
 * Row condition for {@link Selection}, expressed over column names.
 */
public interface Predicate {
    /**
     * Checks that every referenced column exists in the schema and has a comparable type.
     *
     * @throws RelationException UNKNOWN_ATTRIBUTE or SCHEMA_VIOLATION
     */
    void validate(Schema schema);

    /** Tests a tuple of the given schema. Only called after {@link #validate(Schema)} succeeded. */
    boolean test(Tuple tuple, Schema schema);
}
