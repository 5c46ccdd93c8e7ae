package db.algebra.storage;

/**
 * Recoverable failure categories reported by relations, schemas and operators.
 */
public enum ErrorKind {
    /** Tuple arity or a value type does not match the schema. */
    SCHEMA_VIOLATION,
    /** Primary key already stored, or repeated inside one batch. */
    DUPLICATE_PRIMARY_KEY,
    /** Two attributes of one schema share a name. */
    DUPLICATE_ATTRIBUTE_NAME,
    /** An operator references a column the input schema does not have. */
    UNKNOWN_ATTRIBUTE,
    /** An operator leaf has no relation to read. */
    MISSING_INPUT;
}
