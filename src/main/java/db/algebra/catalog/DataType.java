package db.algebra.catalog;

/**
 * Supported scalar attribute types.
 * Declaration order is the type discriminant used when ordering values of different kinds.
 */
public enum DataType {
    INT,
    BOOLEAN,
    VARCHAR;
}
