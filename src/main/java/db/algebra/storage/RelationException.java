package db.algebra.storage;

/**
 * Unchecked failure carrying an {@link ErrorKind}. Raised by schema construction and
 * operator evaluation; insertion reports through {@link InsertResult} instead.
 */
public class RelationException extends RuntimeException {
    private final ErrorKind kind;

    public RelationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() { return kind; }
}
