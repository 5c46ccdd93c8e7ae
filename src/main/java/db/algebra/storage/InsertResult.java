package db.algebra.storage;

import java.util.List;

/**
 * Outcome of an insert batch. A failed result lists every rejected row in batch order;
 * a failed batch stores nothing.
 */
public final class InsertResult {
    private static final InsertResult OK = new InsertResult(List.of());

    private final List<RelationError> errors;

    private InsertResult(List<RelationError> errors) {
        this.errors = errors;
    }

    public static InsertResult ok() { return OK; }

    public static InsertResult failed(List<RelationError> errors) {
        if (errors == null || errors.isEmpty()) throw new IllegalArgumentException("failed result needs at least one error");
        return new InsertResult(List.copyOf(errors));
    }

    public boolean isSuccess() { return errors.isEmpty(); }

    public List<RelationError> errors() { return errors; }

    /** True if any error of this result has the given kind. */
    public boolean hasError(ErrorKind kind) {
        for (RelationError e : errors) if (e.kind() == kind) return true;
        return false;
    }

    @Override
    public String toString() { return isSuccess() ? "InsertResult[ok]" : "InsertResult" + errors; }
}
