package db.algebra.storage;

// One rejected row of an insert batch. rowIndex is the position inside the submitted batch.
public record RelationError(ErrorKind kind, int rowIndex, String message) {
    @Override
    public String toString() { return kind + " at row " + rowIndex + ": " + message; }
}
