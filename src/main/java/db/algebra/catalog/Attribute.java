package db.algebra.catalog;

// Immutable (name, type) pair describing one column of a schema.
public record Attribute(String name, DataType type) {
    public Attribute {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("attribute name must be non-empty");
        if (type == null) throw new IllegalArgumentException("attribute type must not be null: " + name);
    }

    public static Attribute of(String name, DataType type) { return new Attribute(name, type); }

    @Override
    public String toString() { return name + ":" + type; }
}
