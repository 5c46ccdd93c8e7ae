package db.algebra.catalog;

import java.util.Objects;

/**
 * Immutable tagged scalar stored in a tuple cell.
 * Ordering is total: first by {@link DataType} declaration order, then by the payload's natural order.
 * There is no coercion between kinds, so INT 1 and VARCHAR "1" are different values.
 */
public final class Value implements Comparable<Value> {
    private final DataType type;
    private final Object payload; // Long, Boolean or String depending on type

    private Value(DataType type, Object payload) {
        this.type = type;
        this.payload = payload;
    }

    public static Value ofInt(long v) { return new Value(DataType.INT, v); }

    public static Value ofBoolean(boolean v) { return new Value(DataType.BOOLEAN, v); }

    public static Value ofString(String v) {
        if (v == null) throw new IllegalArgumentException("VARCHAR value must not be null");
        return new Value(DataType.VARCHAR, v);
    }

    /**
     * Wraps a plain Java object: Integer/Long become INT, Boolean becomes BOOLEAN, String becomes VARCHAR.
     * Values are passed through unchanged.
     */
    public static Value of(Object v) {
        if (v instanceof Value) return (Value) v;
        if (v instanceof Integer) return ofInt((Integer) v);
        if (v instanceof Long) return ofInt((Long) v);
        if (v instanceof Boolean) return ofBoolean((Boolean) v);
        if (v instanceof String) return ofString((String) v);
        throw new IllegalArgumentException("Unsupported value: " + (v == null ? "null" : v.getClass().getSimpleName()));
    }

    public DataType type() { return type; }

    public boolean is(DataType t) { return type == t; }

    public long asLong() {
        requireType(DataType.INT);
        return (Long) payload;
    }

    public boolean asBoolean() {
        requireType(DataType.BOOLEAN);
        return (Boolean) payload;
    }

    public String asString() {
        requireType(DataType.VARCHAR);
        return (String) payload;
    }

    private void requireType(DataType expected) {
        if (type != expected) throw new IllegalStateException("Value " + this + " is " + type + ", not " + expected);
    }

    @Override
    public int compareTo(Value other) {
        int byType = type.compareTo(other.type);
        if (byType != 0) return byType;
        return switch (type) {
            case INT -> Long.compare((Long) payload, (Long) other.payload);
            case BOOLEAN -> Boolean.compare((Boolean) payload, (Boolean) other.payload);
            case VARCHAR -> ((String) payload).compareTo((String) other.payload);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        return type == other.type && payload.equals(other.payload);
    }

    @Override
    public int hashCode() { return Objects.hash(type, payload); }

    @Override
    public String toString() { return String.valueOf(payload); }
}
