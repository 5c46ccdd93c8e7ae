package db.algebra.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import db.algebra.catalog.Schema;
import db.algebra.catalog.Value;

/**
 * Named, schema-bound set of tuples stored in primary key order.
 * <p>
 * Base relations key every tuple by the value at {@link #primaryKeyIndex()}. Relations produced by
 * operators are sequentially keyed instead: each tuple gets the next INT ordinal (0, 1, 2, ...) in
 * output order, and that ordinal is not part of the schema.
 * <p>
 * Insertion is all-or-nothing per batch. Not thread-safe; callers must not mutate a relation while an
 * operator tree reading it is being evaluated.
 */
public class Relation {
    /** Key index marker for relations addressed by a synthetic ordinal rather than a column. */
    public static final int SEQUENTIAL_KEY = -1;

    public static final String DERIVED_NAME = "derived";

    private final String name;
    private final Schema schema;
    private final int primaryKeyIndex;
    private final TreeMap<Value, Tuple> storage = new TreeMap<>();

    public Relation(String name, Schema schema, int primaryKeyIndex) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("relation name must be non-empty");
        if (schema == null) throw new IllegalArgumentException("schema must not be null");
        if (primaryKeyIndex != SEQUENTIAL_KEY && (primaryKeyIndex < 0 || primaryKeyIndex >= schema.arity())) {
            throw new IllegalArgumentException("Primary key index " + primaryKeyIndex + " out of range for " + schema);
        }
        this.name = name;
        this.schema = schema;
        this.primaryKeyIndex = primaryKeyIndex;
    }

    /** Base relation keyed by the named attribute. */
    public static Relation keyedBy(String name, Schema schema, String keyAttribute) {
        int idx = schema.indexOf(keyAttribute);
        if (idx < 0) throw new IllegalArgumentException("Key attribute not in schema: " + keyAttribute);
        return new Relation(name, schema, idx);
    }

    /**
     * Builds a sequentially keyed relation named {@value #DERIVED_NAME} from the given tuples.
     * A tuple equal to one already kept is skipped, so the first occurrence wins and order is preserved.
     * Every tuple must already fit the schema.
     */
    public static Relation derive(Schema schema, Iterable<Tuple> tuples) {
        Relation out = new Relation(DERIVED_NAME, schema, SEQUENTIAL_KEY);
        Set<Tuple> distinct = new LinkedHashSet<>();
        for (Tuple t : tuples) distinct.add(t);
        for (Tuple t : distinct) {
            Optional<String> violation = schema.validate(t);
            if (violation.isPresent()) {
                throw new RelationException(ErrorKind.SCHEMA_VIOLATION, "Derived tuple " + t + " rejected: " + violation.get());
            }
            out.storage.put(Value.ofInt(out.storage.size()), t);
        }
        return out;
    }

    public InsertResult insertRow(Tuple row) {
        return insertRows(Collections.singletonList(row));
    }

    /**
     * Validates the whole batch and stores it only if every row passes.
     * Rows are checked in order for arity, value types and key uniqueness (against storage and
     * against earlier rows of the same batch); every failing row is reported.
     * Sequentially keyed relations hold a set of tuples, so there a row equal to a stored tuple or to an
     * earlier row of the batch counts as a duplicate key.
     */
    public InsertResult insertRows(List<Tuple> rows) {
        if (rows == null) throw new IllegalArgumentException("rows must not be null");
        List<RelationError> errors = new ArrayList<>();
        List<Value> keys = new ArrayList<>(rows.size());
        Set<Value> batchKeys = new HashSet<>();
        Set<Tuple> batchRows = new HashSet<>();
        for (int i = 0; i < rows.size(); i++) {
            Tuple row = rows.get(i);
            if (row == null) {
                errors.add(new RelationError(ErrorKind.SCHEMA_VIOLATION, i, "null row"));
                continue;
            }
            Optional<String> violation = schema.validate(row);
            if (violation.isPresent()) {
                errors.add(new RelationError(ErrorKind.SCHEMA_VIOLATION, i, violation.get()));
                continue;
            }
            if (isSequentiallyKeyed()) {
                Value key = Value.ofInt(storage.size() + (long) i);
                if (storage.containsValue(row)) {
                    errors.add(new RelationError(ErrorKind.DUPLICATE_PRIMARY_KEY, i, "tuple " + row + " already exists"));
                } else if (!batchRows.add(row)) {
                    errors.add(new RelationError(ErrorKind.DUPLICATE_PRIMARY_KEY, i, "tuple " + row + " repeated in batch"));
                }
                keys.add(key);
                continue;
            }
            Value key = row.get(primaryKeyIndex);
            if (storage.containsKey(key)) {
                errors.add(new RelationError(ErrorKind.DUPLICATE_PRIMARY_KEY, i, "key " + key + " already exists"));
            } else if (!batchKeys.add(key)) {
                errors.add(new RelationError(ErrorKind.DUPLICATE_PRIMARY_KEY, i, "key " + key + " repeated in batch"));
            }
            keys.add(key);
        }
        if (!errors.isEmpty()) {
            System.err.println("[Relation] " + name + ": rejected batch of " + rows.size() + " row(s): " + errors);
            return InsertResult.failed(errors);
        }
        for (int i = 0; i < rows.size(); i++) {
            storage.put(keys.get(i), rows.get(i));
        }
        return InsertResult.ok();
    }

    /** Current contents in primary key order. The returned list is a snapshot. */
    public List<Tuple> tuples() {
        return List.copyOf(storage.values());
    }

    public Optional<Tuple> lookup(Value primaryKey) {
        if (primaryKey == null) return Optional.empty();
        return Optional.ofNullable(storage.get(primaryKey));
    }

    /** Key/tuple pairs in key order; for sequentially keyed relations the keys are the ordinals. */
    public Map<Value, Tuple> entries() {
        return Collections.unmodifiableMap(storage);
    }

    public String name() { return name; }

    public Schema schema() { return schema; }

    public int primaryKeyIndex() { return primaryKeyIndex; }

    public boolean isSequentiallyKeyed() { return primaryKeyIndex == SEQUENTIAL_KEY; }

    public int size() { return storage.size(); }

    public boolean isEmpty() { return storage.isEmpty(); }

    @Override
    public String toString() {
        return "Relation[" + name + ", " + schema + ", pk=" + (isSequentiallyKeyed() ? "seq" : primaryKeyIndex)
            + ", rows=" + storage.size() + "]";
    }
}
