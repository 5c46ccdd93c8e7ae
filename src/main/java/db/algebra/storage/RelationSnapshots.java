package db.algebra.storage;

import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;

import db.algebra.catalog.Attribute;
import db.algebra.catalog.DataType;
import db.algebra.catalog.Schema;
import db.algebra.catalog.Value;

/**
 * JSON export/import of a relation: name, key index, attributes and rows in key order.
 * Imported rows go through {@link Relation#insertRows(List)}, so a snapshot that breaks the schema or
 * repeats a key is rejected exactly like a bad insert.
 * This is a hand-off format for display and fixtures, not a durability layer.
 */
public final class RelationSnapshots {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private RelationSnapshots() {}

    // Wire shape; field names are the JSON keys.
    private static final class Snapshot {
        String name;
        int primaryKey;
        List<AttributeEntry> attributes;
        List<JsonArray> rows;
    }

    // Type kept as text so an unknown name is reported here rather than by Gson.
    private static final class AttributeEntry {
        String name;
        String type;

        AttributeEntry() {}

        AttributeEntry(String name, String type) {
            this.name = name;
            this.type = type;
        }
    }

    public static String toJson(Relation relation) {
        return GSON.toJson(toSnapshot(relation));
    }

    public static void write(Relation relation, Writer writer) {
        GSON.toJson(toSnapshot(relation), writer);
    }

    public static void write(Relation relation, File file) throws IOException {
        File parent = file.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            throw new IOException("Could not create directory " + parent.getPath());
        }
        try (FileWriter writer = new FileWriter(file, StandardCharsets.UTF_8)) {
            write(relation, writer);
        }
    }

    public static Relation fromJson(String json) {
        return fromSnapshot(GSON.fromJson(json, Snapshot.class));
    }

    public static Relation read(Reader reader) {
        return fromSnapshot(GSON.fromJson(reader, Snapshot.class));
    }

    public static Relation read(File file) throws IOException {
        try (FileReader reader = new FileReader(file, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (JsonParseException | IllegalArgumentException e) {
            System.err.println("[RelationSnapshots] Failed loading snapshot: " + file.getPath());
            throw e;
        }
    }

    private static Snapshot toSnapshot(Relation relation) {
        Snapshot s = new Snapshot();
        s.name = relation.name();
        s.primaryKey = relation.primaryKeyIndex();
        s.attributes = new ArrayList<>(relation.schema().arity());
        for (Attribute a : relation.schema().attributes()) {
            s.attributes.add(new AttributeEntry(a.name(), a.type().name()));
        }
        s.rows = new ArrayList<>(relation.size());
        for (Tuple t : relation.tuples()) {
            JsonArray row = new JsonArray();
            for (Value v : t.values()) row.add(encode(v));
            s.rows.add(row);
        }
        return s;
    }

    private static Relation fromSnapshot(Snapshot s) {
        if (s == null) throw new JsonParseException("empty snapshot");
        if (s.name == null || s.attributes == null) throw new JsonParseException("snapshot needs 'name' and 'attributes'");
        Relation relation = new Relation(s.name, new Schema(toAttributes(s.attributes)), s.primaryKey);
        List<Tuple> tuples = new ArrayList<>();
        if (s.rows != null) {
            for (JsonArray row : s.rows) {
                List<Value> values = new ArrayList<>(row.size());
                for (JsonElement cell : row) values.add(decode(cell));
                tuples.add(new Tuple(values));
            }
        }
        InsertResult result = relation.insertRows(tuples);
        if (!result.isSuccess()) {
            throw new IllegalArgumentException("Snapshot rows rejected for " + s.name + ": " + result.errors());
        }
        return relation;
    }

    private static List<Attribute> toAttributes(List<AttributeEntry> entries) {
        List<Attribute> attributes = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            AttributeEntry e = entries.get(i);
            if (e == null) throw new JsonParseException("Attribute " + i + " is null");
            if (e.name == null || e.name.isEmpty()) throw new JsonParseException("Attribute " + i + " has no name");
            if (e.type == null) throw new JsonParseException("Attribute '" + e.name + "' has no type");
            DataType type;
            try {
                type = DataType.valueOf(e.type);
            } catch (IllegalArgumentException ex) {
                throw new JsonParseException("Attribute '" + e.name + "' has unknown type " + e.type, ex);
            }
            attributes.add(new Attribute(e.name, type));
        }
        return attributes;
    }

    private static JsonPrimitive encode(Value v) {
        return switch (v.type()) {
            case INT -> new JsonPrimitive(v.asLong());
            case BOOLEAN -> new JsonPrimitive(v.asBoolean());
            case VARCHAR -> new JsonPrimitive(v.asString());
        };
    }

    // Cells decode by their JSON kind; the schema check happens on insert.
    private static Value decode(JsonElement cell) {
        if (cell == null || !cell.isJsonPrimitive()) {
            throw new JsonParseException("Snapshot cells must be JSON primitives, got " + cell);
        }
        JsonPrimitive p = cell.getAsJsonPrimitive();
        if (p.isBoolean()) return Value.ofBoolean(p.getAsBoolean());
        if (p.isString()) return Value.ofString(p.getAsString());
        try {
            return Value.ofInt(new BigDecimal(p.getAsString()).longValueExact());
        } catch (ArithmeticException e) {
            throw new JsonParseException("Not a 64-bit integer: " + p.getAsString(), e);
        }
    }
}
