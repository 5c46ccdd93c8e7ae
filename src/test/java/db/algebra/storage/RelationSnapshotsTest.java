package db.algebra.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.gson.JsonParseException;

import db.algebra.catalog.Attribute;
import db.algebra.catalog.DataType;
import db.algebra.catalog.Schema;
import db.algebra.catalog.Value;

public class RelationSnapshotsTest {

    private static Reader fixture(String name) {
        return new InputStreamReader(RelationSnapshotsTest.class.getResourceAsStream("/fixtures/" + name), StandardCharsets.UTF_8);
    }

    @Test
    void loadsFixtureInKeyOrder() throws Exception {
        Relation users;
        try (Reader r = fixture("users.json")) {
            users = RelationSnapshots.read(r);
        }
        assertEquals("users", users.name());
        assertEquals(0, users.primaryKeyIndex());
        assertEquals(DataType.INT, users.schema().attribute(2).type());
        assertEquals(List.of(
            Tuple.of(100, "bob", 9999999999L),
            Tuple.of(101, "alice", 6666666666L)
        ), users.tuples());
    }

    @Test
    void rejectsRowsThatBreakTheSchema() throws Exception {
        try (Reader r = fixture("users-bad-type.json")) {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> RelationSnapshots.read(r));
            assertTrue(ex.getMessage().contains("SCHEMA_VIOLATION"));
        }
    }

    @Test
    void rejectsFractionalNumbers() {
        String json = "{\"name\":\"n\",\"primaryKey\":0,\"attributes\":[{\"name\":\"x\",\"type\":\"INT\"}],\"rows\":[[1.5]]}";
        assertThrows(JsonParseException.class, () -> RelationSnapshots.fromJson(json));
    }

    @Test
    void writesAndReadsBackThroughAFile(@TempDir Path dir) throws Exception {
        Relation r = new Relation("flags", Schema.of(
            Attribute.of("id", DataType.INT),
            Attribute.of("label", DataType.VARCHAR),
            Attribute.of("on", DataType.BOOLEAN)
        ), 0);
        r.insertRows(List.of(Tuple.of(2, "b", false), Tuple.of(1, "a", true)));

        File f = dir.resolve("nested/flags.json").toFile();
        RelationSnapshots.write(r, f);
        Relation back = RelationSnapshots.read(f);

        assertEquals(r.schema(), back.schema());
        assertEquals(r.tuples(), back.tuples());
        assertEquals(Tuple.of(1, "a", true), back.lookup(Value.ofInt(1)).orElseThrow());
    }

    @Test
    void derivedRelationsKeepSequentialKeying() {
        Relation d = Relation.derive(Schema.of(Attribute.of("v", DataType.VARCHAR)), List.of(Tuple.of("x"), Tuple.of("y")));
        String json = RelationSnapshots.toJson(d);
        assertTrue(json.contains("\"primaryKey\": -1"));
        Relation back = RelationSnapshots.fromJson(json);
        assertTrue(back.isSequentiallyKeyed());
        assertEquals(d.tuples(), back.tuples());
    }

    @Test
    void rejectsUnknownAttributeType() {
        String json = "{\"name\":\"n\",\"primaryKey\":0,\"attributes\":[{\"name\":\"x\",\"type\":\"FLOAT\"}],\"rows\":[]}";
        JsonParseException ex = assertThrows(JsonParseException.class, () -> RelationSnapshots.fromJson(json));
        assertTrue(ex.getMessage().contains("FLOAT"));
    }

    @Test
    void rejectsMissingAttributeType() {
        String json = "{\"name\":\"n\",\"primaryKey\":0,\"attributes\":[{\"name\":\"x\"}]}";
        assertThrows(JsonParseException.class, () -> RelationSnapshots.fromJson(json));
    }

    @Test
    void rejectsNullAttributeEntry() {
        String json = "{\"name\":\"n\",\"primaryKey\":0,\"attributes\":[null]}";
        assertThrows(JsonParseException.class, () -> RelationSnapshots.fromJson(json));
    }

    @Test
    void rejectsRepeatedTupleInSequentialSnapshot() {
        String json = "{\"name\":\"d\",\"primaryKey\":-1,\"attributes\":[{\"name\":\"v\",\"type\":\"VARCHAR\"}],"
            + "\"rows\":[[\"x\"],[\"x\"]]}";
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> RelationSnapshots.fromJson(json));
        assertTrue(ex.getMessage().contains("DUPLICATE_PRIMARY_KEY"));
    }

    @Test
    void badAttributeTypeInFileIsReported(@TempDir Path dir) throws Exception {
        File f = dir.resolve("bad.json").toFile();
        Files.writeString(f.toPath(),
            "{\"name\":\"n\",\"primaryKey\":0,\"attributes\":[{\"name\":\"x\",\"type\":\"FLOAT\"}]}");
        assertThrows(JsonParseException.class, () -> RelationSnapshots.read(f));
    }
}
