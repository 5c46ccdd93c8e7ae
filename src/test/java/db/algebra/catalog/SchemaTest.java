package db.algebra.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Optional;
import org.junit.jupiter.api.Test;

import db.algebra.storage.ErrorKind;
import db.algebra.storage.RelationException;
import db.algebra.storage.Tuple;

public class SchemaTest {
    private static Schema keyValue() {
        return Schema.of(Attribute.of("key", DataType.INT), Attribute.of("value", DataType.VARCHAR));
    }

    @Test
    void looksUpAttributesByName() {
        Schema s = keyValue();
        assertEquals(2, s.arity());
        assertEquals(0, s.indexOf("key"));
        assertEquals(1, s.indexOf("value"));
        assertEquals(-1, s.indexOf("missing"));
        assertTrue(s.contains("value"));
    }

    @Test
    void rejectsDuplicateAttributeNames() {
        RelationException ex = assertThrows(RelationException.class, () -> Schema.of(
            Attribute.of("id", DataType.INT), Attribute.of("id", DataType.VARCHAR)));
        assertEquals(ErrorKind.DUPLICATE_ATTRIBUTE_NAME, ex.kind());
    }

    @Test
    void validatesArityAndTypes() {
        Schema s = keyValue();
        assertEquals(Optional.empty(), s.validate(Tuple.of(1, "foo")));
        assertTrue(s.validate(Tuple.of("foo", 1)).isPresent());
        assertTrue(s.validate(Tuple.of(1)).isPresent());
        assertTrue(s.validate(Tuple.of(1, "foo", true)).isPresent());
    }

    @Test
    void projectKeepsRequestedOrder() {
        Schema s = keyValue().project(new int[] {1, 0});
        assertEquals("value", s.attribute(0).name());
        assertEquals("key", s.attribute(1).name());
    }

    @Test
    void rejectsNullAttribute() {
        assertThrows(IllegalArgumentException.class,
            () -> new Schema(Arrays.asList(Attribute.of("id", DataType.INT), null)));
    }
}
