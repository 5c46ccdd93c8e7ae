package db.algebra.catalog;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import db.algebra.exec.Projection;
import db.algebra.exec.ProjectionList;
import db.algebra.storage.Relation;

public class RelationCatalogTest {
    @Test
    void registersBaseAndDerivedRelations() {
        RelationCatalog catalog = new RelationCatalog();
        Relation r = new Relation("kv", Schema.of(Attribute.of("k", DataType.INT), Attribute.of("v", DataType.VARCHAR)), 0);
        assertTrue(catalog.register(r));
        assertFalse(catalog.register(r));

        Relation derived = new Projection(r, ProjectionList.of("v")).evaluate().orElseThrow();
        assertTrue(catalog.register("values", derived));
        assertSame(derived, catalog.get("values"));
        assertSame(r, catalog.get("kv"));
        assertNull(catalog.get("nope"));
        assertEquals(2, catalog.all().size());
    }
}
