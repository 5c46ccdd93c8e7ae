package db.algebra.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import db.algebra.catalog.Attribute;
import db.algebra.catalog.DataType;
import db.algebra.catalog.Schema;
import db.algebra.storage.Relation;
import db.algebra.storage.Tuple;

/**
 * Nested queries: derived relations fed back into further operators.
 */
public class OperatorTreeTest {

    private static Relation users() {
        Relation users = new Relation("users", Schema.of(
            Attribute.of("id", DataType.INT),
            Attribute.of("name", DataType.VARCHAR),
            Attribute.of("phone", DataType.INT)
        ), 0);
        assertTrue(users.insertRows(List.of(
            Tuple.of(100, "bob", 9999999999L),
            Tuple.of(101, "alice", 6666666666L)
        )).isSuccess());
        return users;
    }

    @Test
    void projectionOfProjectionOverUsers() {
        Relation users = users();
        Relation contacts = new Projection(users, ProjectionList.of("name", "phone")).evaluate().orElseThrow();
        assertEquals(Set.of(Tuple.of("bob", 9999999999L), Tuple.of("alice", 6666666666L)), new HashSet<>(contacts.tuples()));

        Relation phones = new Projection(contacts, ProjectionList.of("phone")).evaluate().orElseThrow();
        assertEquals(Set.of(Tuple.of(9999999999L), Tuple.of(6666666666L)), new HashSet<>(phones.tuples()));
    }

    @Test
    void nestedTreeMatchesStepwiseEvaluation() {
        Relation users = users();
        Operator inner = new Projection(users, ProjectionList.of("name", "phone"));
        Operator outer = new Projection(inner, ProjectionList.of("phone"));
        Relation stepwise = new Projection(inner.evaluate().orElseThrow(), ProjectionList.of("phone")).evaluate().orElseThrow();
        assertEquals(stepwise.tuples(), outer.evaluate().orElseThrow().tuples());
    }

    @Test
    void projectionComposesWithSubsetProjection() {
        Relation r = new Relation("r", Schema.of(
            Attribute.of("a", DataType.INT),
            Attribute.of("b", DataType.VARCHAR),
            Attribute.of("c", DataType.BOOLEAN),
            Attribute.of("d", DataType.VARCHAR)
        ), 0);
        r.insertRows(List.of(
            Tuple.of(1, "x", true, "p"),
            Tuple.of(2, "y", false, "p"),
            Tuple.of(3, "x", true, "q"),
            Tuple.of(4, "x", false, "p")
        ));
        Operator twice = new Projection(new Projection(r, ProjectionList.of("d", "b", "c")), ProjectionList.of("c", "b"));
        Operator once = new Projection(r, ProjectionList.of("c", "b"));
        assertEquals(new HashSet<>(once.evaluate().orElseThrow().tuples()),
            new HashSet<>(twice.evaluate().orElseThrow().tuples()));
        assertEquals(once.evaluate().orElseThrow().schema(), twice.evaluate().orElseThrow().schema());
    }

    @Test
    void selectionThenProjection() {
        Relation users = users();
        Operator tree = new Projection(
            new Selection(users, ComparisonPredicate.of("phone", ComparisonPredicate.Op.LT, 7000000000L)),
            ProjectionList.of("name"));
        assertEquals(List.of(Tuple.of("alice")), tree.evaluate().orElseThrow().tuples());
    }

    @Test
    void evaluationDoesNotMutateInput() {
        Relation users = users();
        List<Tuple> before = users.tuples();
        new Projection(new Projection(users, ProjectionList.of("name")), ProjectionList.all()).evaluate();
        new Projection(users, ProjectionList.of("missing")).evaluate();
        assertEquals(before, users.tuples());
        assertEquals("users", users.name());
    }

    @Test
    void scanYieldsItsRelation() {
        Relation users = users();
        assertSame(users, Operator.scan(users).evaluate().orElseThrow());
    }
}
