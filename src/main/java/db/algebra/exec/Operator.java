package db.algebra.exec;

import java.util.Optional;

import db.algebra.storage.Relation;
import db.algebra.storage.RelationException;

/**
 * Node of an algebraic expression tree. Evaluation walks the tree post-order exactly as written
 * (no rewriting) and produces one relation per node. Inputs are only read, never mutated.
 */
public interface Operator {

    /**
     * Evaluates this subtree.
     *
     * @throws RelationException when an input is missing or the tree does not fit its input schemas
     */
    Relation evaluateOrThrow();

    /** Evaluates this subtree, reporting failure as an empty result. */
    default Optional<Relation> evaluate() {
        try {
            return Optional.of(evaluateOrThrow());
        } catch (RelationException e) {
            System.err.println("[" + getClass().getSimpleName() + "] " + e.kind() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    /** Leaf reading the given relation. */
    static Operator scan(Relation relation) { return new RelationScan(relation); }
}
