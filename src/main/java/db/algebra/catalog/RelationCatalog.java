package db.algebra.catalog;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import db.algebra.storage.Relation;

/**
 * In-memory name registry for base and derived relations, so a front end can resolve
 * relation names into operator inputs. Nothing is persisted.
 */
public class RelationCatalog {
    private final Map<String, Relation> relations = new TreeMap<>();

    /** Registers under the relation's own name; false if that name is taken. */
    public boolean register(Relation relation) {
        return register(relation.name(), relation);
    }

    /** Registers under an alias, e.g. to keep a "derived" result around under a real name. */
    public boolean register(String name, Relation relation) {
        if (name == null || relation == null) throw new IllegalArgumentException("name and relation are required");
        if (relations.containsKey(name)) return false;
        relations.put(name, relation);
        return true;
    }

    /** Registered relation, or null when the name is unknown. */
    public Relation get(String name) { return relations.get(name); }

    public boolean contains(String name) { return relations.containsKey(name); }

    public Map<String, Relation> all() { return Collections.unmodifiableMap(relations); }
}
