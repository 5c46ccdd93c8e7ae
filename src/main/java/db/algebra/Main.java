package db.algebra;

import java.io.File;
import java.io.IOException;
import java.util.List;

import db.algebra.catalog.Attribute;
import db.algebra.catalog.DataType;
import db.algebra.catalog.RelationCatalog;
import db.algebra.catalog.Schema;
import db.algebra.cli.TablePrinter;
import db.algebra.exec.Operator;
import db.algebra.exec.Projection;
import db.algebra.exec.ProjectionList;
import db.algebra.storage.InsertResult;
import db.algebra.storage.Relation;
import db.algebra.storage.RelationSnapshots;
import db.algebra.storage.Tuple;

public class Main {
    public static void main(String[] args) {
        DemoConfig config = DemoConfig.fromArgs(args);
        RelationCatalog catalog = run(config);
        if (config.exportDir != null) {
            for (var e : catalog.all().entrySet()) {
                File f = config.exportDir.resolve(e.getKey() + ".json").toFile();
                try {
                    RelationSnapshots.write(e.getValue(), f);
                    if (!config.quiet) System.out.println("Exported " + e.getKey() + " to " + f.getPath());
                } catch (IOException ex) {
                    System.err.println("[Main] Failed exporting " + e.getKey() + ": " + ex.getMessage());
                }
            }
        }
    }

    /**
     * Builds the users relation, projects it onto (name, phone) and that result onto (phone),
     * registering every relation in the returned catalog.
     */
    static RelationCatalog run(DemoConfig config) {
        RelationCatalog catalog = new RelationCatalog();
        Relation users = new Relation("users", Schema.of(
            Attribute.of("id", DataType.INT),
            Attribute.of("name", DataType.VARCHAR),
            Attribute.of("phone", DataType.INT)
        ), 0);
        InsertResult inserted = users.insertRows(List.of(
            Tuple.of(100, "bob", 9999999999L),
            Tuple.of(101, "alice", 6666666666L)
        ));
        if (!inserted.isSuccess()) throw new IllegalStateException("Seeding users failed: " + inserted);
        catalog.register(users);
        show(config, "users", users);

        Operator contacts = new Projection(users, ProjectionList.of("name", "phone"));
        Relation contactRel = contacts.evaluate().orElseThrow();
        catalog.register("contacts", contactRel);
        show(config, "PROJECT name, phone FROM users", contactRel);

        // Projection over the previous projection's tree.
        Relation phones = new Projection(contacts, ProjectionList.of("phone")).evaluate().orElseThrow();
        catalog.register("phones", phones);
        show(config, "PROJECT phone FROM (PROJECT name, phone FROM users)", phones);
        return catalog;
    }

    private static void show(DemoConfig config, String title, Relation relation) {
        if (config.quiet) return;
        System.out.println(title);
        TablePrinter.print(relation);
        System.out.println();
    }
}
