package db.algebra;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Options for the demo entry point. Unknown flags are ignored.
 */
public class DemoConfig {
    public final Path exportDir; // null: no JSON export
    public final boolean quiet;

    public DemoConfig(Path exportDir, boolean quiet) {
        this.exportDir = exportDir;
        this.quiet = quiet;
    }

    public static DemoConfig defaultConfig() { return new DemoConfig(null, false); }

    public static DemoConfig fromArgs(String[] args) {
        Path exportDir = null;
        boolean quiet = false;

        for (String a : args) {
            if (a == null) continue;
            String s = a.trim();
            if (s.startsWith("--export=")) {
                String dir = s.substring("--export=".length());
                if (!dir.isEmpty()) exportDir = Paths.get(dir);
            } else if (s.equals("--quiet")) {
                quiet = true;
            }
        }
        return new DemoConfig(exportDir, quiet);
    }
}
