package db.algebra.cli;

import java.io.PrintStream;
import java.util.List;

import db.algebra.catalog.Schema;
import db.algebra.storage.Relation;
import db.algebra.storage.Tuple;

/**
 * Simple ASCII table printer for a relation, in key order, with schema names as headers.
 */
public final class TablePrinter {
    private TablePrinter() {}

    public static void print(Relation relation) { print(relation, System.out); }

    public static void print(Relation relation, PrintStream out) { out.print(render(relation)); }

    public static String render(Relation relation) {
        Schema schema = relation.schema();
        List<Tuple> rows = relation.tuples();
        int colCount = schema.arity();
        String[] headers = new String[colCount];
        int[] widths = new int[colCount];
        for (int i = 0; i < colCount; i++) {
            headers[i] = schema.attribute(i).name();
            widths[i] = headers[i].length();
        }
        for (Tuple t : rows) {
            for (int i = 0; i < colCount; i++) {
                String s = String.valueOf(t.get(i));
                if (s.length() > widths[i]) widths[i] = s.length();
            }
        }
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        String divLine = buildDivider(widths);
        sb.append(divLine).append(nl);
        sb.append(buildLine(headers, widths)).append(nl);
        sb.append(divLine).append(nl);
        for (Tuple t : rows) {
            String[] cells = new String[colCount];
            for (int i = 0; i < colCount; i++) cells[i] = String.valueOf(t.get(i));
            sb.append(buildLine(cells, widths)).append(nl);
        }
        sb.append(divLine).append(nl);
        sb.append('(').append(rows.size()).append(" row(s))").append(nl);
        return sb.toString();
    }

    private static String buildDivider(int[] widths) {
        StringBuilder divider = new StringBuilder();
        divider.append('+');
        for (int w : widths) {
            for (int k = 0; k < w + 2; k++) divider.append('-');
            divider.append('+');
        }
        return divider.toString();
    }

    private static String buildLine(String[] cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        sb.append('|');
        for (int i = 0; i < cells.length; i++) {
            sb.append(' ').append(pad(cells[i], widths[i])).append(' ').append('|');
        }
        return sb.toString();
    }

    private static String pad(String s, int width) {
        if (s.length() >= width) return s;
        StringBuilder sb = new StringBuilder(width);
        sb.append(s);
        for (int i = s.length(); i < width; i++) sb.append(' ');
        return sb.toString();
    }
}
