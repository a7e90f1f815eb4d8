package com.github.jshook.cqllabs.formatting;

import java.util.List;

/**
 * Renders rows as a bordered ASCII table.
 * <p>
 * Each column is as wide as its header or its widest value, whichever is longer. Numeric columns
 * are right aligned, all others left aligned. Values are never truncated.
 * <pre>
 * +---+----+---+
 * |id |name|age|
 * +---+----+---+
 * |123|jon | 32|
 * +---+----+---+
 * </pre>
 * Instances hold no state and can be shared.
 */
public class TableRenderer {
    /** Rendered in place of a table when there are no rows. */
    public static final String NO_ROWS = "Nothing";

    private static final String NULL_TEXT = "null";

    /**
     * Renders rows using the columns of the first row.
     *
     * @param rows the rows to render
     * @return the rendered table, or {@link #NO_ROWS} if there are no rows
     * @throws SchemaMismatchException if a row lacks a column of the first row
     */
    public String render(List<? extends TabularRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return NO_ROWS;
        }
        return render(rows.get(0).getColumns(), rows);
    }

    /**
     * Renders rows using an explicit list of columns.
     *
     * @param columns the columns, in display order
     * @param rows    the rows to render
     * @return the rendered table, or {@link #NO_ROWS} if there are no rows
     * @throws SchemaMismatchException if a row lacks one of the columns
     */
    public String render(List<ColumnDescriptor> columns, List<? extends TabularRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return NO_ROWS;
        }
        int numColumns = columns.size();

        // Header widths, then widest value per column; every row is converted once
        int[] columnWidths = new int[numColumns];
        for (int i = 0; i < numColumns; i++) {
            columnWidths[i] = columns.get(i).name().length();
        }
        String[][] cells = new String[rows.size()][numColumns];
        for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
            TabularRow row = rows.get(rowIndex);
            for (int i = 0; i < numColumns; i++) {
                String column = columns.get(i).name();
                if (!row.hasColumn(column)) {
                    throw new SchemaMismatchException(rowIndex, column);
                }
                String valueStr = textOf(row.getObject(column));
                cells[rowIndex][i] = valueStr;
                columnWidths[i] = Math.max(columnWidths[i], valueStr.length());
            }
        }

        String separator = separator(columnWidths);
        StringBuilder sb = new StringBuilder();
        sb.append(separator);

        sb.append('|');
        for (int i = 0; i < numColumns; i++) {
            sb.append(padRight(columns.get(i).name(), columnWidths[i])).append('|');
        }
        sb.append('\n');
        sb.append(separator);

        for (String[] line : cells) {
            sb.append('|');
            for (int i = 0; i < numColumns; i++) {
                String cell = columns.get(i).isNumeric()
                        ? padLeft(line[i], columnWidths[i])
                        : padRight(line[i], columnWidths[i]);
                sb.append(cell).append('|');
            }
            sb.append('\n');
        }
        sb.append(separator);

        return sb.toString();
    }

    private static String textOf(Object value) {
        return value == null ? NULL_TEXT : value.toString();
    }

    private static String separator(int[] columnWidths) {
        StringBuilder sb = new StringBuilder("+");
        for (int width : columnWidths) {
            for (int j = 0; j < width; j++) {
                sb.append('-');
            }
            sb.append('+');
        }
        return sb.append('\n').toString();
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) {
            return s;
        }
        StringBuilder sb = new StringBuilder(s);
        while (sb.length() < width) {
            sb.append(' ');
        }
        return sb.toString();
    }

    private static String padLeft(String s, int width) {
        if (s.length() >= width) {
            return s;
        }
        StringBuilder sb = new StringBuilder(width);
        for (int i = s.length(); i < width; i++) {
            sb.append(' ');
        }
        return sb.append(s).toString();
    }
}
