package com.github.jshook.cqllabs.formatting;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TableRendererTest {
    private final TableRenderer renderer = new TableRenderer();

    private static MapRow user(String id, String name, Object age) {
        return MapRow.builder()
            .other("id", id)
            .other("name", name)
            .numeric("age", age)
            .build();
    }

    @Test
    public void testEmptyRowsRenderPlaceholder() {
        assertEquals("Nothing", renderer.render(List.of()));
        assertEquals("Nothing", renderer.render(null));
        assertEquals("Nothing", renderer.render(List.of(ColumnDescriptor.other("id")), List.of()));
    }

    @Test
    public void testTwoUsers() {
        String expected = ""
            + "+---+----+---+\n"
            + "|id |name|age|\n"
            + "+---+----+---+\n"
            + "|123|jon | 32|\n"
            + "|456|mary| 25|\n"
            + "+---+----+---+\n";
        assertEquals(expected, renderer.render(List.of(user("123", "jon", 32), user("456", "mary", 25))));
    }

    @Test
    public void testHeadersWiderThanValues() {
        String expected = ""
            + "+--+----+---+\n"
            + "|id|name|age|\n"
            + "+--+----+---+\n"
            + "|1 |Al  |  5|\n"
            + "+--+----+---+\n";
        assertEquals(expected, renderer.render(List.of(user("1", "Al", 5))));
    }

    @Test
    public void testValueWiderThanHeader() {
        String expected = ""
            + "+--+----------+---+\n"
            + "|id|name      |age|\n"
            + "+--+----------+---+\n"
            + "|9 |Anastasios| 39|\n"
            + "|14|Alan      | 22|\n"
            + "+--+----------+---+\n";
        assertEquals(expected, renderer.render(List.of(user("9", "Anastasios", 39), user("14", "Alan", 22))));
    }

    @Test
    public void testWidthFollowsWidestValueAnywhere() {
        List<MapRow> rows = List.of(
            user("1", "a", 1),
            user("2", "b", 2),
            user("3", "Emma-Sophie", 123456));

        String[] lines = renderer.render(rows).split("\n");
        int[] expectedWidths = {2, 11, 6};
        for (String line : lines) {
            char delimiter = line.charAt(0);
            String[] fields = line.substring(1).split(delimiter == '+' ? "\\+" : "\\|", -1);
            assertEquals(4, fields.length, line);
            for (int i = 0; i < expectedWidths.length; i++) {
                assertEquals(expectedWidths[i], fields[i].length(), line);
            }
        }
    }

    @Test
    public void testStructure() {
        List<MapRow> rows = List.of(user("1", "a", 1), user("2", "b", 2), user("3", "c", 3));
        String rendered = renderer.render(rows);
        String[] lines = rendered.split("\n");

        assertEquals(rows.size() + 4, lines.length);
        assertEquals(lines[0], lines[2]);
        assertEquals(lines[0], lines[lines.length - 1]);
        assertTrue(lines[0].matches("\\+(-+\\+)+"));
        for (int i = 3; i < lines.length - 1; i++) {
            assertEquals(4, lines[i].chars().filter(c -> c == '|').count(), lines[i]);
        }
        assertEquals(4, lines[1].chars().filter(c -> c == '|').count());
        assertTrue(rendered.endsWith("+\n"));
    }

    @Test
    public void testNumericColumnsRightAlignedOthersLeftAligned() {
        MapRow row = MapRow.builder()
            .numeric("amount", 1.5)
            .other("code", "007")
            .numeric("total", new BigDecimal("2.5"))
            .build();

        String[] lines = renderer.render(List.of(row)).split("\n");
        assertEquals("|amount|code|total|", lines[1]);
        assertEquals("|   1.5|007 |  2.5|", lines[3]);
    }

    @Test
    public void testValuesAreNeverTruncated() {
        String longName = "Panagiotis-Alexandros-Konstantinos-Papadopoulos";
        String rendered = renderer.render(List.of(user("8", longName, 66)));
        assertTrue(rendered.contains("|" + longName + "|"));
    }

    @Test
    public void testNullValuesRenderAsNull() {
        String[] lines = renderer.render(List.of(user("1", null, null))).split("\n");
        assertEquals("|1 |null|null|", lines[3]);
    }

    @Test
    public void testExplicitColumnsSetOrder() {
        List<ColumnDescriptor> columns = List.of(ColumnDescriptor.numeric("age"), ColumnDescriptor.other("name"));
        String expected = ""
            + "+---+----+\n"
            + "|age|name|\n"
            + "+---+----+\n"
            + "| 32|jon |\n"
            + "+---+----+\n";
        assertEquals(expected, renderer.render(columns, List.of(user("123", "jon", 32))));
    }

    @Test
    public void testMissingColumnFailsFast() {
        MapRow partial = MapRow.builder().other("id", "456").other("name", "mary").build();

        SchemaMismatchException e = assertThrows(SchemaMismatchException.class,
            () -> renderer.render(List.of(user("123", "jon", 32), partial)));
        assertEquals(1, e.getRowIndex());
        assertEquals("age", e.getColumnName());
    }
}
