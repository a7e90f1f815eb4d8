package com.github.jshook.cqllabs.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.jshook.cqllabs.config.FormattingConfig;
import com.github.jshook.cqllabs.config.OutputFormat;
import com.github.jshook.cqllabs.formatting.MapRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ResultFormatterFactoryTest {
    private static final List<MapRow> USERS = List.of(
        MapRow.builder().other("id", "123").other("name", "jon").numeric("age", 32).build(),
        MapRow.builder().other("id", "456").other("name", "mary, jr").numeric("age", null).build());

    @Test
    public void testTabular() {
        String formatted = ResultFormatterFactory.createFormatter(OutputFormat.TABULAR).format(USERS);
        assertTrue(formatted.startsWith("+---+--------+----+\n|id |name    |age |\n"), formatted);
        assertTrue(formatted.contains("|123|jon     |  32|\n"), formatted);
    }

    @Test
    public void testJson() throws Exception {
        String formatted = ResultFormatterFactory.createFormatter(OutputFormat.JSON).format(USERS);

        JsonNode root = new ObjectMapper().readTree(formatted);
        assertEquals(2, root.size());
        assertEquals("123", root.get(0).get("id").asText());
        assertTrue(root.get(0).get("age").isInt());
        assertEquals(32, root.get(0).get("age").asInt());
        assertTrue(root.get(1).get("age").isNull());
    }

    @Test
    public void testCsv() {
        String formatted = ResultFormatterFactory.createFormatter(OutputFormat.CSV).format(USERS);
        assertEquals("id,name,age\r\n123,jon,32\r\n456,\"mary, jr\",\r\n", formatted);
    }

    @Test
    public void testEmptyResults() {
        assertEquals("Nothing", ResultFormatterFactory.createFormatter(OutputFormat.TABULAR).format(List.of()));
        assertEquals("[]", ResultFormatterFactory.createFormatter(OutputFormat.JSON).format(List.of()));
        assertEquals("", ResultFormatterFactory.createFormatter(OutputFormat.CSV).format(List.of()));
    }

    @Test
    public void testFactoryFollowsConfigChanges() {
        FormattingConfig config = new FormattingConfig();
        ResultFormatterFactory factory = new ResultFormatterFactory(config);
        assertEquals("Nothing", factory.createFormatter().format(List.of()));

        config.setOutputFormat(OutputFormat.JSON);
        assertEquals("[]", factory.createFormatter().format(List.of()));
    }
}
