package com.github.jshook.cqllabs.driver;

import com.datastax.oss.driver.api.core.ProtocolVersion;
import com.datastax.oss.driver.api.core.cql.ColumnDefinition;
import com.datastax.oss.driver.api.core.cql.ColumnDefinitions;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.detach.AttachmentPoint;
import com.datastax.oss.driver.api.core.type.codec.TypeCodecs;
import com.datastax.oss.driver.internal.core.cql.DefaultColumnDefinition;
import com.datastax.oss.driver.internal.core.cql.DefaultColumnDefinitions;
import com.datastax.oss.driver.internal.core.cql.DefaultRow;
import com.datastax.oss.protocol.internal.ProtocolConstants;
import com.datastax.oss.protocol.internal.response.result.ColumnSpec;
import com.datastax.oss.protocol.internal.response.result.RawType;
import com.github.jshook.cqllabs.formatting.ColumnDescriptor;
import com.github.jshook.cqllabs.formatting.TableRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DriverRowTest {

    private List<DriverRow> rows;

    @BeforeEach
    public void setUp() {
        ColumnDefinitions definitions = DefaultColumnDefinitions.valueOf(List.of(
            column("id", 0, ProtocolConstants.DataType.VARCHAR),
            column("age", 1, ProtocolConstants.DataType.INT)));

        Row jon = row(definitions, TypeCodecs.TEXT.encode("123", ProtocolVersion.DEFAULT),
            TypeCodecs.INT.encode(32, ProtocolVersion.DEFAULT));
        Row unknownAge = row(definitions, TypeCodecs.TEXT.encode("456", ProtocolVersion.DEFAULT), null);
        rows = DriverRow.wrap(List.of(jon, unknownAge));
    }

    private static ColumnDefinition column(String name, int index, int typeCode) {
        return new DefaultColumnDefinition(
            new ColumnSpec("education", "user", name, index, RawType.PRIMITIVES.get(typeCode)),
            AttachmentPoint.NONE);
    }

    private static Row row(ColumnDefinitions definitions, ByteBuffer... values) {
        return new DefaultRow(definitions, Arrays.asList(values), AttachmentPoint.NONE);
    }

    @Test
    public void testColumnsFollowDefinitions() {
        assertEquals(List.of(ColumnDescriptor.other("id"), ColumnDescriptor.numeric("age")),
            rows.get(0).getColumns());
        assertSame(rows.get(0).getColumns(), rows.get(1).getColumns());
    }

    @Test
    public void testRendersDriverRows() {
        String expected = "+---+----+\n"
            + "|id |age |\n"
            + "+---+----+\n"
            + "|123|  32|\n"
            + "|456|null|\n"
            + "+---+----+\n";
        assertEquals(expected, new TableRenderer().render(rows));
    }

    @Test
    public void testReadsValuesByName() {
        assertEquals("123", rows.get(0).getObject("id"));
        assertEquals(32, rows.get(0).getObject("age"));
        assertNull(rows.get(1).getObject("age"));
    }

    @Test
    public void testUnknownColumn() {
        DriverRow row = rows.get(0);
        assertTrue(row.hasColumn("id"));
        assertFalse(row.hasColumn("name"));
        assertThrows(IllegalArgumentException.class, () -> row.getObject("name"));
    }

    @Test
    public void testWrapsNoRows() {
        assertTrue(DriverRow.wrap(List.of()).isEmpty());
    }
}
