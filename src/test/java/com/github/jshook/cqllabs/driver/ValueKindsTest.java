package com.github.jshook.cqllabs.driver;

import com.datastax.oss.driver.api.core.type.DataType;
import com.datastax.oss.driver.api.core.type.DataTypes;
import com.github.jshook.cqllabs.formatting.ValueKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ValueKindsTest {

    @Test
    public void testNumberTypesAreNumeric() {
        List<DataType> numeric = List.of(
            DataTypes.INT, DataTypes.BIGINT, DataTypes.SMALLINT, DataTypes.TINYINT, DataTypes.VARINT,
            DataTypes.COUNTER, DataTypes.FLOAT, DataTypes.DOUBLE, DataTypes.DECIMAL);
        for (DataType type : numeric) {
            assertEquals(ValueKind.NUMERIC, ValueKinds.of(type), type.asCql(false, true));
        }
    }

    @Test
    public void testOtherTypesAreNotNumeric() {
        List<DataType> others = List.of(
            DataTypes.TEXT, DataTypes.ASCII, DataTypes.BOOLEAN, DataTypes.UUID, DataTypes.TIMESTAMP,
            DataTypes.DATE, DataTypes.INET, DataTypes.BLOB,
            DataTypes.listOf(DataTypes.INT), DataTypes.setOf(DataTypes.DOUBLE),
            DataTypes.mapOf(DataTypes.TEXT, DataTypes.INT), DataTypes.tupleOf(DataTypes.INT, DataTypes.INT));
        for (DataType type : others) {
            assertEquals(ValueKind.OTHER, ValueKinds.of(type), type.asCql(false, true));
        }
    }
}
