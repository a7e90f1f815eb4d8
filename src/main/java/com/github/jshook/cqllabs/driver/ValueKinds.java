package com.github.jshook.cqllabs.driver;

import com.datastax.oss.driver.api.core.type.DataType;
import com.datastax.oss.protocol.internal.ProtocolConstants;
import com.github.jshook.cqllabs.formatting.ValueKind;

/**
 * Maps CQL column types to the alignment category used by the table renderer.
 */
public final class ValueKinds {

    private ValueKinds() {
    }

    /**
     * Resolves the value kind of a CQL type. Only native number types are numeric; collections,
     * tuples and user types are not, even when they hold numbers.
     *
     * @param type the CQL type of the column
     * @return {@link ValueKind#NUMERIC} for number types, {@link ValueKind#OTHER} otherwise
     */
    public static ValueKind of(DataType type) {
        switch (type.getProtocolCode()) {
            case ProtocolConstants.DataType.INT:
            case ProtocolConstants.DataType.BIGINT:
            case ProtocolConstants.DataType.SMALLINT:
            case ProtocolConstants.DataType.TINYINT:
            case ProtocolConstants.DataType.VARINT:
            case ProtocolConstants.DataType.COUNTER:
            case ProtocolConstants.DataType.FLOAT:
            case ProtocolConstants.DataType.DOUBLE:
            case ProtocolConstants.DataType.DECIMAL:
                return ValueKind.NUMERIC;
            default:
                return ValueKind.OTHER;
        }
    }
}
