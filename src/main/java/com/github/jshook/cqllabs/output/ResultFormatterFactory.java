package com.github.jshook.cqllabs.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.jshook.cqllabs.config.FormattingConfig;
import com.github.jshook.cqllabs.config.OutputFormat;
import com.github.jshook.cqllabs.formatting.ColumnDescriptor;
import com.github.jshook.cqllabs.formatting.TableRenderer;
import com.github.jshook.cqllabs.formatting.TabularRow;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for creating result formatters based on the formatting configuration.
 */
public class ResultFormatterFactory {
    private final FormattingConfig formattingConfig;

    /**
     * Creates a new ResultFormatterFactory with the given formatting configuration.
     *
     * @param formattingConfig the formatting configuration
     */
    public ResultFormatterFactory(FormattingConfig formattingConfig) {
        this.formattingConfig = formattingConfig;
    }

    /**
     * Creates a formatter for the currently configured output format. The configuration is read
     * on every call, so a format change applies to the next result.
     *
     * @return the appropriate formatter
     */
    public ResultFormatter createFormatter() {
        return createFormatter(formattingConfig.getOutputFormat());
    }

    /**
     * Creates a formatter for the given output format.
     *
     * @param outputFormat the output format
     * @return the appropriate formatter
     */
    public static ResultFormatter createFormatter(OutputFormat outputFormat) {
        switch (outputFormat) {
            case JSON:
                return new JsonResultFormatter();
            case CSV:
                return new CsvResultFormatter();
            case TABULAR:
            default:
                return new TabularResultFormatter();
        }
    }

    /**
     * Tabular result formatter for displaying results in a bordered table.
     */
    private static class TabularResultFormatter implements ResultFormatter {
        private final TableRenderer renderer = new TableRenderer();

        @Override
        public String format(List<? extends TabularRow> rows) {
            return renderer.render(rows);
        }
    }

    /**
     * JSON result formatter for displaying results in JSON format.
     */
    private static class JsonResultFormatter implements ResultFormatter {
        private final ObjectMapper objectMapper = new ObjectMapper();

        @Override
        public String format(List<? extends TabularRow> rows) {
            if (rows == null || rows.isEmpty()) {
                return "[]";
            }

            ArrayNode rootArray = objectMapper.createArrayNode();
            List<ColumnDescriptor> columns = rows.get(0).getColumns();

            for (TabularRow row : rows) {
                ObjectNode rowNode = objectMapper.createObjectNode();

                for (ColumnDescriptor column : columns) {
                    putValue(rowNode, column.name(), row.getObject(column.name()));
                }

                rootArray.add(rowNode);
            }

            try {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(rootArray);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Error formatting JSON: " + e.getMessage(), e);
            }
        }

        private static void putValue(ObjectNode node, String name, Object value) {
            if (value == null) {
                node.putNull(name);
            } else if (value instanceof Boolean) {
                node.put(name, (Boolean) value);
            } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                node.put(name, ((Number) value).intValue());
            } else if (value instanceof Long) {
                node.put(name, (Long) value);
            } else if (value instanceof Float) {
                node.put(name, (Float) value);
            } else if (value instanceof Double) {
                node.put(name, (Double) value);
            } else if (value instanceof BigDecimal) {
                node.put(name, (BigDecimal) value);
            } else if (value instanceof BigInteger) {
                node.put(name, (BigInteger) value);
            } else {
                node.put(name, value.toString());
            }
        }
    }

    /**
     * CSV result formatter for displaying results in CSV format.
     */
    private static class CsvResultFormatter implements ResultFormatter {
        @Override
        public String format(List<? extends TabularRow> rows) {
            if (rows == null || rows.isEmpty()) {
                return "";
            }

            List<ColumnDescriptor> columns = rows.get(0).getColumns();
            String[] headers = new String[columns.size()];
            for (int i = 0; i < headers.length; i++) {
                headers[i] = columns.get(i).name();
            }

            StringWriter writer = new StringWriter();
            CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(headers).build();
            try (CSVPrinter csvPrinter = new CSVPrinter(writer, format)) {
                for (TabularRow row : rows) {
                    List<Object> rowData = new ArrayList<>(headers.length);
                    for (String header : headers) {
                        rowData.add(row.getObject(header));
                    }
                    csvPrinter.printRecord(rowData);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Error formatting CSV: " + e.getMessage(), e);
            }
            return writer.toString();
        }
    }
}
