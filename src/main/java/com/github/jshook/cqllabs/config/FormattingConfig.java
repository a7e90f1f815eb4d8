package com.github.jshook.cqllabs.config;

/**
 * Configuration for formatting query results.
 */
public class FormattingConfig {
    private OutputFormat outputFormat;

    /**
     * Creates a new FormattingConfig with the tabular output format.
     */
    public FormattingConfig() {
        this(OutputFormat.TABULAR);
    }

    /**
     * Creates a new FormattingConfig with the specified output format.
     *
     * @param outputFormat the output format to use
     */
    public FormattingConfig(OutputFormat outputFormat) {
        setOutputFormat(outputFormat);
    }

    /**
     * Gets the output format.
     *
     * @return the output format
     */
    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    /**
     * Sets the output format.
     *
     * @param outputFormat the output format
     */
    public void setOutputFormat(OutputFormat outputFormat) {
        if (outputFormat == null) {
            throw new IllegalArgumentException("Output format cannot be null");
        }
        this.outputFormat = outputFormat;
    }
}
