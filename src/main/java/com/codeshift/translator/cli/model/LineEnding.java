package com.codeshift.translator.cli.model;

/**
 * Line terminator choices for the rendered output.
 */
public enum LineEnding {
    LF("\n"),
    CRLF("\r\n"),
    SYSTEM(System.lineSeparator());

    private final String separator;

    LineEnding(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }
}
