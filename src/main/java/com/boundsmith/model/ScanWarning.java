package com.boundsmith.model;

import java.util.Objects;

/**
 * A file that was skipped because it could not be read or parsed.
 */
public final class ScanWarning {

    private final String file;
    private final int line;
    private final int column;
    private final String message;

    public ScanWarning(String file, int line, int column, String message) {
        this.file = Objects.requireNonNull(file, "file");
        this.line = line;
        this.column = column;
        this.message = Objects.requireNonNull(message, "message");
    }

    public String getFile() {
        return file;
    }

    /**
     * 1-based line of the problem, or 0 when the whole file is affected.
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return line > 0 ? file + ":" + line + ": " + message : file + ": " + message;
    }
}
