package com.boundsmith.syntax;

/**
 * Thrown when a source file is not syntactically valid. Only that file is skipped.
 */
public class SourceParseException extends Exception {

    private final String file;
    private final int line;
    private final int column;

    public SourceParseException(String file, int line, int column, String message) {
        super(message);
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    /**
     * 1-based line of the offending token, or 0 if unknown.
     */
    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column + ": " + getMessage();
    }
}
