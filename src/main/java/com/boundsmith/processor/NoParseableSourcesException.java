package com.boundsmith.processor;

/**
 * Thrown when source files were found but none of them could be parsed.
 */
public class NoParseableSourcesException extends Exception {

    private final int attemptedFiles;

    public NoParseableSourcesException(int attemptedFiles) {
        super("None of the " + attemptedFiles + " source files could be parsed");
        this.attemptedFiles = attemptedFiles;
    }

    public int getAttemptedFiles() {
        return attemptedFiles;
    }
}
