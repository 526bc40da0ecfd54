package com.boundsmith;

/**
 * Thrown when the command line cannot be understood.
 */
public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }
}
