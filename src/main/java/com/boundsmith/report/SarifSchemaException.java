package com.boundsmith.report;

/**
 * Thrown when a SARIF result cannot carry the fields the 2.1.0 schema requires.
 */
public class SarifSchemaException extends RuntimeException {

    public SarifSchemaException(String message) {
        super(message);
    }
}
