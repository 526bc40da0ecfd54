package com.boundsmith.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * An exact numeric literal value together with its literal type.
 * Integers and floats never compare equal, so {@code 3} does not match {@code 3.0}.
 */
public final class NumericValue implements Comparable<NumericValue> {

    /**
     * Literal type of a numeric value.
     */
    public enum Type {
        INTEGER, FLOAT
    }

    private final Type type;
    private final BigDecimal value;

    private NumericValue(Type type, BigDecimal value) {
        this.type = Objects.requireNonNull(type, "type");
        BigDecimal stripped = value.stripTrailingZeros();
        this.value = type == Type.INTEGER ? stripped.setScale(0) : stripped;
    }

    public static NumericValue ofInteger(long value) {
        return new NumericValue(Type.INTEGER, BigDecimal.valueOf(value));
    }

    public static NumericValue ofInteger(BigInteger value) {
        return new NumericValue(Type.INTEGER, new BigDecimal(value));
    }

    public static NumericValue ofFloat(String decimal) {
        return new NumericValue(Type.FLOAT, new BigDecimal(decimal));
    }

    public static NumericValue ofFloat(BigDecimal value) {
        return new NumericValue(Type.FLOAT, value);
    }

    /**
     * Parses a Python numeric literal token.
     *
     * @param text The literal as written, e.g. {@code 0x1F}, {@code 1_000}, {@code .5e-3}
     * @return The value, or empty for imaginary literals and text that is not a number
     */
    public static Optional<NumericValue> parsePythonLiteral(String text) {
        String literal = text.replace("_", "");
        if (literal.isEmpty()) {
            return Optional.empty();
        }
        char last = literal.charAt(literal.length() - 1);
        if (last == 'j' || last == 'J') {
            return Optional.empty();
        }
        try {
            BigInteger radixValue = parseRadixInteger(literal, false);
            if (radixValue != null) {
                return Optional.of(ofInteger(radixValue));
            }
            if (isFloatSyntax(literal)) {
                return Optional.of(ofFloat(literal));
            }
            return Optional.of(ofInteger(new BigInteger(literal)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a Java integer, long, float or double literal.
     *
     * @param text The literal as written, e.g. {@code 10L}, {@code 0b101}, {@code 1.5f}
     * @param floating Whether the parser classified the token as a floating point literal
     * @return The value, or empty if the text is not a number
     */
    public static Optional<NumericValue> parseJavaLiteral(String text, boolean floating) {
        String literal = text.replace("_", "");
        if (literal.isEmpty()) {
            return Optional.empty();
        }
        try {
            if (floating) {
                String lower = literal.toLowerCase(Locale.ROOT);
                if (lower.startsWith("0x")) {
                    return Optional.of(ofFloat(new BigDecimal(Double.parseDouble(literal))));
                }
                if (lower.endsWith("f") || lower.endsWith("d")) {
                    literal = literal.substring(0, literal.length() - 1);
                }
                return Optional.of(ofFloat(literal));
            }
            char last = literal.charAt(literal.length() - 1);
            if (last == 'l' || last == 'L') {
                literal = literal.substring(0, literal.length() - 1);
            }
            BigInteger radixValue = parseRadixInteger(literal, true);
            return Optional.of(ofInteger(radixValue != null ? radixValue : new BigInteger(literal)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static BigInteger parseRadixInteger(String literal, boolean javaOctal) {
        if (literal.length() > 2 && literal.charAt(0) == '0') {
            char prefix = Character.toLowerCase(literal.charAt(1));
            switch (prefix) {
                case 'x' -> {
                    return new BigInteger(literal.substring(2), 16);
                }
                case 'o' -> {
                    return new BigInteger(literal.substring(2), 8);
                }
                case 'b' -> {
                    return new BigInteger(literal.substring(2), 2);
                }
                default -> {
                    // no prefix
                }
            }
        }
        if (javaOctal && literal.length() > 1 && literal.charAt(0) == '0' && literal.chars().allMatch(Character::isDigit)) {
            return new BigInteger(literal.substring(1), 8);
        }
        return null;
    }

    private static boolean isFloatSyntax(String literal) {
        return literal.indexOf('.') >= 0 || literal.indexOf('e') >= 0 || literal.indexOf('E') >= 0;
    }

    public Type getType() {
        return type;
    }

    public boolean isInteger() {
        return type == Type.INTEGER;
    }

    public BigDecimal toBigDecimal() {
        return value;
    }

    public BigInteger toBigInteger() {
        return value.toBigInteger();
    }

    public int signum() {
        return value.signum();
    }

    public NumericValue add(BigDecimal step) {
        return new NumericValue(type, value.add(step));
    }

    public NumericValue subtract(BigDecimal step) {
        return new NumericValue(type, value.subtract(step));
    }

    public NumericValue negate() {
        return new NumericValue(type, value.negate());
    }

    /**
     * The float value with at least one fractional digit, as a JSON writer should print it.
     */
    public BigDecimal toFloatDecimal() {
        return value.scale() < 1 ? value.setScale(1) : value;
    }

    /**
     * Orders by numeric value only; use {@link #equals(Object)} for type-strict identity.
     */
    @Override
    public int compareTo(NumericValue other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NumericValue)) {
            return false;
        }
        NumericValue that = (NumericValue) o;
        return type == that.type && value.compareTo(that.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }

    /**
     * Source-like rendering: {@code 3}, {@code -10}, {@code 0.5}, {@code 3.0}.
     */
    @Override
    public String toString() {
        if (type == Type.INTEGER) {
            return value.toBigInteger().toString();
        }
        return toFloatDecimal().toPlainString();
    }
}
