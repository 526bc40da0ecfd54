package com.boundsmith.model;

import java.util.Objects;

/**
 * One literal-bearing comparison in canonical {@code subject OP literal} form.
 */
public final class Predicate implements BoundaryPredicate {

    /** Conjunction id of a predicate that is not part of any conjunction. */
    public static final int NO_CONJUNCTION = -1;

    private final ComparisonOperator operator;
    private final NumericValue literal;
    private final String subject;
    private final boolean lengthSubject;
    private final String file;
    private final int line;
    private final int column;
    private final String expression;
    private final int conjunction;

    public Predicate(ComparisonOperator operator, NumericValue literal, String subject, boolean lengthSubject,
                     String file, int line, int column, String expression, int conjunction) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.literal = Objects.requireNonNull(literal, "literal");
        this.subject = Objects.requireNonNull(subject, "subject");
        this.lengthSubject = lengthSubject;
        this.file = Objects.requireNonNull(file, "file");
        this.line = line;
        this.column = column;
        this.expression = expression;
        this.conjunction = conjunction;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public NumericValue getLiteral() {
        return literal;
    }

    @Override
    public String getSubject() {
        return subject;
    }

    public boolean isLengthSubject() {
        return lengthSubject;
    }

    @Override
    public String getFile() {
        return file;
    }

    @Override
    public int getLine() {
        return line;
    }

    @Override
    public int getColumn() {
        return column;
    }

    @Override
    public String getExpression() {
        return expression;
    }

    public int getConjunction() {
        return conjunction;
    }

    public boolean isInConjunction() {
        return conjunction != NO_CONJUNCTION;
    }

    @Override
    public ComparandType getComparandType() {
        if (lengthSubject) {
            return ComparandType.LENGTH;
        }
        return literal.isInteger() ? ComparandType.INTEGER : ComparandType.FLOAT;
    }

    @Override
    public String getOperatorDescriptor() {
        return operator.getSymbol();
    }

    @Override
    public String describe() {
        return subject + " " + operator.getSymbol() + " " + literal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Predicate)) {
            return false;
        }
        Predicate that = (Predicate) o;
        return line == that.line && column == that.column && lengthSubject == that.lengthSubject
                && conjunction == that.conjunction && operator == that.operator
                && literal.equals(that.literal) && subject.equals(that.subject) && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, literal, subject, lengthSubject, file, line, column, conjunction);
    }

    @Override
    public String toString() {
        return file + ":" + line + " " + describe();
    }
}
