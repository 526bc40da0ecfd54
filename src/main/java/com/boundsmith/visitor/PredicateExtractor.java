package com.boundsmith.visitor;

import com.boundsmith.model.ComparisonOperator;
import com.boundsmith.model.NumericValue;
import com.boundsmith.model.Predicate;
import com.boundsmith.syntax.BooleanOperationNode;
import com.boundsmith.syntax.ComparisonNode;
import com.boundsmith.syntax.LiteralNode;
import com.boundsmith.syntax.NodeKind;
import com.boundsmith.syntax.SyntaxNode;
import com.boundsmith.syntax.SyntaxVisitorAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Walks a syntax tree and emits one {@link Predicate} per comparison between a subject and a
 * numeric literal. Chained comparisons are split into adjacent pairs, literals written on the
 * left are mirrored, and comparisons directly under the same AND share a conjunction id.
 */
public class PredicateExtractor extends SyntaxVisitorAdapter {

    private static final Logger logger = LoggerFactory.getLogger(PredicateExtractor.class);

    private final String file;
    private final List<Predicate> predicates = new ArrayList<>();
    private int nextConjunction = 0;

    public PredicateExtractor(String file) {
        this.file = file;
    }

    /**
     * Extracts all predicates of one parsed file.
     *
     * @param tree Module node of the file
     * @param file Path reported in every predicate
     * @return Predicates in tree order
     */
    public static List<Predicate> extract(SyntaxNode tree, String file) {
        PredicateExtractor extractor = new PredicateExtractor(file);
        extractor.visit(tree);
        return extractor.getPredicates();
    }

    public List<Predicate> getPredicates() {
        return Collections.unmodifiableList(predicates);
    }

    @Override
    protected void visitBooleanOperation(BooleanOperationNode node) {
        if (node.isConjunction()) {
            visitConjunction(node, nextConjunction++);
        } else {
            visitChildren(node);
        }
    }

    @Override
    protected void visitComparison(ComparisonNode node) {
        int conjunction = node.isChained() ? nextConjunction++ : Predicate.NO_CONJUNCTION;
        extractComparison(node, conjunction);
        visitChildren(node);
    }

    private void visitConjunction(BooleanOperationNode node, int conjunction) {
        for (SyntaxNode operand : node.getOperands()) {
            if (operand.getKind() == NodeKind.BOOLEAN_AND) {
                visitConjunction((BooleanOperationNode) operand, conjunction);
            } else if (operand.getKind() == NodeKind.COMPARISON) {
                extractComparison((ComparisonNode) operand, conjunction);
                visitChildren(operand);
            } else {
                visit(operand);
            }
        }
    }

    private void extractComparison(ComparisonNode node, int conjunction) {
        List<SyntaxNode> operands = node.getOperands();
        List<String> operators = node.getOperators();
        for (int i = 0; i < operators.size(); i++) {
            Optional<ComparisonOperator> operator = ComparisonOperator.fromSymbol(operators.get(i));
            if (operator.isEmpty()) {
                logger.debug("{}:{} skipping '{}' comparison", file, node.getLine(), operators.get(i));
                continue;
            }
            toPredicate(operands.get(i), operator.get(), operands.get(i + 1), node, conjunction)
                    .ifPresent(predicates::add);
        }
    }

    private Optional<Predicate> toPredicate(SyntaxNode left, ComparisonOperator operator, SyntaxNode right,
                                            ComparisonNode comparison, int conjunction) {
        boolean literalLeft = left instanceof LiteralNode;
        boolean literalRight = right instanceof LiteralNode;
        if (literalLeft == literalRight) {
            logger.debug("{}: no single literal operand in {}", file, comparison);
            return Optional.empty();
        }
        SyntaxNode subject = literalLeft ? right : left;
        NumericValue literal = ((LiteralNode) (literalLeft ? left : right)).getValue();
        ComparisonOperator canonical = literalLeft ? operator.mirror() : operator;

        if (!subject.getKind().isSubject()) {
            logger.debug("{}: unsupported subject {}", file, subject);
            return Optional.empty();
        }
        boolean length = subject.getKind() == NodeKind.LENGTH_CALL;
        if (length && (!literal.isInteger() || literal.signum() < 0)) {
            logger.debug("{}:{} length compared with {}, ignored", file, comparison.getLine(), literal);
            return Optional.empty();
        }
        return Optional.of(new Predicate(canonical, literal, subject.getText(), length, file,
                comparison.getLine(), comparison.getColumn(), comparison.getText(), conjunction));
    }
}
