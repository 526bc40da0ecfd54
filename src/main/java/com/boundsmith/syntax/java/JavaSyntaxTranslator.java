package com.boundsmith.syntax.java;

import com.boundsmith.model.NumericValue;
import com.boundsmith.syntax.BooleanOperationNode;
import com.boundsmith.syntax.ComparisonNode;
import com.boundsmith.syntax.ExpressionNode;
import com.boundsmith.syntax.LengthCallNode;
import com.boundsmith.syntax.LiteralNode;
import com.boundsmith.syntax.NodeKind;
import com.boundsmith.syntax.SourceParseException;
import com.boundsmith.syntax.SourceTreeParser;
import com.boundsmith.syntax.SyntaxNode;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parses Java source with JavaParser and translates every expression whose parent is not an
 * expression into a root of the neutral syntax tree. Expressions inside lambda bodies,
 * anonymous classes and switch entries become roots of their own.
 * Node text is rendered on first use.
 */
public class JavaSyntaxTranslator implements SourceTreeParser {

    private static final Logger logger = LoggerFactory.getLogger(JavaSyntaxTranslator.class);

    private static final Set<String> LENGTH_METHODS = Set.of("size", "length");

    private final JavaParser javaParser;

    public JavaSyntaxTranslator() {
        ParserConfiguration parserConfig = new ParserConfiguration();
        parserConfig.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.javaParser = new JavaParser(parserConfig);
    }

    @Override
    public SyntaxNode parse(String source, String file) throws SourceParseException {
        ParseResult<CompilationUnit> result = javaParser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw toParseException(result.getProblems(), file);
        }
        CompilationUnit cu = result.getResult().get();

        List<SyntaxNode> roots = new ArrayList<>();
        for (Expression expression : cu.findAll(Expression.class)) {
            boolean nested = expression.getParentNode().map(parent -> parent instanceof Expression).orElse(false);
            if (!nested) {
                roots.add(translate(expression));
            }
        }
        logger.debug("Translated {} top-level expressions from {}", roots.size(), file);
        return new ExpressionNode(NodeKind.MODULE, file, 1, 1, roots);
    }

    /**
     * Translates one JavaParser expression and its subexpressions.
     */
    SyntaxNode translate(Expression expression) {
        if (expression instanceof EnclosedExpr) {
            return translate(((EnclosedExpr) expression).getInner());
        }
        if (expression instanceof BinaryExpr) {
            return translateBinary((BinaryExpr) expression);
        }
        if (expression instanceof UnaryExpr) {
            return translateUnary((UnaryExpr) expression);
        }
        if (expression instanceof LiteralExpr) {
            return translateLiteral((LiteralExpr) expression);
        }
        if (expression instanceof NameExpr || expression instanceof ThisExpr) {
            return leaf(NodeKind.NAME, expression);
        }
        if (expression instanceof FieldAccessExpr) {
            FieldAccessExpr fieldAccess = (FieldAccessExpr) expression;
            SyntaxNode scope = translate(fieldAccess.getScope());
            if (fieldAccess.getNameAsString().equals("length")) {
                return new LengthCallNode(expression::toString, line(expression), column(expression), scope);
            }
            return node(NodeKind.ATTRIBUTE, expression, List.of(scope));
        }
        if (expression instanceof MethodCallExpr) {
            return translateMethodCall((MethodCallExpr) expression);
        }
        if (expression instanceof ArrayAccessExpr) {
            ArrayAccessExpr access = (ArrayAccessExpr) expression;
            return node(NodeKind.SUBSCRIPT, expression, List.of(translate(access.getName()), translate(access.getIndex())));
        }
        List<SyntaxNode> children = new ArrayList<>();
        for (Node child : expression.getChildNodes()) {
            if (child instanceof Expression) {
                children.add(translate((Expression) child));
            }
        }
        return node(NodeKind.OTHER, expression, children);
    }

    private SyntaxNode translateBinary(BinaryExpr binary) {
        BinaryExpr.Operator operator = binary.getOperator();
        switch (operator) {
            case AND, OR -> {
                List<SyntaxNode> operands = new ArrayList<>();
                flatten(binary, operator, operands);
                NodeKind kind = operator == BinaryExpr.Operator.AND ? NodeKind.BOOLEAN_AND : NodeKind.BOOLEAN_OR;
                return new BooleanOperationNode(kind, binary::toString, line(binary), column(binary), operands);
            }
            case LESS, LESS_EQUALS, GREATER, GREATER_EQUALS, EQUALS, NOT_EQUALS -> {
                return new ComparisonNode(binary::toString, line(binary), column(binary),
                        List.of(translate(binary.getLeft()), translate(binary.getRight())),
                        List.of(operator.asString()));
            }
            default -> {
                return node(NodeKind.OTHER, binary, List.of(translate(binary.getLeft()), translate(binary.getRight())));
            }
        }
    }

    /**
     * Collects the operands of a left-associated {@code a && b && c} chain.
     */
    private void flatten(Expression expression, BinaryExpr.Operator operator, List<SyntaxNode> operands) {
        if (expression instanceof BinaryExpr && ((BinaryExpr) expression).getOperator() == operator) {
            BinaryExpr binary = (BinaryExpr) expression;
            flatten(binary.getLeft(), operator, operands);
            flatten(binary.getRight(), operator, operands);
        } else {
            operands.add(translate(expression));
        }
    }

    private SyntaxNode translateUnary(UnaryExpr unary) {
        SyntaxNode operand = translate(unary.getExpression());
        UnaryExpr.Operator operator = unary.getOperator();
        if (operand instanceof LiteralNode
                && (operator == UnaryExpr.Operator.MINUS || operator == UnaryExpr.Operator.PLUS)) {
            NumericValue value = ((LiteralNode) operand).getValue();
            return new LiteralNode(operator == UnaryExpr.Operator.MINUS ? value.negate() : value,
                    unary::toString, line(unary), column(unary));
        }
        return node(NodeKind.OTHER, unary, List.of(operand));
    }

    private SyntaxNode translateLiteral(LiteralExpr literal) {
        Optional<NumericValue> value = Optional.empty();
        if (literal instanceof IntegerLiteralExpr) {
            value = NumericValue.parseJavaLiteral(((IntegerLiteralExpr) literal).getValue(), false);
        } else if (literal instanceof LongLiteralExpr) {
            value = NumericValue.parseJavaLiteral(((LongLiteralExpr) literal).getValue(), false);
        } else if (literal instanceof DoubleLiteralExpr) {
            value = NumericValue.parseJavaLiteral(((DoubleLiteralExpr) literal).getValue(), true);
        }
        if (value.isPresent()) {
            return new LiteralNode(value.get(), literal::toString, line(literal), column(literal));
        }
        return leaf(NodeKind.OTHER_LITERAL, literal);
    }

    private SyntaxNode translateMethodCall(MethodCallExpr call) {
        if (call.getArguments().isEmpty() && call.getScope().isPresent()
                && LENGTH_METHODS.contains(call.getNameAsString())) {
            return new LengthCallNode(call::toString, line(call), column(call), translate(call.getScope().get()));
        }
        List<SyntaxNode> children = new ArrayList<>();
        call.getScope().ifPresent(scope -> children.add(translate(scope)));
        for (Expression argument : call.getArguments()) {
            children.add(translate(argument));
        }
        return node(NodeKind.CALL, call, children);
    }

    private static SyntaxNode node(NodeKind kind, Expression expression, List<SyntaxNode> children) {
        return new ExpressionNode(kind, expression::toString, line(expression), column(expression), children);
    }

    private static SyntaxNode leaf(NodeKind kind, Expression expression) {
        return ExpressionNode.leaf(kind, expression.toString(), line(expression), column(expression));
    }

    private static int line(Node node) {
        return node.getBegin().map(position -> position.line).orElse(0);
    }

    private static int column(Node node) {
        return node.getBegin().map(position -> position.column).orElse(0);
    }

    private static SourceParseException toParseException(List<Problem> problems, String file) {
        if (problems.isEmpty()) {
            return new SourceParseException(file, 0, 0, "unparseable Java source");
        }
        Problem problem = problems.get(0);
        Optional<Position> begin = problem.getLocation()
                .flatMap(range -> range.getBegin().getRange())
                .map(range -> range.begin);
        String message = problem.getMessage().lines().findFirst().orElse("syntax error");
        return new SourceParseException(file, begin.map(p -> p.line).orElse(0), begin.map(p -> p.column).orElse(0), message);
    }
}
