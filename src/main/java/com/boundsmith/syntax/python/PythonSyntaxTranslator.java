package com.boundsmith.syntax.python;

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
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Parses Python source with the ANTLR-generated {@link Python3Parser} and translates every
 * expression that appears directly in a statement into a root of the neutral syntax tree, in
 * source order. Node text is rendered from the tokens on first use, with normalized spacing.
 */
public class PythonSyntaxTranslator implements SourceTreeParser {

    private static final Logger logger = LoggerFactory.getLogger(PythonSyntaxTranslator.class);

    private static final Set<Integer> OPENING_BRACKETS = Set.of(
            Python3Lexer.OPEN_PAREN, Python3Lexer.OPEN_BRACK, Python3Lexer.OPEN_BRACE);

    private static final Set<Integer> CLOSING_BRACKETS = Set.of(
            Python3Lexer.CLOSE_PAREN, Python3Lexer.CLOSE_BRACK, Python3Lexer.CLOSE_BRACE);

    @Override
    public SyntaxNode parse(String source, String file) throws SourceParseException {
        ThrowingErrorListener errorListener = new ThrowingErrorListener();
        Python3Lexer lexer = new Python3Lexer(CharStreams.fromString(source, file));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);
        CommonTokenStream tokens = new CommonTokenStream(lexer);

        Python3Parser.File_inputContext tree;
        try {
            tokens.fill();
            checkBrackets(tokens.getTokens());
            Python3Parser parser = new Python3Parser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(errorListener);
            tree = parser.file_input();
        } catch (PythonSyntaxError e) {
            throw new SourceParseException(file, e.line, e.column, e.getMessage());
        }

        List<SyntaxNode> roots = new ArrayList<>();
        new StatementWalker(new ExpressionTranslator(tokens), roots).visit(tree);
        logger.debug("Translated {} top-level expressions from {}", roots.size(), file);
        return new ExpressionNode(NodeKind.MODULE, file, 1, 1, roots);
    }

    /**
     * Rejects unbalanced brackets with the position of the bracket at fault.
     */
    private static void checkBrackets(List<Token> tokens) {
        Deque<Token> open = new ArrayDeque<>();
        for (Token token : tokens) {
            if (OPENING_BRACKETS.contains(token.getType())) {
                open.push(token);
            } else if (CLOSING_BRACKETS.contains(token.getType())) {
                if (open.isEmpty()) {
                    throw new PythonSyntaxError(token, "unmatched '" + token.getText() + "'");
                }
                Token opener = open.pop();
                if (!matches(opener, token)) {
                    throw new PythonSyntaxError(token, "closing parenthesis '" + token.getText()
                            + "' does not match opening parenthesis '" + opener.getText() + "'");
                }
            }
        }
        if (!open.isEmpty()) {
            Token opener = open.peek();
            throw new PythonSyntaxError(opener, "'" + opener.getText() + "' was never closed");
        }
    }

    private static boolean matches(Token opener, Token closer) {
        switch (opener.getType()) {
            case Python3Lexer.OPEN_PAREN:
                return closer.getType() == Python3Lexer.CLOSE_PAREN;
            case Python3Lexer.OPEN_BRACK:
                return closer.getType() == Python3Lexer.CLOSE_BRACK;
            default:
                return closer.getType() == Python3Lexer.CLOSE_BRACE;
        }
    }

    private static int line(Token token) {
        return token.getLine();
    }

    private static int column(Token token) {
        return token.getCharPositionInLine() + 1;
    }

    /**
     * Turns the first lexer or parser error into a {@link PythonSyntaxError}.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new PythonSyntaxError(line, charPositionInLine + 1, msg);
        }
    }

    private static final class PythonSyntaxError extends RuntimeException {

        private final int line;
        private final int column;

        PythonSyntaxError(int line, int column, String message) {
            super(message);
            this.line = line;
            this.column = column;
        }

        PythonSyntaxError(Token token, String message) {
            this(PythonSyntaxTranslator.line(token), PythonSyntaxTranslator.column(token), message);
        }
    }

    /**
     * Collects the expressions of each statement as roots. Names in imports, parameter lists and
     * {@code global} statements are not expressions and are left out.
     */
    private static final class StatementWalker extends Python3BaseVisitor<Void> {

        private final ExpressionTranslator expressions;
        private final List<SyntaxNode> roots;

        StatementWalker(ExpressionTranslator expressions, List<SyntaxNode> roots) {
            this.expressions = expressions;
            this.roots = roots;
        }

        private Void add(ParserRuleContext ctx) {
            roots.add(expressions.visit(ctx));
            return null;
        }

        @Override
        public Void visitNamedexpr_test(Python3Parser.Namedexpr_testContext ctx) {
            return add(ctx);
        }

        @Override
        public Void visitTest(Python3Parser.TestContext ctx) {
            return add(ctx);
        }

        @Override
        public Void visitStar_expr(Python3Parser.Star_exprContext ctx) {
            return add(ctx);
        }

        @Override
        public Void visitExpr(Python3Parser.ExprContext ctx) {
            return add(ctx);
        }

        @Override
        public Void visitYield_expr(Python3Parser.Yield_exprContext ctx) {
            return add(ctx);
        }
    }

    /**
     * Translates one expression subtree of the parse tree.
     */
    private static final class ExpressionTranslator extends Python3BaseVisitor<SyntaxNode> {

        private final CommonTokenStream tokens;

        ExpressionTranslator(CommonTokenStream tokens) {
            this.tokens = tokens;
        }

        @Override
        public SyntaxNode visitNamedexpr_test(Python3Parser.Namedexpr_testContext ctx) {
            if (ctx.WALRUS() == null) {
                return visit(ctx.test(0));
            }
            return other(ctx, List.of(visit(ctx.test(0)), visit(ctx.test(1))));
        }

        @Override
        public SyntaxNode visitTest(Python3Parser.TestContext ctx) {
            if (ctx.lambdef() != null) {
                return visit(ctx.lambdef());
            }
            if (ctx.IF() == null) {
                return visit(ctx.or_test(0));
            }
            return other(ctx, List.of(visit(ctx.or_test(0)), visit(ctx.or_test(1)), visit(ctx.test())));
        }

        @Override
        public SyntaxNode visitLambdef(Python3Parser.LambdefContext ctx) {
            List<SyntaxNode> children = new ArrayList<>();
            if (ctx.varargslist() != null) {
                for (Python3Parser.VarargContext parameter : ctx.varargslist().vararg()) {
                    if (parameter.test() != null) {
                        children.add(visit(parameter.test()));
                    }
                }
            }
            children.add(visit(ctx.test()));
            return other(ctx, children);
        }

        @Override
        public SyntaxNode visitOr_test(Python3Parser.Or_testContext ctx) {
            if (ctx.and_test().size() == 1) {
                return visit(ctx.and_test(0));
            }
            return booleanOperation(NodeKind.BOOLEAN_OR, ctx, ctx.and_test());
        }

        @Override
        public SyntaxNode visitAnd_test(Python3Parser.And_testContext ctx) {
            if (ctx.not_test().size() == 1) {
                return visit(ctx.not_test(0));
            }
            return booleanOperation(NodeKind.BOOLEAN_AND, ctx, ctx.not_test());
        }

        private SyntaxNode booleanOperation(NodeKind kind, ParserRuleContext ctx, List<? extends ParserRuleContext> operands) {
            List<SyntaxNode> translated = new ArrayList<>();
            for (ParserRuleContext operand : operands) {
                translated.add(visit(operand));
            }
            return new BooleanOperationNode(kind, text(ctx), line(ctx.getStart()), column(ctx.getStart()), translated);
        }

        @Override
        public SyntaxNode visitNot_test(Python3Parser.Not_testContext ctx) {
            if (ctx.NOT() != null) {
                return other(ctx, List.of(visit(ctx.not_test())));
            }
            return visit(ctx.comparison());
        }

        @Override
        public SyntaxNode visitComparison(Python3Parser.ComparisonContext ctx) {
            if (ctx.comp_op().isEmpty()) {
                return visit(ctx.expr(0));
            }
            List<SyntaxNode> operands = new ArrayList<>();
            for (Python3Parser.ExprContext operand : ctx.expr()) {
                operands.add(visit(operand));
            }
            List<String> operators = new ArrayList<>();
            for (Python3Parser.Comp_opContext operator : ctx.comp_op()) {
                List<String> words = new ArrayList<>();
                for (int i = 0; i < operator.getChildCount(); i++) {
                    words.add(operator.getChild(i).getText());
                }
                operators.add(String.join(" ", words));
            }
            return new ComparisonNode(text(ctx), line(ctx.getStart()), column(ctx.getStart()), operands, operators);
        }

        @Override
        public SyntaxNode visitStar_expr(Python3Parser.Star_exprContext ctx) {
            return other(ctx, List.of(visit(ctx.expr())));
        }

        @Override
        public SyntaxNode visitExpr(Python3Parser.ExprContext ctx) {
            if (ctx.atom_expr() != null) {
                return visit(ctx.atom_expr());
            }
            if (ctx.getChild(0) instanceof TerminalNode) {
                return prefixed(ctx);
            }
            return other(ctx, List.of(visit(ctx.expr(0)), visit(ctx.expr(1))));
        }

        /**
         * Applies unary {@code +}, {@code -} and {@code ~} from the innermost outwards. A signed
         * numeric literal stays a literal; {@code ~} never does.
         */
        private SyntaxNode prefixed(Python3Parser.ExprContext ctx) {
            SyntaxNode current = visit(ctx.expr(0));
            int stop = ctx.getStop().getTokenIndex();
            for (int i = ctx.getChildCount() - 2; i >= 0; i--) {
                Token operator = ((TerminalNode) ctx.getChild(i)).getSymbol();
                Supplier<String> text = text(operator.getTokenIndex(), stop);
                if (current instanceof LiteralNode && operator.getType() != Python3Lexer.NOT_OP) {
                    NumericValue value = ((LiteralNode) current).getValue();
                    NumericValue signed = operator.getType() == Python3Lexer.MINUS ? value.negate() : value;
                    current = new LiteralNode(signed, text, line(operator), column(operator));
                } else {
                    current = new ExpressionNode(NodeKind.OTHER, text, line(operator), column(operator), List.of(current));
                }
            }
            return current;
        }

        @Override
        public SyntaxNode visitAtom_expr(Python3Parser.Atom_exprContext ctx) {
            Token first = ctx.atom().getStart();
            int start = first.getTokenIndex();
            SyntaxNode current = visit(ctx.atom());
            for (Python3Parser.TrailerContext trailer : ctx.trailer()) {
                Supplier<String> text = text(start, trailer.getStop().getTokenIndex());
                if (trailer.DOT() != null) {
                    current = new ExpressionNode(NodeKind.ATTRIBUTE, text, line(first), column(first), List.of(current));
                } else if (trailer.OPEN_PAREN() != null) {
                    current = call(current, trailer.arglist(), text, first);
                } else {
                    current = new ExpressionNode(NodeKind.SUBSCRIPT, text, line(first), column(first),
                            List.of(current, subscript(trailer.subscriptlist())));
                }
            }
            if (ctx.AWAIT() != null) {
                return other(ctx, List.of(current));
            }
            return current;
        }

        /**
         * {@code len(x)} with a single positional argument is a length call; every other call,
         * {@code len} with keywords or unpacking included, is a plain call.
         */
        private SyntaxNode call(SyntaxNode callee, Python3Parser.ArglistContext arglist, Supplier<String> text, Token first) {
            List<Python3Parser.ArgumentContext> arguments = arglist == null ? List.of() : arglist.argument();
            if (callee.getKind() == NodeKind.NAME && callee.getText().equals("len")
                    && arguments.size() == 1 && isPositional(arguments.get(0))) {
                return new LengthCallNode(text, line(first), column(first), visit(arguments.get(0).test(0)));
            }
            List<SyntaxNode> children = new ArrayList<>();
            children.add(callee);
            for (Python3Parser.ArgumentContext argument : arguments) {
                children.add(visit(argument));
            }
            return new ExpressionNode(NodeKind.CALL, text, line(first), column(first), children);
        }

        private static boolean isPositional(Python3Parser.ArgumentContext argument) {
            return argument.test().size() == 1 && argument.comp_for() == null
                    && argument.STAR() == null && argument.POWER() == null;
        }

        @Override
        public SyntaxNode visitArgument(Python3Parser.ArgumentContext ctx) {
            if (ctx.comp_for() != null) {
                List<SyntaxNode> children = new ArrayList<>();
                children.add(visit(ctx.test(0)));
                children.addAll(comprehension(ctx.comp_for()));
                return other(ctx, children);
            }
            if (ctx.WALRUS() != null) {
                return other(ctx, List.of(visit(ctx.test(0)), visit(ctx.test(1))));
            }
            if (ctx.ASSIGN() != null) {
                return visit(ctx.test(1));
            }
            return visit(ctx.test(0));
        }

        private SyntaxNode subscript(Python3Parser.SubscriptlistContext ctx) {
            if (ctx.subscript_().size() == 1 && ctx.COMMA().isEmpty()) {
                return visit(ctx.subscript_(0));
            }
            return other(ctx, items(ctx));
        }

        @Override
        public SyntaxNode visitSubscript_(Python3Parser.Subscript_Context ctx) {
            if (ctx.namedexpr_test() != null) {
                return visit(ctx.namedexpr_test());
            }
            if (ctx.star_expr() != null) {
                return visit(ctx.star_expr());
            }
            List<SyntaxNode> bounds = new ArrayList<>();
            for (Python3Parser.TestContext bound : ctx.test()) {
                bounds.add(visit(bound));
            }
            if (ctx.sliceop() != null && ctx.sliceop().test() != null) {
                bounds.add(visit(ctx.sliceop().test()));
            }
            return other(ctx, bounds);
        }

        @Override
        public SyntaxNode visitAtom(Python3Parser.AtomContext ctx) {
            if (ctx.OPEN_PAREN() != null) {
                if (ctx.yield_expr() != null) {
                    return visit(ctx.yield_expr());
                }
                Python3Parser.Testlist_compContext inner = ctx.testlist_comp();
                if (inner == null) {
                    return other(ctx, List.of());
                }
                if (inner.comp_for() == null && inner.COMMA().isEmpty()) {
                    return visit(inner.getChild(0));
                }
                return other(ctx, items(inner));
            }
            if (ctx.OPEN_BRACK() != null) {
                return other(ctx, ctx.testlist_comp() == null ? List.of() : items(ctx.testlist_comp()));
            }
            if (ctx.OPEN_BRACE() != null) {
                return other(ctx, ctx.dictorsetmaker() == null ? List.of() : items(ctx.dictorsetmaker()));
            }
            Token token = ctx.getStart();
            if (ctx.name() != null) {
                return ExpressionNode.leaf(NodeKind.NAME, token.getText(), line(token), column(token));
            }
            if (ctx.NUMBER() != null) {
                Optional<NumericValue> value = NumericValue.parsePythonLiteral(token.getText());
                if (value.isPresent()) {
                    return new LiteralNode(value.get(), token.getText(), line(token), column(token));
                }
            }
            return new ExpressionNode(NodeKind.OTHER_LITERAL, text(ctx), line(token), column(token), List.of());
        }

        @Override
        public SyntaxNode visitYield_expr(Python3Parser.Yield_exprContext ctx) {
            if (ctx.test() != null) {
                return other(ctx, List.of(visit(ctx.test())));
            }
            if (ctx.testlist_star_expr() != null) {
                return other(ctx, items(ctx.testlist_star_expr()));
            }
            return other(ctx, List.of());
        }

        /**
         * Translates the element expressions of a display, argument or target list, flattening
         * comprehension clauses into their targets, iterables and conditions.
         */
        private List<SyntaxNode> items(ParserRuleContext container) {
            List<SyntaxNode> nodes = new ArrayList<>();
            for (int i = 0; i < container.getChildCount(); i++) {
                ParseTree child = container.getChild(i);
                if (child instanceof Python3Parser.Comp_forContext) {
                    nodes.addAll(comprehension((Python3Parser.Comp_forContext) child));
                } else if (child instanceof ParserRuleContext) {
                    nodes.add(visit(child));
                }
            }
            return nodes;
        }

        private List<SyntaxNode> comprehension(Python3Parser.Comp_forContext compFor) {
            List<SyntaxNode> parts = new ArrayList<>();
            Python3Parser.Comp_forContext clause = compFor;
            while (clause != null) {
                parts.addAll(items(clause.exprlist()));
                parts.add(visit(clause.or_test()));
                Python3Parser.Comp_iterContext next = clause.comp_iter();
                clause = null;
                while (next != null && next.comp_if() != null) {
                    parts.add(visit(next.comp_if().or_test()));
                    next = next.comp_if().comp_iter();
                }
                if (next != null) {
                    clause = next.comp_for();
                }
            }
            return parts;
        }

        private SyntaxNode other(ParserRuleContext ctx, List<SyntaxNode> children) {
            return new ExpressionNode(NodeKind.OTHER, text(ctx), line(ctx.getStart()), column(ctx.getStart()), children);
        }

        private Supplier<String> text(ParserRuleContext ctx) {
            return text(ctx.getStart().getTokenIndex(), ctx.getStop().getTokenIndex());
        }

        private Supplier<String> text(int from, int to) {
            return () -> TokenRenderer.render(tokens.getTokens(), from, to);
        }
    }
}
