package com.boundsmith.visitor;

import com.boundsmith.model.LiteralCorpus;
import com.boundsmith.syntax.LiteralNode;
import com.boundsmith.syntax.SyntaxNode;
import com.boundsmith.syntax.SyntaxVisitorAdapter;

/**
 * Collects every numeric literal of a test tree, negated literals included.
 */
public class LiteralCollector extends SyntaxVisitorAdapter {

    private final LiteralCorpus corpus;

    public LiteralCollector(LiteralCorpus corpus) {
        this.corpus = corpus;
    }

    public static LiteralCorpus collect(SyntaxNode tree) {
        LiteralCorpus corpus = new LiteralCorpus();
        new LiteralCollector(corpus).visit(tree);
        return corpus;
    }

    @Override
    protected void visitLiteral(LiteralNode node) {
        corpus.add(node.getValue());
    }
}
