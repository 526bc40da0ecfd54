package com.boundsmith.syntax;

/**
 * Front end that turns the text of one source file into a neutral syntax tree.
 */
public interface SourceTreeParser {

    /**
     * Parses one file.
     *
     * @param source The file's text
     * @param file Display name used for locations
     * @return A {@link NodeKind#MODULE} node whose children are the file's top-level expressions
     * @throws SourceParseException if the text is not syntactically valid
     */
    SyntaxNode parse(String source, String file) throws SourceParseException;
}
