package org.dxworks.pyframe.analyzer.lexer;

public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    OPERATOR,
    STRING,
    NUMBER,
    /** Physical line break that ends a logical line. */
    NEWLINE,
    /** Physical line break that does not end a logical line (blank, comment-only or bracketed lines). */
    NL,
    INDENT,
    DEDENT,
    COMMENT,
    /** Spaces, tabs and form feeds. */
    WHITESPACE,
    /** Backslash followed by a line break. */
    CONTINUATION,
    EOF;

    /** Tokens that carry no syntax for the parser. */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT || this == NL || this == CONTINUATION;
    }
}
