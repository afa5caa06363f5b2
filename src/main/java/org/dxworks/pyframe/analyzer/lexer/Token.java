package org.dxworks.pyframe.analyzer.lexer;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.Objects;

public final class Token {
    public final TokenKind kind;
    public final String text;
    public final SourceSpan span;

    public Token(TokenKind kind, String text, SourceSpan span) {
        this.kind = kind;
        this.text = text;
        this.span = span;
    }

    /** Same text and span, different kind. */
    public Token withKind(TokenKind newKind) {
        return new Token(newKind, text, span);
    }

    /** Zero-width marker token placed at the start of {@code anchor}. */
    public static Token marker(TokenKind kind, Token anchor) {
        return new Token(kind, "", SourceSpan.at(anchor.span));
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isOperator(String op) {
        return kind == TokenKind.OPERATOR && text.equals(op);
    }

    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && text.equals(keyword);
    }

    public boolean isName(String name) {
        return kind == TokenKind.IDENTIFIER && text.equals(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return kind == token.kind && text.equals(token.text) && span.equals(token.span);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, span);
    }

    @Override
    public String toString() {
        return kind + "('" + text.replace("\n", "\\n") + "')@" + span;
    }
}
