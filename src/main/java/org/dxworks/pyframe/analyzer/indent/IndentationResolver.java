package org.dxworks.pyframe.analyzer.indent;

import org.dxworks.pyframe.analyzer.lexer.Token;
import org.dxworks.pyframe.analyzer.lexer.TokenKind;
import org.dxworks.pyframe.ParseException;
import org.dxworks.pyframe.model.SourceSpan;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns the raw token sequence into an indentation-annotated one.
 *
 * Synthesizes zero-width {@link TokenKind#INDENT} / {@link TokenKind#DEDENT} markers at the start of
 * each logical line whose indentation differs from the enclosing block, and re-tags line breaks that
 * do not end a logical line (blank lines, comment-only lines, lines inside brackets) as
 * {@link TokenKind#NL}. Widths are computed with two tab stops; a line whose comparison against the
 * current level differs between the two is rejected as ambiguous.
 *
 * The output always ends with one DEDENT per open level followed by EOF, so INDENT and DEDENT
 * counts are equal for every accepted input.
 */
public final class IndentationResolver {

    public static final int DEFAULT_TAB_SIZE = 8;
    public static final int DEFAULT_ALTERNATE_TAB_SIZE = 1;

    private static final String OPENERS = "([{";
    private static final String CLOSERS = ")]}";

    private final int tabSize;
    private final int alternateTabSize;

    public IndentationResolver() {
        this(DEFAULT_TAB_SIZE, DEFAULT_ALTERNATE_TAB_SIZE);
    }

    public IndentationResolver(int tabSize, int alternateTabSize) {
        if (tabSize <= 0 || alternateTabSize <= 0 || tabSize == alternateTabSize) {
            throw new IllegalArgumentException("tab sizes must be positive and distinct");
        }
        this.tabSize = tabSize;
        this.alternateTabSize = alternateTabSize;
    }

    public List<Token> resolve(Iterable<Token> rawTokens) {
        return new Pass().run(rawTokens);
    }

    /** Width of a run of leading whitespace under the given tab stop. */
    public static int width(String whitespace, int tab) {
        int col = 0;
        for (int i = 0; i < whitespace.length(); i++) {
            char ch = whitespace.charAt(i);
            if (ch == '\t') {
                col = (col / tab + 1) * tab;
            } else if (ch == '\f') {
                col = 0;
            } else {
                col++;
            }
        }
        return col;
    }

    private final class Pass {
        private final List<Token> out = new ArrayList<>();
        private final Deque<int[]> levels = new ArrayDeque<>();
        private final Deque<Token> brackets = new ArrayDeque<>();
        private final List<Token> leading = new ArrayList<>();
        private boolean lineStart = true;

        List<Token> run(Iterable<Token> rawTokens) {
            levels.push(new int[]{0, 0});
            for (Token token : rawTokens) {
                if (token.is(TokenKind.EOF)) {
                    finish(token);
                    break;
                }
                if (lineStart) {
                    atLineStart(token);
                } else {
                    inLine(token);
                }
            }
            return out;
        }

        private void atLineStart(Token token) {
            switch (token.kind) {
                case WHITESPACE:
                    leading.add(token);
                    return;
                case COMMENT:
                case CONTINUATION:
                    flushLeading();
                    out.add(token);
                    return;
                case NEWLINE:
                    flushLeading();
                    out.add(token.withKind(TokenKind.NL));
                    return;
                default:
                    String indentation = leadingText();
                    SourceSpan span = leading.isEmpty()
                            ? SourceSpan.at(token.span)
                            : SourceSpan.between(leading.get(0).span, leading.get(leading.size() - 1).span);
                    flushLeading();
                    indent(indentation, span, token);
                    lineStart = false;
                    inLine(token);
            }
        }

        private void inLine(Token token) {
            if (token.is(TokenKind.NEWLINE)) {
                if (brackets.isEmpty()) {
                    out.add(token);
                    lineStart = true;
                } else {
                    out.add(token.withKind(TokenKind.NL));
                }
                return;
            }
            if (token.is(TokenKind.OPERATOR) && token.text.length() == 1) {
                char ch = token.text.charAt(0);
                if (OPENERS.indexOf(ch) >= 0) {
                    brackets.push(token);
                } else if (CLOSERS.indexOf(ch) >= 0) {
                    closeBracket(token, ch);
                }
            }
            out.add(token);
        }

        private void closeBracket(Token closer, char ch) {
            if (brackets.isEmpty()) {
                throw new ParseException(ParseException.Kind.UNBALANCED_BRACKETS,
                        "Unmatched '" + ch + "'", closer.span);
            }
            Token opener = brackets.pop();
            if (OPENERS.indexOf(opener.text.charAt(0)) != CLOSERS.indexOf(ch)) {
                throw new ParseException(ParseException.Kind.UNBALANCED_BRACKETS,
                        "Closing '" + ch + "' does not match '" + opener.text + "' opened at " + opener.span,
                        closer.span);
            }
        }

        private void indent(String indentation, SourceSpan span, Token anchor) {
            int col = width(indentation, tabSize);
            int alt = width(indentation, alternateTabSize);
            int[] top = levels.peek();
            if (col == top[0]) {
                requireConsistent(alt == top[1], span);
            } else if (col > top[0]) {
                requireConsistent(alt > top[1], span);
                levels.push(new int[]{col, alt});
                out.add(Token.marker(TokenKind.INDENT, anchor));
            } else {
                while (levels.size() > 1 && col < levels.peek()[0]) {
                    levels.pop();
                    out.add(Token.marker(TokenKind.DEDENT, anchor));
                }
                top = levels.peek();
                if (col != top[0]) {
                    throw new IndentationException(IndentationException.Kind.INCONSISTENT_DEDENT,
                            "Unindent does not match any outer indentation level", span);
                }
                requireConsistent(alt == top[1], span);
            }
        }

        private void requireConsistent(boolean consistent, SourceSpan span) {
            if (!consistent) {
                throw new IndentationException(IndentationException.Kind.AMBIGUOUS_TABS,
                        "Inconsistent use of tabs and spaces in indentation", span);
            }
        }

        private void finish(Token eof) {
            if (!brackets.isEmpty()) {
                Token opener = brackets.peek();
                throw new ParseException(ParseException.Kind.UNBALANCED_BRACKETS,
                        "'" + opener.text + "' was never closed", opener.span);
            }
            flushLeading();
            if (!lineStart) {
                out.add(Token.marker(TokenKind.NEWLINE, eof));
            }
            while (levels.size() > 1) {
                levels.pop();
                out.add(Token.marker(TokenKind.DEDENT, eof));
            }
            out.add(eof);
        }

        private String leadingText() {
            StringBuilder sb = new StringBuilder();
            for (Token ws : leading) {
                sb.append(ws.text);
            }
            return sb.toString();
        }

        private void flushLeading() {
            out.addAll(leading);
            leading.clear();
        }
    }
}
