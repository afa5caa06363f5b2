package org.dxworks.pyframe.analyzer.parser;

import org.dxworks.pyframe.analyzer.lexer.Token;
import org.dxworks.pyframe.analyzer.lexer.TokenKind;
import org.dxworks.pyframe.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * View of an indentation-annotated token list that skips trivia, while still rendering source text
 * with the whitespace that sat between the significant tokens.
 * Positions are indices into the significant tokens; ranges are half-open.
 */
final class SignificantTokens {

    private static final String OPENERS = "([{";
    private static final String CLOSERS = ")]}";

    private final List<Token> all;
    private final int[] significant;

    SignificantTokens(List<Token> all) {
        if (all.isEmpty() || !all.get(all.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("token list must end with EOF");
        }
        this.all = all;
        int count = 0;
        for (Token token : all) {
            if (!token.kind.isTrivia()) count++;
        }
        this.significant = new int[count];
        int k = 0;
        for (int i = 0; i < all.size(); i++) {
            if (!all.get(i).kind.isTrivia()) significant[k++] = i;
        }
    }

    int size() {
        return significant.length;
    }

    /** Token at {@code k}; positions past the end yield the EOF token. */
    Token get(int k) {
        return all.get(significant[Math.min(k, significant.length - 1)]);
    }

    SourceSpan span(int from, int to) {
        return SourceSpan.between(get(from).span, get(Math.max(from, to - 1)).span);
    }

    /**
     * Source text of {@code [from, to)}. Whitespace inside a physical line is kept as written;
     * line breaks, comments and continuations collapse to a single space (none next to a bracket).
     */
    String text(int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int k = from; k < to; k++) {
            Token token = get(k);
            sb.append(token.text);
            if (k + 1 < to) {
                sb.append(separator(k, token, get(k + 1)));
            }
        }
        return sb.toString();
    }

    private String separator(int k, Token left, Token right) {
        StringBuilder whitespace = new StringBuilder();
        boolean lineBreak = false;
        for (int i = significant[k] + 1; i < significant[k + 1]; i++) {
            Token trivia = all.get(i);
            if (trivia.is(TokenKind.WHITESPACE)) {
                whitespace.append(trivia.text);
            } else {
                lineBreak = true;
            }
        }
        if (!lineBreak) {
            return whitespace.toString();
        }
        return isOpener(left) || isCloser(right) ? "" : " ";
    }

    /** Whitespace that leads the physical line starting at {@code k}, ignoring indentation markers. */
    String leadingWhitespace(int k) {
        StringBuilder sb = new StringBuilder();
        for (int i = significant[Math.min(k, significant.length - 1)] - 1; i >= 0; i--) {
            Token token = all.get(i);
            if (token.is(TokenKind.WHITESPACE)) {
                sb.insert(0, token.text);
            } else if (!token.is(TokenKind.INDENT) && !token.is(TokenKind.DEDENT)) {
                break;
            }
        }
        return sb.toString();
    }

    /** Position of the bracket closing the one at {@code open}, or -1 when it is not closed before {@code limit}. */
    int matching(int open, int limit) {
        int depth = 0;
        for (int k = open; k < limit; k++) {
            Token token = get(k);
            if (isOpener(token)) {
                depth++;
            } else if (isCloser(token)) {
                depth--;
                if (depth == 0) return k;
            }
        }
        return -1;
    }

    /**
     * First position in {@code [from, to)} holding one of {@code operators} outside any bracket,
     * or -1. The parameters of a {@code lambda} are skipped, so its defaults and colon never match.
     */
    int findTopLevel(int from, int to, Set<String> operators) {
        int depth = 0;
        int openLambdas = 0;
        for (int k = from; k < to; k++) {
            Token token = get(k);
            if (isOpener(token)) {
                depth++;
            } else if (isCloser(token)) {
                depth--;
            } else if (depth == 0) {
                if (token.isKeyword("lambda")) {
                    openLambdas++;
                } else if (openLambdas > 0) {
                    if (token.isOperator(":")) openLambdas--;
                } else if (token.is(TokenKind.OPERATOR) && operators.contains(token.text)) {
                    return k;
                }
            }
        }
        return -1;
    }

    /** Ranges of {@code [from, to)} separated by top-level commas; a trailing empty range is dropped. */
    List<int[]> splitTopLevel(int from, int to) {
        List<int[]> ranges = new ArrayList<>();
        int start = from;
        while (start < to) {
            int comma = findTopLevel(start, to, Set.of(","));
            int end = comma < 0 ? to : comma;
            if (end > start) {
                ranges.add(new int[]{start, end});
            }
            if (comma < 0) break;
            start = comma + 1;
        }
        return ranges;
    }

    boolean containsOperator(int from, int to, String operator) {
        for (int k = from; k < to; k++) {
            if (get(k).isOperator(operator)) return true;
        }
        return false;
    }

    static boolean isOpener(Token token) {
        return token.is(TokenKind.OPERATOR) && token.text.length() == 1 && OPENERS.indexOf(token.text.charAt(0)) >= 0;
    }

    static boolean isCloser(Token token) {
        return token.is(TokenKind.OPERATOR) && token.text.length() == 1 && CLOSERS.indexOf(token.text.charAt(0)) >= 0;
    }
}
