package org.dxworks.pyframe.analyzer.parser;

import org.dxworks.pyframe.analyzer.lexer.Token;
import org.dxworks.pyframe.analyzer.lexer.TokenKind;
import org.dxworks.pyframe.analyzer.parser.tree.CallNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds call expressions in a token range without a full expression grammar.
 *
 * A call is a primary chain (name, literal or bracketed group, followed by {@code .attr}, {@code [...]}
 * or {@code (...)} trailers) whose trailer is an argument list. Calls are reported in the order of
 * their opening parenthesis; calls inside arguments follow the call that contains them.
 */
final class CallScanner {

    private static final Set<String> LITERAL_KEYWORDS = Set.of("None", "True", "False");

    private final SignificantTokens tokens;

    CallScanner(SignificantTokens tokens) {
        this.tokens = tokens;
    }

    List<CallNode> scan(int from, int to) {
        List<CallNode> calls = new ArrayList<>();
        scan(from, to, calls);
        return calls;
    }

    private void scan(int from, int to, List<CallNode> calls) {
        int k = from;
        while (k < to) {
            if (isAtomStart(tokens.get(k))) {
                k = scanChain(k, to, calls);
            } else {
                k++;
            }
        }
    }

    private int scanChain(int start, int to, List<CallNode> calls) {
        int k = start;
        Token atom = tokens.get(k);
        if (SignificantTokens.isOpener(atom)) {
            int close = tokens.matching(k, to);
            if (close < 0) {
                scan(k + 1, to, calls);
                return to;
            }
            scan(k + 1, close, calls);
            k = close + 1;
        } else {
            k++;
            while (atom.is(TokenKind.STRING) && k < to && tokens.get(k).is(TokenKind.STRING)) {
                k++;
            }
        }

        while (k < to) {
            Token trailer = tokens.get(k);
            if (trailer.isOperator(".") && k + 1 < to && tokens.get(k + 1).is(TokenKind.IDENTIFIER)) {
                k += 2;
            } else if (trailer.isOperator("(") || trailer.isOperator("[")) {
                int close = tokens.matching(k, to);
                if (close < 0) {
                    scan(k + 1, to, calls);
                    return to;
                }
                if (trailer.isOperator("(")) {
                    calls.add(new CallNode(tokens.text(start, k), arguments(k + 1, close), tokens.span(start, close + 1)));
                }
                scan(k + 1, close, calls);
                k = close + 1;
            } else {
                break;
            }
        }
        return k;
    }

    private List<String> arguments(int from, int to) {
        List<String> arguments = new ArrayList<>();
        for (int[] range : tokens.splitTopLevel(from, to)) {
            arguments.add(tokens.text(range[0], range[1]));
        }
        return arguments;
    }

    private static boolean isAtomStart(Token token) {
        switch (token.kind) {
            case IDENTIFIER:
            case STRING:
            case NUMBER:
                return true;
            case KEYWORD:
                return LITERAL_KEYWORDS.contains(token.text);
            case OPERATOR:
                return SignificantTokens.isOpener(token);
            default:
                return false;
        }
    }
}
