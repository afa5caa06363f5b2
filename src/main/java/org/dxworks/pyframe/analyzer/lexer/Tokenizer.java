package org.dxworks.pyframe.analyzer.lexer;

import org.dxworks.pyframe.model.SourceSpan;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Converts Python source text into a flat token sequence.
 *
 * The sequence is lossless: whitespace, comments, line breaks and line continuations are tokens too,
 * so concatenating the text of every token reproduces the input. Each call to {@link #iterator()}
 * starts an independent lexing pass over the same text.
 */
public final class Tokenizer implements Iterable<Token> {

    public static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
            "return", "try", "while", "with", "yield");

    private static final String[] OPERATORS_3 = {"**=", "//=", ">>=", "<<=", "..."};
    private static final String[] OPERATORS_2 = {
            "**", "//", "==", "!=", "<=", ">=", "<<", ">>", "+=", "-=", "*=", "/=", "%=",
            "&=", "|=", "^=", "@=", "->", ":="};
    private static final String OPERATORS_1 = "+-*/%@&|^~<>()[]{},:.;=!";
    private static final String STRING_PREFIX_CHARS = "rRbBuUfF";

    private final String source;

    public Tokenizer(String source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        this.source = source;
    }

    /** Eagerly tokenizes {@code source}, ending with an {@link TokenKind#EOF} token. */
    public static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        for (Token token : new Tokenizer(source)) {
            tokens.add(token);
        }
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Lexer();
    }

    private final class Lexer implements Iterator<Token> {
        private int pos = 0;
        private int line = 1;
        private int column = 0;
        private boolean done = false;

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done) {
                throw new NoSuchElementException();
            }
            if (pos >= source.length()) {
                done = true;
                return make(TokenKind.EOF, pos);
            }

            char c = source.charAt(pos);
            if (c == ' ' || c == '\t' || c == '\f') {
                return make(TokenKind.WHITESPACE, scanWhitespace(pos));
            }
            if (c == '\n' || c == '\r') {
                return make(TokenKind.NEWLINE, lineBreakEnd(pos));
            }
            if (c == '#') {
                return make(TokenKind.COMMENT, scanToLineEnd(pos));
            }
            if (c == '\\') {
                int next = pos + 1;
                if (next < source.length() && (source.charAt(next) == '\n' || source.charAt(next) == '\r')) {
                    return make(TokenKind.CONTINUATION, lineBreakEnd(next));
                }
                throw invalid(pos, "Unexpected character after line continuation");
            }
            int stringStart = stringQuoteIndex(pos);
            if (stringStart >= 0) {
                return make(TokenKind.STRING, scanString(stringStart));
            }
            if (isDigit(c) || (c == '.' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
                return make(TokenKind.NUMBER, scanNumber(pos));
            }
            int cp = source.codePointAt(pos);
            if (cp == '_' || Character.isUnicodeIdentifierStart(cp)) {
                int end = scanIdentifier(pos);
                String word = source.substring(pos, end);
                return make(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, end);
            }
            int opEnd = scanOperator(pos);
            if (opEnd > pos) {
                return make(TokenKind.OPERATOR, opEnd);
            }
            throw invalid(pos, "Invalid character '" + new String(Character.toChars(cp)) + "'");
        }

        private Token make(TokenKind kind, int end) {
            SourceSpan span = spanTo(end);
            Token token = new Token(kind, source.substring(pos, end), span);
            pos = end;
            line = span.endLine;
            column = span.endColumn;
            return token;
        }

        /** Span from the current position to {@code end}, without consuming anything. */
        private SourceSpan spanTo(int end) {
            int l = line;
            int col = column;
            for (int i = pos; i < end; i++) {
                char ch = source.charAt(i);
                if (ch == '\r' && i + 1 < end && source.charAt(i + 1) == '\n') {
                    continue;
                }
                if (ch == '\n' || ch == '\r') {
                    l++;
                    col = 0;
                } else {
                    col++;
                }
            }
            return new SourceSpan(line, column, l, col, pos, end);
        }

        private LexException invalid(int at, String message) {
            int end = Math.min(source.length(), at + Character.charCount(source.codePointAt(at)));
            SourceSpan start = spanTo(at);
            SourceSpan span = new SourceSpan(start.endLine, start.endColumn, start.endLine,
                    start.endColumn + (end - at), at, end);
            return new LexException(LexException.Kind.INVALID_CHARACTER, message, span);
        }

        private int scanWhitespace(int i) {
            while (i < source.length()) {
                char ch = source.charAt(i);
                if (ch != ' ' && ch != '\t' && ch != '\f') break;
                i++;
            }
            return i;
        }

        private int lineBreakEnd(int i) {
            if (source.charAt(i) == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                return i + 2;
            }
            return i + 1;
        }

        private int scanToLineEnd(int i) {
            while (i < source.length() && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
                i++;
            }
            return i;
        }

        /** Index of the opening quote if a string literal (with optional prefix) starts at {@code i}, else -1. */
        private int stringQuoteIndex(int i) {
            int j = i;
            while (j < source.length() && j - i < 2 && STRING_PREFIX_CHARS.indexOf(source.charAt(j)) >= 0) {
                j++;
            }
            if (j < source.length() && (source.charAt(j) == '\'' || source.charAt(j) == '"')) {
                return j;
            }
            return -1;
        }

        private int scanString(int quoteIndex) {
            char quote = source.charAt(quoteIndex);
            String triple = String.valueOf(new char[]{quote, quote, quote});
            boolean isTriple = source.startsWith(triple, quoteIndex);
            int i = quoteIndex + (isTriple ? 3 : 1);
            while (i < source.length()) {
                char ch = source.charAt(i);
                if (ch == '\\') {
                    i = i + 1 < source.length() ? escapedEnd(i + 1) : i + 1;
                    continue;
                }
                if (isTriple) {
                    if (source.startsWith(triple, i)) {
                        return i + 3;
                    }
                } else if (ch == quote) {
                    return i + 1;
                } else if (ch == '\n' || ch == '\r') {
                    throw unterminated(i);
                }
                i++;
            }
            throw unterminated(source.length());
        }

        private int escapedEnd(int i) {
            if (source.charAt(i) == '\r' || source.charAt(i) == '\n') {
                return lineBreakEnd(i);
            }
            return i + 1;
        }

        private LexException unterminated(int end) {
            return new LexException(LexException.Kind.UNTERMINATED_STRING,
                    "Unterminated string literal", spanTo(end));
        }

        private int scanNumber(int i) {
            if (source.charAt(i) == '0' && i + 1 < source.length()
                    && "xXoObB".indexOf(source.charAt(i + 1)) >= 0) {
                i += 2;
                while (i < source.length() && (Character.digit(source.charAt(i), 16) >= 0 || source.charAt(i) == '_')) {
                    i++;
                }
                return i;
            }
            i = scanDigits(i);
            if (i < source.length() && source.charAt(i) == '.') {
                i = scanDigits(i + 1);
            }
            if (i < source.length() && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
                int j = i + 1;
                if (j < source.length() && (source.charAt(j) == '+' || source.charAt(j) == '-')) {
                    j++;
                }
                if (j < source.length() && isDigit(source.charAt(j))) {
                    i = scanDigits(j);
                }
            }
            if (i < source.length() && (source.charAt(i) == 'j' || source.charAt(i) == 'J')) {
                i++;
            }
            return i;
        }

        private int scanDigits(int i) {
            while (i < source.length() && (isDigit(source.charAt(i)) || source.charAt(i) == '_')) {
                i++;
            }
            return i;
        }

        private int scanIdentifier(int i) {
            i += Character.charCount(source.codePointAt(i));
            while (i < source.length()) {
                int cp = source.codePointAt(i);
                if (cp != '_' && !Character.isUnicodeIdentifierPart(cp)) break;
                if (Character.isIdentifierIgnorable(cp)) break;
                i += Character.charCount(cp);
            }
            return i;
        }

        private int scanOperator(int i) {
            for (String op : OPERATORS_3) {
                if (source.startsWith(op, i)) return i + 3;
            }
            for (String op : OPERATORS_2) {
                if (source.startsWith(op, i)) return i + 2;
            }
            if (OPERATORS_1.indexOf(source.charAt(i)) >= 0) {
                return i + 1;
            }
            return i;
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
