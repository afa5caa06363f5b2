package org.dxworks.pyframe.analyzer.parser;

import org.dxworks.pyframe.ParseException;
import org.dxworks.pyframe.analyzer.indent.IndentationException;
import org.dxworks.pyframe.analyzer.indent.IndentationResolver;
import org.dxworks.pyframe.analyzer.lexer.Token;
import org.dxworks.pyframe.analyzer.lexer.TokenKind;
import org.dxworks.pyframe.analyzer.parser.tree.AssignmentNode;
import org.dxworks.pyframe.analyzer.parser.tree.BlockNode;
import org.dxworks.pyframe.analyzer.parser.tree.CallNode;
import org.dxworks.pyframe.analyzer.parser.tree.ClassNode;
import org.dxworks.pyframe.analyzer.parser.tree.DecoratorNode;
import org.dxworks.pyframe.analyzer.parser.tree.ExpressionNode;
import org.dxworks.pyframe.analyzer.parser.tree.FromImportNode;
import org.dxworks.pyframe.analyzer.parser.tree.FunctionNode;
import org.dxworks.pyframe.analyzer.parser.tree.ImportNode;
import org.dxworks.pyframe.analyzer.parser.tree.ImportedName;
import org.dxworks.pyframe.analyzer.parser.tree.ModuleNode;
import org.dxworks.pyframe.analyzer.parser.tree.SimpleNode;
import org.dxworks.pyframe.analyzer.parser.tree.SkippedNode;
import org.dxworks.pyframe.analyzer.parser.tree.StatementNode;
import org.dxworks.pyframe.model.Diagnostic;
import org.dxworks.pyframe.model.DiagnosticKind;
import org.dxworks.pyframe.model.Parameter;
import org.dxworks.pyframe.model.ParameterKind;
import org.dxworks.pyframe.model.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser over an indentation-annotated token list, one logical statement at a time.
 *
 * Covers the statement grammar needed to recover scopes and call sites: imports, decorators, function
 * and class definitions, assignments, expression statements and control-flow blocks. A statement
 * outside that grammar is skipped up to the next statement boundary at the same or lower indentation
 * (its block included) and reported as a {@link DiagnosticKind#SKIPPED_CONSTRUCT}.
 *
 * Every statement that starts a physical line must sit at the indentation width of the innermost open
 * block, measured with the same tab stop as the {@link IndentationResolver} that produced the tokens. A
 * DEDENT with no open block or a misplaced statement means the token structure and the block structure
 * diverged, and fails with {@link ParseException.Kind#STRUCTURAL_MISMATCH}.
 */
public final class Parser {

    private static final Set<String> COMPOUND_KEYWORDS = Set.of(
            "if", "elif", "else", "for", "while", "try", "except", "finally", "with");
    private static final Set<String> SIMPLE_KEYWORDS = Set.of(
            "pass", "break", "continue", "return", "raise", "del", "assert", "global", "nonlocal", "yield");
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "await", "lambda", "not", "None", "True", "False");
    private static final Set<String> AUGMENTED_OPERATORS = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", ">>=", "<<=", "&=", "|=", "^=", "@=");
    private static final Set<String> LITERAL_OPERATORS = Set.of("-", "+", "(", ")", "[", "]", "{", "}", ",", ":");
    private static final Set<String> ASSIGN = Set.of("=");
    private static final Set<String> COLON = Set.of(":");
    private static final Set<String> SEMICOLON = Set.of(";");
    private static final Set<String> ANNOTATION_END = Set.of(",", "=");

    private final SignificantTokens tokens;
    private final CallScanner callScanner;
    private final int tabSize;
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private int p = 0;

    public Parser(List<Token> indentedTokens) {
        this(indentedTokens, IndentationResolver.DEFAULT_TAB_SIZE);
    }

    /** {@code tabSize} must be the primary tab stop the tokens were resolved with. */
    public Parser(List<Token> indentedTokens, int tabSize) {
        this.tokens = new SignificantTokens(indentedTokens);
        this.callScanner = new CallScanner(tokens);
        this.tabSize = tabSize;
    }

    /** Non-fatal diagnostics of the last {@link #parse()}, in source order. */
    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public ModuleNode parse() {
        p = 0;
        diagnostics.clear();
        List<StatementNode> body = new ArrayList<>();
        while (!at(TokenKind.EOF)) {
            if (at(TokenKind.DEDENT)) {
                throw new ParseException(ParseException.Kind.STRUCTURAL_MISMATCH,
                        "Dedent without an open block", peek().span);
            }
            checkStatementStart(0);
            parseStatement(body);
        }
        return new ModuleNode(body, tokens.span(0, tokens.size()));
    }

    // ---- statements ----

    private void parseStatement(List<StatementNode> out) {
        int start = p;
        try {
            Token first = peek();
            if (first.isOperator("@")) {
                out.add(parseDecorator());
            } else if (first.isKeyword("def")) {
                out.add(parseFunction(start, false));
            } else if (first.isKeyword("async")) {
                out.add(parseAsync(start));
            } else if (first.isKeyword("class")) {
                out.add(parseClass(start));
            } else if (first.isKeyword("import")) {
                out.add(parseImport(start));
            } else if (first.isKeyword("from")) {
                out.add(parseFromImport(start));
            } else if (first.is(TokenKind.KEYWORD) && COMPOUND_KEYWORDS.contains(first.text)) {
                advance();
                out.add(parseCompound(first.text, start));
            } else if (isMatchStatement()) {
                throw new UnsupportedConstruct("match statement");
            } else if (isTypeAliasStatement()) {
                throw new UnsupportedConstruct("type alias statement");
            } else {
                out.add(parseSimpleStatement(start));
            }
        } catch (UnsupportedConstruct e) {
            int last = skipToBoundary(start);
            SourceSpan span = tokens.span(start, last + 1);
            diagnostics.add(new Diagnostic(DiagnosticKind.SKIPPED_CONSTRUCT,
                    "Skipped unsupported construct: " + e.getMessage(), span));
            out.add(new SkippedNode(e.getMessage(), span));
        }
    }

    private DecoratorNode parseDecorator() {
        int at = p;
        advance();
        int from = p;
        int end = lineEnd(from);
        if (end == from) {
            throw new UnsupportedConstruct("empty decorator");
        }
        String expression = tokens.text(from, end);
        String name = expression;
        List<String> arguments = new ArrayList<>();
        int open = trailingCallOpen(from, end);
        if (open >= 0) {
            name = tokens.text(from, open);
            for (int[] range : tokens.splitTopLevel(open + 1, end - 1)) {
                arguments.add(tokens.text(range[0], range[1]));
            }
        }
        p = end;
        endStatement();
        return new DecoratorNode(expression, name, arguments, tokens.span(at, end));
    }

    /** Position of the top-level '(' whose ')' ends the range, or -1. */
    private int trailingCallOpen(int from, int end) {
        if (!tokens.get(end - 1).isOperator(")")) return -1;
        int depth = 0;
        int lastOpen = -1;
        for (int k = from; k < end; k++) {
            Token token = tokens.get(k);
            if (SignificantTokens.isOpener(token)) {
                if (depth == 0) lastOpen = k;
                depth++;
            } else if (SignificantTokens.isCloser(token)) {
                depth--;
            }
        }
        if (lastOpen <= from || !tokens.get(lastOpen).isOperator("(")) return -1;
        return tokens.matching(lastOpen, end) == end - 1 ? lastOpen : -1;
    }

    private StatementNode parseAsync(int start) {
        Token next = tokens.get(p + 1);
        if (next.isKeyword("def")) {
            advance();
            return parseFunction(start, true);
        }
        if (next.isKeyword("for") || next.isKeyword("with")) {
            advance();
            advance();
            return parseCompound("async " + next.text, start);
        }
        throw new UnsupportedConstruct("async statement");
    }

    private FunctionNode parseFunction(int start, boolean isAsync) {
        expectKeyword("def");
        String name = expectName().text;
        List<CallNode> calls = new ArrayList<>();
        List<Parameter> parameters = parseParameters(calls);
        String returnAnnotation = null;
        if (atOperator("->")) {
            advance();
            int colon = tokens.findTopLevel(p, lineEnd(p), COLON);
            if (colon <= p) {
                throw new UnsupportedConstruct("return annotation");
            }
            returnAnnotation = tokens.text(p, colon);
            p = colon;
        }
        List<StatementNode> body = parseBlock();
        return new FunctionNode(name, isAsync, parameters, returnAnnotation, body, calls, spanFrom(start));
    }

    private List<Parameter> parseParameters(List<CallNode> calls) {
        expectOperator("(");
        int close = tokens.matching(p - 1, tokens.size());
        List<Parameter> parameters = new ArrayList<>();
        boolean keywordOnly = false;
        while (p < close) {
            if (atOperator("/")) {
                for (int i = 0; i < parameters.size(); i++) {
                    parameters.set(i, parameters.get(i).withKind(ParameterKind.POSITIONAL_ONLY));
                }
                advance();
            } else if (atOperator("*")) {
                advance();
                keywordOnly = true;
                if (at(TokenKind.IDENTIFIER)) {
                    parameters.add(parseParameter(ParameterKind.VAR_POSITIONAL, close, calls));
                }
            } else if (atOperator("**")) {
                advance();
                parameters.add(parseParameter(ParameterKind.VAR_KEYWORD, close, calls));
            } else if (at(TokenKind.IDENTIFIER)) {
                parameters.add(parseParameter(keywordOnly ? ParameterKind.KEYWORD_ONLY : ParameterKind.POSITIONAL,
                        close, calls));
            } else {
                throw new UnsupportedConstruct("parameter list");
            }
            if (atOperator(",")) {
                advance();
            } else if (p != close) {
                throw new UnsupportedConstruct("parameter list");
            }
        }
        expectOperator(")");
        return parameters;
    }

    private Parameter parseParameter(ParameterKind kind, int close, List<CallNode> calls) {
        String name = expectName().text;
        String annotation = null;
        String defaultValue = null;
        if (atOperator(":")) {
            advance();
            int end = endOf(tokens.findTopLevel(p, close, ANNOTATION_END), close);
            if (end == p) throw new UnsupportedConstruct("parameter annotation");
            annotation = tokens.text(p, end);
            p = end;
        }
        if (atOperator("=")) {
            advance();
            int end = endOf(tokens.findTopLevel(p, close, Set.of(",")), close);
            if (end == p) throw new UnsupportedConstruct("parameter default");
            defaultValue = tokens.text(p, end);
            calls.addAll(callScanner.scan(p, end));
            p = end;
        }
        return new Parameter(name, annotation, defaultValue, kind);
    }

    private ClassNode parseClass(int start) {
        expectKeyword("class");
        String name = expectName().text;
        if (atOperator("[")) {
            p = requireClosed(tokens.matching(p, tokens.size())) + 1;
        }
        List<String> bases = new ArrayList<>();
        List<String> keywords = new ArrayList<>();
        List<CallNode> calls = new ArrayList<>();
        if (atOperator("(")) {
            int open = p;
            int close = requireClosed(tokens.matching(open, tokens.size()));
            for (int[] range : tokens.splitTopLevel(open + 1, close)) {
                String text = tokens.text(range[0], range[1]);
                if (isKeywordArgument(range[0], range[1])) {
                    keywords.add(text);
                } else {
                    bases.add(text);
                }
            }
            calls.addAll(callScanner.scan(open + 1, close));
            p = close + 1;
        }
        List<StatementNode> body = parseBlock();
        return new ClassNode(name, bases, keywords, body, calls, spanFrom(start));
    }

    private boolean isKeywordArgument(int from, int to) {
        Token first = tokens.get(from);
        if (first.isOperator("**")) return true;
        return first.is(TokenKind.IDENTIFIER) && from + 1 < to && tokens.get(from + 1).isOperator("=");
    }

    private ImportNode parseImport(int start) {
        expectKeyword("import");
        List<ImportedName> names = new ArrayList<>();
        do {
            if (atOperator(",")) advance();
            int nameStart = p;
            List<String> path = dottedName();
            String alias = null;
            if (atKeyword("as")) {
                advance();
                alias = expectName().text;
            }
            names.add(new ImportedName(path, alias, tokens.span(nameStart, p)));
        } while (atOperator(","));
        SourceSpan span = tokens.span(start, p);
        endStatement();
        return new ImportNode(names, span);
    }

    private FromImportNode parseFromImport(int start) {
        expectKeyword("from");
        int level = 0;
        while (atOperator(".") || atOperator("...")) {
            level += advance().text.length();
        }
        List<String> module = at(TokenKind.IDENTIFIER) ? dottedName() : List.of();
        if (level == 0 && module.isEmpty()) {
            throw new UnsupportedConstruct("from-import without module");
        }
        expectKeyword("import");
        List<ImportedName> names = new ArrayList<>();
        boolean wildcard = false;
        if (atOperator("*")) {
            advance();
            wildcard = true;
        } else {
            boolean parenthesized = atOperator("(");
            if (parenthesized) advance();
            while (at(TokenKind.IDENTIFIER)) {
                int nameStart = p;
                String name = advance().text;
                String alias = null;
                if (atKeyword("as")) {
                    advance();
                    alias = expectName().text;
                }
                names.add(new ImportedName(List.of(name), alias, tokens.span(nameStart, p)));
                if (!atOperator(",")) break;
                advance();
            }
            if (parenthesized) expectOperator(")");
            if (names.isEmpty()) {
                throw new UnsupportedConstruct("from-import without names");
            }
        }
        SourceSpan span = tokens.span(start, p);
        endStatement();
        return new FromImportNode(level, module, names, wildcard, span);
    }

    private BlockNode parseCompound(String keyword, int start) {
        int colon = tokens.findTopLevel(p, lineEnd(p), COLON);
        if (colon < 0) {
            throw new UnsupportedConstruct("incomplete " + keyword + " statement");
        }
        if (tokens.containsOperator(p, colon, ":=")) {
            throw new UnsupportedConstruct("assignment expression");
        }
        String header = tokens.text(p, colon);
        List<CallNode> calls = callScanner.scan(p, colon);
        p = colon;
        List<StatementNode> body = parseBlock();
        return new BlockNode(keyword, header, body, calls, spanFrom(start));
    }

    private StatementNode parseSimpleStatement(int start) {
        int lineEnd = lineEnd(start);
        int end = endOf(tokens.findTopLevel(start, lineEnd, SEMICOLON), lineEnd);
        if (end == start) {
            throw new UnsupportedConstruct("empty statement");
        }
        if (tokens.containsOperator(start, end, ":=")) {
            throw new UnsupportedConstruct("assignment expression");
        }
        Token first = tokens.get(start);
        if (first.is(TokenKind.KEYWORD) && !SIMPLE_KEYWORDS.contains(first.text)
                && !EXPRESSION_KEYWORDS.contains(first.text)) {
            throw new UnsupportedConstruct("statement starting with '" + first.text + "'");
        }
        List<CallNode> calls = callScanner.scan(start, end);
        SourceSpan span = tokens.span(start, end);
        StatementNode node;
        if (first.is(TokenKind.KEYWORD) && SIMPLE_KEYWORDS.contains(first.text)) {
            node = new SimpleNode(first.text, calls, span);
        } else {
            node = assignmentOrExpression(start, end, calls, span);
        }
        p = end;
        endStatement();
        return node;
    }

    private StatementNode assignmentOrExpression(int start, int end, List<CallNode> calls, SourceSpan span) {
        int assign = tokens.findTopLevel(start, end, ASSIGN);
        int augmented = tokens.findTopLevel(start, end, AUGMENTED_OPERATORS);
        int colon = tokens.findTopLevel(start, end, COLON);

        if (augmented > start && (assign < 0 || augmented < assign)) {
            String value = tokens.text(augmented + 1, end);
            return new AssignmentNode(List.of(tokens.text(start, augmented)), null, tokens.get(augmented).text,
                    value, isLiteral(augmented + 1, end), calls, span);
        }
        if (colon > start && (assign < 0 || colon < assign)) {
            int annotationEnd = assign < 0 ? end : assign;
            String value = assign < 0 ? null : tokens.text(assign + 1, end);
            return new AssignmentNode(List.of(tokens.text(start, colon)), tokens.text(colon + 1, annotationEnd),
                    "=", value, assign >= 0 && isLiteral(assign + 1, end), calls, span);
        }
        if (assign > start) {
            List<String> targets = new ArrayList<>();
            int from = start;
            int next = assign;
            while (next >= 0) {
                targets.add(tokens.text(from, next));
                from = next + 1;
                next = tokens.findTopLevel(from, end, ASSIGN);
            }
            return new AssignmentNode(targets, null, "=", tokens.text(from, end), isLiteral(from, end), calls, span);
        }
        boolean stringLiteral = true;
        for (int k = start; k < end; k++) {
            stringLiteral &= tokens.get(k).is(TokenKind.STRING);
        }
        return new ExpressionNode(tokens.text(start, end), stringLiteral, calls, span);
    }

    /** Literal tokens only: strings, numbers, None/True/False, and the brackets and signs around them. */
    private boolean isLiteral(int from, int to) {
        boolean sawLiteral = false;
        for (int k = from; k < to; k++) {
            Token token = tokens.get(k);
            if (token.is(TokenKind.STRING) || token.is(TokenKind.NUMBER)
                    || token.isKeyword("None") || token.isKeyword("True") || token.isKeyword("False")) {
                sawLiteral = true;
            } else if (!(token.is(TokenKind.OPERATOR) && LITERAL_OPERATORS.contains(token.text))) {
                return false;
            }
        }
        return sawLiteral;
    }

    // ---- blocks ----

    /** Parses {@code ':' (simple statements NEWLINE | NEWLINE INDENT statement+ DEDENT)}. */
    private List<StatementNode> parseBlock() {
        expectOperator(":");
        List<StatementNode> body = new ArrayList<>();
        if (!at(TokenKind.NEWLINE)) {
            do {
                parseStatement(body);
            } while (!atLineStart() && !at(TokenKind.EOF));
            return body;
        }
        advance();
        if (!at(TokenKind.INDENT)) {
            throw new IndentationException(IndentationException.Kind.EXPECTED_INDENT,
                    "Expected an indented block", peek().span);
        }
        advance();
        int width = indentation();
        while (!at(TokenKind.DEDENT)) {
            if (at(TokenKind.EOF)) {
                throw new ParseException(ParseException.Kind.UNEXPECTED_EOF, "Block never closed", peek().span);
            }
            checkStatementStart(width);
            parseStatement(body);
        }
        advance();
        return body;
    }

    private void checkStatementStart(int width) {
        if (at(TokenKind.INDENT)) {
            throw new IndentationException(IndentationException.Kind.UNEXPECTED_INDENT, "Unexpected indent",
                    tokens.get(p + 1).span);
        }
        if (atLineStart()) {
            int actual = indentation();
            if (actual != width) {
                throw new ParseException(ParseException.Kind.STRUCTURAL_MISMATCH,
                        "Statement at indentation width " + actual + " inside a block at width " + width,
                        peek().span);
            }
        }
    }

    private int indentation() {
        return IndentationResolver.width(tokens.leadingWhitespace(p), tabSize);
    }

    private boolean atLineStart() {
        if (p == 0) return true;
        TokenKind previous = tokens.get(p - 1).kind;
        return previous == TokenKind.NEWLINE || previous == TokenKind.INDENT || previous == TokenKind.DEDENT;
    }

    /** Ends a simple statement at ';' or NEWLINE. */
    private void endStatement() {
        if (atOperator(";")) {
            advance();
            if (at(TokenKind.NEWLINE)) advance();
        } else if (at(TokenKind.NEWLINE)) {
            advance();
        } else if (!at(TokenKind.EOF)) {
            throw new UnsupportedConstruct("unexpected '" + peek().text + "'");
        }
    }

    /**
     * Skips the rest of the logical line and, when an indented block follows, the whole block.
     * Returns the position of the last skipped token that is not a layout marker.
     */
    private int skipToBoundary(int start) {
        int last = start;
        while (!at(TokenKind.NEWLINE) && !at(TokenKind.EOF)) {
            last = p;
            advance();
        }
        if (at(TokenKind.NEWLINE)) advance();
        if (at(TokenKind.INDENT)) {
            int depth = 0;
            do {
                if (at(TokenKind.INDENT)) {
                    depth++;
                } else if (at(TokenKind.DEDENT)) {
                    depth--;
                } else if (!at(TokenKind.NEWLINE)) {
                    last = p;
                }
                advance();
            } while (depth > 0 && !at(TokenKind.EOF));
        }
        return last;
    }

    private boolean isMatchStatement() {
        if (!peek().isName("match")) return false;
        int end = lineEnd(p);
        Token second = tokens.get(p + 1);
        return end > p + 2 && tokens.get(end - 1).isOperator(":")
                && !second.isOperator("=") && !second.isOperator(".") && !second.isOperator(":")
                && !AUGMENTED_OPERATORS.contains(second.text);
    }

    private boolean isTypeAliasStatement() {
        return peek().isName("type") && tokens.get(p + 1).is(TokenKind.IDENTIFIER)
                && (tokens.get(p + 2).isOperator("=") || tokens.get(p + 2).isOperator("["));
    }

    // ---- token helpers ----

    private Token peek() {
        return tokens.get(p);
    }

    private Token advance() {
        Token token = tokens.get(p);
        if (p < tokens.size() - 1) p++;
        return token;
    }

    private boolean at(TokenKind kind) {
        return peek().is(kind);
    }

    private boolean atOperator(String op) {
        return peek().isOperator(op);
    }

    private boolean atKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    private Token expectName() {
        if (!at(TokenKind.IDENTIFIER)) {
            throw new UnsupportedConstruct("expected a name but found '" + peek().text + "'");
        }
        return advance();
    }

    private void expectKeyword(String keyword) {
        if (!atKeyword(keyword)) {
            throw new UnsupportedConstruct("expected '" + keyword + "' but found '" + peek().text + "'");
        }
        advance();
    }

    private void expectOperator(String op) {
        if (!atOperator(op)) {
            throw new UnsupportedConstruct("expected '" + op + "' but found '" + peek().text + "'");
        }
        advance();
    }

    private List<String> dottedName() {
        List<String> path = new ArrayList<>();
        path.add(expectName().text);
        while (atOperator(".") && tokens.get(p + 1).is(TokenKind.IDENTIFIER)) {
            advance();
            path.add(advance().text);
        }
        return path;
    }

    /** Position of the NEWLINE (or EOF) ending the logical line that contains {@code from}. */
    private int lineEnd(int from) {
        int k = from;
        while (!tokens.get(k).is(TokenKind.NEWLINE) && !tokens.get(k).is(TokenKind.EOF)) {
            k++;
        }
        return k;
    }

    private static int endOf(int found, int fallback) {
        return found < 0 ? fallback : found;
    }

    private static int requireClosed(int close) {
        if (close < 0) {
            throw new UnsupportedConstruct("unclosed bracket");
        }
        return close;
    }

    /** Span from {@code start} to the last consumed token that is not a layout marker. */
    private SourceSpan spanFrom(int start) {
        int last = p - 1;
        while (last > start && isLayout(tokens.get(last))) {
            last--;
        }
        return tokens.span(start, last + 1);
    }

    private static boolean isLayout(Token token) {
        return token.is(TokenKind.NEWLINE) || token.is(TokenKind.INDENT) || token.is(TokenKind.DEDENT);
    }

    /** Raised inside a statement that falls outside the supported grammar; caught at the statement level. */
    private static final class UnsupportedConstruct extends RuntimeException {
        private static final long serialVersionUID = 1L;

        UnsupportedConstruct(String message) {
            super(message, null, false, false);
        }
    }
}
