package org.dxworks.pyframe.analyzer.indent;

import org.dxworks.pyframe.ParseException;
import org.dxworks.pyframe.analyzer.lexer.Token;
import org.dxworks.pyframe.analyzer.lexer.TokenKind;
import org.dxworks.pyframe.analyzer.lexer.Tokenizer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.pyframe.TestUtils.readSample;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndentationResolverTest {

    private final IndentationResolver resolver = new IndentationResolver();

    private List<Token> resolve(String source) {
        return resolver.resolve(new Tokenizer(source));
    }

    private static long count(List<Token> tokens, TokenKind kind) {
        return tokens.stream().filter(t -> t.is(kind)).count();
    }

    /** Significant kinds only, for compact structural assertions. */
    private static List<TokenKind> layout(List<Token> tokens) {
        return tokens.stream()
                .map(t -> t.kind)
                .filter(k -> k == TokenKind.NEWLINE || k == TokenKind.INDENT || k == TokenKind.DEDENT
                        || k == TokenKind.EOF)
                .collect(Collectors.toList());
    }

    @Test
    void resolve_Sample_BalancesIndentsAndDedents() throws IOException {
        List<Token> tokens = resolve(readSample("sample.py"));

        assertTrue(count(tokens, TokenKind.INDENT) > 0);
        assertEquals(count(tokens, TokenKind.INDENT), count(tokens, TokenKind.DEDENT));
        assertEquals(TokenKind.EOF, tokens.get(tokens.size() - 1).kind);
    }

    @Test
    void resolve_Sample_SpansStayInSourceOrder() throws IOException {
        List<Token> tokens = resolve(readSample("sample.py"));

        for (int i = 1; i < tokens.size(); i++) {
            Token previous = tokens.get(i - 1);
            Token next = tokens.get(i);
            assertTrue(previous.span.endOffset <= next.span.startOffset, previous + " overlaps " + next);
        }
    }

    @Test
    void resolve_NestedBlocks_ClosesEveryLevelAtEof() {
        List<Token> tokens = resolve("class A:\n    def m(self):\n        if x:\n            pass");

        assertEquals(List.of(
                TokenKind.NEWLINE, TokenKind.INDENT,
                TokenKind.NEWLINE, TokenKind.INDENT,
                TokenKind.NEWLINE, TokenKind.INDENT,
                TokenKind.NEWLINE,
                TokenKind.DEDENT, TokenKind.DEDENT, TokenKind.DEDENT, TokenKind.EOF), layout(tokens));
    }

    @Test
    void resolve_BlankAndCommentLines_DoNotChangeIndentation() {
        List<Token> tokens = resolve("def f():\n\n        # deep comment\n    return 1\n  \n");

        assertEquals(1, count(tokens, TokenKind.INDENT));
        assertEquals(1, count(tokens, TokenKind.DEDENT));
        assertEquals(2, count(tokens, TokenKind.NEWLINE));
        assertEquals(3, count(tokens, TokenKind.NL));
    }

    @Test
    void resolve_LineBreaksInsideBrackets_AreNotLogicalLines() {
        List<Token> tokens = resolve("x = foo(\n        1,\n  2)\ny = 3\n");

        assertEquals(0, count(tokens, TokenKind.INDENT));
        assertEquals(2, count(tokens, TokenKind.NEWLINE));
        assertEquals(2, count(tokens, TokenKind.NL));
    }

    @Test
    void resolve_BackslashContinuation_DoesNotIndent() {
        List<Token> tokens = resolve("x = 1 + \\\n        2\ny = 3\n");

        assertEquals(0, count(tokens, TokenKind.INDENT));
        assertEquals(2, count(tokens, TokenKind.NEWLINE));
    }

    @Test
    void resolve_MarkersAreZeroWidthAndKeepTextLossless() {
        String source = "if a:\n    b()\nc()\n";
        List<Token> tokens = resolve(source);

        assertEquals(source, tokens.stream().map(t -> t.text).collect(Collectors.joining()));
        Token indent = tokens.stream().filter(t -> t.is(TokenKind.INDENT)).findFirst().orElseThrow();
        assertEquals(0, indent.span.length());
        assertEquals(2, indent.span.startLine);
        assertEquals(4, indent.span.startColumn);
    }

    @Test
    void resolve_DedentToUnknownLevel_ThrowsInconsistentDedent() {
        IndentationException e = assertThrows(IndentationException.class,
                () -> resolve("if a:\n        b\n    c\n"));

        assertEquals(IndentationException.Kind.INCONSISTENT_DEDENT, e.getKind());
        assertEquals(3, e.getSpan().startLine);
    }

    @Test
    void resolve_TabsAndSpacesThatOnlyAgreeForOneTabSize_ThrowAmbiguousTabs() {
        IndentationException e = assertThrows(IndentationException.class,
                () -> resolve("if a:\n        b\n\tc\n"));

        assertEquals(IndentationException.Kind.AMBIGUOUS_TABS, e.getKind());
    }

    @Test
    void resolve_ConsistentTabs_AreAccepted() {
        List<Token> tokens = resolve("if a:\n\tb\n\tif c:\n\t\td\n");

        assertEquals(2, count(tokens, TokenKind.INDENT));
        assertEquals(2, count(tokens, TokenKind.DEDENT));
    }

    @Test
    void resolve_UnclosedBracket_ThrowsUnbalancedBrackets() {
        ParseException e = assertThrows(ParseException.class, () -> resolve("x = foo(1,\ny = 2\n"));

        assertEquals(ParseException.Kind.UNBALANCED_BRACKETS, e.getKind());
        assertEquals(1, e.getSpan().startLine);
    }

    @Test
    void resolve_MismatchedCloser_ThrowsUnbalancedBrackets() {
        ParseException e = assertThrows(ParseException.class, () -> resolve("x = [1, 2)\n"));

        assertEquals(ParseException.Kind.UNBALANCED_BRACKETS, e.getKind());
    }

    @Test
    void width_TabsAdvanceToNextStop() {
        assertEquals(8, IndentationResolver.width("\t", 8));
        assertEquals(8, IndentationResolver.width("   \t", 8));
        assertEquals(12, IndentationResolver.width("\t    ", 8));
        assertEquals(3, IndentationResolver.width("  \t", 1));
    }

    @Test
    void constructor_RejectsEqualTabSizes() {
        assertThrows(IllegalArgumentException.class, () -> new IndentationResolver(4, 4));
    }
}
