package org.dxworks.pyframe.analyzer;

import org.dxworks.pyframe.analyzer.lexer.LexException;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SourceDecoderTest {

    @Test
    void decode_StripsUtf8Bom() {
        byte[] bytes = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'x', '\n'};

        assertEquals("x\n", SourceDecoder.decode(bytes));
    }

    @Test
    void decode_CodingCookieOnSecondLine() {
        byte[] bytes = "#!/usr/bin/env python\n# vim: set fileencoding=iso-8859-15 :\ns = '€'\n"
                .getBytes(Charset.forName("ISO-8859-15"));

        assertEquals("s = '€'", SourceDecoder.decode(bytes).split("\n")[2]);
    }

    @Test
    void decode_CookieAfterCode_IsIgnored() {
        byte[] bytes = "x = 1\n# coding: latin-1\n".getBytes(StandardCharsets.UTF_8);

        assertEquals(StandardCharsets.UTF_8, SourceDecoder.declaredCharset(bytes, 0));
    }

    @Test
    void decode_UnknownEncoding_FailsWithLexError() {
        byte[] bytes = "# coding: klingon\nx = 1\n".getBytes(StandardCharsets.US_ASCII);

        LexException e = assertThrows(LexException.class, () -> SourceDecoder.decode(bytes));
        assertEquals(LexException.Kind.INVALID_CHARACTER, e.getKind());
        assertEquals(1, e.getSpan().startLine);
    }

    @Test
    void decode_BadByteOnSecondLine_ReportsItsPosition() {
        byte[] bytes = {'a', '\n', 'b', 'c', (byte) 0xFF};

        LexException e = assertThrows(LexException.class, () -> SourceDecoder.decode(bytes));
        assertEquals(2, e.getSpan().startLine);
        assertEquals(2, e.getSpan().startColumn);
        assertEquals(4, e.getSpan().startOffset);
    }
}
