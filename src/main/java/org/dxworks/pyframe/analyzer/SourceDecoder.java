package org.dxworks.pyframe.analyzer;

import org.dxworks.pyframe.analyzer.lexer.LexException;
import org.dxworks.pyframe.model.SourceSpan;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes source bytes into text. The encoding comes from a {@code coding} declaration on one of the
 * first two lines, UTF-8 otherwise; a leading UTF-8 byte order mark is dropped.
 */
public final class SourceDecoder {

    private static final Pattern CODING = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");
    private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^[ \\t\\f]*(#.*)?$");

    private SourceDecoder() {
    }

    public static String decode(byte[] bytes) {
        int offset = hasBom(bytes) ? 3 : 0;
        Charset charset = declaredCharset(bytes, offset);
        CharsetDecoder decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
        CharBuffer out = CharBuffer.allocate((int) Math.ceil((bytes.length - offset) * (double) decoder.maxCharsPerByte()) + 1);
        CoderResult result = decoder.decode(in, out, true);
        if (result.isError()) {
            out.flip();
            throw badByte(out.toString(), in.position());
        }
        result = decoder.flush(out);
        if (result.isError()) {
            out.flip();
            throw badByte(out.toString(), in.position());
        }
        out.flip();
        return out.toString();
    }

    /** Charset named by a coding declaration, or UTF-8. */
    static Charset declaredCharset(byte[] bytes, int offset) {
        String head = new String(bytes, offset, Math.min(bytes.length - offset, 1024), StandardCharsets.ISO_8859_1);
        String[] lines = head.split("\\r\\n|\\r|\\n", 3);
        for (int i = 0; i < Math.min(2, lines.length); i++) {
            Matcher matcher = CODING.matcher(lines[i]);
            if (matcher.find()) {
                return charsetFor(matcher.group(1), i + 1);
            }
            if (!BLANK_OR_COMMENT.matcher(lines[i]).matches()) {
                break;
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static Charset charsetFor(String name, int line) {
        String normalized = name.toLowerCase().replace('_', '-');
        if (normalized.equals("utf8") || normalized.startsWith("utf-8-")) {
            normalized = "utf-8";
        } else if (normalized.equals("latin-1") || normalized.startsWith("iso-latin-1")) {
            normalized = "iso-8859-1";
        }
        try {
            return Charset.forName(normalized);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new LexException(LexException.Kind.INVALID_CHARACTER, "Unknown source encoding '" + name + "'",
                    new SourceSpan(line, 0, line, 0, 0, 0));
        }
    }

    private static boolean hasBom(byte[] bytes) {
        return bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF;
    }

    /** The bad byte sits right after {@code decoded}; its position is reported in decoded characters. */
    private static LexException badByte(String decoded, int bytePosition) {
        int line = 1;
        int column = 0;
        for (int i = 0; i < decoded.length(); i++) {
            char ch = decoded.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= decoded.length() || decoded.charAt(i + 1) != '\n'))) {
                line++;
                column = 0;
            } else if (ch != '\r') {
                column++;
            }
        }
        int offset = decoded.length();
        return new LexException(LexException.Kind.INVALID_CHARACTER,
                "Undecodable byte at byte offset " + bytePosition,
                new SourceSpan(line, column, line, column + 1, offset, offset + 1));
    }
}
