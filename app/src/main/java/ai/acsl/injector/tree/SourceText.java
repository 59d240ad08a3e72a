package ai.acsl.injector.tree;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Source text addressed by UTF-8 byte offsets, the unit every tree span uses.
 */
public final class SourceText {

    private final String text;
    private final byte[] bytes;

    public SourceText(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return bytes.length;
    }

    public String slice(int startByte, int endByte) {
        if (startByte < 0 || endByte > bytes.length || endByte < startByte) {
            throw new IndexOutOfBoundsException("Invalid byte range [" + startByte + ", " + endByte + ") for length " + bytes.length);
        }
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /**
     * One plus the number of newlines before {@code byteOffset}.
     */
    public int lineNumberAt(int byteOffset) {
        int limit = Math.min(byteOffset, bytes.length);
        int line = 1;
        for (int i = 0; i < limit; i++) {
            if (bytes[i] == '\n') {
                line++;
            }
        }
        return line;
    }

    /**
     * Whether a byte offset falls between two encoded characters.
     */
    public boolean isCharBoundary(int byteOffset) {
        if (byteOffset == 0 || byteOffset == bytes.length) {
            return true;
        }
        if (byteOffset < 0 || byteOffset > bytes.length) {
            return false;
        }
        return (bytes[byteOffset] & 0xC0) != 0x80;
    }

    /**
     * Collapses every whitespace run into a single space and trims the result.
     */
    public static String normalizeWhitespace(String raw) {
        return raw.strip().replaceAll("\\s+", " ");
    }
}
