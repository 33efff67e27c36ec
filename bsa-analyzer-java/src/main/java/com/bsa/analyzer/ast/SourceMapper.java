package com.bsa.analyzer.ast;

import java.nio.charset.StandardCharsets;

/**
 * Maps byte offsets from AST {@code src} attributes to line/column pairs.
 * Offsets count UTF-8 bytes, as the compiler reports them.
 */
public final class SourceMapper {

    private static final SourceLocation START = new SourceLocation(1, 1);

    private SourceMapper() {}

    public static SourceLocation toLineCol(int offset, String sourceText) {
        if (sourceText == null || sourceText.isEmpty() || offset < 0) {
            return START;
        }
        int lineStart = 0;
        int line = 1;
        int i = 0;
        while (i < sourceText.length()) {
            int end = sourceText.indexOf('\n', i);
            int next = end < 0 ? sourceText.length() : end + 1;
            int lineBytes = sourceText.substring(i, next).getBytes(StandardCharsets.UTF_8).length;
            if (offset < lineStart + lineBytes) {
                return new SourceLocation(line, offset - lineStart + 1);
            }
            lineStart += lineBytes;
            line++;
            i = next;
        }
        return START;
    }

    /** Resolves the offset part of an {@code "offset:length:fileIndex"} attribute. */
    public static SourceLocation locate(String src, String sourceText) {
        return toLineCol(offsetOf(src), sourceText);
    }

    public static int offsetOf(String src) {
        if (src == null || src.isEmpty()) return 0;
        int colon = src.indexOf(':');
        String head = colon < 0 ? src : src.substring(0, colon);
        try {
            return Integer.parseInt(head.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
