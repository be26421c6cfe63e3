package com.raditha.pyrewrite.syntax;

import com.raditha.pyrewrite.model.Range;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Wrapper for a source text that maps the UTF-8 byte offsets reported by tree-sitter onto Java
 * character offsets, lines and columns.
 */
public final class SourceContent {

    private final String text;
    private final int byteLength;
    private final int[] charIndexOfByte;
    private final int[] lineStarts;

    private SourceContent(String text, int byteLength, int[] charIndexOfByte, int[] lineStarts) {
        this.text = text;
        this.byteLength = byteLength;
        this.charIndexOfByte = charIndexOfByte;
        this.lineStarts = lineStarts;
    }

    /**
     * Creates a SourceContent wrapper for the provided source text.
     */
    public static SourceContent of(String text) {
        int byteLength = text.getBytes(StandardCharsets.UTF_8).length;
        int[] charIndexOfByte = new int[byteLength + 1];
        int bytePos = 0;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int width = utf8Width(codePoint);
            for (int b = 0; b < width && bytePos < byteLength; b++) {
                charIndexOfByte[bytePos++] = i;
            }
            i += Character.charCount(codePoint);
        }
        charIndexOfByte[byteLength] = text.length();

        int lines = 1;
        for (int c = 0; c < text.length(); c++) {
            if (text.charAt(c) == '\n') {
                lines++;
            }
        }
        int[] lineStarts = new int[lines];
        int line = 1;
        for (int c = 0; c < text.length(); c++) {
            if (text.charAt(c) == '\n') {
                lineStarts[line++] = c + 1;
            }
        }
        return new SourceContent(text, byteLength, charIndexOfByte, lineStarts);
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint <= 0xFFFF && Character.isSurrogate((char) codePoint)) {
            // lone surrogates encode as a single replacement byte
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return byteLength;
    }

    /**
     * Converts a UTF-8 byte offset into a Java String character index, clamping out of range values.
     */
    public int byteOffsetToCharPosition(int byteOffset) {
        if (byteOffset <= 0) {
            return 0;
        }
        if (byteOffset >= byteLength) {
            return text.length();
        }
        return charIndexOfByte[byteOffset];
    }

    /**
     * Extracts the text between two UTF-8 byte offsets.
     */
    public String substringFromBytes(int startByte, int endByte) {
        int start = byteOffsetToCharPosition(startByte);
        int end = byteOffsetToCharPosition(endByte);
        if (end <= start) {
            return "";
        }
        return text.substring(start, end);
    }

    /**
     * Extracts the source text a node spans.
     */
    public String substringFrom(TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    public Range rangeOf(TSNode node) {
        return rangeOfChars(byteOffsetToCharPosition(node.getStartByte()), byteOffsetToCharPosition(node.getEndByte()));
    }

    /**
     * Builds a range from character offsets, computing lines and columns.
     */
    public Range rangeOfChars(int start, int end) {
        int startLine = lineOf(start);
        int endLine = lineOf(end);
        return new Range(startLine, endLine,
                start - lineStarts[startLine - 1] + 1,
                end - lineStarts[endLine - 1] + 1,
                start, end);
    }

    /**
     * 1-based line number of a character offset.
     */
    public int lineOf(int charOffset) {
        int index = Arrays.binarySearch(lineStarts, charOffset);
        if (index >= 0) {
            return index + 1;
        }
        return -index - 1;
    }
}
