package com.raditha.treediff.frontend;

import com.github.javaparser.Position;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Source of one file with line/column to offset conversion.
 * Columns are counted in characters, as JavaParser reports them with a tab
 * width of one.
 */
final class SourceText {

    private final String text;
    private final int[] lineStarts;
    private final int[] bytesBefore;

    SourceText(String text) {
        this.text = text;
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();

        this.bytesBefore = new int[text.length() + 1];
        for (int i = 0; i < text.length(); i++) {
            int cp = text.codePointAt(i);
            int width = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8).length;
            bytesBefore[i + 1] = bytesBefore[i] + width;
            if (Character.charCount(cp) == 2) {
                i++;
                bytesBefore[i + 1] = bytesBefore[i];
            }
        }
    }

    String text() {
        return text;
    }

    int length() {
        return text.length();
    }

    /**
     * Character offset of a 1-indexed position, clamped to the text.
     */
    int charOffset(Position position) {
        int line = Math.max(1, Math.min(position.line, lineStarts.length));
        int offset = lineStarts[line - 1] + Math.max(0, position.column - 1);
        return Math.min(offset, text.length());
    }

    int byteOffset(int charOffset) {
        return bytesBefore[charOffset];
    }

    String slice(int startChar, int endChar) {
        return text.substring(startChar, endChar);
    }
}
