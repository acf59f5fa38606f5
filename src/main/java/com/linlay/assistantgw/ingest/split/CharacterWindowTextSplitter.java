package com.linlay.assistantgw.ingest.split;

import org.springframework.ai.transformer.splitter.TextSplitter;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-size character windows with overlap. A window ends at the last whitespace inside it
 * when that whitespace lies in the second half of the window.
 */
public class CharacterWindowTextSplitter extends TextSplitter {

    private final int chunkSize;
    private final int chunkOverlap;

    public CharacterWindowTextSplitter(int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be >= 0 and < chunkSize");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
    }

    @Override
    protected List<String> splitText(String text) {
        String cleaned = text == null ? "" : text.strip();
        if (cleaned.isEmpty()) {
            return List.of();
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < cleaned.length()) {
            int end = Math.min(cleaned.length(), start + chunkSize);
            if (end < cleaned.length()) {
                int boundary = lastWhitespace(cleaned, start + chunkSize / 2, end);
                if (boundary > start) {
                    end = boundary;
                }
            }
            String chunk = cleaned.substring(start, end).strip();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
            if (end >= cleaned.length()) {
                break;
            }
            start = Math.max(start + 1, end - chunkOverlap);
        }
        return chunks;
    }

    private static int lastWhitespace(String text, int from, int to) {
        for (int i = to; i > from; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) {
                return i - 1;
            }
        }
        return -1;
    }
}
