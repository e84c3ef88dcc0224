package me.golemcore.ircbot.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into lines that fit a byte budget. Lengths are UTF-8 byte
 * counts, which is what the server counts.
 */
public final class LineWrapper {

    private LineWrapper() {
    }

    /**
     * Wraps one line of text (no embedded line breaks).
     *
     * <p>
     * A line that fits is returned unchanged. Otherwise words are packed
     * greedily and each output line is cut at the last whitespace that keeps it
     * within {@code budget}, trimmed. A word longer than the budget is cut at
     * the budget, never inside a code point.
     *
     * @throws IllegalArgumentException
     *             if {@code budget} is not positive
     */
    public static List<String> wrap(String line, int budget) {
        if (budget < 1) {
            throw new IllegalArgumentException("Line budget must be positive, got " + budget);
        }
        if (utf8Length(line) <= budget) {
            return List.of(line);
        }
        List<String> lines = new ArrayList<>();
        String rest = line.strip();
        while (!rest.isEmpty()) {
            if (utf8Length(rest) <= budget) {
                lines.add(rest);
                break;
            }
            int boundary = lastBoundaryWithin(rest, budget);
            int cut = boundary > 0 ? boundary : hardCutWithin(rest, budget);
            lines.add(rest.substring(0, cut).strip());
            rest = rest.substring(cut).strip();
        }
        return lines;
    }

    public static int utf8Length(CharSequence text) {
        int length = 0;
        for (int i = 0; i < text.length(); i++) {
            length += utf8Width(text, i);
            if (Character.isHighSurrogate(text.charAt(i)) && i + 1 < text.length()
                    && Character.isLowSurrogate(text.charAt(i + 1))) {
                i++;
            }
        }
        return length;
    }

    /**
     * Index of the last whitespace char whose preceding text fits, or 0.
     */
    private static int lastBoundaryWithin(String text, int budget) {
        int bytes = 0;
        int boundary = 0;
        int i = 0;
        while (i < text.length() && bytes <= budget) {
            int codePoint = text.codePointAt(i);
            if (i > 0 && Character.isWhitespace(codePoint)) {
                boundary = i;
            }
            bytes += utf8Width(text, i);
            i += Character.charCount(codePoint);
        }
        return boundary;
    }

    /**
     * Index after the longest prefix that fits, at least one code point.
     */
    private static int hardCutWithin(String text, int budget) {
        int bytes = 0;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int width = utf8Width(text, i);
            if (bytes + width > budget && i > 0) {
                break;
            }
            bytes += width;
            i += Character.charCount(codePoint);
        }
        return i;
    }

    private static int utf8Width(CharSequence text, int index) {
        char c = text.charAt(index);
        if (c < 0x80) {
            return 1;
        }
        if (c < 0x800) {
            return 2;
        }
        if (Character.isHighSurrogate(c) && index + 1 < text.length()
                && Character.isLowSurrogate(text.charAt(index + 1))) {
            return 4;
        }
        return 3;
    }
}
