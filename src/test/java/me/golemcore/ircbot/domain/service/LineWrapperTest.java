package me.golemcore.ircbot.domain.service;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineWrapperTest {

    @Test
    void wrap_returnsFittingLineUnchanged() {
        String line = "  hello   world  ";

        assertEquals(List.of(line), LineWrapper.wrap(line, 100));
    }

    @Test
    void wrap_cutsAtLastWordBoundary() {
        List<String> lines = LineWrapper.wrap("aaa bbb ccc ddd", 8);

        assertEquals(List.of("aaa bbb", "ccc ddd"), lines);
    }

    @Test
    void wrap_keepsLineExactlyAtBudget() {
        List<String> lines = LineWrapper.wrap("abcd efgh ij", 9);

        assertEquals(List.of("abcd efgh", "ij"), lines);
    }

    @Test
    void wrap_hardCutsWordLongerThanBudget() {
        List<String> lines = LineWrapper.wrap("abcdefghij xy", 4);

        assertEquals(List.of("abcd", "efgh", "ij", "xy"), lines);
    }

    @Test
    void wrap_countsUtf8Bytes() {
        // each letter is two bytes
        List<String> lines = LineWrapper.wrap("жжж жжж", 7);

        assertEquals(List.of("жжж", "жжж"), lines);
        for (String line : lines) {
            assertTrue(LineWrapper.utf8Length(line) <= 7);
        }
    }

    @Test
    void wrap_neverSplitsSurrogatePair() {
        String emoji = "😀";
        List<String> lines = LineWrapper.wrap(emoji + emoji + emoji, 5);

        assertEquals(List.of(emoji, emoji, emoji), lines);
    }

    @Test
    void wrap_rejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> LineWrapper.wrap("text", 0));
    }

    @Test
    void wrap_preservesWordsAndRespectsBudgetForRandomText() {
        Random random = new Random(42);
        for (int round = 0; round < 200; round++) {
            int budget = 5 + random.nextInt(60);
            StringBuilder text = new StringBuilder();
            int words = 1 + random.nextInt(40);
            for (int i = 0; i < words; i++) {
                if (i > 0) {
                    text.append(random.nextInt(5) == 0 ? "  " : " ");
                }
                int length = 1 + random.nextInt(budget + 10);
                for (int j = 0; j < length; j++) {
                    text.append((char) ('a' + random.nextInt(26)));
                }
            }

            List<String> lines = LineWrapper.wrap(text.toString(), budget);

            for (String line : lines) {
                assertTrue(LineWrapper.utf8Length(line) <= budget, "line over budget " + budget + ": " + line);
            }
            assertEquals(String.join("", words(text.toString())), String.join("", concatWords(lines)),
                    "characters of words must survive in order");
            for (String word : words(text.toString())) {
                if (word.length() <= budget) {
                    assertTrue(containsWord(lines, word), "short word must not be split: " + word);
                }
            }
        }
    }

    @Test
    void utf8Length_countsMultibyteCharacters() {
        assertEquals(3, LineWrapper.utf8Length("abc"));
        assertEquals(2, LineWrapper.utf8Length("é"));
        assertEquals(3, LineWrapper.utf8Length("€"));
        assertEquals(4, LineWrapper.utf8Length("😀"));
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        for (String word : text.trim().split("\\s+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static List<String> concatWords(List<String> lines) {
        List<String> all = new ArrayList<>();
        for (String line : lines) {
            all.addAll(words(line));
        }
        return all;
    }

    private static boolean containsWord(List<String> lines, String word) {
        for (String line : lines) {
            if (Arrays.asList(line.split("\\s+")).contains(word)) {
                return true;
            }
        }
        return false;
    }
}
