package com.flagship.token_wallet.metering;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WordCounterTest {

    @Test
    @DisplayName("Words are split on any whitespace")
    void countsWords() {
        assertEquals(4, WordCounter.countBillableWords("  hello there\tmy\nfriend "));
    }

    @Test
    @DisplayName("Links are not billed")
    void ignoresLinks() {
        assertEquals(2, WordCounter.countBillableWords("look https://example.com/a?b=c here"));
    }

    @Test
    @DisplayName("Emoji are not billed")
    void ignoresEmoji() {
        assertEquals(2, WordCounter.countBillableWords("good 😀 morning ❤️"));
        assertEquals(0, WordCounter.countBillableWords("😀😀"));
    }

    @Test
    @DisplayName("Newer emoji blocks, flags, tiles and arrows are not billed")
    void ignoresWiderEmojiBlocks() {
        assertEquals(1, WordCounter.countBillableWords("hello 🫠"));
        assertEquals(1, WordCounter.countBillableWords("hello 🇺🇸"));
        assertEquals(1, WordCounter.countBillableWords("🫶 thanks"));
        assertEquals(1, WordCounter.countBillableWords("🀄 win"));
        assertEquals(1, WordCounter.countBillableWords("⬆️ up"));
        assertEquals(1, WordCounter.countBillableWords("bye 👋🏽"));
        assertEquals(1, WordCounter.countBillableWords("wales 🏴\uDB40\uDC67\uDB40\uDC62\uDB40\uDC77\uDB40\uDC6C\uDB40\uDC73\uDB40\uDC7F"));
        assertEquals(0, WordCounter.countBillableWords("👨‍👩‍👧"));
    }

    @Test
    void emptyText() {
        assertEquals(0, WordCounter.countBillableWords(null));
        assertEquals(0, WordCounter.countBillableWords("   "));
    }
}
