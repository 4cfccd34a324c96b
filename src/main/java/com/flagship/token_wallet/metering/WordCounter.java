package com.flagship.token_wallet.metering;

import java.util.regex.Pattern;

/**
 * Counts the billable words of a chat message.
 *
 * Links and emoji are not billed: URLs and pictographic glyphs are removed before the text
 * is split on whitespace.
 */
public final class WordCounter {

    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final Pattern EMOJI = Pattern.compile(
        "[\\p{So}"                 // other symbols
        + "\\x{1F000}-\\x{1F2FF}"  // mahjong, domino, cards, enclosed alphanumerics, regional indicators
        + "\\x{1F300}-\\x{1F5FF}"  // symbols and pictographs, skin tone modifiers
        + "\\x{1F600}-\\x{1F64F}"  // emoticons
        + "\\x{1F680}-\\x{1F6FF}"  // transport and map
        + "\\x{1F700}-\\x{1F8FF}"  // alchemical, geometric shapes extended, arrows-C
        + "\\x{1F900}-\\x{1FAFF}"  // supplemental symbols, chess, symbols and pictographs extended-A
        + "\\x{2600}-\\x{27BF}"    // miscellaneous symbols, dingbats
        + "\\x{2B00}-\\x{2BFF}"    // miscellaneous symbols and arrows
        + "\\x{E0020}-\\x{E007F}"  // tag sequences (subdivision flags)
        + "\\x{20E3}\\x{FE0F}\\x{200D}]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private WordCounter() {
        // Utility class
    }

    public static int countBillableWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        String cleaned = EMOJI.matcher(URL.matcher(text).replaceAll(" ")).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return 0;
        }
        return WHITESPACE.split(cleaned).length;
    }
}
