package me.bechberger.phidetect.fuzzy;

import java.util.Locale;

/**
 * American Soundex code of a word: the first letter followed by three digits.
 * Vowels and H, W, Y separate runs of equal codes.
 */
public final class Soundex {

    //                                    ABCDEFGHIJKLMNOPQRSTUVWXYZ
    private static final String CODES = "01230120022455012623010202";

    private Soundex() {
    }

    public static String encode(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        StringBuilder letters = new StringBuilder(upper.length());
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                letters.append(c);
            }
        }
        if (letters.length() == 0) {
            return "0000";
        }
        StringBuilder result = new StringBuilder(4);
        result.append(letters.charAt(0));
        char previous = code(letters.charAt(0));
        for (int i = 1; i < letters.length() && result.length() < 4; i++) {
            char code = code(letters.charAt(i));
            if (code != '0' && code != previous) {
                result.append(code);
            }
            previous = code;
        }
        while (result.length() < 4) {
            result.append('0');
        }
        return result.toString();
    }

    private static char code(char letter) {
        return CODES.charAt(letter - 'A');
    }
}
