package me.bechberger.phidetect.scan;

/**
 * Cheap pre-condition a text has to meet before a pattern can possibly match.
 * Used by {@link ParallelScanBackend} to skip patterns without running the regex.
 */
public enum TextTrigger {
    ANY,
    DIGIT,
    AT_SIGN,
    LETTER;

    boolean presentIn(TextProfile profile) {
        switch (this) {
            case DIGIT:
                return profile.hasDigit;
            case AT_SIGN:
                return profile.hasAtSign;
            case LETTER:
                return profile.hasLetter;
            default:
                return true;
        }
    }

    /**
     * Character classes present in a text, computed once per scan.
     */
    static final class TextProfile {
        final boolean hasDigit;
        final boolean hasAtSign;
        final boolean hasLetter;

        private TextProfile(boolean hasDigit, boolean hasAtSign, boolean hasLetter) {
            this.hasDigit = hasDigit;
            this.hasAtSign = hasAtSign;
            this.hasLetter = hasLetter;
        }

        static TextProfile of(CharSequence text) {
            boolean digit = false;
            boolean at = false;
            boolean letter = false;
            for (int i = 0; i < text.length() && !(digit && at && letter); i++) {
                char c = text.charAt(i);
                if (c >= '0' && c <= '9') {
                    digit = true;
                } else if (c == '@') {
                    at = true;
                } else if (Character.isLetter(c)) {
                    letter = true;
                }
            }
            return new TextProfile(digit, at, letter);
        }
    }
}
