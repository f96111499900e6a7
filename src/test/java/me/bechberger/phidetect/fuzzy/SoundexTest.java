package me.bechberger.phidetect.fuzzy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class SoundexTest {

    @ParameterizedTest
    @CsvSource({
        "Robert, R163",
        "Rupert, R163",
        "robert, R163",
        "Rubin, R150",
        "Tymczak, T522",
        "Pfister, P236",
        "Smith, S530",
        "Smythe, S530",
        "Lee, L000",
        "Jackson, J250",
        "O'Brien, O165"
    })
    public void testEncode(String word, String expected) {
        assertEquals(expected, Soundex.encode(word));
    }

    @Test
    public void testHSeparatesEqualCodes() {
        // S and C are both 2, the H between them starts a new run
        assertEquals("A226", Soundex.encode("Ashcraft"));
    }

    @Test
    public void testNoLetters() {
        assertEquals("0000", Soundex.encode(""));
        assertEquals("0000", Soundex.encode("123"));
        assertEquals("0000", Soundex.encode("--"));
    }

    @Test
    public void testNonAsciiLettersAreSkipped() {
        assertEquals(Soundex.encode("Mller"), Soundex.encode("Müller"));
    }
}
