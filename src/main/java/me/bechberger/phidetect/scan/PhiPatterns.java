package me.bechberger.phidetect.scan;

import me.bechberger.phidetect.model.FilterType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Built-in PHI pattern corpus.
 *
 * Categories:
 * - SSN (dashed, spaced, solid, labeled, last four)
 * - Phone numbers (US formats, +1, extensions, labeled)
 * - Email addresses
 * - Dates (numeric, ISO, written)
 * - Medical record numbers
 * - Credit cards (Luhn validated)
 * - IP addresses
 * - ZIP codes
 */
public final class PhiPatterns {

    private static final int CI = Pattern.CASE_INSENSITIVE;

    private static final String MONTHS =
        "January|February|March|April|May|June|July|August|September|October|November|December";

    private PhiPatterns() {
    }

    public static List<PatternDef> ssn() {
        Predicate<String> ssn = Validators::isValidSsn;
        return List.of(
            def("SSN_DASHED", FilterType.SSN, "\\b(\\d{3})-(\\d{2})-(\\d{4})\\b", 0, 0.95,
                "SSN with dashes: 123-45-6789", ssn),
            def("SSN_SPACED", FilterType.SSN, "\\b(\\d{3})\\s(\\d{2})\\s(\\d{4})\\b", 0, 0.90,
                "SSN with spaces: 123 45 6789", ssn),
            def("SSN_SOLID", FilterType.SSN, "\\b(\\d{9})\\b", 0, 0.60,
                "SSN without delimiters: 123456789", ssn),
            def("SSN_LABELED", FilterType.SSN,
                "\\b(?:ssn|social\\s*security(?:\\s*(?:number|#|no\\.?))?)\\s*[:\\s#]?\\s*(\\d{3})[- ]?(\\d{2})[- ]?(\\d{4})\\b",
                CI, 0.98, "Labeled SSN: SSN: 123-45-6789", ssn),
            def("SSN_LAST4", FilterType.SSN, "\\b(?:ssn|social\\s*security).*?(\\d{4})\\b", CI, 0.85,
                "Last 4 of SSN: SSN ending in 6789", null)
        );
    }

    public static List<PatternDef> phone() {
        return List.of(
            def("PHONE_US_PARENS", FilterType.PHONE, "\\((\\d{3})\\)\\s*(\\d{3})[- .]?(\\d{4})\\b", 0, 0.95,
                "US phone with parens: (555) 123-4567", null),
            def("PHONE_US_DASHED", FilterType.PHONE, "\\b(\\d{3})-(\\d{3})-(\\d{4})\\b", 0, 0.90,
                "US phone dashed: 555-123-4567", null),
            def("PHONE_US_DOTTED", FilterType.PHONE, "\\b(\\d{3})\\.(\\d{3})\\.(\\d{4})\\b", 0, 0.90,
                "US phone dotted: 555.123.4567", null),
            def("PHONE_US_SPACED", FilterType.PHONE, "\\b(\\d{3})\\s(\\d{3})\\s(\\d{4})\\b", 0, 0.85,
                "US phone spaced: 555 123 4567", null),
            def("PHONE_US_SOLID", FilterType.PHONE, "\\b(\\d{10})\\b", 0, 0.50,
                "US phone solid: 5551234567", null),
            def("PHONE_INTL_PLUS", FilterType.PHONE, "\\+1[- .]?(\\d{3})[- .]?(\\d{3})[- .]?(\\d{4})\\b", 0, 0.95,
                "International +1: +1-555-123-4567", null),
            def("PHONE_INTL_PARENS", FilterType.PHONE, "\\+1[- .]?\\((\\d{3})\\)\\s*(\\d{3})[- .]?(\\d{4})\\b", 0, 0.95,
                "International +1 with parens: +1 (555) 123-4567", null),
            def("PHONE_EXT", FilterType.PHONE,
                "\\b(\\d{3})[- .]?(\\d{3})[- .]?(\\d{4})\\s*(?:ext|x|extension)[.:]?\\s*(\\d{1,6})\\b", CI, 0.95,
                "Phone with extension: 555-123-4567 ext 123", null),
            def("PHONE_LABELED", FilterType.PHONE,
                "\\b(?:phone|tel|telephone|cell|mobile|contact)[:\\s#]*\\s*\\(?(\\d{3})\\)?[- .]?(\\d{3})[- .]?(\\d{4})\\b",
                CI, 0.98, "Labeled phone: Phone: 555-123-4567", null)
        );
    }

    public static List<PatternDef> email() {
        return List.of(
            new PatternDef("EMAIL_STANDARD", FilterType.EMAIL,
                Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b"), 0.95,
                "Standard email format", null, TextTrigger.AT_SIGN),
            new PatternDef("EMAIL_LABELED", FilterType.EMAIL,
                Pattern.compile("\\b(?:email|e-mail)[:\\s]*\\s*([A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,})\\b", CI),
                0.98, "Labeled email: Email: user@example.com", null, TextTrigger.AT_SIGN)
        );
    }

    public static List<PatternDef> date() {
        return List.of(
            def("DATE_MMDDYYYY_SLASH", FilterType.DATE,
                "\\b(0?[1-9]|1[0-2])/(0?[1-9]|[12]\\d|3[01])/(\\d{4}|\\d{2})\\b", 0, 0.90,
                "MM/DD/YYYY or MM/DD/YY", null),
            def("DATE_MMDDYYYY_DASH", FilterType.DATE,
                "\\b(0?[1-9]|1[0-2])-(0?[1-9]|[12]\\d|3[01])-(\\d{4}|\\d{2})\\b", 0, 0.90,
                "MM-DD-YYYY or MM-DD-YY", null),
            def("DATE_YYYYMMDD", FilterType.DATE,
                "\\b(\\d{4})[-/](0?[1-9]|1[0-2])[-/](0?[1-9]|[12]\\d|3[01])\\b", 0, 0.92,
                "YYYY-MM-DD (ISO format)", null),
            def("DATE_WRITTEN_FULL", FilterType.DATE,
                "\\b(" + MONTHS + ")\\s+(0?[1-9]|[12]\\d|3[01])(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b", CI, 0.95,
                "Written date: January 15, 2024", null),
            def("DATE_WRITTEN_ABBREV", FilterType.DATE,
                "\\b(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)\\.?\\s+(0?[1-9]|[12]\\d|3[01])(?:st|nd|rd|th)?,?\\s+(\\d{4}|\\d{2})\\b",
                CI, 0.92, "Abbreviated date: Jan 15, 2024", null),
            def("DATE_DAY_WRITTEN", FilterType.DATE,
                "\\b(0?[1-9]|[12]\\d|3[01])(?:st|nd|rd|th)?\\s+(" + MONTHS + ")\\s+(\\d{4})\\b", CI, 0.95,
                "Day first: 15 January 2024", null)
        );
    }

    public static List<PatternDef> mrn() {
        return List.of(
            def("MRN_LABELED", FilterType.MRN,
                "\\b(?:mrn|medical\\s*record(?:\\s*(?:number|#|no\\.?))?|chart(?:\\s*(?:number|#|no\\.?))?)\\s*[:\\s#]?\\s*([A-Z]?\\d{5,10})\\b",
                CI, 0.98, "Labeled MRN: MRN: 12345678", null),
            def("MRN_PREFIX", FilterType.MRN, "\\b(MRN|MR|PT)[- ]?(\\d{6,10})\\b", 0, 0.90,
                "Prefixed MRN: MRN-12345678", null),
            def("MRN_NUMERIC_CONTEXT", FilterType.MRN,
                "\\b(?:patient\\s*(?:id|#|number)?)[:\\s#]*\\s*(\\d{5,10})\\b", CI, 0.85,
                "Patient ID context: Patient ID: 12345678", null)
        );
    }

    public static List<PatternDef> creditCard() {
        Predicate<String> luhn = Validators::isValidLuhn;
        return List.of(
            def("CC_VISA", FilterType.CREDIT_CARD, "\\b(4\\d{3})[- ]?(\\d{4})[- ]?(\\d{4})[- ]?(\\d{4})\\b", 0, 0.95,
                "Visa: 4xxx-xxxx-xxxx-xxxx", luhn),
            def("CC_MASTERCARD", FilterType.CREDIT_CARD, "\\b(5[1-5]\\d{2})[- ]?(\\d{4})[- ]?(\\d{4})[- ]?(\\d{4})\\b", 0, 0.95,
                "Mastercard: 5[1-5]xx-xxxx-xxxx-xxxx", luhn),
            def("CC_AMEX", FilterType.CREDIT_CARD, "\\b(3[47]\\d{2})[- ]?(\\d{6})[- ]?(\\d{5})\\b", 0, 0.95,
                "Amex: 3[47]xx-xxxxxx-xxxxx", luhn),
            def("CC_DISCOVER", FilterType.CREDIT_CARD, "\\b(6011)[- ]?(\\d{4})[- ]?(\\d{4})[- ]?(\\d{4})\\b", 0, 0.95,
                "Discover: 6011-xxxx-xxxx-xxxx", luhn),
            def("CC_GENERIC_16", FilterType.CREDIT_CARD, "\\b(\\d{4})[- ](\\d{4})[- ](\\d{4})[- ](\\d{4})\\b", 0, 0.80,
                "Generic 16-digit card", luhn)
        );
    }

    public static List<PatternDef> ip() {
        return List.of(
            def("IP_V4", FilterType.IP,
                "\\b((?:25[0-5]|2[0-4]\\d|[01]?\\d\\d?)\\.){3}(?:25[0-5]|2[0-4]\\d|[01]?\\d\\d?)\\b", 0, 0.90,
                "IPv4 address: 192.168.1.1", Validators::isValidIpv4),
            new PatternDef("IP_V6", FilterType.IP, Pattern.compile("\\b([0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}\\b"), 0.95,
                "IPv6 address", null, TextTrigger.ANY)
        );
    }

    public static List<PatternDef> zipcode() {
        return List.of(
            def("ZIP_5", FilterType.ZIPCODE, "\\b(\\d{5})\\b", 0, 0.50, "5-digit ZIP", null),
            def("ZIP_PLUS4", FilterType.ZIPCODE, "\\b(\\d{5})-(\\d{4})\\b", 0, 0.90, "ZIP+4: 12345-6789", null),
            def("ZIP_LABELED", FilterType.ZIPCODE,
                "\\b(?:zip(?:\\s*code)?|postal\\s*code)[:\\s]*\\s*(\\d{5})(?:-(\\d{4}))?\\b", CI, 0.98,
                "Labeled ZIP: Zip Code: 12345", null)
        );
    }

    /**
     * The complete corpus in scan order.
     */
    public static List<PatternDef> all() {
        List<PatternDef> all = new ArrayList<>();
        all.addAll(ssn());
        all.addAll(phone());
        all.addAll(email());
        all.addAll(date());
        all.addAll(mrn());
        all.addAll(creditCard());
        all.addAll(ip());
        all.addAll(zipcode());
        return Collections.unmodifiableList(all);
    }

    public static Map<FilterType, Integer> countByType(List<PatternDef> patterns) {
        Map<FilterType, Integer> byType = new EnumMap<>(FilterType.class);
        for (PatternDef pattern : patterns) {
            byType.merge(pattern.getFilterType(), 1, Integer::sum);
        }
        return byType;
    }

    // every numeric pattern needs at least one digit in the text
    private static PatternDef def(String id, FilterType type, String regex, int flags, double confidence,
                                  String description, Predicate<String> validator) {
        return new PatternDef(id, type, Pattern.compile(regex, flags), confidence, description, validator, TextTrigger.DIGIT);
    }
}
