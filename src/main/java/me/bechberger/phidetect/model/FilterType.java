package me.bechberger.phidetect.model;

/**
 * Category assigned to a detected span.
 */
public enum FilterType {
    // Identity
    NAME,
    PROVIDER_NAME,
    EMAIL,
    SSN,
    PHONE,
    FAX,

    // Geographic
    ADDRESS,
    ZIPCODE,
    CITY,
    STATE,
    COUNTY,

    // Temporal
    DATE,
    RELATIVE_DATE,
    AGE,
    AGE_90_PLUS,

    // Financial
    CREDIT_CARD,
    ACCOUNT,

    // Medical
    MRN,
    HEALTH_PLAN,
    DEVICE,
    LICENSE,
    PASSPORT,

    // Technical
    IP,
    URL,
    MAC_ADDRESS,

    // Contextual
    BIOMETRIC,
    VEHICLE,
    OCCUPATION,

    CUSTOM;

    /**
     * Lenient parse used by the configuration layer ("phone", "Zip-Code" and "ZIPCODE" all work).
     */
    public static FilterType fromString(String value) {
        if (value == null || value.isBlank()) {
            return CUSTOM;
        }
        String normalized = value.trim().toUpperCase(java.util.Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (FilterType type : values()) {
            if (type.name().equals(normalized) || type.name().replace("_", "").equals(normalized.replace("_", ""))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown filter type: " + value);
    }
}
