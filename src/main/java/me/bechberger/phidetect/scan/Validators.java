package me.bechberger.phidetect.scan;

/**
 * Checksum and range validators for pattern matches.
 */
public final class Validators {

    private Validators() {
    }

    /**
     * SSN rules: nine digits, area not 000, 666 or 9xx, group and serial not zero, well-known test values rejected.
     */
    public static boolean isValidSsn(String ssn) {
        String digits = ssn.replaceAll("\\D", "");
        if (digits.length() != 9) {
            return false;
        }
        int area = Integer.parseInt(digits.substring(0, 3));
        int group = Integer.parseInt(digits.substring(3, 5));
        int serial = Integer.parseInt(digits.substring(5, 9));
        if (area == 0 || area == 666 || area >= 900) {
            return false;
        }
        if (group == 0 || serial == 0) {
            return false;
        }
        return !digits.equals("123456789") && !digits.equals("111111111");
    }

    /**
     * Luhn checksum over the digits of the input; separators are ignored.
     */
    public static boolean isValidLuhn(String cardNumber) {
        String digits = cardNumber.replaceAll("\\D", "");
        if (digits.isEmpty()) {
            return false;
        }
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int digit = digits.charAt(i) - '0';
            if (doubleIt) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }

    public static boolean isValidIpv4(String ip) {
        String[] octets = ip.split("\\.", -1);
        if (octets.length != 4) {
            return false;
        }
        for (String octet : octets) {
            if (octet.isEmpty() || octet.length() > 3) {
                return false;
            }
            for (int i = 0; i < octet.length(); i++) {
                if (!Character.isDigit(octet.charAt(i))) {
                    return false;
                }
            }
            if (Integer.parseInt(octet) > 255) {
                return false;
            }
        }
        return true;
    }
}
