package com.bitflag.util;

/**
 * Validation of hexadecimal literals against a fixed bit width.
 */
public final class HexDigits {

    private HexDigits() {} // utility class

    /**
     * Check that {@code digits} is a non-empty run of ASCII hex digits whose value fits in
     * {@code width} bits, and return it without leading zeros ({@code "0"} for a zero value).
     *
     * @param digits the digits to check, without any prefix
     * @param width the number of available bits, a multiple of 4
     * @return the significant digits
     * @throws NumberFormatException if the digits are malformed or overflow the width
     */
    public static String significant(String digits, int width) {
        if (digits.isEmpty())
            throw new NumberFormatException("No hex digits");

        int start = -1;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (!isHexDigit(c))
                throw new NumberFormatException("Invalid hex digit '" + c + "' in \"" + digits + "\"");
            if (start < 0 && c != '0')
                start = i;
        }
        if (start < 0)
            return "0";

        var stripped = digits.substring(start);
        if (stripped.length() * 4 > width) {
            throw new NumberFormatException("Hex value \"" + digits + "\" overflows " + width + " bits");
        }
        return stripped;
    }

    public static boolean isHexDigit(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }
}
