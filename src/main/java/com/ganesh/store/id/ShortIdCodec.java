package com.ganesh.store.id;

import com.google.common.base.CharMatcher;

/**
 * Base58 text rendering for random ID bytes.
 *
 * <p>Uses the Bitcoin alphabet, which leaves out {@code 0}, {@code O}, {@code I} and {@code l}
 * and has no punctuation, so IDs are safe in URLs and file names and hard to misread. Leading
 * zero bytes map to leading {@code '1'} characters, so the encoding is lossless.
 */
public final class ShortIdCodec {
    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

    private static final char[] DIGITS = ALPHABET.toCharArray();
    private static final CharMatcher VALID_CHARS = CharMatcher.anyOf(ALPHABET);

    private ShortIdCodec() {
    }

    /**
     * @param input The bytes to encode.
     * @return The Base58 text, empty for empty input.
     */
    public static String encode(byte[] input) {
        if (input.length == 0) {
            return "";
        }
        int zeros = 0;
        while (zeros < input.length && input[zeros] == 0) {
            zeros++;
        }

        // Repeated division of the big-endian number by 58, working on a copy.
        byte[] number = input.clone();
        char[] encoded = new char[input.length * 2];
        int outputStart = encoded.length;
        int inputStart = zeros;
        while (inputStart < number.length) {
            encoded[--outputStart] = DIGITS[divmod(number, inputStart, 256, 58)];
            if (number[inputStart] == 0) {
                inputStart++;
            }
        }
        while (outputStart < encoded.length && encoded[outputStart] == DIGITS[0]) {
            outputStart++;
        }
        while (--zeros >= 0) {
            encoded[--outputStart] = DIGITS[0];
        }
        return new String(encoded, outputStart, encoded.length - outputStart);
    }

    /**
     * @param id Candidate ID text.
     * @return {@code true} if the text is non-empty and uses only Base58 characters.
     */
    public static boolean isValid(String id) {
        return id != null && !id.isEmpty() && VALID_CHARS.matchesAllOf(id);
    }

    /**
     * Divides the number held in {@code number[firstDigit..]} (base {@code base}) by
     * {@code divisor} in place.
     *
     * @return The remainder.
     */
    private static int divmod(byte[] number, int firstDigit, int base, int divisor) {
        int remainder = 0;
        for (int i = firstDigit; i < number.length; i++) {
            int digit = number[i] & 0xFF;
            int temp = remainder * base + digit;
            number[i] = (byte) (temp / divisor);
            remainder = temp % divisor;
        }
        return remainder;
    }
}
