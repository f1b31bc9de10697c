package io.packageoperator.api;

/**
 * Deterministic short hash over the canonical JSON form of a value.
 * <p>
 * FNV-1a (32 bit) of the canonical bytes, optionally salted with a collision count, rendered with an
 * alphabet that avoids vowels and look-alike characters so results are safe to use in object names.
 */
public final class ContentHash {

    private static final String ALPHABET = "bcdfghjklmnpqrstvwxz2456789";
    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private ContentHash() {
    }

    public static String of(Object value) {
        return of(value, 0);
    }

    public static String of(Object value, int salt) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : ApiJson.canonicalBytes(value)) {
            hash ^= b & 0xff;
            hash *= FNV_PRIME;
        }
        if (salt > 0) {
            for (int shift = 0; shift < 32; shift += 8) {
                hash ^= (salt >>> shift) & 0xff;
                hash *= FNV_PRIME;
            }
        }
        return safeEncode(Integer.toUnsignedString(hash));
    }

    static String safeEncode(String digits) {
        StringBuilder encoded = new StringBuilder(digits.length());
        for (int i = 0; i < digits.length(); i++) {
            encoded.append(ALPHABET.charAt(digits.charAt(i) % ALPHABET.length()));
        }
        return encoded.toString();
    }
}
