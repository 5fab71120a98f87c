package alertmigrator.dedup;

import java.security.SecureRandom;

/**
 * Random short identifiers: lowercase letters and digits, starting with a letter.
 *
 * <p>Lowercase only, so that identifiers stay distinct under case-insensitive
 * database collations.
 */
public final class ShortUid {

    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyz";
    private static final String ALPHABET = LETTERS + "0123456789";
    private static final SecureRandom RANDOM = new SecureRandom();

    private ShortUid() {}

    public static String generate(int length) {
        if (length <= 0) throw new IllegalArgumentException("length must be positive");
        StringBuilder sb = new StringBuilder(length);
        sb.append(LETTERS.charAt(RANDOM.nextInt(LETTERS.length())));
        for (int i = 1; i < length; i++) {
            sb.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
