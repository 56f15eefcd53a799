package pl.faktulove.ocr.extraction;

/**
 * Checksum of the Polish tax identifier (NIP): the tenth digit equals the weighted sum of
 * the first nine modulo 11.
 */
public final class NipChecksum {

    private static final int[] WEIGHTS = {6, 5, 7, 2, 3, 4, 5, 6, 7};

    private NipChecksum() {
    }

    /**
     * @param nip ten digits, without separators
     */
    public static boolean isValid(String nip) {
        if (nip == null || nip.length() != 10 || !nip.chars().allMatch(Character::isDigit)) {
            return false;
        }
        if (nip.chars().distinct().count() == 1) {
            return false;
        }
        int check = checkDigit(nip.substring(0, 9));
        return check >= 0 && check == nip.charAt(9) - '0';
    }

    /**
     * @param prefix the first nine digits
     * @return the check digit, or -1 when the prefix admits no valid NIP
     */
    public static int checkDigit(String prefix) {
        int sum = 0;
        for (int i = 0; i < WEIGHTS.length; i++) {
            sum += (prefix.charAt(i) - '0') * WEIGHTS[i];
        }
        int check = sum % 11;
        return check == 10 ? -1 : check;
    }

    /**
     * Strips the {@code PL} prefix and any separators.
     */
    public static String normalize(String raw) {
        if (raw == null) return "";
        String s = raw.trim().toUpperCase();
        if (s.startsWith("PL")) s = s.substring(2);
        return s.replaceAll("[\\s\\-.]", "");
    }
}
