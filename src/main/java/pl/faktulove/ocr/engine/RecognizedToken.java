package pl.faktulove.ocr.engine;

/**
 * One recognized word.
 *
 * @param text       the token text
 * @param start      offset of the first character in the raw text
 * @param end        offset after the last character in the raw text
 * @param confidence engine confidence, 0-100
 * @param box        position on the page, may be null
 */
public record RecognizedToken(String text, int start, int end, double confidence, BoundingBox box) {

    public boolean overlaps(int spanStart, int spanEnd) {
        return start < spanEnd && spanStart < end;
    }
}
