package pl.faktulove.ocr.engine;

/**
 * Position of a token on its page, in pixels of the rendered page.
 */
public record BoundingBox(int page, int x, int y, int width, int height) {
}
