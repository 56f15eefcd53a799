package pl.faktulove.ocr.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Raw text of a recognized document plus its tokens, each mapped to a character span
 * of the text.
 */
public class RecognitionOutput {

    private static final Pattern WORD = Pattern.compile("\\S+");

    private final String rawText;
    private final List<RecognizedToken> tokens;
    private final String engineId;

    public RecognitionOutput(String rawText, List<RecognizedToken> tokens) {
        this(rawText, tokens, null);
    }

    private RecognitionOutput(String rawText, List<RecognizedToken> tokens, String engineId) {
        this.rawText = rawText == null ? "" : rawText;
        this.tokens = List.copyOf(tokens);
        this.engineId = engineId;
    }

    /**
     * The same output, attributed to the engine that produced it.
     */
    public RecognitionOutput producedBy(String engineId) {
        return new RecognitionOutput(rawText, tokens, engineId);
    }

    /**
     * Splits the text on whitespace and gives every token the same confidence. Used for
     * engines that only report a page-level score.
     */
    public static RecognitionOutput withUniformConfidence(String rawText, double confidence) {
        String text = rawText == null ? "" : rawText;
        List<RecognizedToken> tokens = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            tokens.add(new RecognizedToken(m.group(), m.start(), m.end(), confidence, null));
        }
        return new RecognitionOutput(text, tokens);
    }

    public String getRawText() {
        return rawText;
    }

    public List<RecognizedToken> getTokens() {
        return tokens;
    }

    /**
     * Engine that recognized this text, or null when the engine did not say.
     */
    public String getEngineId() {
        return engineId;
    }

    /**
     * Confidence of a text span: the weakest token it touches. Falls back to the document
     * mean when no token overlaps the span, and to 0 when nothing was recognized.
     */
    public double confidenceForSpan(int start, int end) {
        double min = Double.MAX_VALUE;
        boolean found = false;
        for (RecognizedToken token : tokens) {
            if (token.overlaps(start, end)) {
                min = Math.min(min, token.confidence());
                found = true;
            }
        }
        if (found) return min;
        return meanConfidence();
    }

    public double meanConfidence() {
        return tokens.stream().mapToDouble(RecognizedToken::confidence).average().orElse(0);
    }
}
