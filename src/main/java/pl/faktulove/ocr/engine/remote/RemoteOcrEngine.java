package pl.faktulove.ocr.engine.remote;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.ProcessingException;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.rest.client.inject.RestClient;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.engine.BoundingBox;
import pl.faktulove.ocr.engine.EngineFailureException;
import pl.faktulove.ocr.engine.OcrEngine;
import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.engine.RecognizedToken;
import pl.faktulove.ocr.engine.remote.OcrServiceResponseExceptionMapper.OcrServiceApiException;
import pl.faktulove.ocr.engine.remote.dto.RecognizeRequest;
import pl.faktulove.ocr.engine.remote.dto.RecognizeResponse;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * {@link OcrEngine} backed by a remote OCR server.
 */
@JBossLog
@ApplicationScoped
public class RemoteOcrEngine implements OcrEngine {

    @Inject
    @RestClient
    OcrServiceAPI ocrServiceAPI;

    @Inject
    OcrPipelineConfig config;

    static final String DEFAULT_ENGINE_ID = "remote";

    @Override
    public RecognitionOutput recognize(byte[] content, String mimeType) throws EngineFailureException {
        RecognizeRequest request = new RecognizeRequest(
                Base64.getEncoder().encodeToString(content), mimeType,
                config.engine().language(), config.engine().preprocessing());
        RecognizeResponse response;
        try {
            response = ocrServiceAPI.recognize(request);
        } catch (OcrServiceApiException e) {
            if (e.isRetryable()) {
                throw EngineFailureException.transientFailure("OCR server unavailable: " + e.getMessage(), e);
            }
            throw EngineFailureException.permanentFailure("OCR server rejected document: " + e.getMessage(), e);
        } catch (ProcessingException e) {
            // connection refused, reset or read timeout
            throw EngineFailureException.transientFailure("OCR server unreachable: " + e.getMessage(), e);
        }

        if (response == null || response.text() == null || response.text().isBlank()) {
            throw EngineFailureException.permanentFailure("No text could be recognized in the document", null);
        }
        String engineId = response.engine() != null ? response.engine() : DEFAULT_ENGINE_ID;
        log.debugf("OCR server %s recognized %d characters", engineId, response.text().length());
        return toOutput(response).producedBy(engineId);
    }

    @Override
    public String engineId() {
        return DEFAULT_ENGINE_ID;
    }

    RecognitionOutput toOutput(RecognizeResponse response) {
        String text = response.text();
        if (response.tokens() == null || response.tokens().isEmpty()) {
            double confidence = response.confidence() == null ? 0 : toPercent(response.confidence());
            return RecognitionOutput.withUniformConfidence(text, confidence);
        }

        List<RecognizedToken> tokens = new ArrayList<>(response.tokens().size());
        int cursor = 0;
        for (RecognizeResponse.Token token : response.tokens()) {
            if (token.text() == null || token.text().isEmpty()) continue;
            int start = text.indexOf(token.text(), cursor);
            if (start < 0) {
                log.debugf("Token '%s' not found in recognized text after offset %d", token.text(), cursor);
                continue;
            }
            int end = start + token.text().length();
            tokens.add(new RecognizedToken(token.text(), start, end, toPercent(token.confidence()),
                    new BoundingBox(token.page(), token.x(), token.y(), token.width(), token.height())));
            cursor = end;
        }
        return new RecognitionOutput(text, tokens);
    }

    private static double toPercent(double engineConfidence) {
        double percent = engineConfidence <= 1.0 ? engineConfidence * 100.0 : engineConfidence;
        return Math.max(0, Math.min(100, percent));
    }
}
