package pl.faktulove.ocr.engine.remote;

import jakarta.ws.rs.ProcessingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import pl.faktulove.ocr.engine.EngineFailureException;
import pl.faktulove.ocr.engine.RecognitionOutput;
import pl.faktulove.ocr.engine.RecognizedToken;
import pl.faktulove.ocr.engine.remote.OcrServiceResponseExceptionMapper.OcrServiceApiException;
import pl.faktulove.ocr.engine.remote.dto.RecognizeRequest;
import pl.faktulove.ocr.engine.remote.dto.RecognizeResponse;
import pl.faktulove.ocr.support.TestPipelineConfig;

import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RemoteOcrEngine")
class RemoteOcrEngineTest {

    private static final byte[] CONTENT = {1, 2, 3, 4};

    @Mock
    private OcrServiceAPI ocrServiceAPI;

    private RemoteOcrEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RemoteOcrEngine();
        engine.ocrServiceAPI = ocrServiceAPI;
        engine.config = new TestPipelineConfig();
    }

    @Test
    @DisplayName("sends the document base64 encoded with language and preprocessing")
    void buildsRequest() throws Exception {
        when(ocrServiceAPI.recognize(any())).thenReturn(new RecognizeResponse("tesseract-5.3", "Faktura VAT", 0.9, null));

        engine.recognize(CONTENT, "image/png");

        ArgumentCaptor<RecognizeRequest> request = ArgumentCaptor.forClass(RecognizeRequest.class);
        verify(ocrServiceAPI).recognize(request.capture());
        assertArrayEquals(CONTENT, Base64.getDecoder().decode(request.getValue().content()));
        assertEquals("image/png", request.getValue().mimeType());
        assertEquals("pol", request.getValue().language());
        assertEquals(List.of("deskew", "binarize"), request.getValue().preprocessing());
    }

    @Test
    @DisplayName("maps token confidences to percent and locates tokens in the text")
    void mapsTokens() throws Exception {
        // Given
        RecognizeResponse response = new RecognizeResponse("tesseract-5.3", "NIP: 526-104-08-28 NIP", 0.9, List.of(
                new RecognizeResponse.Token("NIP:", 0.97, 1, 10, 10, 40, 12),
                new RecognizeResponse.Token("526-104-08-28", 0.41, 1, 55, 10, 120, 12),
                new RecognizeResponse.Token("NIP", 0.88, 1, 180, 10, 30, 12)));
        when(ocrServiceAPI.recognize(any())).thenReturn(response);

        // When
        RecognitionOutput output = engine.recognize(CONTENT, "application/pdf");

        // Then
        List<RecognizedToken> tokens = output.getTokens();
        assertEquals(3, tokens.size());
        assertEquals(5, tokens.get(1).start());
        assertEquals(18, tokens.get(1).end());
        assertEquals(41.0, tokens.get(1).confidence(), 0.001);
        assertEquals(19, tokens.get(2).start());
        assertEquals(55, tokens.get(1).box().x());
        assertEquals("tesseract-5.3", output.getEngineId());
    }

    @Test
    @DisplayName("without tokens the overall confidence applies to every word")
    void uniformConfidence() throws Exception {
        when(ocrServiceAPI.recognize(any())).thenReturn(new RecognizeResponse(null, "Faktura VAT", 0.85, null));

        RecognitionOutput output = engine.recognize(CONTENT, "application/pdf");

        assertEquals(2, output.getTokens().size());
        assertEquals(85.0, output.confidenceForSpan(0, 11), 0.001);
        assertEquals("remote", output.getEngineId());
    }

    @Test
    @DisplayName("each output keeps the engine that produced it")
    void engineIdPerOutput() throws Exception {
        when(ocrServiceAPI.recognize(any())).thenReturn(
                new RecognizeResponse("tesseract-5.3", "Faktura VAT", 0.9, null),
                new RecognizeResponse("paddle-2.7", "Faktura VAT", 0.9, null));

        RecognitionOutput first = engine.recognize(CONTENT, "application/pdf");
        RecognitionOutput second = engine.recognize(CONTENT, "application/pdf");

        assertEquals("tesseract-5.3", first.getEngineId());
        assertEquals("paddle-2.7", second.getEngineId());
        assertEquals("remote", engine.engineId());
    }

    @ParameterizedTest(name = "status {0} is transient")
    @ValueSource(ints = {408, 429, 500, 502, 503})
    @DisplayName("server errors, throttling and timeouts are transient")
    void transientStatus(int status) {
        when(ocrServiceAPI.recognize(any())).thenThrow(new OcrServiceApiException(status, "busy"));

        EngineFailureException e = assertThrows(EngineFailureException.class,
                () -> engine.recognize(CONTENT, "application/pdf"));

        assertTrue(e.isTransient());
    }

    @ParameterizedTest(name = "status {0} is permanent")
    @ValueSource(ints = {400, 413, 415, 422})
    @DisplayName("rejections of the document are permanent")
    void permanentStatus(int status) {
        when(ocrServiceAPI.recognize(any())).thenThrow(new OcrServiceApiException(status, "bad document"));

        EngineFailureException e = assertThrows(EngineFailureException.class,
                () -> engine.recognize(CONTENT, "application/pdf"));

        assertFalse(e.isTransient());
    }

    @Test
    @DisplayName("an unreachable server is transient")
    void connectionFailure() {
        when(ocrServiceAPI.recognize(any())).thenThrow(new ProcessingException("Connection refused"));

        EngineFailureException e = assertThrows(EngineFailureException.class,
                () -> engine.recognize(CONTENT, "application/pdf"));

        assertTrue(e.isTransient());
    }

    @Test
    @DisplayName("a response without text is a permanent failure")
    void emptyText() {
        when(ocrServiceAPI.recognize(any())).thenReturn(new RecognizeResponse("tesseract-5.3", "   ", 0.0, List.of()));

        EngineFailureException e = assertThrows(EngineFailureException.class,
                () -> engine.recognize(CONTENT, "application/pdf"));

        assertFalse(e.isTransient());
    }
}
