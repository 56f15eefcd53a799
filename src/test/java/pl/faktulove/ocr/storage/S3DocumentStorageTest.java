package pl.faktulove.ocr.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class S3DocumentStorageTest {

    @Test
    @DisplayName("object keys are partitioned by the year and month of the injected clock")
    void keyUsesInjectedClock() {
        // Given
        S3DocumentStorage storage = new S3DocumentStorage();
        storage.clock = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneId.of("Europe/Warsaw"));

        // When
        String first = storage.buildKey();
        String second = storage.buildKey();

        // Then
        assertTrue(first.startsWith("ocr-uploads/2024/03/"), first);
        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("the month boundary follows the clock zone")
    void monthBoundaryInClockZone() {
        S3DocumentStorage storage = new S3DocumentStorage();
        storage.clock = Clock.fixed(Instant.parse("2024-03-31T23:30:00Z"), ZoneId.of("Europe/Warsaw"));

        assertTrue(storage.buildKey().startsWith("ocr-uploads/2024/04/"));
    }
}
