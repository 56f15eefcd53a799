package pl.faktulove.ocr.taskqueue.services;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FairOwnerRotationTest {

    private static final List<String> OWNERS = List.of("celina", "anna", "bartek", "anna");

    @Test
    @DisplayName("owners are visited once each, in name order")
    void distinctOwnersInOrder() {
        FairOwnerRotation rotation = new FairOwnerRotation();

        assertEquals(List.of("anna", "bartek", "celina"), rotation.order(OWNERS));
    }

    @Test
    @DisplayName("the owner after the last served one goes first")
    void startsAfterLastServed() {
        FairOwnerRotation rotation = new FairOwnerRotation();
        rotation.served("anna");

        assertEquals(List.of("bartek", "celina", "anna"), rotation.order(OWNERS));
        assertEquals("anna", rotation.lastServed());
    }

    @Test
    @DisplayName("rotation wraps around past the last owner")
    void wrapsAround() {
        FairOwnerRotation rotation = new FairOwnerRotation();
        rotation.served("celina");

        assertEquals(List.of("anna", "bartek", "celina"), rotation.order(OWNERS));
    }

    @Test
    @DisplayName("a last served owner without claimable work still positions the rotation")
    void absentLastServed() {
        FairOwnerRotation rotation = new FairOwnerRotation();
        rotation.served("bogdan");

        assertEquals(List.of("celina", "anna", "bartek"), rotation.order(OWNERS));
    }

    @Test
    void emptyOwners() {
        assertTrue(new FairOwnerRotation().order(List.of()).isEmpty());
    }
}
