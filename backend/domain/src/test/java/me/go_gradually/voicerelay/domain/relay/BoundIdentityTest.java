package me.go_gradually.voicerelay.domain.relay;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BoundIdentityTest {

    @Test
    void of_keepsBothIdentifiers() {
        BoundIdentity identity = BoundIdentity.of("u1", "s1");

        assertEquals("u1", identity.callerId());
        assertEquals("s1", identity.sessionId());
    }

    @Test
    void constructor_rejectsBlankIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> BoundIdentity.of("", "s1"));
        assertThrows(IllegalArgumentException.class, () -> BoundIdentity.of("u1", null));
    }
}
