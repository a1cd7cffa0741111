package me.go_gradually.voicerelay.domain.relay;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayConnectionTest {

    @Test
    void newConnection_isUnbound() {
        RelayConnection connection = new RelayConnection("c1");

        assertEquals(ConnectionState.UNBOUND, connection.getState());
        assertTrue(connection.getIdentity().isEmpty());
    }

    @Test
    void beginSpeaking_beforeBind_throwsNotBound() {
        RelayConnection connection = new RelayConnection("c1");

        RelayStateException error = assertThrows(RelayStateException.class, connection::beginSpeaking);

        assertEquals(RelayErrorCode.NOT_BOUND, error.getCode());
        assertEquals(ConnectionState.UNBOUND, connection.getState());
    }

    @Test
    void bind_isIdempotentForSamePair() {
        RelayConnection connection = new RelayConnection("c1");

        connection.bind(BoundIdentity.of("u1", "s1"));
        connection.bind(BoundIdentity.of("u1", "s1"));

        assertEquals(ConnectionState.BOUND, connection.getState());
        assertEquals(BoundIdentity.of("u1", "s1"), connection.getIdentity().orElseThrow());
    }

    @Test
    void beginSpeaking_whileSpeaking_throwsAlreadySpeaking() {
        RelayConnection connection = new RelayConnection("c1");
        connection.bind(BoundIdentity.of("u1", "s1"));
        connection.beginSpeaking();

        RelayStateException error = assertThrows(RelayStateException.class, connection::beginSpeaking);

        assertEquals(RelayErrorCode.ALREADY_SPEAKING, error.getCode());
        assertTrue(connection.isSpeaking());
    }

    @Test
    void bind_whileSpeaking_replacesIdentityWithoutLeavingSpeaking() {
        RelayConnection connection = new RelayConnection("c1");
        connection.bind(BoundIdentity.of("u1", "s1"));
        BoundIdentity speaking = connection.beginSpeaking();

        connection.bind(BoundIdentity.of("u2", "s2"));

        assertEquals(BoundIdentity.of("u1", "s1"), speaking);
        assertEquals(ConnectionState.SPEAKING, connection.getState());
        assertEquals(BoundIdentity.of("u2", "s2"), connection.getIdentity().orElseThrow());
    }

    @Test
    void finishSpeaking_returnsToBound() {
        RelayConnection connection = new RelayConnection("c1");
        connection.bind(BoundIdentity.of("u1", "s1"));
        connection.beginSpeaking();

        connection.finishSpeaking();

        assertEquals(ConnectionState.BOUND, connection.getState());
    }

    @Test
    void close_isTerminalAndIdempotent() {
        RelayConnection connection = new RelayConnection("c1");
        connection.bind(BoundIdentity.of("u1", "s1"));
        connection.beginSpeaking();

        assertTrue(connection.close());
        assertFalse(connection.close());
        connection.finishSpeaking();

        assertEquals(ConnectionState.CLOSED, connection.getState());
        assertThrows(IllegalStateException.class, () -> connection.bind(BoundIdentity.of("u1", "s1")));
    }
}
