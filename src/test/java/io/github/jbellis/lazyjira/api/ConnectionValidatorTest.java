package io.github.jbellis.lazyjira.api;

import static org.junit.jupiter.api.Assertions.*;

import io.github.jbellis.lazyjira.exception.LazyJiraException;
import io.github.jbellis.lazyjira.testutil.FakeJiraClient;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class ConnectionValidatorTest {

    private static ConnectionStatus probeFailingWith(LazyJiraException error) {
        var client = new FakeJiraClient();
        client.failOn("search", error);
        return ConnectionValidator.testConnection(client);
    }

    @Test
    void successfulProbeIsConnected() {
        var client = new FakeJiraClient();
        var status = ConnectionValidator.testConnection(client);
        assertTrue(status.isConnected());
        assertTrue(status.errorMessage().isEmpty());
        assertEquals(java.util.List.of("search"), client.calls());
    }

    @Test
    void mapsFailureKindsToStatuses() {
        assertEquals(
                ConnectionStatus.AUTHENTICATION_FAILED,
                probeFailingWith(LazyJiraException.authentication("Unauthorized (401)")));
        assertEquals(
                ConnectionStatus.NETWORK_ERROR,
                probeFailingWith(LazyJiraException.network("refused", new IOException("refused"))));
        assertEquals(ConnectionStatus.CONFIGURATION_ERROR, probeFailingWith(LazyJiraException.config("bad")));
    }

    @Test
    void otherFailuresCarryTheirMessage() {
        var status = probeFailingWith(LazyJiraException.api(500, "boom"));
        assertEquals(ConnectionStatus.State.UNKNOWN_ERROR, status.state());
        assertEquals("API error (500): boom", status.errorMessage().orElseThrow());
    }

    @Test
    void messagesAreUserFacing() {
        assertEquals(
                "Authentication failed. Please check your credentials.",
                ConnectionStatus.AUTHENTICATION_FAILED.errorMessage().orElseThrow());
        assertEquals(
                "Network error. Please check your internet connection.",
                ConnectionStatus.NETWORK_ERROR.errorMessage().orElseThrow());
    }
}
