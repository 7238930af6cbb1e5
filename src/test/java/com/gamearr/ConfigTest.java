package com.gamearr;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    @DisplayName("getPort always returns a usable port")
    void getPortIsInRange() {
        int port = Config.getPort();
        assertTrue(port >= 0 && port <= 65535);
    }

    @Test
    @DisplayName("collaborator checks do not throw without configuration")
    void collaboratorChecksDoNotThrow() {
        assertDoesNotThrow(Config::hasProwlarr);
        assertDoesNotThrow(Config::hasQBittorrent);
    }

    @Test
    @DisplayName("printStatus does not throw")
    void printStatusDoesNotThrow() {
        assertDoesNotThrow(Config::printStatus);
    }
}
