package com.gamearr.release;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VersionParserTest {

    @Test
    void extractsDottedVersionAfterSeparator() {
        assertEquals("2.0.1", VersionParser.parse("Game.Name.v2.0.1.GOG").orElseThrow());
        assertEquals("1.5", VersionParser.parse("Hollow Knight v1.5 GOG").orElseThrow());
    }

    @Test
    void extractsOtherShapes() {
        assertEquals("3", VersionParser.parse("Game Name v3 Repack").orElseThrow());
        assertEquals("1.2", VersionParser.parse("v1.2 Game Name").orElseThrow());
        assertEquals("4.1", VersionParser.parse("Game Name Version 4.1").orElseThrow());
        assertEquals("1.10.3", VersionParser.parse("Game Name 1.10.3 Repack").orElseThrow());
        assertEquals("12345", VersionParser.parse("Game Name Build 12345").orElseThrow());
        assertEquals("7", VersionParser.parse("Game Name Update 7").orElseThrow());
        assertEquals("4", VersionParser.parse("Game.Name.u4-GOG").orElseThrow());
        assertEquals("2", VersionParser.parse("Game Name r2 Scene").orElseThrow());
    }

    @Test
    void keepsEveryComponentOfLongVersions() {
        assertEquals("4.1.1.418", VersionParser.parse("Baldurs.Gate.3.v4.1.1.418").orElseThrow());
        assertEquals("1.2.3.4", VersionParser.parse("Game 1.2.3.4").orElseThrow());
        assertEquals(1, VersionComparator.compareVersions("4.1.1.418", "4.0.0"));
    }

    @Test
    void noVersionIsEmpty() {
        assertTrue(VersionParser.parse("Baldurs Gate 3 GOG").isEmpty());
        assertTrue(VersionParser.parse("Game Name GOG").isEmpty());
        assertTrue(VersionParser.parse("").isEmpty());
        assertTrue(VersionParser.parse(null).isEmpty());
    }
}
