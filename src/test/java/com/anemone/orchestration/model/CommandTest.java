package com.anemone.orchestration.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CommandTest {

    @Test
    void testFromToken_ExactMatch() {
        assertEquals(Optional.of(Command.QUERY_ROLE_DATA), Command.fromToken("queryRoleData"));
        assertEquals(Optional.of(Command.GET_TOKENS_SUMMARY), Command.fromToken(" getTokensSummary "));
        assertTrue(Command.fromToken("QUERYROLEDATA").isEmpty());
        assertTrue(Command.fromToken("transfer").isEmpty());
        assertTrue(Command.fromToken(null).isEmpty());
    }

    @Test
    void testFromToken_NoneIsCaseInsensitive() {
        assertEquals(Optional.of(Command.NONE), Command.fromToken("none"));
        assertEquals(Optional.of(Command.NONE), Command.fromToken("NONE"));
        assertEquals(Optional.of(Command.NONE), Command.fromToken("None"));
    }

    @Test
    void testIsTokenQuery() {
        assertTrue(Command.GET_TOKENS.isTokenQuery());
        assertTrue(Command.GET_TOKENS_SUMMARY.isTokenQuery());
        assertFalse(Command.QUERY_ROLE_DATA.isTokenQuery());
    }
}
