package com.anemone.orchestration.service;

import com.anemone.orchestration.model.Command;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandMarkerParserTest {

    private final CommandMarkerParser parser = new CommandMarkerParser();

    @Test
    void testParse_MultipleMarkersInProse() {
        String text = "Let me check. $execute:queryRoleData and then $execute:getTokensSummary, one moment.";

        assertEquals(List.of(Command.QUERY_ROLE_DATA, Command.GET_TOKENS_SUMMARY), parser.parse(text));
    }

    @Test
    void testParse_NoneMarkerIsCaseInsensitive() {
        assertEquals(List.of(Command.NONE), parser.parse("Hi there! $execute:NONE"));
    }

    @Test
    void testParse_UnknownTokensIgnored() {
        assertEquals(List.of(Command.GET_WALLET), parser.parse("$execute:transferAll $execute:getWallet"));
    }

    @Test
    void testParse_ToolsBlock() {
        String text = """
                I need role data and the wallet summary.
                Tools to use:
                $queryRoleData
                $getTokensSummary

                Anything else is unnecessary.
                """;

        assertEquals(List.of(Command.QUERY_ROLE_DATA, Command.GET_TOKENS_SUMMARY), parser.parse(text));
    }

    @Test
    void testParse_EmptyInput() {
        assertTrue(parser.parse(null).isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
        assertFalse(parser.containsMarker("Your balance is 12 SUI."));
    }
}
