package com.anemone.orchestration.service;

import com.anemone.orchestration.model.Command;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordCommandClassifierTest {

    private final KeywordCommandClassifier classifier = new KeywordCommandClassifier();

    @Test
    void testClassify_MixedLanguageBalanceQuestion() {
        List<Command> commands = classifier.classify("你的balance还有多少sui", List.of());

        assertTrue(commands.contains(Command.QUERY_ROLE_DATA));
        assertTrue(commands.contains(Command.GET_TOKENS_SUMMARY));
    }

    @Test
    void testClassify_SkillsAndWallet() {
        assertEquals(List.of(Command.QUERY_SKILL_DETAILS), classifier.classify("What skills do you have?", List.of()));
        assertEquals(List.of(Command.GET_WALLET), classifier.classify("显示你的钱包地址", List.of()));
    }

    @Test
    void testClassify_DetailedTokenList() {
        assertEquals(List.of(Command.GET_TOKENS), classifier.classify("show all tokens please", List.of()));
    }

    @Test
    void testClassify_SmallTalkIsNone() {
        assertEquals(List.of(Command.NONE), classifier.classify("Good morning!", List.of()));
    }
}
