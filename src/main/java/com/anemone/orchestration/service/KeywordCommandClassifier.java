package com.anemone.orchestration.service;

import com.anemone.orchestration.api.CommandClassifier;
import com.anemone.orchestration.model.ChatTurn;
import com.anemone.orchestration.model.Command;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic classifier used when no language model is configured.
 */
@Slf4j
public class KeywordCommandClassifier implements CommandClassifier {

    @Override
    public List<Command> classify(String message, List<ChatTurn> history) {
        String text = message.toLowerCase(Locale.ROOT);
        List<Command> commands = new ArrayList<>();

        if (containsAny(text, "余额", "balance", "健康", "health", "状态", "status", "role", "角色")) {
            commands.add(Command.QUERY_ROLE_DATA);
        }
        if (containsAny(text, "技能", "skill")) {
            commands.add(Command.QUERY_SKILL_DETAILS);
        }
        if (containsAny(text, "配置", "profile", "设置", "settings")) {
            commands.add(Command.GET_PROFILE);
        }
        if (containsAny(text, "钱包", "wallet", "地址", "address")) {
            commands.add(Command.GET_WALLET);
        }
        if (containsAny(text, "代币列表", "token list", "所有代币", "all tokens", "详细代币")) {
            commands.add(Command.GET_TOKENS);
        } else if (containsAny(text, "代币", "token", "usd", "美元", "资产", "sui")) {
            commands.add(Command.GET_TOKENS_SUMMARY);
        }

        if (commands.isEmpty()) {
            commands.add(Command.NONE);
        }
        log.debug("Keyword classification for message selected {}.", commands);
        return commands;
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
