package com.anemone.orchestration.model;

public record ChatTurn(Role role, String content) {

    public enum Role {
        USER, ASSISTANT, SYSTEM
    }

    public static ChatTurn user(String content) {
        return new ChatTurn(Role.USER, content);
    }

    public static ChatTurn assistant(String content) {
        return new ChatTurn(Role.ASSISTANT, content);
    }
}
