package com.anemone.orchestration;

import java.util.List;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
    }

    // Processor names used for message admission
    public static final String PROCESSOR_PLANNING = "PlanningService";

    // Bookkeeping tasks
    public static final String TASK_INTERPRET_INTENT = "Interpret the user's intent";
    public static final String TASK_FETCH_PREFIX = "Fetch ";
    public static final String TASK_INTEGRATE_RESULTS = "Integrate the fetched results";
    public static final String TASK_FINAL_REPLY = "Produce the final reply";
    public static final String NO_COMMAND_RESULT = "Task \"%s\" completed, no command needed";
    public static final String EXECUTION_FAILED_PREFIX = "Execution failed: ";

    // Dispatcher
    public static final String NONE_RESULT = "No command needed";
    public static final String UNKNOWN_COMMAND_PREFIX = "Unknown command: ";
    public static final String COMMAND_FAILED_PREFIX = "Command execution failed: ";
    public static final String LABEL_PROFILE = "Profile configuration";
    public static final String LABEL_WALLET = "Wallet information";
    public static final String LABEL_ROLE_DATA = "Role data (role balance is the balance held by the on-chain role object)";
    public static final String LABEL_SKILL_DETAILS = "Skill details";
    public static final String LABEL_TOKENS = "Wallet token list (wallet balance held by the wallet address)";
    public static final String LABEL_TOKENS_SUMMARY = "Wallet token summary (wallet balance held by the wallet address)";

    // Markers
    public static final String EXECUTE_MARKER = "$execute:";
    public static final String TOOLS_HEADER = "Tools to use:";

    // Balance rule keywords, matched case-insensitively
    public static final List<String> BALANCE_KEYWORDS = List.of("余额", "balance", "token", "代币");

    // Fallback replies
    public static final String FALLBACK_REPLY = "Sorry, I could not produce an answer right now. Please try again.";
    public static final String LOW_CONFIDENCE_DISCLAIMER =
            "[Low confidence] The language model did not answer, so this reply was assembled directly from the fetched data.";
    public static final String UNVERIFIED_DATA_WARNING =
            "[Warning: unverified data] The following answer was not backed by any data query and may be inaccurate.\n\n";
    public static final String PENDING_REPLY = "I'm still thinking about this one. Check the chat history again in a moment.";
    public static final String NO_RESULTS = "No data was fetched for this request.";
    public static final String UNBACKED_FIGURES_REPLY =
            "I don't have verified on-chain data for that yet, so I won't quote any figures. "
                    + "Ask me about your role or wallet balance and I'll fetch it.";

    public static final String SYSTEM_PROMPT = """
            You are Anemone Agent, an on-chain agent on the Sui network. You can decide on your own whether to
            run the following data commands for the user:

            1. $execute:queryRoleData - read your on-chain role: role balance, health, activity and skill ids.
            2. $execute:querySkillDetails - read the details of every skill the role owns.
            3. $execute:getProfile - read your profile configuration.
            4. $execute:getWallet - read the wallet address linked to you.
            5. $execute:getTokens - list every token balance held by the wallet.
            6. $execute:getTokensSummary - summarize the wallet: total USD value and SUI balance.

            Mandatory rules:
            1. Every reply must contain at least one command marker.
            2. If the question needs data (balances, health, skills, tokens) use the matching command.
            3. If no data is needed, use $execute:none.
            4. Never invent numbers. Any figure you state must come from a command result.

            Keep answers short and answer only what was asked.
            """;

    public static final String RETRY_PROMPT_TEMPLATE = """
            %s

            System notice: your reply must contain a command marker such as $execute:queryRoleData or
            $execute:none. If no data is needed, use $execute:none.
            """;

    public static final String RESULT_FORMATTING_PROMPT_TEMPLATE = """
            The user asked: "%s"

            You already ran data queries for this request. Query results:
            %s

            Write the reply following these rules:
            1. Be concise and answer only what the user asked.
            2. The role balance is the balance of the on-chain role object. The wallet balance is the token
               balance held by the wallet address. Never merge or confuse the two.
            3. Do not mention commands or internal system operations.
            4. Only use figures that appear in the query results.
            """;

    public static final String CLASSIFIER_PROMPT_TEMPLATE = """
            Decide which data commands are needed to answer the user's latest message.

            Available commands:
            %s

            Recent conversation:
            %s

            User message: "%s"

            Return only JSON in this shape:
            {"reasoning": "one sentence", "commands": ["queryRoleData", "getTokensSummary"]}
            Use ["none"] when no data is needed. Commands must come from the list above.
            """;
}
