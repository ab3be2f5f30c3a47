package com.anemone.config;

import com.anemone.account.ProfileService;
import com.anemone.account.TokenService;
import com.anemone.account.WalletService;
import com.anemone.events.EventBus;
import com.anemone.orchestration.api.CommandClassifier;
import com.anemone.orchestration.api.CompletionProvider;
import com.anemone.orchestration.api.TaskPlanner;
import com.anemone.orchestration.model.Command;
import com.anemone.orchestration.service.ChatClientCompletionProvider;
import com.anemone.orchestration.service.CommandDispatcher;
import com.anemone.orchestration.service.CommandMarkerParser;
import com.anemone.orchestration.service.FabricationGuard;
import com.anemone.orchestration.service.JsonProcessingService;
import com.anemone.orchestration.service.KeywordCommandClassifier;
import com.anemone.orchestration.service.LlmCommandClassifier;
import com.anemone.orchestration.service.LlmTaskPlanner;
import com.anemone.orchestration.service.OrchestrationMetricsService;
import com.anemone.orchestration.service.ResponseSynthesizer;
import com.anemone.orchestration.service.TaskExecutor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.anemone.orchestration.OrchestrationConstants.LABEL_PROFILE;
import static com.anemone.orchestration.OrchestrationConstants.LABEL_ROLE_DATA;
import static com.anemone.orchestration.OrchestrationConstants.LABEL_SKILL_DETAILS;
import static com.anemone.orchestration.OrchestrationConstants.LABEL_TOKENS;
import static com.anemone.orchestration.OrchestrationConstants.LABEL_TOKENS_SUMMARY;
import static com.anemone.orchestration.OrchestrationConstants.LABEL_WALLET;

@Configuration
public class OrchestratorConfig {

    @Bean(destroyMethod = "close")
    public EventBus eventBus(AgentProperties properties) {
        return new EventBus(Clock.systemUTC(), properties.getProcessing().getRetention());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService orchestrationExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean
    public CompletionProvider completionProvider(ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider,
                                                 ObjectProvider<OpenAiChatModel> openAiChatModelProvider,
                                                 AgentProperties properties) {
        GoogleGenAiChatModel googleModel = googleGenAiChatModelProvider.getIfAvailable();
        OpenAiChatModel openAiModel = openAiChatModelProvider.getIfAvailable();
        return new ChatClientCompletionProvider(
                googleModel != null ? ChatClient.builder(googleModel).build() : null,
                openAiModel != null ? ChatClient.builder(openAiModel).build() : null,
                properties);
    }

    @Bean
    public CommandClassifier commandClassifier(AgentProperties properties,
                                               CompletionProvider completionProvider,
                                               JsonProcessingService jsonProcessingService,
                                               CommandMarkerParser commandMarkerParser,
                                               OrchestrationMetricsService metricsService) {
        if (properties.getPlanner().getClassifier() == AgentProperties.ClassifierType.KEYWORD) {
            return new KeywordCommandClassifier();
        }
        return new LlmCommandClassifier(completionProvider, jsonProcessingService, commandMarkerParser, metricsService);
    }

    @Bean
    public TaskPlanner taskPlanner(CommandClassifier commandClassifier, OrchestrationMetricsService metricsService) {
        return new LlmTaskPlanner(commandClassifier, metricsService);
    }

    @Bean
    public CommandDispatcher commandDispatcher(JsonProcessingService jsonProcessingService,
                                               ProfileService profileService,
                                               WalletService walletService,
                                               TokenService tokenService) {
        return new CommandDispatcher(jsonProcessingService)
                .register(Command.GET_PROFILE, LABEL_PROFILE, userId -> profileService.getProfile()
                        .orElseThrow(() -> new IllegalStateException("No profile configured")))
                .register(Command.GET_WALLET, LABEL_WALLET, userId -> walletService.getWalletInfo()
                        .orElseThrow(() -> new IllegalStateException("No wallet registered")))
                .register(Command.QUERY_ROLE_DATA, LABEL_ROLE_DATA, userId -> profileService.getRoleData()
                        .orElseThrow(() -> new IllegalStateException("Role data is not available")))
                .register(Command.QUERY_SKILL_DETAILS, LABEL_SKILL_DETAILS, userId -> profileService.getSkillDetails()
                        .orElseThrow(() -> new IllegalStateException("Role data is not available")))
                .register(Command.GET_TOKENS, LABEL_TOKENS, userId -> tokenService.getWalletTokenBalances())
                .register(Command.GET_TOKENS_SUMMARY, LABEL_TOKENS_SUMMARY, userId -> tokenService.getWalletTokensSummary());
    }

    @Bean
    public TaskExecutor planTaskExecutor(CommandDispatcher commandDispatcher, EventBus eventBus,
                                         OrchestrationMetricsService metricsService) {
        return new TaskExecutor(commandDispatcher, eventBus, metricsService);
    }

    @Bean
    public FabricationGuard fabricationGuard(AgentProperties properties) {
        return new FabricationGuard(properties.getFabricationGuard().getPatterns());
    }

    @Bean
    public ResponseSynthesizer responseSynthesizer(CompletionProvider completionProvider,
                                                   FabricationGuard fabricationGuard,
                                                   CommandMarkerParser commandMarkerParser,
                                                   OrchestrationMetricsService metricsService,
                                                   AgentProperties properties) {
        return new ResponseSynthesizer(completionProvider, fabricationGuard, commandMarkerParser, metricsService,
                properties.getPlanner().getMaxActionabilityAttempts());
    }
}
