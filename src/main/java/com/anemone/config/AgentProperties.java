package com.anemone.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "anemone")
public class AgentProperties {

    private AiProvider aiProvider = AiProvider.OPENAI;
    private OpenAIConfig openai = new OpenAIConfig();
    private PlannerConfig planner = new PlannerConfig();
    private ProcessingConfig processing = new ProcessingConfig();
    private ChainConfig chain = new ChainConfig();
    private FabricationGuardConfig fabricationGuard = new FabricationGuardConfig();

    public enum AiProvider {
        GOOGLE, OPENAI
    }

    public enum PlannerMode {
        STRUCTURED, FREE_TEXT
    }

    public enum ClassifierType {
        LLM, KEYWORD
    }

    public static class OpenAIConfig {
        private String model = "gpt-4o";

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class PlannerConfig {
        private PlannerMode mode = PlannerMode.STRUCTURED;
        private ClassifierType classifier = ClassifierType.LLM;
        private int historyRounds = 3;
        private int maxActionabilityAttempts = 3;

        public PlannerMode getMode() {
            return mode;
        }

        public void setMode(PlannerMode mode) {
            if (mode == null) {
                return;
            }
            this.mode = mode;
        }

        public ClassifierType getClassifier() {
            return classifier;
        }

        public void setClassifier(ClassifierType classifier) {
            if (classifier == null) {
                return;
            }
            this.classifier = classifier;
        }

        public int getHistoryRounds() {
            return historyRounds;
        }

        public void setHistoryRounds(int historyRounds) {
            this.historyRounds = historyRounds;
        }

        public int getMaxActionabilityAttempts() {
            return maxActionabilityAttempts;
        }

        public void setMaxActionabilityAttempts(int maxActionabilityAttempts) {
            this.maxActionabilityAttempts = maxActionabilityAttempts > 0 ? maxActionabilityAttempts : 1;
        }
    }

    public static class ProcessingConfig {
        private Duration waitTimeout = Duration.ofSeconds(60);
        private Duration retention = Duration.ofMinutes(30);

        public Duration getWaitTimeout() {
            return waitTimeout;
        }

        public void setWaitTimeout(Duration waitTimeout) {
            this.waitTimeout = waitTimeout;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }

    public static class ChainConfig {
        private String suiRpcUrl = "https://fullnode.devnet.sui.io:443";
        private String blockberryBaseUrl = "https://api.blockberry.one";
        private String blockberryApiKey;

        public String getSuiRpcUrl() { return suiRpcUrl; }
        public void setSuiRpcUrl(String suiRpcUrl) { this.suiRpcUrl = suiRpcUrl; }
        public String getBlockberryBaseUrl() { return blockberryBaseUrl; }
        public void setBlockberryBaseUrl(String blockberryBaseUrl) { this.blockberryBaseUrl = blockberryBaseUrl; }
        public String getBlockberryApiKey() { return blockberryApiKey; }
        public void setBlockberryApiKey(String blockberryApiKey) { this.blockberryApiKey = blockberryApiKey; }
    }

    public static class FabricationGuardConfig {
        private List<String> patterns = new ArrayList<>(List.of(
                "(?i)(balance|health|余额|健康)[^\\n]{0,40}?\\d",
                "(?i)\\d[\\d,.]*\\s*(sui|usdc?|美元)"));

        public List<String> getPatterns() {
            return patterns;
        }

        public void setPatterns(List<String> patterns) {
            if (patterns == null || patterns.isEmpty()) {
                return;
            }
            this.patterns = new ArrayList<>(patterns);
        }
    }

    public AiProvider getAiProvider() {
        return aiProvider;
    }

    public void setAiProvider(AiProvider aiProvider) {
        this.aiProvider = aiProvider;
    }

    public OpenAIConfig getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAIConfig openai) {
        this.openai = openai;
    }

    public PlannerConfig getPlanner() {
        return planner;
    }

    public void setPlanner(PlannerConfig planner) {
        this.planner = planner != null ? planner : new PlannerConfig();
    }

    public ProcessingConfig getProcessing() {
        return processing;
    }

    public void setProcessing(ProcessingConfig processing) {
        this.processing = processing != null ? processing : new ProcessingConfig();
    }

    public ChainConfig getChain() {
        return chain;
    }

    public void setChain(ChainConfig chain) {
        this.chain = chain != null ? chain : new ChainConfig();
    }

    public FabricationGuardConfig getFabricationGuard() {
        return fabricationGuard;
    }

    public void setFabricationGuard(FabricationGuardConfig fabricationGuard) {
        this.fabricationGuard = fabricationGuard != null ? fabricationGuard : new FabricationGuardConfig();
    }
}
