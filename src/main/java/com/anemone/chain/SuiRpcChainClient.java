package com.anemone.chain;

import com.anemone.config.AgentProperties;
import com.anemone.orchestration.api.ChainClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reads role and skill objects through the Sui JSON-RPC {@code sui_getObject} method.
 */
@Component
@Slf4j
public class SuiRpcChainClient implements ChainClient {

    private final RestClient restClient;
    private final AtomicLong requestIds = new AtomicLong();

    public SuiRpcChainClient(RestClient.Builder restClientBuilder, AgentProperties properties) {
        this.restClient = restClientBuilder
                .baseUrl(properties.getChain().getSuiRpcUrl())
                .build();
    }

    @Override
    @Nullable
    public RoleData getRoleData(String roleId) {
        JsonNode fields = fetchObjectFields(roleId);
        if (fields == null) {
            return null;
        }
        List<String> skills = new ArrayList<>();
        fields.path("skills").forEach(skill -> skills.add(idText(skill)));
        return new RoleData(
                idText(fields.path("id")),
                text(fields, "bot_nft_id"),
                u64(fields.path("health")),
                fields.path("is_active").asBoolean(false),
                fields.path("is_locked").asBoolean(false),
                u64(fields.path("last_epoch")),
                u64(fields.path("inactive_epochs")),
                u64(fields.path("balance")),
                text(fields, "bot_address"),
                skills,
                text(fields, "app_id"));
    }

    @Override
    @Nullable
    public SkillDetails getSkillDetails(String skillId) {
        JsonNode fields = fetchObjectFields(skillId);
        if (fields == null) {
            return null;
        }
        return new SkillDetails(
                idText(fields.path("id")),
                text(fields, "name"),
                text(fields, "description"),
                u64(fields.path("fee")),
                fields.path("is_enabled").asBoolean(false),
                text(fields, "author"));
    }

    @Nullable
    private JsonNode fetchObjectFields(String objectId) {
        Map<String, Object> request = Map.of(
                "jsonrpc", "2.0",
                "id", requestIds.incrementAndGet(),
                "method", "sui_getObject",
                "params", List.of(objectId, Map.of("showContent", true)));
        JsonNode response;
        try {
            response = restClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            log.warn("sui_getObject failed for {}: {}", objectId, ex.getMessage());
            return null;
        }
        if (response == null) {
            return null;
        }
        if (response.hasNonNull("error")) {
            log.warn("sui_getObject returned an error for {}: {}", objectId, response.get("error"));
            return null;
        }
        JsonNode fields = response.path("result").path("data").path("content").path("fields");
        if (fields.isMissingNode() || !fields.isObject()) {
            log.info("Object {} has no readable content.", objectId);
            return null;
        }
        return fields;
    }

    // u64 values arrive as JSON strings; Balance<T> arrives as a struct with a value field
    static BigInteger u64(JsonNode node) {
        if (node.isObject()) {
            JsonNode value = node.path("fields").path("value");
            return value.isMissingNode() ? BigInteger.ZERO : u64(value);
        }
        if (node.isNumber()) {
            return node.bigIntegerValue();
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            return new BigInteger(node.asText().trim());
        }
        return BigInteger.ZERO;
    }

    private static String idText(JsonNode node) {
        if (node.isObject()) {
            return node.path("id").asText(null);
        }
        return node.asText(null);
    }

    @Nullable
    private static String text(JsonNode fields, String name) {
        JsonNode node = fields.path(name);
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
