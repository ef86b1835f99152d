package com.quotapool.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotapool.common.dto.FailureKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 把 HTTP 错误响应映射为带分类的 {@link RemoteApiException}。
 * <p>
 * 错误体格式：
 * <pre>{@code
 * {"error": {"code": 403, "message": "...",
 *            "errors": [{"reason": "quotaExceeded", "domain": "youtube.quota"}],
 *            "details": [{"reason": "API_KEY_INVALID"}]}}
 * }</pre>
 * 只按 reason 代码和状态码判断，不匹配错误文本。
 */
@Slf4j
@Component
public class ApiErrorMapper {

    static final Set<String> QUOTA_REASONS = Set.of(
            "quotaExceeded", "dailyLimitExceeded", "dailyLimitExceededUnreg");

    static final Set<String> INVALID_KEY_REASONS = Set.of(
            "keyInvalid", "keyExpired", "API_KEY_INVALID", "API_KEY_EXPIRED", "API_KEY_SERVICE_BLOCKED");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public RemoteApiException map(int status, String body) {
        JsonNode error = parseError(body);
        List<String> reasons = extractReasons(error);
        String message = extractMessage(error, status);
        String primaryReason = reasons.isEmpty() ? null : reasons.get(0);

        FailureKind kind = classify(status, reasons);
        String matched = reasons.stream()
                .filter(r -> QUOTA_REASONS.contains(r) || INVALID_KEY_REASONS.contains(r))
                .findFirst()
                .orElse(primaryReason);
        return new RemoteApiException(kind, status, matched, message);
    }

    FailureKind classify(int status, List<String> reasons) {
        if (reasons.stream().anyMatch(QUOTA_REASONS::contains)) {
            return FailureKind.QUOTA_EXCEEDED;
        }
        if (reasons.stream().anyMatch(INVALID_KEY_REASONS::contains)) {
            return FailureKind.CREDENTIAL_INVALID;
        }
        if (status == 403 || status == 429 || status >= 500) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.NON_RETRYABLE;
    }

    private List<String> extractReasons(JsonNode error) {
        List<String> reasons = new ArrayList<>();
        if (error == null) {
            return reasons;
        }
        for (JsonNode item : error.path("errors")) {
            String reason = item.path("reason").asText("");
            if (!reason.isEmpty()) reasons.add(reason);
        }
        for (JsonNode item : error.path("details")) {
            String reason = item.path("reason").asText("");
            if (!reason.isEmpty()) reasons.add(reason);
        }
        return reasons;
    }

    private String extractMessage(JsonNode error, int status) {
        String message = error != null ? error.path("message").asText("") : "";
        return message.isEmpty() ? "API 返回错误: " + status : message;
    }

    private JsonNode parseError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            return error.isObject() ? error : null;
        } catch (Exception e) {
            log.debug("错误响应不是 JSON: {}", e.getMessage());
            return null;
        }
    }
}
