package com.quotapool.client.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotapool.client.transport.RemoteApiClient;
import com.quotapool.common.exception.QuotaPoolException;
import com.quotapool.dispatcher.service.RequestExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 带配额管理的 API 客户端：每次调用由 {@link RequestExecutor} 选 Key、计费、换 Key 重试。
 * <p>
 * 上层业务（频道轮询等）只需声明调用成本，Key 轮换对其不可见。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaAwareApiClient {

    private final RequestExecutor requestExecutor;
    private final RemoteApiClient remoteApiClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * 发送一次 GET 请求，成功后计入 {@code cost} 个配额单位。
     */
    public JsonNode get(String path, Map<String, String> params, long cost) {
        String body = requestExecutor.execute(apiKey -> remoteApiClient.get(path, params, apiKey), cost);
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            // 已成功计费，解析失败不影响配额记录
            throw new QuotaPoolException("BAD_RESPONSE", "API 响应不是合法 JSON: " + path, e);
        }
    }
}
