package com.quotapool.client.transport;

import com.quotapool.client.config.ClientProperties;
import com.quotapool.common.dto.FailureKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * 远程 API 的 HTTP 传输层，一次调用对应一个 GET 请求。
 * <p>
 * 失败统一抛出 {@link RemoteApiException}：HTTP 错误交给 {@link ApiErrorMapper} 分类，
 * 网络层异常（超时、连接失败）与 Key 无关，归为 {@link FailureKind#NON_RETRYABLE}。
 * URL 中带有 Key，日志里只打印 path。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteApiClient {

    private final OkHttpClient apiHttpClient;
    private final ClientProperties properties;
    private final ApiErrorMapper errorMapper;

    /**
     * 发送 GET 请求并返回响应体文本。
     *
     * @param path   相对 baseUrl 的路径，如 "/channels"
     * @param params 查询参数（不含 Key）
     * @param apiKey 本次使用的 API Key
     */
    public String get(String path, Map<String, String> params, String apiKey) {
        HttpUrl base = HttpUrl.parse(properties.getBaseUrl() + path);
        if (base == null) {
            throw new IllegalArgumentException("非法的 API 地址: " + properties.getBaseUrl() + path);
        }
        HttpUrl.Builder url = base.newBuilder();
        params.forEach(url::addQueryParameter);
        url.addQueryParameter(properties.getKeyParam(), apiKey);

        Request request = new Request.Builder()
                .url(url.build())
                .get()
                .build();

        try (Response response = apiHttpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";

            if (!response.isSuccessful()) {
                RemoteApiException error = errorMapper.map(response.code(), body);
                log.warn("API 调用失败: GET {} -> {} [{}] {}", path, response.code(),
                        error.getKind(), error.getReason());
                throw error;
            }

            log.debug("API 调用成功: GET {}, 响应长度 {} 字符", path, body.length());
            return body;
        } catch (IOException e) {
            log.warn("API 网络请求失败: GET {} - {}", path, e.getMessage());
            throw new RemoteApiException(FailureKind.NON_RETRYABLE, 0, null,
                    "网络请求失败: " + e.getMessage(), e);
        }
    }
}
