package com.quotapool.client.transport;

import com.quotapool.common.dto.FailureKind;
import com.quotapool.common.exception.ClassifiedFailureException;

/**
 * 远程 API 调用失败，已按 HTTP 状态码和 API 返回的 reason 完成分类。
 */
public class RemoteApiException extends ClassifiedFailureException {

    /** HTTP 状态码，网络层失败时为 0 */
    private final int status;

    /** API 返回的错误 reason，可能为空 */
    private final String reason;

    public RemoteApiException(FailureKind kind, int status, String reason, String message) {
        super(kind, message);
        this.status = status;
        this.reason = reason;
    }

    public RemoteApiException(FailureKind kind, int status, String reason, String message, Throwable cause) {
        super(kind, message, cause);
        this.status = status;
        this.reason = reason;
    }

    public int getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }
}
