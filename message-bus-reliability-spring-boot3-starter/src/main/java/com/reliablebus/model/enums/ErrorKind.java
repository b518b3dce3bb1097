package com.reliablebus.model.enums;

/**
 * 规范化错误类型
 * 仓储边界之外只出现这几类, broker 私有异常一律翻译
 */
public enum ErrorKind {

    /** 参数/消息校验失败, 默认不重试 */
    VALIDATION_ERROR,

    /** broker 不可用（连接失败、IO 异常等） */
    BROKER_UNAVAILABLE,

    /** topic 不存在 */
    TOPIC_NOT_FOUND,

    /** 调用超时 */
    TIMEOUT,

    /** 熔断打开, 未触达 broker */
    CIRCUIT_OPEN,

    /** 兜底 */
    UNKNOWN;

    /**
     * 默认可重试判定, 未配置 retryableErrors 时使用
     */
    public boolean isRetryableByDefault() {
        return switch (this) {
            case VALIDATION_ERROR -> false;
            case BROKER_UNAVAILABLE, TOPIC_NOT_FOUND, TIMEOUT, CIRCUIT_OPEN, UNKNOWN -> true;
        };
    }
}
