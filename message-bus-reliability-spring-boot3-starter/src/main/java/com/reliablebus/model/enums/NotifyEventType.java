package com.reliablebus.model.enums;

/**
 * 通知事件
 */
public enum NotifyEventType {
    /** 进入死信 */
    DEAD_LETTER,

    /** 死信容量已满, 最旧条目被淘汰 */
    DEAD_LETTER_EVICTED,

    /** 不可重试的失败 */
    NON_RETRYABLE_FAILED,

    /** 熔断打开 */
    CIRCUIT_OPENED,

    /** 引擎级异常（调度循环、线程池拒绝等） */
    ENGINE_ERROR
}
