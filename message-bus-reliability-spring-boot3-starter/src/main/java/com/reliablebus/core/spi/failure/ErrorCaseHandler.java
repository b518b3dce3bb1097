package com.reliablebus.core.spi.failure;

import com.reliablebus.model.enums.ErrorKind;

/**
 * 异常翻译 SPI: 把 broker 异常映射为规范错误类型
 */
public interface ErrorCaseHandler<E extends Throwable> {

    /**
     * 返回能够处理的异常类型
     */
    Class<E> exceptionType();

    /** 是否匹配 */
    default boolean supports(Throwable t) {
        return exceptionType().isInstance(t);
    }

    ErrorKind translate(E ex);
}
