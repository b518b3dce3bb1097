package com.reliablebus.core.spi;

import com.reliablebus.model.Message;

/**
 * 重试回调, 到期时由调度器在处理线程池中调用
 */
@FunctionalInterface
public interface RetryCallback {

    /**
     * @return true 投递成功; false 或抛出异常视为失败
     */
    boolean attempt(Message message) throws Exception;
}
