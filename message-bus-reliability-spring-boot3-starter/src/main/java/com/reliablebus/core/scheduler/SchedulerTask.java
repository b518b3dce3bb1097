package com.reliablebus.core.scheduler;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的调度循环任务
 * 停机时用于从时间轮返回的未触发 Timeout 中识别本调度器挂入的任务
 */
public class SchedulerTask implements TimerTask {

    private final String owner;

    /** 真正要执行的逻辑 */
    private final Runnable actual;

    public SchedulerTask(String owner, Runnable actual) {
        this.owner = owner;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) {
        if (timeout.isCancelled()) {
            return;
        }
        actual.run();
    }

    public String getOwner() {
        return owner;
    }
}
