package com.reliablebus.core.guard;

import com.reliablebus.config.BrokerGuardProperties;
import com.reliablebus.core.failure.BrokerErrorTranslator;
import com.reliablebus.core.notify.NotifyingFacade;
import com.reliablebus.exception.BusException;
import com.reliablebus.exception.guard.CircuitOpenException;
import com.reliablebus.model.CircuitBreakerState;
import com.reliablebus.model.enums.ErrorKind;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * broker 调用统一入口
 * 按仓储名缓存熔断器, 熔断打开时不触达 broker; 异常统一翻译为 BusException
 */
public class BrokerGuard {

    private final BrokerGuardProperties props;

    private final BrokerErrorTranslator translator;

    private final NotifyingFacade notifier;

    private final String instanceId;

    private final Clock clock;

    private final ConcurrentHashMap<String, BrokerCircuitBreaker> cbCache = new ConcurrentHashMap<>();

    public BrokerGuard(BrokerGuardProperties props, BrokerErrorTranslator translator) {
        this(props, translator, NotifyingFacade.noop(), "local", Clock.systemUTC());
    }

    public BrokerGuard(BrokerGuardProperties props, BrokerErrorTranslator translator,
                       NotifyingFacade notifier, String instanceId, Clock clock) {
        this.props = props;
        this.translator = translator;
        this.notifier = notifier;
        this.instanceId = instanceId;
        this.clock = clock;
    }

    /**
     * 执行受保护的 broker 调用
     *
     * @param repository 仓储名, 决定使用哪个熔断器
     * @param operation  操作名, 用于异常信息
     */
    public <T> T call(String repository, String operation, Callable<T> call) {
        BrokerCircuitBreaker cb = breaker(repository);
        if (cb.isOpen()) {
            throw new CircuitOpenException(repository);
        }
        T result;
        try {
            result = call.call();
        } catch (Exception e) {
            BusException be = translator.translate(e, operation);
            if (be.getKind() == ErrorKind.VALIDATION_ERROR) {
                // broker 正常响应, 不计入熔断
                cb.releasePermission();
            } else {
                cb.recordFailure(e);
            }
            throw be;
        }
        cb.recordSuccess();
        return result;
    }

    public BrokerCircuitBreaker breaker(String repository) {
        return cbCache.computeIfAbsent(repository, this::buildCb);
    }

    public CircuitBreakerState state(String repository) {
        return breaker(repository).state();
    }

    private BrokerCircuitBreaker buildCb(String repository) {
        Map<String, BrokerGuardProperties.CbConfig> per = props.getCbPerRepository();
        BrokerGuardProperties.CbConfig c = per != null && per.get(repository) != null
                ? per.get(repository) : props.getCircuitBreaker();
        return new BrokerCircuitBreaker(repository, c.getFailureThreshold(), c.getResetTimeout(),
                notifier, instanceId, clock);
    }
}
