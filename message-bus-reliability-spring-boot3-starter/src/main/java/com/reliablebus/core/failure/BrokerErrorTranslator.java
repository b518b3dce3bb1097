package com.reliablebus.core.failure;

import com.reliablebus.core.failure.handler.BrokerIoCaseHandler;
import com.reliablebus.core.failure.handler.BusExceptionCaseHandler;
import com.reliablebus.core.failure.handler.OpenCircuitCaseHandler;
import com.reliablebus.core.failure.handler.SocketTimeoutCaseHandler;
import com.reliablebus.core.failure.handler.TimeoutCaseHandler;
import com.reliablebus.core.failure.handler.UnknownTopicCaseHandler;
import com.reliablebus.core.failure.handler.ValidationCaseHandler;
import com.reliablebus.core.spi.broker.UnknownTopicException;
import com.reliablebus.core.spi.failure.ErrorCaseHandler;
import com.reliablebus.exception.BrokerTimeoutException;
import com.reliablebus.exception.BrokerUnavailableException;
import com.reliablebus.exception.BusException;
import com.reliablebus.exception.TopicNotFoundException;
import com.reliablebus.model.enums.ErrorKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 异常翻译器
 * 沿 cause 链逐级匹配, 同一层级选择离异常类最近的处理器; 均未匹配时为 UNKNOWN
 */
public class BrokerErrorTranslator {

    private final List<ErrorCaseHandler<?>> handlers;

    public BrokerErrorTranslator() {
        this(List.of());
    }

    /**
     * @param extra 额外处理器（如 broker 专有异常）, 与内置处理器一起参与最近匹配
     */
    public BrokerErrorTranslator(List<ErrorCaseHandler<?>> extra) {
        List<ErrorCaseHandler<?>> all = new ArrayList<>(extra == null ? List.of() : extra);
        all.add(new BusExceptionCaseHandler());
        all.add(new TimeoutCaseHandler());
        all.add(new SocketTimeoutCaseHandler());
        all.add(new BrokerIoCaseHandler());
        all.add(new UnknownTopicCaseHandler());
        all.add(new OpenCircuitCaseHandler());
        all.add(new ValidationCaseHandler());
        this.handlers = List.copyOf(all);
    }

    /**
     * 解析错误类型
     */
    public ErrorKind kindOf(Throwable t) {
        // 先本体, 再逐级 cause
        for (Throwable e = t; e != null; e = e.getCause()) {
            ErrorCaseHandler<?> matched = findBestHandler(e);
            if (matched != null) {
                return safeCall(matched, e);
            }
            if (e.getCause() == e) {
                break;
            }
        }
        return ErrorKind.UNKNOWN;
    }

    /**
     * 翻译为 BusException, 原始异常保留为 cause
     */
    public BusException translate(Throwable t, String operation) {
        if (t instanceof BusException) {
            return (BusException) t;
        }
        ErrorKind kind = kindOf(t);
        String msg = operation + " failed: " + t;
        switch (kind) {
            case BROKER_UNAVAILABLE:
                return new BrokerUnavailableException(msg, t);
            case TOPIC_NOT_FOUND:
                return new TopicNotFoundException(findTopic(t), t);
            case TIMEOUT:
                return new BrokerTimeoutException(msg, t);
            case VALIDATION_ERROR:
            case CIRCUIT_OPEN:
            case UNKNOWN:
                return new BusException(kind, msg, t);
            default:
                throw new IllegalStateException("unhandled kind " + kind);
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private ErrorKind safeCall(ErrorCaseHandler h, Throwable e) {
        ErrorKind kind = h.translate(e);
        return kind == null ? ErrorKind.UNKNOWN : kind;
    }

    private ErrorCaseHandler<?> findBestHandler(Throwable e) {
        return handlers.stream()
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // from 向上继承到 to 的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }

    private static String findTopic(Throwable t) {
        for (Throwable e = t; e != null; e = e.getCause()) {
            if (e instanceof UnknownTopicException) {
                return ((UnknownTopicException) e).getTopic();
            }
            if (e instanceof TopicNotFoundException) {
                return ((TopicNotFoundException) e).getTopic();
            }
            if (e.getCause() == e) {
                break;
            }
        }
        return null;
    }
}
