package org.stocktake.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * 追踪ID工具类
 * - 请求线程由 TraceIdFilter 设置
 * - 后台同步线程（网络回调、定时任务）自行生成
 * - 同时写入 MDC，日志格式中以 %X{traceId} 输出
 */
public final class TraceIdUtil {

    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID_HOLDER = new ThreadLocal<>();

    private TraceIdUtil() {
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void setTraceId(String traceId) {
        TRACE_ID_HOLDER.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }

    /**
     * 获取当前追踪ID，未设置时返回 null
     */
    public static String getTraceId() {
        return TRACE_ID_HOLDER.get();
    }

    /**
     * 当前线程没有追踪ID时生成一个
     *
     * @return true: 本次新生成（调用方负责清除）
     */
    public static boolean ensureTraceId() {
        if (TRACE_ID_HOLDER.get() != null) {
            return false;
        }
        setTraceId(generateTraceId());
        return true;
    }

    public static void clearTraceId() {
        TRACE_ID_HOLDER.remove();
        MDC.remove(MDC_KEY);
    }
}
