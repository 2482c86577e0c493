package org.stocktake.controller;

import lombok.extern.slf4j.Slf4j;
import org.stocktake.exception.AreaItemsUnavailableException;
import org.stocktake.exception.IllegalSessionStateException;
import org.stocktake.exception.IncompleteDecisionsException;
import org.stocktake.exception.ItemNotFoundException;
import org.stocktake.exception.NoPausedSessionException;
import org.stocktake.exception.SessionConflictException;
import org.stocktake.exception.StockSessionException;
import org.stocktake.util.TraceIdUtil;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 统一响应：{code, message, traceId, data}
 */
@Slf4j
final class ApiResponses {

    private ApiResponses() {
    }

    static ResponseEntity<Map<String, Object>> execute(String action, Supplier<Object> command) {
        // ✅ TraceId 由 Filter 自动设置
        String traceId = TraceIdUtil.getTraceId();

        Map<String, Object> response = new HashMap<>();
        response.put("traceId", traceId);

        try {
            Object data = command.get();
            response.put("code", "SUCCESS");
            response.put("message", action + "成功");
            if (data != null) {
                response.put("data", data);
            }
            return ResponseEntity.ok(response);

        } catch (StockSessionException e) {
            log.warn("[{}失败] code={}, errorMsg={}, traceId={}", action, e.getErrorCode(), e.getMessage(), traceId);
            response.put("code", e.getErrorCode());
            response.put("message", e.getMessage());
            if (e instanceof IncompleteDecisionsException) {
                IncompleteDecisionsException incomplete = (IncompleteDecisionsException) e;
                response.put("unresolvedItemIds", incomplete.getUnresolvedItemIds());
                response.put("unresolvedItemNames", incomplete.getUnresolvedItemNames());
            } else if (e instanceof SessionConflictException) {
                response.put("existingSessionId", ((SessionConflictException) e).getExistingSessionId());
            }
            return ResponseEntity.status(statusOf(e)).body(response);

        } catch (Exception e) {
            log.error("[{}异常] errorMsg={}, traceId={}", action, e.getMessage(), traceId, e);
            response.put("code", "ERROR");
            response.put("message", "系统异常：" + e.getMessage());
            return ResponseEntity.status(500).body(response);
        }
    }

    static ResponseEntity<Map<String, Object>> paramError(String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("traceId", TraceIdUtil.getTraceId());
        response.put("code", "PARAM_ERROR");
        response.put("message", message);
        return ResponseEntity.badRequest().body(response);
    }

    private static HttpStatus statusOf(StockSessionException e) {
        if (e instanceof ItemNotFoundException || e instanceof NoPausedSessionException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof SessionConflictException
                || e instanceof IllegalSessionStateException
                || e instanceof IncompleteDecisionsException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof AreaItemsUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.BAD_REQUEST;
    }
}
