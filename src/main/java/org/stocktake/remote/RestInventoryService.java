package org.stocktake.remote;

import lombok.extern.slf4j.Slf4j;
import org.stocktake.domain.AreaItem;
import org.stocktake.domain.SessionItemUpdate;
import org.stocktake.domain.UpdateMethod;
import org.stocktake.exception.RemoteServiceException;
import org.stocktake.util.TraceIdUtil;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 HTTP 的远端库存服务
 *
 * 接口约定：
 * - GET  /areas/{areaId}/items
 * - POST /area-items/{areaItemId}/stock-updates
 * - POST /sessions/{sessionId}/commit
 *
 * 2xx 即视为确认，其余情况统一转换为 RemoteServiceException
 */
@Slf4j
public class RestInventoryService implements InventoryService {

    private static final String TRACE_ID_HEADER = "X-Trace-Id";

    private final RestClient restClient;

    public RestInventoryService(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public List<AreaItem> fetchAreaItems(String areaId) {
        try {
            AreaItem[] items = restClient.get()
                    .uri("/areas/{areaId}/items", areaId)
                    .accept(MediaType.APPLICATION_JSON)
                    .headers(this::addTraceHeader)
                    .retrieve()
                    .body(AreaItem[].class);
            List<AreaItem> result = items == null ? List.of() : Arrays.asList(items);
            log.debug("[拉取区域条目] areaId={}, count={}", areaId, result.size());
            return result;
        } catch (RestClientException e) {
            throw new RemoteServiceException("拉取区域条目失败，areaId=" + areaId, e);
        }
    }

    @Override
    public void persistItemUpdate(String areaItemId, BigDecimal quantity, UpdateMethod method,
                                  String note, String photoUrl) {
        Map<String, Object> body = new HashMap<>();
        body.put("quantity", quantity);
        body.put("method", method);
        body.put("note", note);
        body.put("photoUrl", photoUrl);
        try {
            restClient.post()
                    .uri("/area-items/{areaItemId}/stock-updates", areaItemId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(this::addTraceHeader)
                    .body(body)
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new RemoteServiceException("写入条目数量失败，areaItemId=" + areaItemId, e);
        }
    }

    @Override
    public void commitSession(String sessionId, List<SessionItemUpdate> updates) {
        try {
            restClient.post()
                    .uri("/sessions/{sessionId}/commit", sessionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(this::addTraceHeader)
                    .body(Map.of("updates", updates))
                    .retrieve()
                    .toBodilessEntity();
        } catch (RestClientException e) {
            throw new RemoteServiceException("提交盘点会话失败，sessionId=" + sessionId, e);
        }
    }

    private void addTraceHeader(HttpHeaders headers) {
        String traceId = TraceIdUtil.getTraceId();
        if (traceId != null) {
            headers.add(TRACE_ID_HEADER, traceId);
        }
    }
}
