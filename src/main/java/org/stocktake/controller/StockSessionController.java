package org.stocktake.controller;

import lombok.extern.slf4j.Slf4j;
import org.stocktake.business.StockSessionEngine;
import org.stocktake.domain.DecisionOptions;
import org.stocktake.domain.UpdateMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 盘点会话控制器
 *
 * API规范：
 * - POST /api/stock-session/start - 开始盘点（同区域进行中时返回当前会话）
 * - POST /api/stock-session/pause - 暂停
 * - POST /api/stock-session/resume - 恢复暂停的会话
 * - POST /api/stock-session/complete - 完成并返回汇总
 * - POST /api/stock-session/abandon - 放弃当前会话
 * - POST /api/stock-session/abandon-paused - 放弃某区域暂停的会话
 * - GET  /api/stock-session/current - 当前会话视图
 * - POST /api/stock-session/next | previous | go-to | skip - 导航
 * - POST /api/stock-session/decision - 记录盘点数量
 * - POST /api/stock-session/edit-quantity - 完成前修改数量
 * - GET  /api/stock-session/summary/preview - 预览汇总
 * - POST /api/stock-session/prefetch - 预取区域条目（离线准备）
 */
@Slf4j
@RestController
@RequestMapping("/api/stock-session")
public class StockSessionController {

    private final StockSessionEngine stockSessionEngine;

    public StockSessionController(StockSessionEngine stockSessionEngine) {
        this.stockSessionEngine = stockSessionEngine;
    }

    /**
     * 开始盘点
     *
     * 请求体：
     * {
     *     "areaId": "walk-in-cooler",
     *     "scanMethod": "QR"
     * }
     */
    @PostMapping("/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody StartSessionRequest request) {
        if (request == null || !StringUtils.hasText(request.getAreaId())) {
            return ApiResponses.paramError("areaId不能为空");
        }
        log.info("[开始盘点请求] areaId={}, scanMethod={}", request.getAreaId(), request.getScanMethod());
        return ApiResponses.execute("开始盘点",
                () -> stockSessionEngine.startSession(request.getAreaId(), request.getScanMethod()));
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause(@RequestParam(required = false) String returnLocationId) {
        return ApiResponses.execute("暂停盘点", () -> stockSessionEngine.pauseSession(returnLocationId));
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resume(@RequestParam String areaId) {
        if (!StringUtils.hasText(areaId)) {
            return ApiResponses.paramError("areaId不能为空");
        }
        return ApiResponses.execute("恢复盘点", () -> stockSessionEngine.resumeSession(areaId));
    }

    @PostMapping("/complete")
    public ResponseEntity<Map<String, Object>> complete() {
        return ApiResponses.execute("完成盘点", stockSessionEngine::completeSession);
    }

    @PostMapping("/abandon")
    public ResponseEntity<Map<String, Object>> abandon() {
        return ApiResponses.execute("放弃盘点", () -> {
            stockSessionEngine.abandonSession();
            return null;
        });
    }

    @PostMapping("/abandon-paused")
    public ResponseEntity<Map<String, Object>> abandonPaused(@RequestParam String areaId) {
        if (!StringUtils.hasText(areaId)) {
            return ApiResponses.paramError("areaId不能为空");
        }
        return ApiResponses.execute("放弃暂停的盘点", () -> {
            stockSessionEngine.abandonPausedSession(areaId);
            return null;
        });
    }

    /**
     * 当前会话视图；没有进行中的会话时 data 为空
     */
    @GetMapping("/current")
    public ResponseEntity<Map<String, Object>> current() {
        return ApiResponses.execute("查询当前会话", () -> stockSessionEngine.currentView().orElse(null));
    }

    // ==================== 导航 ====================

    @PostMapping("/next")
    public ResponseEntity<Map<String, Object>> next() {
        return ApiResponses.execute("下一个条目", () -> navigation(stockSessionEngine.next()));
    }

    /**
     * moved=false 表示已经在第一个条目
     */
    @PostMapping("/previous")
    public ResponseEntity<Map<String, Object>> previous() {
        return ApiResponses.execute("上一个条目", () -> navigation(stockSessionEngine.previous()));
    }

    @PostMapping("/go-to")
    public ResponseEntity<Map<String, Object>> goTo(@RequestParam int index) {
        return ApiResponses.execute("跳转条目", () -> navigation(stockSessionEngine.goToItem(index)));
    }

    @PostMapping("/skip")
    public ResponseEntity<Map<String, Object>> skip(@RequestParam(required = false) String areaItemId) {
        if (StringUtils.hasText(areaItemId)) {
            return ApiResponses.execute("跳过条目", () -> stockSessionEngine.skipItem(areaItemId));
        }
        return ApiResponses.execute("跳过条目", stockSessionEngine::skipCurrentItem);
    }

    // ==================== 数量 ====================

    /**
     * 记录盘点数量
     *
     * 请求体：
     * {
     *     "areaItemId": "item-1",
     *     "quantity": 12.5,
     *     "method": "MANUAL",
     *     "note": "货架后方还有一箱",
     *     "photoUri": "file:///sdcard/DCIM/shelf.jpg"
     * }
     *
     * 离线或上传失败时照片不会保存，warnings 中给出提示
     */
    @PostMapping("/decision")
    public ResponseEntity<Map<String, Object>> decision(@RequestBody DecisionRequest request) {
        if (request == null || !StringUtils.hasText(request.getAreaItemId())) {
            return ApiResponses.paramError("areaItemId不能为空");
        }
        DecisionOptions options = DecisionOptions.builder()
                .note(request.getNote())
                .photoUri(request.getPhotoUri())
                .build();
        return ApiResponses.execute("记录数量", () -> stockSessionEngine.recordDecision(
                request.getAreaItemId(), request.getQuantity(), request.getMethod(), options));
    }

    @PostMapping("/edit-quantity")
    public ResponseEntity<Map<String, Object>> editQuantity(@RequestBody EditQuantityRequest request) {
        if (request == null || !StringUtils.hasText(request.getAreaItemId())) {
            return ApiResponses.paramError("areaItemId不能为空");
        }
        return ApiResponses.execute("修改数量",
                () -> stockSessionEngine.setSessionItemQuantity(request.getAreaItemId(), request.getQuantity()));
    }

    @GetMapping("/summary/preview")
    public ResponseEntity<Map<String, Object>> previewSummary() {
        return ApiResponses.execute("预览汇总", stockSessionEngine::previewSummary);
    }

    /**
     * 预取区域条目：POST /api/stock-session/prefetch?areaIds=a1,a2
     */
    @PostMapping("/prefetch")
    public ResponseEntity<Map<String, Object>> prefetch(@RequestParam List<String> areaIds) {
        log.info("[预取区域请求] areaIds={}", areaIds);
        return ApiResponses.execute("预取区域条目", () -> {
            Map<String, Object> data = new HashMap<>();
            data.put("requested", areaIds.size());
            data.put("cached", stockSessionEngine.prefetchAreaItems(areaIds));
            return data;
        });
    }

    private Map<String, Object> navigation(boolean moved) {
        Map<String, Object> data = new HashMap<>();
        data.put("moved", moved);
        data.put("session", stockSessionEngine.currentView().orElse(null));
        return data;
    }

    // ==================== 内部请求类 ====================

    /**
     * 开始盘点请求
     */
    public static class StartSessionRequest {
        private String areaId;
        private UpdateMethod scanMethod;

        public StartSessionRequest() {}

        public String getAreaId() { return areaId; }
        public void setAreaId(String areaId) { this.areaId = areaId; }

        public UpdateMethod getScanMethod() { return scanMethod; }
        public void setScanMethod(UpdateMethod scanMethod) { this.scanMethod = scanMethod; }
    }

    /**
     * 记录数量请求
     */
    public static class DecisionRequest {
        private String areaItemId;
        private BigDecimal quantity;
        private UpdateMethod method;
        private String note;
        private String photoUri;

        public DecisionRequest() {}

        public String getAreaItemId() { return areaItemId; }
        public void setAreaItemId(String areaItemId) { this.areaItemId = areaItemId; }

        public BigDecimal getQuantity() { return quantity; }
        public void setQuantity(BigDecimal quantity) { this.quantity = quantity; }

        public UpdateMethod getMethod() { return method; }
        public void setMethod(UpdateMethod method) { this.method = method; }

        public String getNote() { return note; }
        public void setNote(String note) { this.note = note; }

        public String getPhotoUri() { return photoUri; }
        public void setPhotoUri(String photoUri) { this.photoUri = photoUri; }
    }

    /**
     * 修改数量请求
     */
    public static class EditQuantityRequest {
        private String areaItemId;
        private BigDecimal quantity;

        public EditQuantityRequest() {}

        public String getAreaItemId() { return areaItemId; }
        public void setAreaItemId(String areaItemId) { this.areaItemId = areaItemId; }

        public BigDecimal getQuantity() { return quantity; }
        public void setQuantity(BigDecimal quantity) { this.quantity = quantity; }
    }
}
