package org.stocktake.controller;

import lombok.extern.slf4j.Slf4j;
import org.stocktake.business.PendingUpdateQueue;
import org.stocktake.remote.ManualNetworkMonitor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * 同步控制器
 * - 设备外壳上报网络状态
 * - 查看/手动触发待同步写入
 */
@Slf4j
@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private final PendingUpdateQueue pendingUpdateQueue;
    private final ManualNetworkMonitor networkMonitor;

    public SyncController(PendingUpdateQueue pendingUpdateQueue, ManualNetworkMonitor networkMonitor) {
        this.pendingUpdateQueue = pendingUpdateQueue;
        this.networkMonitor = networkMonitor;
    }

    /**
     * 上报网络状态；从离线变为在线时自动触发同步
     */
    @PostMapping("/network")
    public ResponseEntity<Map<String, Object>> network(@RequestParam boolean online) {
        return ApiResponses.execute("上报网络状态", () -> {
            boolean changed = networkMonitor.report(online);
            Map<String, Object> data = new HashMap<>();
            data.put("online", online);
            data.put("changed", changed);
            data.put("pendingCount", pendingUpdateQueue.pendingCount());
            return data;
        });
    }

    /**
     * 立即在当前线程同步一次
     */
    @PostMapping("/drain")
    public ResponseEntity<Map<String, Object>> drain() {
        return ApiResponses.execute("同步", () -> {
            int synced = pendingUpdateQueue.drain();
            Map<String, Object> data = new HashMap<>();
            data.put("synced", synced);
            data.put("pendingCount", pendingUpdateQueue.pendingCount());
            return data;
        });
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ApiResponses.execute("查询同步状态", () -> {
            Map<String, Object> data = new HashMap<>();
            data.put("online", networkMonitor.isOnline());
            data.put("pendingCount", pendingUpdateQueue.pendingCount());
            data.put("draining", pendingUpdateQueue.isDraining());
            data.put("lastSyncAt", pendingUpdateQueue.lastSyncAt());
            return data;
        });
    }

    @GetMapping("/pending")
    public ResponseEntity<Map<String, Object>> pending() {
        return ApiResponses.execute("查询待同步写入", pendingUpdateQueue::listPending);
    }

    /**
     * 放弃一条待同步写入（不会再发送到远端）
     */
    @DeleteMapping("/pending/{id}")
    public ResponseEntity<Map<String, Object>> abandon(@PathVariable Long id) {
        log.warn("[放弃待同步写入请求] id={}", id);
        return ApiResponses.execute("放弃待同步写入", () -> {
            Map<String, Object> data = new HashMap<>();
            data.put("removed", pendingUpdateQueue.abandon(id));
            data.put("pendingCount", pendingUpdateQueue.pendingCount());
            return data;
        });
    }
}
