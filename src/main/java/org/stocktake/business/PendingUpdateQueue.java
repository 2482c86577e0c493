package org.stocktake.business;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.stocktake.domain.ItemUpdatePayload;
import org.stocktake.domain.PendingUpdate;
import org.stocktake.domain.PendingUpdateType;
import org.stocktake.domain.SessionCommitPayload;
import org.stocktake.event.PendingCountChangedEvent;
import org.stocktake.exception.StockSessionException;
import org.stocktake.remote.InventoryService;
import org.stocktake.remote.NetworkMonitor;
import org.stocktake.service.IPendingUpdateService;
import org.stocktake.util.TraceIdUtil;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 待同步写入队列
 *
 * 核心规则：
 * 1. 入队先落库，进程重启后不丢失
 * 2. 严格先进先出；队首失败时停止本轮，后面的写入不会越过它
 * 3. 只有远端确认后才出队，每次成功出队长度恰好减一
 * 4. 同一时间只有一轮同步；同步期间再次触发只记一个标记，本轮结束前补跑
 * 5. 网络从离线恢复为在线时自动触发同步
 */
@Slf4j
@Component
public class PendingUpdateQueue {

    private final IPendingUpdateService pendingUpdateService;
    private final InventoryService inventoryService;
    private final NetworkMonitor networkMonitor;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ApplicationEventPublisher eventPublisher;
    private final TaskExecutor syncTaskExecutor;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean followUpRequested = new AtomicBoolean(false);
    private final AtomicInteger pendingCount = new AtomicInteger();
    private volatile LocalDateTime lastSyncAt;

    public PendingUpdateQueue(IPendingUpdateService pendingUpdateService,
                              InventoryService inventoryService,
                              NetworkMonitor networkMonitor,
                              ObjectMapper objectMapper,
                              Clock clock,
                              ApplicationEventPublisher eventPublisher,
                              @Qualifier("syncTaskExecutor") TaskExecutor syncTaskExecutor) {
        this.pendingUpdateService = pendingUpdateService;
        this.inventoryService = inventoryService;
        this.networkMonitor = networkMonitor;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.eventPublisher = eventPublisher;
        this.syncTaskExecutor = syncTaskExecutor;
    }

    @PostConstruct
    public void registerNetworkListener() {
        networkMonitor.addListener(online -> {
            if (online) {
                log.info("[网络恢复，触发同步] pendingCount={}", pendingCount.get());
                requestDrain();
            }
        });
    }

    /**
     * 数据库初始化完成后加载上次遗留的待同步数量
     */
    @EventListener(ApplicationReadyEvent.class)
    public void reloadCount() {
        int count = (int) pendingUpdateService.count();
        pendingCount.set(count);
        publishCount(count);
        log.info("[待同步队列已加载] pendingCount={}", count);
    }

    /**
     * 条目数量写入入队
     * 同一会话同一条目已有未同步写入时原地覆盖（保留 id 和排队位置），远端只需要最终值
     */
    public PendingUpdate enqueueItemUpdate(String sessionId, String areaItemId, ItemUpdatePayload payload) {
        String json = toJson(payload);
        Optional<PendingUpdate> existing = pendingUpdateService.findItemUpdate(sessionId, areaItemId);
        if (existing.isPresent()) {
            PendingUpdate entry = existing.get();
            int revision = entry.getRevision() == null ? 1 : entry.getRevision() + 1;
            boolean updated = pendingUpdateService.lambdaUpdate()
                    .eq(PendingUpdate::getId, entry.getId())
                    .set(PendingUpdate::getPayload, json)
                    .set(PendingUpdate::getRevision, revision)
                    .update();
            if (updated) {
                entry.setPayload(json);
                entry.setRevision(revision);
                log.info("[待同步写入已覆盖] id={}, areaItemId={}, revision={}", entry.getId(), areaItemId, revision);
                return entry;
            }
            // 覆盖前刚好被同步出队，按新写入处理
        }
        return append(PendingUpdateType.ITEM_UPDATE, sessionId, areaItemId, json);
    }

    /**
     * 会话最终提交入队，排在该会话所有条目写入之后
     */
    public PendingUpdate enqueueSessionCommit(String sessionId, SessionCommitPayload payload) {
        return append(PendingUpdateType.SESSION_COMMIT, sessionId, null, toJson(payload));
    }

    /**
     * 在同步线程上触发一次同步（不阻塞调用方）
     */
    public void requestDrain() {
        if (!networkMonitor.isOnline()) {
            log.debug("[离线，暂不同步] pendingCount={}", pendingCount.get());
            return;
        }
        syncTaskExecutor.execute(this::drain);
    }

    /**
     * 同步：从队首开始逐条发送，直到队列为空、发送失败或网络断开
     *
     * @return 本次调用成功同步的条数；已有同步在运行时返回 0
     */
    public int drain() {
        if (!draining.compareAndSet(false, true)) {
            followUpRequested.set(true);
            log.debug("[同步进行中，已登记补跑]");
            return 0;
        }
        boolean generatedTraceId = TraceIdUtil.ensureTraceId();
        int synced = 0;
        try {
            boolean again;
            do {
                followUpRequested.set(false);
                DrainPass pass = drainPass();
                synced += pass.synced();
                again = !pass.failed() && followUpRequested.get();
            } while (again);
        } finally {
            draining.set(false);
            if (generatedTraceId) {
                TraceIdUtil.clearTraceId();
            }
        }
        // 最后一轮结束到释放标记之间到达的触发
        if (followUpRequested.getAndSet(false) && networkMonitor.isOnline()) {
            synced += drain();
        }
        return synced;
    }

    private DrainPass drainPass() {
        int synced = 0;
        while (networkMonitor.isOnline()) {
            PendingUpdate head = pendingUpdateService.peekHead();
            if (head == null) {
                lastSyncAt = LocalDateTime.now(clock);
                break;
            }
            try {
                dispatch(head);
            } catch (Exception e) {
                pendingUpdateService.recordFailure(head.getId(), e.getMessage(), LocalDateTime.now(clock));
                log.warn("[同步失败，停止本轮] id={}, type={}, attempts={}, errorMsg={}",
                        head.getId(), head.getType(), (head.getAttempts() == null ? 0 : head.getAttempts()) + 1,
                        e.getMessage());
                return new DrainPass(synced, true);
            }
            boolean removed = pendingUpdateService.lambdaUpdate()
                    .eq(PendingUpdate::getId, head.getId())
                    .eq(PendingUpdate::getRevision, head.getRevision())
                    .remove();
            if (removed) {
                synced++;
                publishCount(pendingCount.updateAndGet(count -> Math.max(0, count - 1)));
                log.info("[同步成功] id={}, type={}, areaItemId={}, pendingCount={}",
                        head.getId(), head.getType(), head.getAreaItemId(), pendingCount.get());
            } else {
                log.info("[同步期间写入被覆盖，重新发送] id={}, areaItemId={}", head.getId(), head.getAreaItemId());
            }
        }
        return new DrainPass(synced, false);
    }

    private void dispatch(PendingUpdate entry) throws JsonProcessingException {
        if (entry.getType() == PendingUpdateType.ITEM_UPDATE) {
            ItemUpdatePayload payload = objectMapper.readValue(entry.getPayload(), ItemUpdatePayload.class);
            inventoryService.persistItemUpdate(entry.getAreaItemId(), payload.getNewQuantity(),
                    payload.getMethod(), payload.getNote(), payload.getPhotoUrl());
        } else if (entry.getType() == PendingUpdateType.SESSION_COMMIT) {
            SessionCommitPayload payload = objectMapper.readValue(entry.getPayload(), SessionCommitPayload.class);
            inventoryService.commitSession(entry.getSessionId(), payload.getUpdates());
        } else {
            throw new IllegalStateException("未知的写入类型: " + entry.getType());
        }
    }

    /**
     * 显式放弃一条写入（运维操作），不会发送到远端
     */
    public boolean abandon(Long id) {
        boolean removed = pendingUpdateService.removeById(id);
        if (removed) {
            publishCount(pendingCount.updateAndGet(count -> Math.max(0, count - 1)));
            log.warn("[待同步写入已放弃] id={}, pendingCount={}", id, pendingCount.get());
        }
        return removed;
    }

    public int pendingCount() {
        return pendingCount.get();
    }

    public List<PendingUpdate> listPending() {
        return pendingUpdateService.listInOrder();
    }

    public LocalDateTime lastSyncAt() {
        return lastSyncAt;
    }

    public boolean isDraining() {
        return draining.get();
    }

    private PendingUpdate append(PendingUpdateType type, String sessionId, String areaItemId, String json) {
        PendingUpdate entry = PendingUpdate.builder()
                .type(type)
                .sessionId(sessionId)
                .areaItemId(areaItemId)
                .payload(json)
                .revision(0)
                .attempts(0)
                .createdAt(LocalDateTime.now(clock))
                .build();
        pendingUpdateService.save(entry);
        publishCount(pendingCount.incrementAndGet());
        log.info("[写入已入队] id={}, type={}, areaItemId={}, pendingCount={}",
                entry.getId(), type, areaItemId, pendingCount.get());
        return entry;
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new StockSessionException("PAYLOAD_SERIALIZATION_FAILED", "写入内容序列化失败: " + e.getMessage());
        }
    }

    private void publishCount(int count) {
        eventPublisher.publishEvent(new PendingCountChangedEvent(count));
    }

    private static final class DrainPass {
        private final int synced;
        private final boolean failed;

        private DrainPass(int synced, boolean failed) {
            this.synced = synced;
            this.failed = failed;
        }

        int synced() {
            return synced;
        }

        boolean failed() {
            return failed;
        }
    }
}
