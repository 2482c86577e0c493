package org.stocktake.business;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.stocktake.config.StockTakeProperties;
import org.stocktake.domain.AreaItem;
import org.stocktake.domain.BandedItem;
import org.stocktake.domain.CompletionSummary;
import org.stocktake.domain.DecisionOptions;
import org.stocktake.domain.DecisionResult;
import org.stocktake.domain.DecisionStatus;
import org.stocktake.domain.DecisionWarning;
import org.stocktake.domain.ItemUpdatePayload;
import org.stocktake.domain.SessionCommitPayload;
import org.stocktake.domain.SessionItemUpdate;
import org.stocktake.domain.SessionStatus;
import org.stocktake.domain.SessionView;
import org.stocktake.domain.StockSession;
import org.stocktake.domain.UpdateMethod;
import org.stocktake.event.SessionStateChangedEvent;
import org.stocktake.exception.AreaItemsUnavailableException;
import org.stocktake.exception.IllegalSessionStateException;
import org.stocktake.exception.IncompleteDecisionsException;
import org.stocktake.exception.InvalidQuantityException;
import org.stocktake.exception.ItemNotFoundException;
import org.stocktake.exception.NoPausedSessionException;
import org.stocktake.exception.RemoteServiceException;
import org.stocktake.exception.SessionConflictException;
import org.stocktake.exception.StockSessionException;
import org.stocktake.remote.BlobStore;
import org.stocktake.remote.InventoryService;
import org.stocktake.remote.NetworkMonitor;
import org.stocktake.service.IAreaItemCacheService;
import org.stocktake.service.ISessionItemUpdateService;
import org.stocktake.service.IStockSessionService;
import org.stocktake.util.DistributedLockUtil;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 盘点会话引擎
 *
 * 状态流转：NotStarted -> ACTIVE -> PAUSED -> ACTIVE -> COMPLETED（ABANDONED 同为终态）
 *
 * 核心规则：
 * 1. 同一设备同一时间最多一个 ACTIVE 会话
 * 2. 所有命令串行执行（方法级 synchronized），远端同步在 PendingUpdateQueue 中进行
 * 3. 每次状态变化都先写本地（会话快照、条目决定、区域缓存），再入队远端写入
 * 4. 进程重启后从快照恢复 ACTIVE 会话
 */
@Slf4j
@Service
public class StockSessionEngine {

    private static final long LOCK_WAIT_SECONDS = 5;

    private final StockTakeProperties properties;
    private final InventoryService inventoryService;
    private final BlobStore blobStore;
    private final NetworkMonitor networkMonitor;
    private final PendingUpdateQueue pendingUpdateQueue;
    private final CompletionAggregator completionAggregator;
    private final IStockSessionService stockSessionService;
    private final ISessionItemUpdateService sessionItemUpdateService;
    private final IAreaItemCacheService areaItemCacheService;
    private final DistributedLockUtil distributedLockUtil;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private ActiveSession current;

    public StockSessionEngine(StockTakeProperties properties,
                              InventoryService inventoryService,
                              BlobStore blobStore,
                              NetworkMonitor networkMonitor,
                              PendingUpdateQueue pendingUpdateQueue,
                              CompletionAggregator completionAggregator,
                              IStockSessionService stockSessionService,
                              ISessionItemUpdateService sessionItemUpdateService,
                              IAreaItemCacheService areaItemCacheService,
                              DistributedLockUtil distributedLockUtil,
                              ObjectMapper objectMapper,
                              ApplicationEventPublisher eventPublisher,
                              Clock clock) {
        this.properties = properties;
        this.inventoryService = inventoryService;
        this.blobStore = blobStore;
        this.networkMonitor = networkMonitor;
        this.pendingUpdateQueue = pendingUpdateQueue;
        this.completionAggregator = completionAggregator;
        this.stockSessionService = stockSessionService;
        this.sessionItemUpdateService = sessionItemUpdateService;
        this.areaItemCacheService = areaItemCacheService;
        this.distributedLockUtil = distributedLockUtil;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 启动时恢复本设备上次未结束的 ACTIVE 会话
     */
    @EventListener(ApplicationReadyEvent.class)
    public synchronized void recover() {
        Optional<StockSession> active = stockSessionService.findActive(properties.getDeviceId());
        if (active.isEmpty()) {
            return;
        }
        StockSession session = active.get();
        try {
            current = load(session);
            log.info("[会话已恢复] sessionId={}, areaId={}, cursor={}, decided={}",
                    session.getId(), session.getAreaId(), current.queue.cursor(), current.updates.size());
        } catch (StockSessionException e) {
            // 快照无法读取：结束该会话，已入队的写入保留
            log.error("[会话恢复失败，标记为放弃] sessionId={}, errorMsg={}", session.getId(), e.getMessage(), e);
            session.setStatus(SessionStatus.ABANDONED);
            session.setCompletedAt(now());
            stockSessionService.updateById(session);
        }
    }

    // ==================== 会话生命周期 ====================

    /**
     * 开始盘点
     * - 同区域已在进行中：直接返回当前会话
     * - 其他区域进行中、或同区域存在暂停的会话：SessionConflictException
     */
    public synchronized SessionView startSession(String areaId, UpdateMethod scanMethod) {
        String lockKey = "session:" + properties.getDeviceId();
        if (!distributedLockUtil.tryLock(lockKey, LOCK_WAIT_SECONDS, TimeUnit.SECONDS)) {
            throw new SessionConflictException(null, "设备会话正在被其他进程操作，请稍后重试");
        }
        try {
            // ==================== 1. 检查进行中的会话 ====================
            if (current != null) {
                StockSession existing = current.session;
                if (existing.getAreaId().equals(areaId)) {
                    log.info("[会话已在进行中] sessionId={}, areaId={}", existing.getId(), areaId);
                    return view(current);
                }
                throw new SessionConflictException(existing.getId(),
                        "设备上已有进行中的盘点，区域=" + existing.getAreaId());
            }
            Optional<StockSession> persisted = stockSessionService.findActive(properties.getDeviceId());
            if (persisted.isPresent()) {
                throw new SessionConflictException(persisted.get().getId(),
                        "设备上已有进行中的盘点，区域=" + persisted.get().getAreaId());
            }

            // ==================== 2. 检查同区域暂停的会话 ====================
            Optional<StockSession> paused = stockSessionService.findPaused(properties.getDeviceId(), areaId);
            if (paused.isPresent()) {
                throw new SessionConflictException(paused.get().getId(),
                        "该区域有已暂停的盘点，请先恢复或放弃，areaId=" + areaId);
            }

            // ==================== 3. 加载区域条目 ====================
            List<AreaItem> items = loadAreaItems(areaId);

            // ==================== 4. 创建会话 ====================
            LocalDateTime now = now();
            StockSession session = StockSession.builder()
                    .id(UUID.randomUUID().toString())
                    .deviceId(properties.getDeviceId())
                    .areaId(areaId)
                    .scanMethod(scanMethod == null ? UpdateMethod.MANUAL : scanMethod)
                    .status(SessionStatus.ACTIVE)
                    .itemsChecked(0)
                    .itemsSkipped(0)
                    .itemsTotal(items.size())
                    .cursor(0)
                    .startedAt(now)
                    .updateTime(now)
                    .build();
            ActiveSession active = new ActiveSession(session, new ItemQueue(items));
            session.setQueueSnapshot(writeSnapshot(active.queue));
            stockSessionService.save(session);
            current = active;

            log.info("[盘点开始] sessionId={}, areaId={}, itemsTotal={}, scanMethod={}",
                    session.getId(), areaId, items.size(), session.getScanMethod());
            publishState(session, null, SessionStatus.ACTIVE);
            return view(active);
        } finally {
            distributedLockUtil.unlock(lockKey);
        }
    }

    /**
     * 暂停：保存游标、顺序和跳过次数，释放内存中的会话
     * 已入队的写入继续同步
     */
    public synchronized SessionView pauseSession(String returnLocationId) {
        ActiveSession active = requireActive();
        StockSession session = active.session;
        session.setStatus(SessionStatus.PAUSED);
        session.setPausedAt(now());
        session.setReturnLocationId(returnLocationId);
        persist(active);
        current = null;

        log.info("[盘点暂停] sessionId={}, areaId={}, cursor={}, returnLocationId={}",
                session.getId(), session.getAreaId(), active.queue.cursor(), returnLocationId);
        publishState(session, SessionStatus.ACTIVE, SessionStatus.PAUSED);
        return view(active);
    }

    /**
     * 恢复某区域最近暂停的会话，游标、顺序、跳过次数和已有决定与暂停时完全一致
     */
    public synchronized SessionView resumeSession(String areaId) {
        if (current != null) {
            throw new SessionConflictException(current.session.getId(),
                    "设备上已有进行中的盘点，区域=" + current.session.getAreaId());
        }
        StockSession session = stockSessionService.findPaused(properties.getDeviceId(), areaId)
                .orElseThrow(() -> new NoPausedSessionException(areaId));

        ActiveSession active = load(session);
        session.setStatus(SessionStatus.ACTIVE);
        persist(active);
        current = active;

        log.info("[盘点恢复] sessionId={}, areaId={}, cursor={}, decided={}",
                session.getId(), areaId, active.queue.cursor(), active.updates.size());
        publishState(session, SessionStatus.PAUSED, SessionStatus.ACTIVE);
        return view(active);
    }

    /**
     * 完成盘点
     * 所有条目都必须已盘点或已跳过；远端提交入队后尽力同步，同步失败不影响完成
     */
    public synchronized CompletionSummary completeSession() {
        ActiveSession active = requireActive();

        // ==================== 1. 检查未决条目 ====================
        List<AreaItem> unresolved = new ArrayList<>();
        for (AreaItem item : active.queue.items()) {
            if (!active.updates.containsKey(item.getId())) {
                unresolved.add(item);
            }
        }
        if (!unresolved.isEmpty()) {
            throw new IncompleteDecisionsException(unresolved);
        }

        // ==================== 2. 汇总 ====================
        StockSession session = active.session;
        CompletionSummary summary = completionAggregator.summarize(
                session, active.bands, active.updates.values(), active.itemsById());

        // ==================== 3. 本地完成 ====================
        LocalDateTime now = now();
        session.setStatus(SessionStatus.COMPLETED);
        session.setCompletedAt(now);
        persist(active);
        current = null;

        // ==================== 4. 远端提交入队 ====================
        pendingUpdateQueue.enqueueSessionCommit(session.getId(), SessionCommitPayload.builder()
                .areaId(session.getAreaId())
                .itemsChecked(session.getItemsChecked())
                .itemsSkipped(session.getItemsSkipped())
                .itemsTotal(session.getItemsTotal())
                .completedAt(now.toString())
                .updates(new ArrayList<>(active.updates.values()))
                .build());

        // ==================== 5. 严重不足提醒 ====================
        completionAggregator.alertIfCritical(session, summary);

        log.info("[盘点完成] sessionId={}, areaId={}, counted={}, skipped={}, critical={}, low={}, healthy={}",
                session.getId(), session.getAreaId(), summary.getCountedCount(), summary.getSkippedCount(),
                summary.getCritical().size(), summary.getLow().size(), summary.getHealthy().size());
        publishState(session, SessionStatus.ACTIVE, SessionStatus.COMPLETED);
        triggerDrain();
        return summary;
    }

    /**
     * 放弃当前会话，已入队的写入保留
     */
    public synchronized void abandonSession() {
        ActiveSession active = requireActive();
        StockSession session = active.session;
        session.setStatus(SessionStatus.ABANDONED);
        session.setCompletedAt(now());
        persist(active);
        current = null;

        log.info("[盘点放弃] sessionId={}, areaId={}, decided={}",
                session.getId(), session.getAreaId(), active.updates.size());
        publishState(session, SessionStatus.ACTIVE, SessionStatus.ABANDONED);
    }

    /**
     * 放弃某区域暂停的会话，之后可以在该区域重新开始
     */
    public synchronized void abandonPausedSession(String areaId) {
        StockSession session = stockSessionService.findPaused(properties.getDeviceId(), areaId)
                .orElseThrow(() -> new NoPausedSessionException(areaId));
        LocalDateTime now = now();
        session.setStatus(SessionStatus.ABANDONED);
        session.setCompletedAt(now);
        session.setUpdateTime(now);
        stockSessionService.updateById(session);

        log.info("[暂停的盘点已放弃] sessionId={}, areaId={}", session.getId(), areaId);
        publishState(session, SessionStatus.PAUSED, SessionStatus.ABANDONED);
    }

    // ==================== 导航 ====================

    public synchronized boolean next() {
        ActiveSession active = requireActive();
        boolean moved = active.queue.next();
        if (moved) {
            persist(active);
        }
        return moved;
    }

    /**
     * @return false 表示已经在第一个条目
     */
    public synchronized boolean previous() {
        ActiveSession active = requireActive();
        boolean moved = active.queue.previous();
        if (moved) {
            persist(active);
        }
        return moved;
    }

    public synchronized boolean goToItem(int index) {
        ActiveSession active = requireActive();
        boolean moved = active.queue.goTo(index);
        if (moved) {
            persist(active);
        }
        return moved;
    }

    public synchronized SessionView skipCurrentItem() {
        ActiveSession active = requireActive();
        AreaItem item = active.queue.current();
        if (item == null) {
            throw new IllegalSessionStateException("当前区域没有可跳过的条目");
        }
        return skipItem(item.getId());
    }

    /**
     * 跳过条目：移到队尾，跳过次数+1
     * 未盘点的条目记为 SKIPPED（最终数量取原值）；已盘点的条目保留盘点结果
     */
    public synchronized SessionView skipItem(String itemId) {
        ActiveSession active = requireActive();
        AreaItem item = requireItem(active, itemId);
        AreaItem currentItem = active.queue.current();
        if (currentItem == null || !currentItem.getId().equals(itemId)) {
            throw new IllegalSessionStateException("只能跳过当前条目，areaItemId=" + itemId);
        }

        int skipCount = active.queue.skip(itemId);

        SessionItemUpdate existing = active.updates.get(itemId);
        if (existing == null || existing.getStatus() == DecisionStatus.SKIPPED) {
            BigDecimal previous = existing != null ? existing.getPreviousQuantity() : item.getCurrentQuantity();
            SessionItemUpdate update = SessionItemUpdate.builder()
                    .sessionId(active.session.getId())
                    .areaItemId(itemId)
                    .previousQuantity(previous)
                    .newQuantity(previous)
                    .status(DecisionStatus.SKIPPED)
                    .method(active.session.getScanMethod())
                    .updatedAt(now())
                    .build();
            sessionItemUpdateService.upsert(update);
            active.updates.put(itemId, update);
            active.bands.classify(item, update);
        }
        persist(active);

        log.info("[条目跳过] sessionId={}, areaItemId={}, skipCount={}", active.session.getId(), itemId, skipCount);
        return view(active);
    }

    // ==================== 数量决定 ====================

    /**
     * 记录盘点数量
     * 1. 校验（同步失败，不入队）
     * 2. 本地生效：条目决定、当前数量、区域缓存、等级、快照
     * 3. 照片：离线丢弃并提示；在线上传，失败提示
     * 4. 远端写入入队，在线时触发同步
     */
    public synchronized DecisionResult recordDecision(String itemId, BigDecimal quantity,
                                                      UpdateMethod method, DecisionOptions options) {
        DecisionOptions opts = options == null ? DecisionOptions.none() : options;

        // ==================== 1. 校验 ====================
        validateQuantity(itemId, quantity);
        ActiveSession active = requireActive();
        AreaItem item = requireItem(active, itemId);

        // ==================== 2. 本地生效 ====================
        SessionItemUpdate existing = active.updates.get(itemId);
        BigDecimal previous = existing != null ? existing.getPreviousQuantity() : item.getCurrentQuantity();
        SessionItemUpdate update = SessionItemUpdate.builder()
                .sessionId(active.session.getId())
                .areaItemId(itemId)
                .previousQuantity(previous)
                .newQuantity(quantity)
                .status(DecisionStatus.COUNTED)
                .method(method == null ? active.session.getScanMethod() : method)
                .note(opts.getNote())
                .updatedAt(now())
                .build();
        BandedItem banded = applyLocally(active, item, update);

        // ==================== 3. 照片 ====================
        List<DecisionWarning> warnings = new ArrayList<>();
        if (StringUtils.hasText(opts.getPhotoUri())) {
            String photoUrl = uploadPhoto(itemId, opts.getPhotoUri(), warnings);
            if (photoUrl != null) {
                update.setPhotoUrl(photoUrl);
                sessionItemUpdateService.upsert(update);
            }
        }

        // ==================== 4. 入队 ====================
        pendingUpdateQueue.enqueueItemUpdate(active.session.getId(), itemId, toPayload(active, item, update));
        log.info("[数量已记录] sessionId={}, areaItemId={}, previous={}, new={}, band={}, warnings={}",
                active.session.getId(), itemId, previous, quantity, banded.getBand(), warnings);
        triggerDrain();

        return DecisionResult.builder()
                .update(update)
                .band(banded.getBand())
                .warnings(warnings)
                .pendingCount(pendingUpdateQueue.pendingCount())
                .build();
    }

    /**
     * 完成前修改已盘点条目的数量，只重新分类该条目
     * 跳过的条目需先通过 recordDecision 重新盘点
     */
    public synchronized BandedItem setSessionItemQuantity(String itemId, BigDecimal newQuantity) {
        validateQuantity(itemId, newQuantity);
        ActiveSession active = requireActive();
        AreaItem item = requireItem(active, itemId);

        SessionItemUpdate existing = active.updates.get(itemId);
        if (existing == null) {
            throw new IllegalSessionStateException("条目尚未盘点，不能修改数量，areaItemId=" + itemId);
        }
        if (existing.getStatus() == DecisionStatus.SKIPPED) {
            throw new IllegalSessionStateException("跳过的条目需要重新盘点后才能修改，areaItemId=" + itemId);
        }

        SessionItemUpdate update = existing.toBuilder()
                .newQuantity(newQuantity)
                .updatedAt(now())
                .build();
        BandedItem banded = applyLocally(active, item, update);
        pendingUpdateQueue.enqueueItemUpdate(active.session.getId(), itemId, toPayload(active, item, update));

        log.info("[数量已修改] sessionId={}, areaItemId={}, new={}, band={}",
                active.session.getId(), itemId, newQuantity, banded.getBand());
        triggerDrain();
        return banded;
    }

    // ==================== 离线准备 ====================

    /**
     * 在线时预先拉取多个区域的条目写入本地缓存，之后离线也能在这些区域开始盘点
     * 单个区域失败只记录日志；进行中会话的区域跳过，保留本地已生效的数量
     *
     * @return 成功缓存的区域数
     */
    public synchronized int prefetchAreaItems(Collection<String> areaIds) {
        if (areaIds == null || areaIds.isEmpty()) {
            return 0;
        }
        if (!networkMonitor.isOnline()) {
            log.info("[离线，跳过区域预取] areaIds={}", areaIds);
            return 0;
        }
        String activeAreaId = current == null ? null : current.session.getAreaId();
        int cached = 0;
        for (String areaId : new LinkedHashSet<>(areaIds)) {
            if (!StringUtils.hasText(areaId) || areaId.equals(activeAreaId)) {
                continue;
            }
            try {
                List<AreaItem> items = inventoryService.fetchAreaItems(areaId);
                areaItemCacheService.replaceArea(areaId, items);
                cached++;
                log.info("[区域已预取] areaId={}, count={}", areaId, items.size());
            } catch (RemoteServiceException e) {
                log.warn("[区域预取失败，忽略] areaId={}, errorMsg={}", areaId, e.getMessage());
            }
        }
        return cached;
    }

    // ==================== 查询 ====================

    public synchronized Optional<SessionView> currentView() {
        return current == null ? Optional.empty() : Optional.of(view(current));
    }

    public synchronized boolean hasCurrentSession() {
        return current != null;
    }

    /**
     * 完成前预览汇总（不发送提醒）
     */
    public synchronized CompletionSummary previewSummary() {
        ActiveSession active = requireActive();
        return completionAggregator.summarize(
                active.session, active.bands, active.updates.values(), active.itemsById());
    }

    // ==================== 内部方法 ====================

    private List<AreaItem> loadAreaItems(String areaId) {
        List<AreaItem> cached = areaItemCacheService.cachedItems(areaId);
        if (!networkMonitor.isOnline()) {
            if (cached.isEmpty()) {
                throw new AreaItemsUnavailableException(areaId, null);
            }
            log.info("[离线，使用区域缓存] areaId={}, count={}", areaId, cached.size());
            return cached;
        }
        try {
            List<AreaItem> fetched = inventoryService.fetchAreaItems(areaId);
            areaItemCacheService.replaceArea(areaId, fetched);
            return fetched;
        } catch (RemoteServiceException e) {
            if (cached.isEmpty()) {
                throw new AreaItemsUnavailableException(areaId, e);
            }
            log.warn("[拉取区域条目失败，使用本地缓存] areaId={}, count={}, errorMsg={}",
                    areaId, cached.size(), e.getMessage());
            return cached;
        }
    }

    private BandedItem applyLocally(ActiveSession active, AreaItem item, SessionItemUpdate update) {
        sessionItemUpdateService.upsert(update);
        active.updates.put(item.getId(), update);
        item.setCurrentQuantity(update.getNewQuantity());
        areaItemCacheService.updateQuantity(item.getId(), update.getNewQuantity());
        BandedItem banded = active.bands.classify(item, update);
        persist(active);
        return banded;
    }

    private String uploadPhoto(String itemId, String photoUri, List<DecisionWarning> warnings) {
        if (!networkMonitor.isOnline()) {
            log.info("[离线，照片未上传] areaItemId={}", itemId);
            warnings.add(DecisionWarning.PHOTO_UNAVAILABLE_OFFLINE);
            return null;
        }
        try {
            return blobStore.uploadPhoto(photoUri);
        } catch (RuntimeException e) {
            // 照片失败不影响数量决定，写入照常入队
            log.warn("[照片上传失败] areaItemId={}, errorMsg={}", itemId, e.getMessage());
            warnings.add(DecisionWarning.PHOTO_UPLOAD_FAILED);
            return null;
        }
    }

    private ItemUpdatePayload toPayload(ActiveSession active, AreaItem item, SessionItemUpdate update) {
        return ItemUpdatePayload.builder()
                .areaId(active.session.getAreaId())
                .inventoryItemId(item.getInventoryItemId())
                .previousQuantity(update.getPreviousQuantity())
                .newQuantity(update.getNewQuantity())
                .method(update.getMethod())
                .note(update.getNote())
                .photoUrl(update.getPhotoUrl())
                .updatedAt(update.getUpdatedAt() == null ? null : update.getUpdatedAt().toString())
                .build();
    }

    /**
     * 尽力触发同步；本地状态已经生效，同步异常不影响当前命令
     */
    private void triggerDrain() {
        try {
            pendingUpdateQueue.requestDrain();
        } catch (Exception e) {
            log.warn("[触发同步失败] errorMsg={}", e.getMessage(), e);
        }
    }

    private ActiveSession load(StockSession session) {
        QueueSnapshot snapshot = readSnapshot(session);
        ActiveSession active = new ActiveSession(session, ItemQueue.restore(snapshot));
        for (SessionItemUpdate update : sessionItemUpdateService.listBySession(session.getId())) {
            AreaItem item = active.queue.find(update.getAreaItemId());
            if (item == null) {
                log.warn("[决定对应的条目不在队列中，忽略] sessionId={}, areaItemId={}",
                        session.getId(), update.getAreaItemId());
                continue;
            }
            active.updates.put(item.getId(), update);
            active.bands.classify(item, update);
        }
        return active;
    }

    private void persist(ActiveSession active) {
        StockSession session = active.session;
        session.setCursor(active.queue.cursor());
        session.setItemsTotal(active.queue.size());
        session.setItemsChecked(active.count(DecisionStatus.COUNTED));
        session.setItemsSkipped(active.count(DecisionStatus.SKIPPED));
        session.setQueueSnapshot(writeSnapshot(active.queue));
        session.setUpdateTime(now());
        stockSessionService.updateById(session);
    }

    private String writeSnapshot(ItemQueue queue) {
        try {
            return objectMapper.writeValueAsString(queue.snapshot());
        } catch (JsonProcessingException e) {
            throw new StockSessionException("SNAPSHOT_FAILED", "会话快照序列化失败: " + e.getMessage(), e);
        }
    }

    private QueueSnapshot readSnapshot(StockSession session) {
        if (!StringUtils.hasText(session.getQueueSnapshot())) {
            throw new StockSessionException("SNAPSHOT_FAILED", "会话没有快照，sessionId=" + session.getId());
        }
        try {
            return objectMapper.readValue(session.getQueueSnapshot(), QueueSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new StockSessionException("SNAPSHOT_FAILED", "会话快照解析失败: " + e.getMessage(), e);
        }
    }

    private ActiveSession requireActive() {
        if (current == null) {
            throw new IllegalSessionStateException("当前没有进行中的盘点");
        }
        return current;
    }

    private static AreaItem requireItem(ActiveSession active, String itemId) {
        AreaItem item = active.queue.find(itemId);
        if (item == null) {
            throw new ItemNotFoundException(itemId);
        }
        return item;
    }

    private static void validateQuantity(String itemId, BigDecimal quantity) {
        if (quantity == null || quantity.signum() < 0) {
            throw new InvalidQuantityException(itemId, quantity);
        }
    }

    private SessionView view(ActiveSession active) {
        ItemQueue queue = active.queue;
        AreaItem item = queue.current();
        return SessionView.builder()
                .sessionId(active.session.getId())
                .areaId(active.session.getAreaId())
                .status(active.session.getStatus())
                .cursor(queue.cursor())
                .itemsTotal(queue.size())
                .itemsChecked(active.count(DecisionStatus.COUNTED))
                .itemsSkipped(active.count(DecisionStatus.SKIPPED))
                .currentItem(item)
                .currentSkipCount(item == null ? 0 : queue.skipCount(item.getId()))
                .repeatedlySkipped(item != null && queue.isRepeatedlySkipped(item.getId()))
                .last(queue.isLast())
                .order(queue.order())
                .pendingCount(pendingUpdateQueue.pendingCount())
                .build();
    }

    private void publishState(StockSession session, SessionStatus from, SessionStatus to) {
        eventPublisher.publishEvent(new SessionStateChangedEvent(session.getId(), session.getAreaId(), from, to));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    /**
     * 内存中的进行中会话
     */
    private static final class ActiveSession {
        private final StockSession session;
        private final ItemQueue queue;
        private final Map<String, SessionItemUpdate> updates = new LinkedHashMap<>();
        private final SessionBands bands = new SessionBands();

        private ActiveSession(StockSession session, ItemQueue queue) {
            this.session = session;
            this.queue = queue;
        }

        private int count(DecisionStatus status) {
            int count = 0;
            for (SessionItemUpdate update : updates.values()) {
                if (update.getStatus() == status) {
                    count++;
                }
            }
            return count;
        }

        private Map<String, AreaItem> itemsById() {
            Map<String, AreaItem> byId = new LinkedHashMap<>();
            for (AreaItem item : queue.items()) {
                byId.put(item.getId(), item);
            }
            return byId;
        }
    }
}
