package org.stocktake.business;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.stocktake.domain.AreaItem;
import org.stocktake.domain.BandedItem;
import org.stocktake.domain.CompletionSummary;
import org.stocktake.domain.DecisionOptions;
import org.stocktake.domain.DecisionResult;
import org.stocktake.domain.DecisionStatus;
import org.stocktake.domain.DecisionWarning;
import org.stocktake.domain.QuantityBand;
import org.stocktake.domain.SessionItemUpdate;
import org.stocktake.domain.SessionStatus;
import org.stocktake.domain.SessionView;
import org.stocktake.domain.StockSession;
import org.stocktake.domain.UpdateMethod;
import org.stocktake.event.CriticalStockAlertEvent;
import org.stocktake.exception.AreaItemsUnavailableException;
import org.stocktake.exception.IllegalSessionStateException;
import org.stocktake.exception.IncompleteDecisionsException;
import org.stocktake.exception.InvalidQuantityException;
import org.stocktake.exception.ItemNotFoundException;
import org.stocktake.exception.NoPausedSessionException;
import org.stocktake.exception.RemoteServiceException;
import org.stocktake.exception.SessionConflictException;
import org.stocktake.service.IAreaItemCacheService;
import org.stocktake.service.ISessionItemUpdateService;
import org.stocktake.service.IStockSessionService;
import org.stocktake.support.IntegrationTestSupport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 盘点会话引擎集成测试
 * - 会话生命周期（开始、暂停、恢复、完成、放弃）
 * - 数量决定（本地生效、入队、照片）
 * - 完成汇总与严重缺货提醒
 */
@Slf4j
@RecordApplicationEvents
class StockSessionEngineTest extends IntegrationTestSupport {

    @Autowired
    private IStockSessionService stockSessionService;

    @Autowired
    private ISessionItemUpdateService sessionItemUpdateService;

    @Autowired
    private IAreaItemCacheService areaItemCacheService;

    @Autowired
    private ApplicationEvents applicationEvents;

    private static BigDecimal qty(String value) {
        return new BigDecimal(value);
    }

    private DecisionResult count(String itemId, String quantity) {
        return engine.recordDecision(itemId, qty(quantity), UpdateMethod.MANUAL, DecisionOptions.none());
    }

    // ==================== 开始 ====================

    @Test
    void startSessionBeginsAtFirstItem() {
        stubDefaultArea();

        SessionView view = engine.startSession(AREA, UpdateMethod.QR);

        assertEquals(0, view.getCursor());
        assertEquals("A", view.getCurrentItem().getId());
        assertEquals(3, view.getItemsTotal());
        assertEquals(SessionStatus.ACTIVE, view.getStatus());

        StockSession persisted = stockSessionService.getById(view.getSessionId());
        assertEquals(SessionStatus.ACTIVE, persisted.getStatus());
        assertEquals(UpdateMethod.QR, persisted.getScanMethod());
        assertEquals(3, areaItemCacheService.cachedItems(AREA).size());
    }

    @Test
    void startingSameAreaAgainReturnsCurrentSession() {
        stubDefaultArea();
        SessionView first = engine.startSession(AREA, UpdateMethod.MANUAL);

        SessionView second = engine.startSession(AREA, UpdateMethod.MANUAL);

        assertEquals(first.getSessionId(), second.getSessionId());
        verify(inventoryService, times(1)).fetchAreaItems(AREA);
    }

    @Test
    void startingAnotherAreaWhileActiveConflicts() {
        stubDefaultArea();
        stubArea("dry-storage", item("X", "1", "1"));
        SessionView active = engine.startSession(AREA, UpdateMethod.MANUAL);

        SessionConflictException e = assertThrows(SessionConflictException.class,
                () -> engine.startSession("dry-storage", UpdateMethod.MANUAL));

        assertEquals(active.getSessionId(), e.getExistingSessionId());
        assertEquals("SESSION_CONFLICT", e.getErrorCode());
    }

    @Test
    void offlineStartUsesAreaCache() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        engine.abandonSession();

        networkMonitor.report(false);
        SessionView view = engine.startSession(AREA, UpdateMethod.MANUAL);

        assertEquals(List.of("A", "B", "C"), view.getOrder());
        verify(inventoryService, times(1)).fetchAreaItems(AREA);
    }

    @Test
    void fetchFailureFallsBackToCacheOrFails() {
        when(inventoryService.fetchAreaItems(AREA)).thenThrow(new RemoteServiceException("库存服务不可用"));

        AreaItemsUnavailableException e = assertThrows(AreaItemsUnavailableException.class,
                () -> engine.startSession(AREA, UpdateMethod.MANUAL));
        assertEquals("AREA_ITEMS_UNAVAILABLE", e.getErrorCode());
        assertFalse(engine.hasCurrentSession());

        List<AreaItem> cached = new ArrayList<>(List.of(item("A", "10", "5"), item("B", "3", "5")));
        areaItemCacheService.replaceArea(AREA, cached);

        SessionView view = engine.startSession(AREA, UpdateMethod.MANUAL);
        assertEquals(List.of("A", "B"), view.getOrder());
    }

    // ==================== 跳过与导航 ====================

    @Test
    void skipMovesItemToEndOfQueue() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);

        SessionView view = engine.skipCurrentItem();

        assertEquals(List.of("B", "C", "A"), view.getOrder());
        assertEquals(0, view.getCursor());
        assertEquals("B", view.getCurrentItem().getId());
        assertEquals(3, view.getItemsTotal());
        assertEquals(1, view.getItemsSkipped());

        // A 跳过后记为 SKIPPED，最终数量取原值
        SessionItemUpdate skipped = sessionItemUpdateService.listBySession(view.getSessionId()).get(0);
        assertEquals("A", skipped.getAreaItemId());
        assertEquals(DecisionStatus.SKIPPED, skipped.getStatus());
        assertEquals(0, qty("10").compareTo(skipped.resolvedQuantity()));
    }

    @Test
    void skippingItemThatIsNotCurrentIsRejected() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);

        assertThrows(IllegalSessionStateException.class, () -> engine.skipItem("C"));
        assertThrows(ItemNotFoundException.class, () -> engine.skipItem("Z"));
    }

    @Test
    void navigationStaysWithinQueue() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);

        assertFalse(engine.previous());
        assertTrue(engine.next());
        assertTrue(engine.next());
        assertFalse(engine.next());
        assertTrue(engine.currentView().get().isLast());
        assertTrue(engine.goToItem(1));
        assertEquals("B", engine.currentView().get().getCurrentItem().getId());
        assertFalse(engine.goToItem(5));
    }

    @Test
    void itemSkippedTwiceShowsHint() {
        stubArea(AREA, item("A", "1", "1"), item("B", "1", "1"));
        engine.startSession(AREA, UpdateMethod.MANUAL);

        engine.skipCurrentItem();
        engine.next();
        SessionView view = engine.skipCurrentItem();

        assertEquals("A", view.getCurrentItem().getId());
        assertEquals(2, view.getCurrentSkipCount());
        assertTrue(view.isRepeatedlySkipped());
    }

    // ==================== 数量决定 ====================

    @Test
    void offlineDecisionIsAppliedLocallyAndSyncedOnReconnect() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        networkMonitor.report(false);

        DecisionResult result = engine.recordDecision("B", qty("2"), UpdateMethod.MANUAL, DecisionOptions.none());

        assertEquals(1, result.getPendingCount());
        assertEquals(1, pendingUpdateQueue.pendingCount());
        assertEquals(QuantityBand.CRITICAL, result.getBand());
        AreaItem cachedB = areaItemCacheService.getById("B");
        assertEquals(0, qty("2").compareTo(cachedB.getCurrentQuantity()));
        verify(inventoryService, never()).persistItemUpdate(anyString(), any(), any(), any(), any());

        networkMonitor.report(true);

        assertEquals(0, pendingUpdateQueue.pendingCount());
        assertEquals(0, pendingRows());
        verify(inventoryService).persistItemUpdate(eq("B"), eq(qty("2")), eq(UpdateMethod.MANUAL), isNull(), isNull());
    }

    @Test
    void invalidQuantityIsRejectedAndNeverQueued() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        networkMonitor.report(false);

        assertThrows(InvalidQuantityException.class,
                () -> engine.recordDecision("A", qty("-1"), UpdateMethod.MANUAL, null));
        assertThrows(InvalidQuantityException.class,
                () -> engine.recordDecision("A", null, UpdateMethod.MANUAL, null));

        assertEquals(0, pendingUpdateQueue.pendingCount());
        assertEquals(0, engine.currentView().get().getItemsChecked());
    }

    @Test
    void decisionForUnknownItemFails() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);

        assertThrows(ItemNotFoundException.class, () -> count("Z", "1"));
    }

    @Test
    void photoIsDroppedWithWarningWhenOffline() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        networkMonitor.report(false);

        DecisionResult result = engine.recordDecision("A", qty("9"), UpdateMethod.MANUAL,
                DecisionOptions.builder().note("后排").photoUri("file:///tmp/shelf.jpg").build());

        assertEquals(List.of(DecisionWarning.PHOTO_UNAVAILABLE_OFFLINE), result.getWarnings());
        assertNull(result.getUpdate().getPhotoUrl());
        assertEquals("后排", result.getUpdate().getNote());
        verify(blobStore, never()).uploadPhoto(anyString());
    }

    @Test
    void uploadedPhotoUrlTravelsWithTheWrite() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        when(blobStore.uploadPhoto("file:///tmp/shelf.jpg")).thenReturn("https://photos.example/1.jpg");

        DecisionResult result = engine.recordDecision("A", qty("9"), UpdateMethod.NFC,
                DecisionOptions.builder().photoUri("file:///tmp/shelf.jpg").build());

        assertTrue(result.getWarnings().isEmpty());
        assertEquals("https://photos.example/1.jpg", result.getUpdate().getPhotoUrl());
        verify(inventoryService).persistItemUpdate(eq("A"), eq(qty("9")), eq(UpdateMethod.NFC), isNull(),
                eq("https://photos.example/1.jpg"));
    }

    @Test
    void photoUploadFailureKeepsDecision() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        when(blobStore.uploadPhoto(anyString())).thenThrow(new RemoteServiceException("上传超时"));

        DecisionResult result = engine.recordDecision("A", qty("9"), UpdateMethod.MANUAL,
                DecisionOptions.builder().photoUri("file:///tmp/shelf.jpg").build());

        assertEquals(List.of(DecisionWarning.PHOTO_UPLOAD_FAILED), result.getWarnings());
        assertEquals(1, engine.currentView().get().getItemsChecked());
    }

    @Test
    void unparseablePhotoLocationStillQueuesTheWrite() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        when(blobStore.uploadPhoto(anyString()))
                .thenThrow(new IllegalArgumentException("Illegal character in path at index 12"));

        DecisionResult result = engine.recordDecision("B", qty("2"), UpdateMethod.MANUAL,
                DecisionOptions.builder().photoUri("file:/tmp/my photo.jpg").build());

        assertEquals(List.of(DecisionWarning.PHOTO_UPLOAD_FAILED), result.getWarnings());
        assertNull(result.getUpdate().getPhotoUrl());
        verify(inventoryService).persistItemUpdate(eq("B"), eq(qty("2")), eq(UpdateMethod.MANUAL), isNull(), isNull());
        assertEquals(0, pendingUpdateQueue.pendingCount());
    }

    @Test
    void unparseablePhotoLocationWhileServiceIsDownLeavesWritePending() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        when(blobStore.uploadPhoto(anyString())).thenThrow(new IllegalStateException("路径解析失败"));
        doThrow(new RemoteServiceException("库存服务返回 503"))
                .when(inventoryService).persistItemUpdate(anyString(), any(), any(), any(), any());

        DecisionResult result = engine.recordDecision("B", qty("2"), UpdateMethod.MANUAL,
                DecisionOptions.builder().photoUri("file:/tmp/my photo.jpg").build());

        assertEquals(List.of(DecisionWarning.PHOTO_UPLOAD_FAILED), result.getWarnings());
        assertEquals(1, pendingUpdateQueue.pendingCount());
        assertEquals(1, pendingRows());
        assertEquals(1, result.getPendingCount());
    }

    @Test
    void recountKeepsOriginalPreviousQuantity() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);

        count("A", "7");
        DecisionResult second = count("A", "6");

        assertEquals(0, qty("10").compareTo(second.getUpdate().getPreviousQuantity()));
        assertEquals(1, sessionItemUpdateService.listBySession(second.getUpdate().getSessionId()).size());
    }

    // ==================== 完成 ====================

    @Test
    void completionBandsItemsAndAlertsOnce() {
        stubDefaultArea();
        SessionView view = engine.startSession(AREA, UpdateMethod.MANUAL);
        count("A", "10");
        count("B", "2");
        count("C", "8");

        CompletionSummary summary = engine.completeSession();

        assertEquals(List.of("B"), ids(summary.getCritical()));
        assertTrue(summary.getLow().isEmpty());
        assertEquals(List.of("A", "C"), ids(summary.getHealthy()));
        assertEquals(3, summary.getCountedCount());
        assertTrue(summary.isAlertSent());
        verify(notificationService, times(1)).scheduleLocalAlert(anyString(), contains("1 个条目"));

        StockSession persisted = stockSessionService.getById(view.getSessionId());
        assertEquals(SessionStatus.COMPLETED, persisted.getStatus());
        assertNotNull(persisted.getAlertSentAt());
        assertNotNull(persisted.getCompletedAt());
        assertEquals(3, persisted.getItemsChecked());
        assertFalse(engine.hasCurrentSession());

        verify(inventoryService).commitSession(eq(view.getSessionId()), anyList());
        assertEquals(0, pendingUpdateQueue.pendingCount());

        List<CriticalStockAlertEvent> alerts = applicationEvents.stream(CriticalStockAlertEvent.class)
                .collect(Collectors.toList());
        assertEquals(1, alerts.size());
        assertEquals(view.getSessionId(), alerts.get(0).getSessionId());
        assertEquals(AREA, alerts.get(0).getAreaId());
        assertEquals(1, alerts.get(0).getCriticalCount());
    }

    @Test
    void completionWithoutCriticalItemsSendsNoAlert() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        count("A", "10");
        count("B", "9");
        count("C", "8");

        CompletionSummary summary = engine.completeSession();

        assertTrue(summary.getCritical().isEmpty());
        assertFalse(summary.isAlertSent());
        verify(notificationService, never()).scheduleLocalAlert(anyString(), anyString());
    }

    @Test
    void completionRequiresDecisionForEveryItem() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        count("A", "10");
        engine.next();
        count("B", "2");

        IncompleteDecisionsException e = assertThrows(IncompleteDecisionsException.class,
                () -> engine.completeSession());

        assertEquals(List.of("C"), e.getUnresolvedItemIds());
        assertTrue(e.getMessage().contains("条目C"));
        assertTrue(engine.hasCurrentSession());
    }

    @Test
    void completionSucceedsWhileOfflineAndCommitIsQueued() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        networkMonitor.report(false);
        count("A", "10");
        engine.skipItem("B");
        count("C", "8");

        CompletionSummary summary = engine.completeSession();

        assertEquals(2, summary.getCountedCount());
        assertEquals(1, summary.getSkippedCount());
        // 两条数量写入 + 一条会话提交
        assertEquals(3, pendingUpdateQueue.pendingCount());
        verify(inventoryService, never()).commitSession(anyString(), anyList());
    }

    @Test
    void editingQuantityReclassifiesOnlyThatItem() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        count("A", "10");
        count("B", "2");
        count("C", "8");

        BandedItem edited = engine.setSessionItemQuantity("A", qty("4"));

        assertEquals(QuantityBand.CRITICAL, edited.getBand());
        CompletionSummary preview = engine.previewSummary();
        assertEquals(List.of("A", "B"), ids(preview.getCritical()));
        assertEquals(List.of("C"), ids(preview.getHealthy()));
        assertEquals(0, qty("10").compareTo(edited.getPreviousQuantity()));
    }

    @Test
    void skippedItemMustBeRecountedBeforeEditing() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        engine.skipCurrentItem();

        assertThrows(IllegalSessionStateException.class, () -> engine.setSessionItemQuantity("A", qty("3")));
        assertThrows(IllegalSessionStateException.class, () -> engine.setSessionItemQuantity("B", qty("3")));
        assertThrows(InvalidQuantityException.class, () -> engine.setSessionItemQuantity("A", qty("-3")));

        count("A", "3");
        BandedItem edited = engine.setSessionItemQuantity("A", qty("12"));
        assertEquals(DecisionStatus.COUNTED, edited.getStatus());
        assertEquals(QuantityBand.HEALTHY, edited.getBand());
    }

    // ==================== 离线准备 ====================

    @Test
    void prefetchedAreaCanBeStartedOffline() {
        stubArea("dry-storage", item("X", "4", "2"), item("Y", "1", "2"));
        stubArea("freezer", item("F", "6", "3"));

        int cached = engine.prefetchAreaItems(List.of("dry-storage", "freezer"));

        assertEquals(2, cached);
        assertEquals(2, areaItemCacheService.cachedItems("dry-storage").size());

        networkMonitor.report(false);
        SessionView view = engine.startSession("dry-storage", UpdateMethod.MANUAL);
        assertEquals(List.of("X", "Y"), view.getOrder());
        verify(inventoryService, times(1)).fetchAreaItems("dry-storage");
    }

    @Test
    void prefetchSkipsFailingAreas() {
        when(inventoryService.fetchAreaItems("dry-storage")).thenThrow(new RemoteServiceException("超时"));
        stubArea("freezer", item("F", "6", "3"));

        int cached = engine.prefetchAreaItems(List.of("dry-storage", "freezer"));

        assertEquals(1, cached);
        assertTrue(areaItemCacheService.cachedItems("dry-storage").isEmpty());
        assertEquals(1, areaItemCacheService.cachedItems("freezer").size());
    }

    @Test
    void prefetchDoesNothingOffline() {
        networkMonitor.report(false);

        assertEquals(0, engine.prefetchAreaItems(List.of("freezer")));
        assertEquals(0, engine.prefetchAreaItems(List.of()));
        verify(inventoryService, never()).fetchAreaItems(anyString());
    }

    @Test
    void prefetchKeepsActiveAreaCache() {
        stubDefaultArea();
        stubArea("freezer", item("F", "6", "3"));
        engine.startSession(AREA, UpdateMethod.MANUAL);
        count("B", "2");

        int cached = engine.prefetchAreaItems(List.of(AREA, "freezer"));

        assertEquals(1, cached);
        verify(inventoryService, times(1)).fetchAreaItems(AREA);
        assertEquals(0, qty("2").compareTo(areaItemCacheService.getById("B").getCurrentQuantity()));
    }

    // ==================== 暂停与恢复 ====================

    @Test
    void pauseAndResumeRestoresQueueExactly() {
        stubDefaultArea();
        SessionView started = engine.startSession(AREA, UpdateMethod.MANUAL);
        engine.skipCurrentItem();
        engine.next();
        count("C", "8");
        SessionView before = engine.currentView().get();

        SessionView paused = engine.pauseSession("store-7");
        assertEquals(SessionStatus.PAUSED, paused.getStatus());
        assertFalse(engine.hasCurrentSession());
        StockSession persisted = stockSessionService.getById(started.getSessionId());
        assertEquals(SessionStatus.PAUSED, persisted.getStatus());
        assertEquals("store-7", persisted.getReturnLocationId());

        SessionView resumed = engine.resumeSession(AREA);

        assertEquals(started.getSessionId(), resumed.getSessionId());
        assertEquals(SessionStatus.ACTIVE, resumed.getStatus());
        assertEquals(before.getOrder(), resumed.getOrder());
        assertEquals(before.getCursor(), resumed.getCursor());
        assertEquals("C", resumed.getCurrentItem().getId());
        assertEquals(before.getItemsChecked(), resumed.getItemsChecked());
        assertEquals(before.getItemsSkipped(), resumed.getItemsSkipped());

        // 已跳过的 A 和已盘点的 C 在恢复后仍然有效，只差 B
        IncompleteDecisionsException e = assertThrows(IncompleteDecisionsException.class,
                () -> engine.completeSession());
        assertEquals(List.of("B"), e.getUnresolvedItemIds());
    }

    @Test
    void resumeWithoutPausedSessionFails() {
        NoPausedSessionException e = assertThrows(NoPausedSessionException.class,
                () -> engine.resumeSession(AREA));
        assertEquals("NO_PAUSED_SESSION", e.getErrorCode());
    }

    @Test
    void resumeWhileAnotherSessionIsActiveConflicts() {
        stubDefaultArea();
        stubArea("dry-storage", item("X", "1", "1"));
        engine.startSession(AREA, UpdateMethod.MANUAL);
        engine.pauseSession(null);
        engine.startSession("dry-storage", UpdateMethod.MANUAL);

        assertThrows(SessionConflictException.class, () -> engine.resumeSession(AREA));
    }

    @Test
    void pausedSessionBlocksNewStartUntilAbandoned() {
        stubDefaultArea();
        SessionView first = engine.startSession(AREA, UpdateMethod.MANUAL);
        engine.pauseSession(null);

        SessionConflictException e = assertThrows(SessionConflictException.class,
                () -> engine.startSession(AREA, UpdateMethod.MANUAL));
        assertEquals(first.getSessionId(), e.getExistingSessionId());

        engine.abandonPausedSession(AREA);
        SessionView second = engine.startSession(AREA, UpdateMethod.MANUAL);

        assertFalse(first.getSessionId().equals(second.getSessionId()));
        assertEquals(SessionStatus.ABANDONED, stockSessionService.getById(first.getSessionId()).getStatus());
    }

    @Test
    void pauseRequiresActiveSession() {
        assertThrows(IllegalSessionStateException.class, () -> engine.pauseSession(null));
        assertThrows(IllegalSessionStateException.class, () -> engine.completeSession());
    }

    @Test
    void activeSessionIsRecoveredFromSnapshot() {
        stubDefaultArea();
        engine.startSession(AREA, UpdateMethod.MANUAL);
        engine.skipCurrentItem();
        count("B", "2");
        SessionView before = engine.currentView().get();

        // 模拟进程重启后的恢复
        engine.recover();

        SessionView after = engine.currentView().get();
        assertEquals(before.getSessionId(), after.getSessionId());
        assertEquals(before.getOrder(), after.getOrder());
        assertEquals(before.getCursor(), after.getCursor());
        assertEquals(1, after.getItemsChecked());
        assertEquals(1, after.getItemsSkipped());
    }

    private static List<String> ids(List<BandedItem> banded) {
        List<String> ids = new ArrayList<>();
        for (BandedItem item : banded) {
            ids.add(item.getAreaItemId());
        }
        return ids;
    }
}
