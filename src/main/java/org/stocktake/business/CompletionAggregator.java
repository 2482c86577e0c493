package org.stocktake.business;

import lombok.extern.slf4j.Slf4j;
import org.stocktake.domain.AreaItem;
import org.stocktake.domain.BandedItem;
import org.stocktake.domain.CompletionSummary;
import org.stocktake.domain.DecisionStatus;
import org.stocktake.domain.QuantityBand;
import org.stocktake.domain.ReorderSuggestion;
import org.stocktake.domain.SessionItemUpdate;
import org.stocktake.domain.StockSession;
import org.stocktake.event.CriticalStockAlertEvent;
import org.stocktake.remote.NotificationService;
import org.stocktake.service.IStockSessionService;
import org.stocktake.util.IdempotentUtil;
import org.stocktake.util.TraceIdUtil;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 完成汇总
 * - 按最终数量把已处理条目分为 严重不足 / 偏低 / 正常
 * - 生成补货建议
 * - 有严重不足条目时发送提醒，每个会话最多一次
 */
@Slf4j
@Component
public class CompletionAggregator {

    static final String ALERT_OPERATION = "CRITICAL_ALERT";
    static final String URGENCY_HIGH = "HIGH";
    static final String URGENCY_MEDIUM = "MEDIUM";

    private final NotificationService notificationService;
    private final IdempotentUtil idempotentUtil;
    private final IStockSessionService stockSessionService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public CompletionAggregator(NotificationService notificationService,
                                IdempotentUtil idempotentUtil,
                                IStockSessionService stockSessionService,
                                ApplicationEventPublisher eventPublisher,
                                Clock clock) {
        this.notificationService = notificationService;
        this.idempotentUtil = idempotentUtil;
        this.stockSessionService = stockSessionService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 根据会话当前的等级索引生成汇总（不发送提醒）
     */
    public CompletionSummary summarize(StockSession session, SessionBands bands,
                                       Collection<SessionItemUpdate> updates,
                                       Map<String, AreaItem> itemsById) {
        Map<QuantityBand, List<BandedItem>> groups = bands.partition();

        int counted = 0;
        int skipped = 0;
        int changed = 0;
        BigDecimal totalChanged = BigDecimal.ZERO;
        for (SessionItemUpdate update : updates) {
            if (update.getStatus() == DecisionStatus.SKIPPED) {
                skipped++;
                continue;
            }
            counted++;
            BigDecimal previous = nullToZero(update.getPreviousQuantity());
            BigDecimal delta = nullToZero(update.getNewQuantity()).subtract(previous).abs();
            if (delta.signum() != 0) {
                changed++;
                totalChanged = totalChanged.add(delta);
            }
        }

        return CompletionSummary.builder()
                .sessionId(session.getId())
                .areaId(session.getAreaId())
                .critical(groups.get(QuantityBand.CRITICAL))
                .low(groups.get(QuantityBand.LOW))
                .healthy(groups.get(QuantityBand.HEALTHY))
                .countedCount(counted)
                .skippedCount(skipped)
                .totalQuantityChanged(totalChanged)
                .updatedItemsCount(changed)
                .reorderSuggestions(reorderSuggestions(groups.get(QuantityBand.CRITICAL), itemsById))
                .alertSent(session.getAlertSentAt() != null)
                .build();
    }

    /**
     * 存在严重不足条目时发送一次提醒
     *
     * @return 本次是否发送
     */
    public boolean alertIfCritical(StockSession session, CompletionSummary summary) {
        List<BandedItem> critical = summary.getCritical();
        if (critical == null || critical.isEmpty()) {
            return false;
        }
        if (session.getAlertSentAt() != null) {
            log.info("[提醒已发送过，跳过] sessionId={}, alertSentAt={}", session.getId(), session.getAlertSentAt());
            return false;
        }
        if (!idempotentUtil.markAsOperated(session.getId(), ALERT_OPERATION)) {
            log.info("[提醒凭证已存在，跳过] sessionId={}", session.getId());
            return false;
        }

        String title = "库存严重不足";
        String body = String.format("区域 %s 盘点完成：%d 个条目低于最低数量", session.getAreaId(), critical.size());
        try {
            notificationService.scheduleLocalAlert(title, body);
        } catch (Exception e) {
            // 提醒发出即忘，失败不影响会话完成
            log.error("[提醒发送异常] sessionId={}, errorMsg={}", session.getId(), e.getMessage(), e);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        session.setAlertSentAt(now);
        stockSessionService.lambdaUpdate()
                .eq(StockSession::getId, session.getId())
                .set(StockSession::getAlertSentAt, now)
                .update();
        summary.setAlertSent(true);

        eventPublisher.publishEvent(CriticalStockAlertEvent.builder()
                .messageId(UUID.randomUUID().toString())
                .sessionId(session.getId())
                .areaId(session.getAreaId())
                .criticalCount(critical.size())
                .title(title)
                .body(body)
                .traceId(TraceIdUtil.getTraceId())
                .timestamp(clock.millis())
                .build());
        log.warn("[严重缺货提醒] sessionId={}, areaId={}, criticalCount={}",
                session.getId(), session.getAreaId(), critical.size());
        return true;
    }

    private List<ReorderSuggestion> reorderSuggestions(List<BandedItem> critical, Map<String, AreaItem> itemsById) {
        List<ReorderSuggestion> suggestions = new ArrayList<>();
        for (BandedItem banded : critical) {
            AreaItem item = itemsById.get(banded.getAreaItemId());
            BigDecimal current = nullToZero(banded.getFinalQuantity());
            BigDecimal target = item != null && item.getMaxQuantity() != null
                    ? item.getMaxQuantity()
                    : nullToZero(banded.getMinQuantity());
            suggestions.add(ReorderSuggestion.builder()
                    .areaItemId(banded.getAreaItemId())
                    .name(banded.getName())
                    .reorderQuantity(target.subtract(current).max(BigDecimal.ZERO))
                    .urgency(current.signum() <= 0 ? URGENCY_HIGH : URGENCY_MEDIUM)
                    .build());
        }
        return suggestions;
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
