package org.stocktake.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 盘点完成汇总
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompletionSummary {
    private String sessionId;
    private String areaId;
    private List<BandedItem> critical;
    private List<BandedItem> low;
    private List<BandedItem> healthy;
    private int countedCount;
    private int skippedCount;

    /**
     * 盘点条目数量变化绝对值之和
     */
    private BigDecimal totalQuantityChanged;

    /**
     * 数量有变化的盘点条目数
     */
    private int updatedItemsCount;

    private List<ReorderSuggestion> reorderSuggestions;

    /**
     * 本会话是否已发送严重缺货提醒
     */
    private boolean alertSent;
}
