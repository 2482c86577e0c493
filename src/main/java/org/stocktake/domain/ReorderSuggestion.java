package org.stocktake.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 补货建议
 * - 仅针对低于最低数量的条目
 * - 补货量 = max(maxQuantity - 当前数量, 0)
 * - 数量为0时紧急度为 HIGH，否则 MEDIUM
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReorderSuggestion {
    private String areaItemId;
    private String name;
    private BigDecimal reorderQuantity;
    private String urgency;
}
