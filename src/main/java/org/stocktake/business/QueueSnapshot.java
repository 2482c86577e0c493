package org.stocktake.business;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.stocktake.domain.AreaItem;

import java.util.List;
import java.util.Map;

/**
 * ItemQueue 的持久化形式（按当前顺序排列的条目、跳过次数、游标）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueSnapshot {
    private List<AreaItem> items;
    private Map<String, Integer> skipCounts;
    private int cursor;
}
