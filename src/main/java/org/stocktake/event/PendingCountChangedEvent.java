package org.stocktake.event;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 待同步数量变化，界面层据此显示"N 条更新待同步"
 */
@Data
@AllArgsConstructor
public class PendingCountChangedEvent {
    private int pendingCount;
}
