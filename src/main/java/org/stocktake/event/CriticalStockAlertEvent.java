package org.stocktake.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 严重缺货提醒事件
 * 每个完成的会话最多一次
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CriticalStockAlertEvent {
    private String messageId;
    private String sessionId;
    private String areaId;
    private int criticalCount;
    private String title;
    private String body;
    private String traceId;
    private Long timestamp;
}
