package org.stocktake.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 当前会话视图（供界面层展示）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionView {
    private String sessionId;
    private String areaId;
    private SessionStatus status;
    private int cursor;
    private int itemsTotal;
    private int itemsChecked;
    private int itemsSkipped;
    private AreaItem currentItem;
    private int currentSkipCount;
    /**
     * "已跳过两次"提示
     */
    private boolean repeatedlySkipped;
    private boolean last;
    private List<String> order;
    private int pendingCount;
}
