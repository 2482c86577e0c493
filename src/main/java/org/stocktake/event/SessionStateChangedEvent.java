package org.stocktake.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.stocktake.domain.SessionStatus;

/**
 * 会话状态变化（from 为空表示新建）
 */
@Data
@AllArgsConstructor
public class SessionStateChangedEvent {
    private String sessionId;
    private String areaId;
    private SessionStatus from;
    private SessionStatus to;
}
