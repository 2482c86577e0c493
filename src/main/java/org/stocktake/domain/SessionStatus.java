package org.stocktake.domain;

/**
 * 盘点会话状态
 * ACTIVE <-> PAUSED 可反复切换；COMPLETED、ABANDONED 为终态
 */
public enum SessionStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }
}
