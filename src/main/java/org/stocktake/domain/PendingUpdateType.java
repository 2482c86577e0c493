package org.stocktake.domain;

/**
 * 待同步写入类型
 */
public enum PendingUpdateType {
    /**
     * 单个条目的数量写入
     */
    ITEM_UPDATE,
    /**
     * 会话最终提交
     */
    SESSION_COMMIT
}
