package org.stocktake.exception;

public class ItemNotFoundException extends StockSessionException {

    public ItemNotFoundException(String areaItemId) {
        super("ITEM_NOT_FOUND", "当前会话中不存在该条目，areaItemId=" + areaItemId);
    }
}
