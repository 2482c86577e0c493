package org.stocktake.exception;

/**
 * 远端拉取失败且本地无缓存，无法开始盘点
 */
public class AreaItemsUnavailableException extends StockSessionException {

    public AreaItemsUnavailableException(String areaId, Throwable cause) {
        super("AREA_ITEMS_UNAVAILABLE", "无法加载区域条目且无本地缓存，areaId=" + areaId, cause);
    }
}
