package org.stocktake.exception;

public class NoPausedSessionException extends StockSessionException {

    public NoPausedSessionException(String areaId) {
        super("NO_PAUSED_SESSION", "该区域没有已暂停的盘点会话，areaId=" + areaId);
    }
}
