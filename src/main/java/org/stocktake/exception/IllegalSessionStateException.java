package org.stocktake.exception;

/**
 * 当前会话状态不允许该操作
 */
public class IllegalSessionStateException extends StockSessionException {

    public IllegalSessionStateException(String message) {
        super("ILLEGAL_SESSION_STATE", message);
    }
}
