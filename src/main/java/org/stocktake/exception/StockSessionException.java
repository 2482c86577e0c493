package org.stocktake.exception;

/**
 * 盘点会话异常基类
 * - 本地/校验/生命周期错误，同步抛出，阻塞当前操作
 * - errorCode 直接返回给调用方
 */
public class StockSessionException extends RuntimeException {

    private final String errorCode;

    public StockSessionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StockSessionException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
