package org.stocktake.exception;

/**
 * 远端调用失败（网络错误、服务端错误）
 * 写入路径上由待同步队列吸收，不直接抛给用户
 */
public class RemoteServiceException extends RuntimeException {

    public RemoteServiceException(String message) {
        super(message);
    }

    public RemoteServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
