package org.stocktake.exception;

import java.math.BigDecimal;

/**
 * 数量校验失败（负数或为空），不会进入待同步队列
 */
public class InvalidQuantityException extends StockSessionException {

    public InvalidQuantityException(String areaItemId, BigDecimal quantity) {
        super("INVALID_QUANTITY", "数量必须为非负数，areaItemId=" + areaItemId + ", quantity=" + quantity);
    }
}
