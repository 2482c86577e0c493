package org.stocktake.remote;

import org.stocktake.domain.AreaItem;
import org.stocktake.domain.SessionItemUpdate;
import org.stocktake.domain.UpdateMethod;

import java.math.BigDecimal;
import java.util.List;

/**
 * 远端库存服务
 * 所有方法失败时抛出 {@link org.stocktake.exception.RemoteServiceException}
 */
public interface InventoryService {

    /**
     * 拉取区域内的全部有效条目
     */
    List<AreaItem> fetchAreaItems(String areaId);

    /**
     * 写入单个条目的盘点数量，正常返回即视为远端已确认
     */
    void persistItemUpdate(String areaItemId, BigDecimal quantity, UpdateMethod method,
                           String note, String photoUrl);

    /**
     * 提交整个会话
     */
    void commitSession(String sessionId, List<SessionItemUpdate> updates);
}
