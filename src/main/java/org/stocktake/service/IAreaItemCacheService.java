package org.stocktake.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.stocktake.domain.AreaItem;

import java.math.BigDecimal;
import java.util.List;

/**
 * 区域条目本地缓存
 * 远端拉取成功后整区覆盖；离线开始盘点时读取
 */
public interface IAreaItemCacheService extends IService<AreaItem> {

    List<AreaItem> cachedItems(String areaId);

    void replaceArea(String areaId, List<AreaItem> items);

    /**
     * 本地乐观更新某条目的当前数量
     */
    void updateQuantity(String areaItemId, BigDecimal quantity);
}
