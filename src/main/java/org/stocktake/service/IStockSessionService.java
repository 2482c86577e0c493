package org.stocktake.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.stocktake.domain.StockSession;

import java.util.Optional;

/**
 * 盘点会话存储
 */
public interface IStockSessionService extends IService<StockSession> {

    /**
     * 设备上进行中的会话
     */
    Optional<StockSession> findActive(String deviceId);

    /**
     * 设备上某区域最近一次暂停的会话
     */
    Optional<StockSession> findPaused(String deviceId, String areaId);
}
