package org.stocktake.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.stocktake.domain.SessionStatus;
import org.stocktake.domain.StockSession;
import org.stocktake.mapper.StockSessionMapper;
import org.stocktake.service.IStockSessionService;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class StockSessionServiceImpl extends ServiceImpl<StockSessionMapper, StockSession>
        implements IStockSessionService {

    @Override
    public Optional<StockSession> findActive(String deviceId) {
        return this.lambdaQuery()
                .eq(StockSession::getDeviceId, deviceId)
                .eq(StockSession::getStatus, SessionStatus.ACTIVE)
                .orderByDesc(StockSession::getStartedAt)
                .last("LIMIT 1")
                .oneOpt();
    }

    @Override
    public Optional<StockSession> findPaused(String deviceId, String areaId) {
        return this.lambdaQuery()
                .eq(StockSession::getDeviceId, deviceId)
                .eq(StockSession::getAreaId, areaId)
                .eq(StockSession::getStatus, SessionStatus.PAUSED)
                .orderByDesc(StockSession::getPausedAt)
                .last("LIMIT 1")
                .oneOpt();
    }
}
