package org.stocktake.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.stocktake.domain.PendingUpdate;
import org.stocktake.domain.PendingUpdateType;
import org.stocktake.mapper.PendingUpdateMapper;
import org.stocktake.service.IPendingUpdateService;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 待同步写入存储实现
 */
@Slf4j
@Service
public class PendingUpdateServiceImpl extends ServiceImpl<PendingUpdateMapper, PendingUpdate>
        implements IPendingUpdateService {

    // 错误信息列长度
    private static final int MAX_ERROR_LENGTH = 500;

    @Override
    public PendingUpdate peekHead() {
        return baseMapper.selectHead();
    }

    @Override
    public List<PendingUpdate> listInOrder() {
        return this.lambdaQuery()
                .orderByAsc(PendingUpdate::getCreatedAt)
                .orderByAsc(PendingUpdate::getId)
                .list();
    }

    @Override
    public Optional<PendingUpdate> findItemUpdate(String sessionId, String areaItemId) {
        return this.lambdaQuery()
                .eq(PendingUpdate::getType, PendingUpdateType.ITEM_UPDATE)
                .eq(PendingUpdate::getSessionId, sessionId)
                .eq(PendingUpdate::getAreaItemId, areaItemId)
                .oneOpt();
    }

    @Override
    public void recordFailure(Long id, String errorMessage, LocalDateTime attemptAt) {
        String truncated = errorMessage;
        if (truncated != null && truncated.length() > MAX_ERROR_LENGTH) {
            truncated = truncated.substring(0, MAX_ERROR_LENGTH);
        }
        baseMapper.recordFailedAttempt(id, truncated, attemptAt);
    }
}
