package org.stocktake.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.stocktake.domain.PendingUpdate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 待同步写入存储
 * 只负责持久化；出队只能由 PendingUpdateQueue 的同步流程执行
 */
public interface IPendingUpdateService extends IService<PendingUpdate> {

    /**
     * 队首记录，队列为空时返回 null
     */
    PendingUpdate peekHead();

    /**
     * 按先进先出顺序列出全部记录
     */
    List<PendingUpdate> listInOrder();

    /**
     * 某会话内某条目尚未同步的数量写入
     */
    Optional<PendingUpdate> findItemUpdate(String sessionId, String areaItemId);

    /**
     * 记录一次失败尝试（attempts+1），记录仍留在原位置
     */
    void recordFailure(Long id, String errorMessage, LocalDateTime attemptAt);
}
