package org.stocktake.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.stocktake.domain.SessionItemUpdate;

import java.util.List;

/**
 * 会话条目决定存储
 */
public interface ISessionItemUpdateService extends IService<SessionItemUpdate> {

    List<SessionItemUpdate> listBySession(String sessionId);

    /**
     * 按 (sessionId, areaItemId) 插入或覆盖
     */
    SessionItemUpdate upsert(SessionItemUpdate update);
}
