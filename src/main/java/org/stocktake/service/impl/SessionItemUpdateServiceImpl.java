package org.stocktake.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import org.stocktake.domain.SessionItemUpdate;
import org.stocktake.mapper.SessionItemUpdateMapper;
import org.stocktake.service.ISessionItemUpdateService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class SessionItemUpdateServiceImpl extends ServiceImpl<SessionItemUpdateMapper, SessionItemUpdate>
        implements ISessionItemUpdateService {

    @Override
    public List<SessionItemUpdate> listBySession(String sessionId) {
        return this.lambdaQuery()
                .eq(SessionItemUpdate::getSessionId, sessionId)
                .orderByAsc(SessionItemUpdate::getId)
                .list();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public SessionItemUpdate upsert(SessionItemUpdate update) {
        SessionItemUpdate existing = this.lambdaQuery()
                .eq(SessionItemUpdate::getSessionId, update.getSessionId())
                .eq(SessionItemUpdate::getAreaItemId, update.getAreaItemId())
                .one();
        if (existing == null) {
            update.setId(null);
            this.save(update);
        } else {
            update.setId(existing.getId());
            this.updateById(update);
        }
        return update;
    }
}
