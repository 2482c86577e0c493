package org.stocktake.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.stocktake.domain.AreaItem;
import org.stocktake.mapper.AreaItemMapper;
import org.stocktake.service.IAreaItemCacheService;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class AreaItemCacheServiceImpl extends ServiceImpl<AreaItemMapper, AreaItem>
        implements IAreaItemCacheService {

    @Override
    public List<AreaItem> cachedItems(String areaId) {
        return this.lambdaQuery()
                .eq(AreaItem::getAreaId, areaId)
                .orderByAsc(AreaItem::getSortOrder)
                .list();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void replaceArea(String areaId, List<AreaItem> items) {
        this.lambdaUpdate().eq(AreaItem::getAreaId, areaId).remove();
        if (items.isEmpty()) {
            return;
        }
        // 条目可能从其他区域移过来
        this.removeByIds(items.stream().map(AreaItem::getId).toList());
        LocalDateTime now = LocalDateTime.now();
        for (int i = 0; i < items.size(); i++) {
            AreaItem item = items.get(i);
            item.setAreaId(areaId);
            item.setSortOrder(i);
            item.setCachedAt(now);
        }
        this.saveBatch(items);
        log.debug("[区域缓存已刷新] areaId={}, count={}", areaId, items.size());
    }

    @Override
    public void updateQuantity(String areaItemId, BigDecimal quantity) {
        this.lambdaUpdate()
                .eq(AreaItem::getId, areaItemId)
                .set(AreaItem::getCurrentQuantity, quantity)
                .update();
    }
}
