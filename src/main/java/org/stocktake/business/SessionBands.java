package org.stocktake.business;

import org.stocktake.domain.AreaItem;
import org.stocktake.domain.BandedItem;
import org.stocktake.domain.QuantityBand;
import org.stocktake.domain.SessionItemUpdate;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话内已处理条目的等级索引
 * 每次决定只重新分类对应的一个条目，不重算整个会话
 */
public class SessionBands {

    private final Map<String, BandedItem> byItemId = new LinkedHashMap<>();

    /**
     * 重新分类单个条目并替换原有结果
     */
    public BandedItem classify(AreaItem item, SessionItemUpdate update) {
        BandedItem banded = BandedItem.builder()
                .areaItemId(item.getId())
                .name(item.getName())
                .unitType(item.getUnitType())
                .previousQuantity(update.getPreviousQuantity())
                .finalQuantity(update.resolvedQuantity())
                .minQuantity(item.getMinQuantity())
                .status(update.getStatus())
                .band(QuantityBand.classify(update.resolvedQuantity(), item.getMinQuantity()))
                .build();
        byItemId.put(item.getId(), banded);
        return banded;
    }

    public BandedItem get(String itemId) {
        return byItemId.get(itemId);
    }

    /**
     * 按等级划分，每个条目恰好落在一个等级中
     */
    public Map<QuantityBand, List<BandedItem>> partition() {
        Map<QuantityBand, List<BandedItem>> groups = new EnumMap<>(QuantityBand.class);
        for (QuantityBand band : QuantityBand.values()) {
            groups.put(band, new ArrayList<>());
        }
        byItemId.values().forEach(banded -> groups.get(banded.getBand()).add(banded));
        return groups;
    }
}
