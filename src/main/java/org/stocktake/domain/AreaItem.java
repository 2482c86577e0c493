package org.stocktake.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 区域盘点条目
 * - 远端库存服务返回的可盘点行
 * - 本地按区域缓存一份，离线时可直接开始盘点
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("area_item_cache")
public class AreaItem {
    /**
     * 主键（远端 area_item id）
     */
    @TableId(type = IdType.INPUT)
    private String id;

    /**
     * 所属区域ID
     */
    private String areaId;

    /**
     * 库存物料ID
     */
    private String inventoryItemId;

    /**
     * 名称
     */
    private String name;

    /**
     * 分类
     */
    private String category;

    /**
     * 计量单位
     */
    private String unitType;

    /**
     * 当前数量（本地乐观更新后的值）
     */
    private BigDecimal currentQuantity;

    /**
     * 最低数量
     */
    private BigDecimal minQuantity;

    /**
     * 最高数量（用于补货建议，可为空）
     */
    private BigDecimal maxQuantity;

    /**
     * 区域内排序
     */
    private Integer sortOrder;

    /**
     * 缓存时间
     */
    private LocalDateTime cachedAt;
}
