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
 * 会话内条目决定
 * - 每个会话每个条目最多一条，后写覆盖
 * - 最终提交前可修改
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@TableName("session_item_update")
public class SessionItemUpdate {
    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    private String sessionId;

    private String areaItemId;

    /**
     * 会话开始时的数量
     */
    private BigDecimal previousQuantity;

    /**
     * 盘点后的数量（SKIPPED 时等于 previousQuantity）
     */
    private BigDecimal newQuantity;

    private DecisionStatus status;

    private UpdateMethod method;

    private String note;

    private String photoUrl;

    private LocalDateTime updatedAt;

    /**
     * 最终数量：盘点取新值，跳过取原值
     */
    public BigDecimal resolvedQuantity() {
        return status == DecisionStatus.COUNTED ? newQuantity : previousQuantity;
    }
}
