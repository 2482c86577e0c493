package org.stocktake.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * ITEM_UPDATE 待同步写入的内容
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemUpdatePayload {
    private String areaId;
    private String inventoryItemId;
    private BigDecimal previousQuantity;
    private BigDecimal newQuantity;
    private UpdateMethod method;
    private String note;
    private String photoUrl;
    private String updatedAt;
}
