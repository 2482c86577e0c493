package org.stocktake.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 汇总中的单个条目
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BandedItem {
    private String areaItemId;
    private String name;
    private String unitType;
    private BigDecimal previousQuantity;
    private BigDecimal finalQuantity;
    private BigDecimal minQuantity;
    private DecisionStatus status;
    private QuantityBand band;
}
