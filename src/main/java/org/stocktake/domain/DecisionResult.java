package org.stocktake.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 数量决定的结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecisionResult {
    private SessionItemUpdate update;
    private QuantityBand band;
    private List<DecisionWarning> warnings;
    private int pendingCount;
}
