package org.stocktake.domain;

public enum DecisionStatus {
    COUNTED,
    SKIPPED
}
