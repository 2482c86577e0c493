package org.stocktake.domain;

/**
 * 数量录入方式
 */
public enum UpdateMethod {
    MANUAL,
    NFC,
    QR
}
