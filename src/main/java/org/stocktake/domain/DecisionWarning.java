package org.stocktake.domain;

/**
 * 非致命警告，附加在单次决定上，不阻塞流程
 */
public enum DecisionWarning {
    /**
     * 离线状态下无法上传照片，照片已丢弃
     */
    PHOTO_UNAVAILABLE_OFFLINE,
    /**
     * 照片上传失败，照片已丢弃
     */
    PHOTO_UPLOAD_FAILED
}
