package org.stocktake.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 数量决定的可选信息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecisionOptions {
    private String note;
    /**
     * 本地照片路径，上传成功后换成远端地址
     */
    private String photoUri;

    public static DecisionOptions none() {
        return new DecisionOptions();
    }
}
