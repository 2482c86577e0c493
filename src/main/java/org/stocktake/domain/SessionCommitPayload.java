package org.stocktake.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * SESSION_COMMIT 待同步写入的内容
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionCommitPayload {
    private String areaId;
    private Integer itemsChecked;
    private Integer itemsSkipped;
    private Integer itemsTotal;
    private String completedAt;
    private List<SessionItemUpdate> updates;
}
