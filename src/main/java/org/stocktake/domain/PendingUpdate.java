package org.stocktake.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 待同步写入记录
 * - 本地已生效、远端尚未确认的写入
 * - 只有远端确认或显式放弃后才删除
 * - 按 createdAt + id 严格先进先出
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("pending_update")
public class PendingUpdate {
    /**
     * 主键（雪花ID，单调递增，用于同一时间戳内的排序）
     */
    @TableId(type = IdType.ASSIGN_ID)
    private Long id;

    private PendingUpdateType type;

    /**
     * 条目ID（SESSION_COMMIT 时为空）
     */
    private String areaItemId;

    private String sessionId;

    /**
     * 写入内容（JSON）
     */
    private String payload;

    /**
     * 覆盖写入时递增；同步确认后按 id + revision 删除，避免删掉同步期间被覆盖的新内容
     */
    private Integer revision;

    /**
     * 已尝试次数
     */
    private Integer attempts;

    private String lastError;

    private LocalDateTime lastAttemptAt;

    private LocalDateTime createdAt;
}
