package org.stocktake.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 盘点会话
 *
 * 状态流转：
 * - ACTIVE: 盘点中
 * - PAUSED: 已暂停，可恢复
 * - COMPLETED: 已完成（终态）
 * - ABANDONED: 已放弃（终态）
 *
 * 同一设备同一时间最多一个 ACTIVE 会话
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("stock_session")
public class StockSession {
    /**
     * 会话ID
     */
    @TableId(type = IdType.INPUT)
    private String id;

    /**
     * 设备ID
     */
    private String deviceId;

    /**
     * 区域ID
     */
    private String areaId;

    /**
     * 开始方式（扫码/NFC/手动）
     */
    private UpdateMethod scanMethod;

    private SessionStatus status;

    /**
     * 已盘点条目数
     */
    private Integer itemsChecked;

    /**
     * 已跳过条目数
     */
    private Integer itemsSkipped;

    /**
     * 条目总数
     */
    private Integer itemsTotal;

    /**
     * 当前游标
     */
    @TableField("cursor_index")
    private Integer cursor;

    /**
     * 暂停后返回的门店ID
     */
    private String returnLocationId;

    /**
     * 队列快照（JSON：顺序、跳过次数、条目数据）
     */
    private String queueSnapshot;

    /**
     * 严重缺货提醒发送时间，为空表示未发送
     */
    private LocalDateTime alertSentAt;

    private LocalDateTime startedAt;

    private LocalDateTime pausedAt;

    private LocalDateTime completedAt;

    private LocalDateTime updateTime;
}
