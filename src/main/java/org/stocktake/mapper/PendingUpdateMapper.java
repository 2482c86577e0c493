package org.stocktake.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import org.stocktake.domain.PendingUpdate;

import java.time.LocalDateTime;

/**
 * 待同步写入Mapper
 */
@Mapper
public interface PendingUpdateMapper extends BaseMapper<PendingUpdate> {

    /**
     * 队首记录（createdAt 最早，同一时间按 id）
     */
    @Select("""
            SELECT * FROM pending_update
            ORDER BY created_at ASC, id ASC
            LIMIT 1
            """)
    PendingUpdate selectHead();

    /**
     * 记录一次失败尝试，不改变排序字段
     */
    @Update("""
            UPDATE pending_update
            SET attempts = attempts + 1,
                last_error = #{lastError},
                last_attempt_at = #{attemptAt}
            WHERE id = #{id}
            """)
    int recordFailedAttempt(@Param("id") Long id,
                            @Param("lastError") String lastError,
                            @Param("attemptAt") LocalDateTime attemptAt);
}
