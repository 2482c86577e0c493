package org.stocktake.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.stocktake.domain.SessionItemUpdate;

/**
 * 会话条目决定Mapper
 */
@Mapper
public interface SessionItemUpdateMapper extends BaseMapper<SessionItemUpdate> {
}
