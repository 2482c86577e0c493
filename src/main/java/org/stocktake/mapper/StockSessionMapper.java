package org.stocktake.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.stocktake.domain.StockSession;

/**
 * 盘点会话Mapper
 */
@Mapper
public interface StockSessionMapper extends BaseMapper<StockSession> {
}
