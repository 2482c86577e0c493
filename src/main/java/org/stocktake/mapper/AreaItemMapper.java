package org.stocktake.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.stocktake.domain.AreaItem;

/**
 * 区域条目本地缓存Mapper
 */
@Mapper
public interface AreaItemMapper extends BaseMapper<AreaItem> {
}
