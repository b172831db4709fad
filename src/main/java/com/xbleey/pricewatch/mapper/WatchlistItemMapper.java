package com.xbleey.pricewatch.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.xbleey.pricewatch.model.WatchlistItem;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface WatchlistItemMapper extends BaseMapper<WatchlistItem> {
}
