package com.xbleey.pricewatch.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.xbleey.pricewatch.model.DailySummaryFire;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface DailySummaryFireMapper extends BaseMapper<DailySummaryFire> {
}
