package com.xbleey.pricewatch.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.xbleey.pricewatch.model.PriceObservation;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface PriceObservationMapper extends BaseMapper<PriceObservation> {
}
