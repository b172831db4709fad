package com.xbleey.pricewatch.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.xbleey.pricewatch.model.NotificationEvent;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface NotificationEventMapper extends BaseMapper<NotificationEvent> {
}
