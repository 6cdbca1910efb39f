package com.keytrader.mapper;

import com.keytrader.api.dto.response.SessionStatsResponse;
import com.keytrader.domain.model.SessionStats;
import org.mapstruct.Mapper;

@Mapper
public interface SessionStatsMapper {

    SessionStatsResponse toResponse(SessionStats stats);
}
