package com.keytrader.mapper;

import com.keytrader.api.dto.response.PositionResponse;
import com.keytrader.domain.model.Position;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(uses = MoneyRounding.class)
public interface PositionMapper {

    @Mapping(source = "avgPrice", target = "avgPrice", qualifiedByName = "money")
    @Mapping(source = "cmp", target = "cmp", qualifiedByName = "money")
    @Mapping(source = "mtm", target = "mtm", qualifiedByName = "money")
    @Mapping(source = "mtmChangePercent", target = "mtmChangePercent", qualifiedByName = "money")
    @Mapping(source = "totalValue", target = "totalValue", qualifiedByName = "money")
    PositionResponse toResponse(Position position);
}
