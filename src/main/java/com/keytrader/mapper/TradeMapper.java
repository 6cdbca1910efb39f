package com.keytrader.mapper;

import com.keytrader.api.dto.response.TradeResponse;
import com.keytrader.domain.model.Trade;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** Closed trades to API rows, rounded the same way as the CSV export. */
@Mapper(uses = MoneyRounding.class)
public interface TradeMapper {

    @Mapping(source = "entryPrice", target = "entryPrice", qualifiedByName = "money")
    @Mapping(source = "exitPrice", target = "exitPrice", qualifiedByName = "money")
    @Mapping(source = "pnl", target = "pnl", qualifiedByName = "money")
    @Mapping(source = "pnlPercent", target = "pnlPercent", qualifiedByName = "money")
    @Mapping(source = "turnover", target = "turnover", qualifiedByName = "money")
    TradeResponse toResponse(Trade trade);

    List<TradeResponse> toResponseList(List<Trade> trades);
}
