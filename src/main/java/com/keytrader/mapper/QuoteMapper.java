package com.keytrader.mapper;

import com.keytrader.api.dto.request.QuoteUpdateRequest;
import com.keytrader.domain.model.MarketDepth;
import org.mapstruct.Mapper;

@Mapper
public interface QuoteMapper {

    MarketDepth toDepth(QuoteUpdateRequest request);
}
