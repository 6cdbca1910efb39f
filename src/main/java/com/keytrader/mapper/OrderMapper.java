package com.keytrader.mapper;

import com.keytrader.api.dto.response.OrderResponse;
import com.keytrader.domain.model.Order;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(uses = MoneyRounding.class)
public interface OrderMapper {

    @Mapping(source = "price", target = "price", qualifiedByName = "money")
    OrderResponse toResponse(Order order);

    List<OrderResponse> toResponseList(List<Order> orders);
}
