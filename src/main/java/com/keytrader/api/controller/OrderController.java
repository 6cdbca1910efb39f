package com.keytrader.api.controller;

import com.keytrader.api.dto.request.PlaceOrderRequest;
import com.keytrader.api.dto.response.PositionResponse;
import com.keytrader.ledger.PositionManager;
import com.keytrader.mapper.PositionMapper;
import com.keytrader.session.TradingCommandService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Order commands for the current instrument. Both endpoints answer with the position after
 * the fill.
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private final TradingCommandService tradingCommandService;
    private final PositionManager positionManager;
    private final PositionMapper positionMapper;

    public OrderController(
            TradingCommandService tradingCommandService,
            PositionManager positionManager,
            PositionMapper positionMapper) {
        this.tradingCommandService = tradingCommandService;
        this.positionManager = positionManager;
        this.positionMapper = positionMapper;
    }

    @PostMapping
    public ResponseEntity<PositionResponse> placeOrder(@Valid @RequestBody PlaceOrderRequest request) {
        tradingCommandService.place(request.getSide(), request.getLots());
        return ResponseEntity.ok(positionMapper.toResponse(positionManager.getPosition()));
    }

    /** Sells every open lot; a flat position is left untouched. */
    @PostMapping("/close-all")
    public ResponseEntity<PositionResponse> closeAll() {
        tradingCommandService.closeAll();
        return ResponseEntity.ok(positionMapper.toResponse(positionManager.getPosition()));
    }
}
