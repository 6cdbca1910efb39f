package com.keytrader.api.controller;

import com.keytrader.api.dto.request.QuoteUpdateRequest;
import com.keytrader.broker.QuoteBoard;
import com.keytrader.domain.model.MarketDepth;
import com.keytrader.mapper.QuoteMapper;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Inbound quotes from the upstream market data feed. */
@RestController
@RequestMapping("/api/market-data")
public class MarketDataController {

    private final QuoteBoard quoteBoard;
    private final QuoteMapper quoteMapper;

    public MarketDataController(QuoteBoard quoteBoard, QuoteMapper quoteMapper) {
        this.quoteBoard = quoteBoard;
        this.quoteMapper = quoteMapper;
    }

    @PostMapping("/quotes")
    public ResponseEntity<MarketDepth> updateQuote(@Valid @RequestBody QuoteUpdateRequest request) {
        MarketDepth depth = quoteMapper.toDepth(request);
        quoteBoard.update(depth);
        return ResponseEntity.ok(depth);
    }
}
