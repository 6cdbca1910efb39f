package com.keytrader.api.controller;

import com.keytrader.api.dto.request.ChangeInstrumentRequest;
import com.keytrader.api.dto.response.InstrumentResponse;
import com.keytrader.api.dto.response.InstrumentsResponse;
import com.keytrader.domain.model.Instrument;
import com.keytrader.mapper.InstrumentMapper;
import com.keytrader.session.TradingSession;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/instruments")
public class InstrumentController {

    private final TradingSession tradingSession;
    private final InstrumentMapper instrumentMapper;

    public InstrumentController(TradingSession tradingSession, InstrumentMapper instrumentMapper) {
        this.tradingSession = tradingSession;
        this.instrumentMapper = instrumentMapper;
    }

    @GetMapping
    public ResponseEntity<InstrumentsResponse> listInstruments() {
        return ResponseEntity.ok(InstrumentsResponse.builder()
                .current(instrumentMapper.toResponse(tradingSession.getCurrentInstrument()))
                .instruments(instrumentMapper.toResponseList(tradingSession.getInstruments()))
                .build());
    }

    /** Switches instrument; refused with 409 while a position is open. */
    @PutMapping("/current")
    public ResponseEntity<InstrumentResponse> changeInstrument(@Valid @RequestBody ChangeInstrumentRequest request) {
        Instrument selected = tradingSession.changeInstrument(request.getSymbol());
        return ResponseEntity.ok(instrumentMapper.toResponse(selected));
    }
}
