package com.keytrader.mapper;

import com.keytrader.api.dto.response.InstrumentResponse;
import com.keytrader.domain.model.Instrument;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper
public interface InstrumentMapper {

    InstrumentResponse toResponse(Instrument instrument);

    List<InstrumentResponse> toResponseList(List<Instrument> instruments);
}
