package com.example.compliance.orchestrator.persistence.converter;

import com.example.compliance.orchestrator.model.ResultStatus;
import jakarta.persistence.Converter;

@Converter
public class ResultStatusConverter extends WireValueConverter<ResultStatus> {

    public ResultStatusConverter() {
        super(ResultStatus::getWireValue, ResultStatus::fromWire);
    }
}
