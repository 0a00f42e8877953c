package com.example.compliance.orchestrator.persistence.converter;

import com.example.compliance.orchestrator.model.OperationStatus;
import jakarta.persistence.Converter;

@Converter
public class OperationStatusConverter extends WireValueConverter<OperationStatus> {

    public OperationStatusConverter() {
        super(OperationStatus::getWireValue, OperationStatus::fromWire);
    }
}
