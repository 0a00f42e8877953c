package com.example.compliance.orchestrator.persistence.converter;

import com.example.compliance.orchestrator.model.DeliveryStatus;
import jakarta.persistence.Converter;

@Converter
public class DeliveryStatusConverter extends WireValueConverter<DeliveryStatus> {

    public DeliveryStatusConverter() {
        super(DeliveryStatus::getWireValue, DeliveryStatus::fromWire);
    }
}
