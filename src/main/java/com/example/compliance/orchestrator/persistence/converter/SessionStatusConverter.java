package com.example.compliance.orchestrator.persistence.converter;

import com.example.compliance.orchestrator.model.SessionStatus;
import jakarta.persistence.Converter;

@Converter
public class SessionStatusConverter extends WireValueConverter<SessionStatus> {

    public SessionStatusConverter() {
        super(SessionStatus::getWireValue, SessionStatus::fromWire);
    }
}
