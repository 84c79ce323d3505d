package com.crewflow.crewflow_backend.model.domain;

public enum TriggerType {
    API,
    SCHEDULE
}
