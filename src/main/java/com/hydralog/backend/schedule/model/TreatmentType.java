package com.hydralog.backend.schedule.model;

public enum TreatmentType {
    MEDICATION,
    FLUID
}
