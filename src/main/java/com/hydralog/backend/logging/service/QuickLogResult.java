package com.hydralog.backend.logging.service;

public record QuickLogResult(int medicationSessions, int fluidSessions, double fluidVolume, int unitsCommitted) {

    public int totalSessions() {
        return medicationSessions + fluidSessions;
    }
}
