package com.hydralog.backend.logging.context;

import java.time.ZoneId;

/** Readiness signals from the auth and profile side. */
public sealed interface ContextEvent {

    Long userId();

    record AuthReady(Long userId) implements ContextEvent {
    }

    record ProfileReady(Long userId, String petId, ZoneId zone) implements ContextEvent {
    }

    record SignedOut(Long userId) implements ContextEvent {
    }
}
