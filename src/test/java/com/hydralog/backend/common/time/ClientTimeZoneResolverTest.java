package com.hydralog.backend.common.time;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ClientTimeZoneResolverTest {

    private final ClientTimeZoneResolver resolver = new ClientTimeZoneResolver();

    @Test
    void valid_zone_is_used() {
        assertEquals(ZoneId.of("Europe/Berlin"), resolver.resolve(" Europe/Berlin "));
    }

    @Test
    void missing_or_invalid_zone_falls_back_to_utc() {
        assertEquals(ZoneOffset.UTC, resolver.resolve(null));
        assertEquals(ZoneOffset.UTC, resolver.resolve(""));
        assertEquals(ZoneOffset.UTC, resolver.resolve("Mars/Olympus"));
    }
}
