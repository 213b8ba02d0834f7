package com.hydralog.backend.common.time;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Slf4j
@Component
public class ClientTimeZoneResolver {

    public static final String HEADER = "X-Client-Timezone";

    /** Absent or unparseable zone ids fall back to UTC. */
    public ZoneId resolve(String tzHeader) {
        if (tzHeader == null || tzHeader.isBlank()) return ZoneOffset.UTC;
        try {
            return ZoneId.of(tzHeader.trim());
        } catch (DateTimeException e) {
            log.debug("invalid client timezone '{}', using UTC", tzHeader);
            return ZoneOffset.UTC;
        }
    }
}
