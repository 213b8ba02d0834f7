package com.hydralog.backend.logging.controller;

import com.hydralog.backend.auth.security.AuthContext;
import com.hydralog.backend.common.time.ClientTimeZoneResolver;
import com.hydralog.backend.logging.dto.MonthlySummaryView;
import com.hydralog.backend.logging.dto.SummaryView;
import com.hydralog.backend.logging.service.TreatmentSummaryService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/treatments/{petId}/summaries")
public class TreatmentSummaryController {

    private final AuthContext auth;
    private final ClientTimeZoneResolver tz;
    private final TreatmentSummaryService summaries;

    @GetMapping("/today")
    public SummaryView today(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @PathVariable String petId
    ) {
        return summaries.getTodaySummary(auth.requireUserId(), petId, tz.resolve(clientTz));
    }

    @GetMapping("/daily")
    public SummaryView daily(
            @PathVariable String petId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return summaries.getDailySummary(auth.requireUserId(), petId, date);
    }

    @GetMapping("/weekly")
    public SummaryView weekly(
            @PathVariable String petId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return summaries.getWeeklySummary(auth.requireUserId(), petId, date);
    }

    @GetMapping("/monthly")
    public MonthlySummaryView monthly(
            @PathVariable String petId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return summaries.getMonthlySummary(auth.requireUserId(), petId, date);
    }
}
