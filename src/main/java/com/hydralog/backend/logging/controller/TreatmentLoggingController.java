package com.hydralog.backend.logging.controller;

import com.hydralog.backend.auth.security.AuthContext;
import com.hydralog.backend.common.time.ClientTimeZoneResolver;
import com.hydralog.backend.logging.dto.FluidSessionRequest;
import com.hydralog.backend.logging.dto.MedicationSessionRequest;
import com.hydralog.backend.logging.dto.QuickLogResponse;
import com.hydralog.backend.logging.dto.SubmissionResponse;
import com.hydralog.backend.logging.model.MedicationSession;
import com.hydralog.backend.logging.service.OfflineAwareLoggingService;
import com.hydralog.backend.logging.service.TreatmentLoggingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.ZoneId;
import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/treatments/{petId}")
public class TreatmentLoggingController {

    private final AuthContext auth;
    private final ClientTimeZoneResolver tz;
    private final OfflineAwareLoggingService submissions;
    private final TreatmentLoggingService logging;

    @PostMapping("/medications")
    public ResponseEntity<SubmissionResponse> logMedication(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @PathVariable String petId,
            @RequestParam(defaultValue = "false") boolean background,
            @Valid @RequestBody MedicationSessionRequest req
    ) {
        Long uid = auth.requireUserId();
        return respond(SubmissionResponse.of(submissions.logMedicationSession(
                uid, petId, tz.resolve(clientTz), req.toSession(uid, petId, null), background)), HttpStatus.CREATED);
    }

    @PostMapping("/fluids")
    public ResponseEntity<SubmissionResponse> logFluid(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @PathVariable String petId,
            @RequestParam(defaultValue = "false") boolean background,
            @Valid @RequestBody FluidSessionRequest req
    ) {
        Long uid = auth.requireUserId();
        return respond(SubmissionResponse.of(submissions.logFluidSession(
                uid, petId, tz.resolve(clientTz), req.toSession(uid, petId, null), background)), HttpStatus.CREATED);
    }

    @PutMapping("/medications/{sessionId}")
    public ResponseEntity<SubmissionResponse> updateMedication(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @PathVariable String petId,
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "false") boolean background,
            @Valid @RequestBody MedicationSessionRequest req
    ) {
        Long uid = auth.requireUserId();
        return respond(SubmissionResponse.of(submissions.updateMedicationSession(
                uid, petId, tz.resolve(clientTz), req.toSession(uid, petId, sessionId), background)), HttpStatus.OK);
    }

    @PutMapping("/fluids/{sessionId}")
    public ResponseEntity<SubmissionResponse> updateFluid(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @PathVariable String petId,
            @PathVariable String sessionId,
            @RequestParam(defaultValue = "false") boolean background,
            @Valid @RequestBody FluidSessionRequest req
    ) {
        Long uid = auth.requireUserId();
        return respond(SubmissionResponse.of(submissions.updateFluidSession(
                uid, petId, tz.resolve(clientTz), req.toSession(uid, petId, sessionId), background)), HttpStatus.OK);
    }

    @DeleteMapping("/medications/{sessionId}")
    public ResponseEntity<Void> deleteMedication(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @PathVariable String petId,
            @PathVariable String sessionId
    ) {
        logging.deleteMedicationSession(auth.requireUserId(), petId, tz.resolve(clientTz), sessionId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/fluids/{sessionId}")
    public ResponseEntity<Void> deleteFluid(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @PathVariable String petId,
            @PathVariable String sessionId
    ) {
        logging.deleteFluidSession(auth.requireUserId(), petId, tz.resolve(clientTz), sessionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/quick-log")
    public ResponseEntity<QuickLogResponse> quickLog(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @PathVariable String petId,
            @RequestParam(defaultValue = "false") boolean background
    ) {
        QuickLogResponse body = QuickLogResponse.of(submissions.quickLogAllTreatments(
                auth.requireUserId(), petId, tz.resolve(clientTz), background));
        HttpStatus status = "QUEUED".equals(body.status()) ? HttpStatus.ACCEPTED : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(body);
    }

    @GetMapping("/medications/today")
    public List<MedicationSession> todaysMedications(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @PathVariable String petId,
            @RequestParam(required = false) String name
    ) {
        ZoneId zone = tz.resolve(clientTz);
        return logging.getTodaysMedicationSessions(auth.requireUserId(), petId, zone, name);
    }

    private static ResponseEntity<SubmissionResponse> respond(SubmissionResponse body, HttpStatus logged) {
        HttpStatus status = "QUEUED".equals(body.status()) ? HttpStatus.ACCEPTED : logged;
        return ResponseEntity.status(status).body(body);
    }
}
