package com.hydralog.backend.logging.controller;

import com.hydralog.backend.auth.security.AuthContext;
import com.hydralog.backend.common.time.ClientTimeZoneResolver;
import com.hydralog.backend.logging.context.ContextEvent;
import com.hydralog.backend.logging.context.TreatmentContextCoordinator;
import com.hydralog.backend.logging.dto.ContextStateResponse;
import com.hydralog.backend.logging.dto.ProfileReadyRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/treatments/context")
public class TreatmentContextController {

    private final AuthContext auth;
    private final ClientTimeZoneResolver tz;
    private final TreatmentContextCoordinator coordinator;

    @GetMapping
    public ContextStateResponse state() {
        return ContextStateResponse.of(coordinator.state(auth.requireUserId()));
    }

    @PostMapping("/auth-ready")
    public ContextStateResponse authReady() {
        return ContextStateResponse.of(coordinator.onEvent(new ContextEvent.AuthReady(auth.requireUserId())));
    }

    @PostMapping("/profile-ready")
    public ContextStateResponse profileReady(
            @RequestHeader(value = ClientTimeZoneResolver.HEADER, required = false) String clientTz,
            @Valid @RequestBody ProfileReadyRequest req
    ) {
        Long uid = auth.requireUserId();
        return ContextStateResponse.of(coordinator.onEvent(
                new ContextEvent.ProfileReady(uid, req.petId(), tz.resolve(clientTz))));
    }

    @PostMapping("/sign-out")
    public ContextStateResponse signOut() {
        return ContextStateResponse.of(coordinator.onEvent(new ContextEvent.SignedOut(auth.requireUserId())));
    }
}
