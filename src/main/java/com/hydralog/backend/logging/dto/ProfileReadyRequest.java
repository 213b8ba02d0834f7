package com.hydralog.backend.logging.dto;

import jakarta.validation.constraints.NotBlank;

public record ProfileReadyRequest(@NotBlank String petId) {
}
