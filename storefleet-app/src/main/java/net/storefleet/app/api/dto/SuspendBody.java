package net.storefleet.app.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SuspendBody(@NotBlank String reason, boolean automatic) { }
