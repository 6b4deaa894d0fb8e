package net.storefleet.app.api.dto;

import jakarta.validation.constraints.NotBlank;

public record RestoreBody(@NotBlank String snapshotId, String scope) { }
