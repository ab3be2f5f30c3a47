package com.anemone.api;

import jakarta.validation.constraints.NotBlank;

public record ProfileInitRequest(
        @NotBlank String roleId,
        @NotBlank String packageId
) {
}
