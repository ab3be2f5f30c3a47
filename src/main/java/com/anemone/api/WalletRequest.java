package com.anemone.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record WalletRequest(
        @NotBlank @Pattern(regexp = "^0x[0-9a-fA-F]+$", message = "must be a 0x-prefixed hex address") String address
) {
}
