package dao.fhe.settle.service;

import jakarta.validation.constraints.NotBlank;

/** Wire form of one committee member's signature over a settlement hash. */
public record AttestationMessage(
        @NotBlank String batchId,
        @NotBlank String settlementHash,
        @NotBlank String operator,
        @NotBlank String signature
) {}
