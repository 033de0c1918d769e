package dao.fhe.settle.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
public class IntentSubmissionRequest {

    private static final String ADDRESS = "^0x[0-9a-fA-F]{40}$";
    private static final String BYTES32 = "^0x[0-9a-fA-F]{64}$";

    @NotBlank
    @Pattern(regexp = BYTES32, message = "must be 0x-prefixed bytes32 hex")
    private String poolId;

    @NotBlank
    @Pattern(regexp = ADDRESS, message = "must be a 0x-prefixed 20-byte address")
    private String submitter;

    @NotBlank
    @Pattern(regexp = ADDRESS, message = "must be a 0x-prefixed 20-byte address")
    private String tokenIn;

    @NotBlank
    @Pattern(regexp = ADDRESS, message = "must be a 0x-prefixed 20-byte address")
    private String tokenOut;

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{1,64}$", message = "must be a 0x-prefixed ciphertext handle")
    private String ctHash;

    @NotNull
    private Integer utype;          // FHE type code

    @PositiveOrZero
    private int securityZone;

    private String proof;

    @NotNull
    private Long deadline;          // unix seconds
}
