package com.whereq.vigil.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to start an ad-hoc scan.
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Ad-hoc scan request")
public class ScanRequest {

    @NotBlank
    @Schema(description = "IPv4 address, CIDR block, address range or hostname", example = "192.168.1.0/24")
    private String target;

    /**
     * Profile display name. Unknown names fall back to Quick.
     */
    @Builder.Default
    @Schema(description = "Scan profile", example = "Quick")
    private String profile = "Quick";
}
