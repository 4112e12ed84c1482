package dustin.perp.domains.admin.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 옵션 볼트 생성 요청 DTO
 * Option Vault Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "옵션 볼트 생성")
public class VaultRequest {

    @NotNull
    @Schema(description = "볼트 번호", example = "1", required = true)
    private Long vaultIndex;

    @NotBlank
    @Schema(description = "bid 토큰 (풀 담보 토큰이어야 함)", example = "USDC", required = true)
    private String bidToken;

    @NotNull
    @Schema(description = "만기 (ms)", required = true)
    private Long expiryMs;

    @PositiveOrZero
    @Schema(description = "share당 내재가치 (bid 토큰, 1e9 share 기준)", example = "1000000")
    private long valuePerShare;
}
