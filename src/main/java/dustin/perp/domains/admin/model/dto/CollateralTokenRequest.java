package dustin.perp.domains.admin.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 풀 담보 토큰 등록 요청 DTO
 * Collateral Token Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "풀 담보 토큰 정의")
public class CollateralTokenRequest {

    @NotBlank
    @Schema(description = "토큰", example = "USDC", required = true)
    private String token;

    @PositiveOrZero
    @Schema(description = "토큰 decimal", example = "6")
    private int decimal;

    @NotBlank
    @Schema(description = "토큰 가격 오라클 id", example = "USDC/USD", required = true)
    private String oracleId;

    @PositiveOrZero
    @Builder.Default
    @Schema(description = "오라클 가격 decimal", example = "8")
    private int oracleDecimal = 8;

    @PositiveOrZero
    @Schema(description = "구간당 차입 이자율 (1e9 스케일)", example = "10000")
    private long borrowRatePerInterval;

    @Positive
    @Builder.Default
    @Schema(description = "차입 이자 구간 (ms)", example = "3600000")
    private long borrowIntervalMs = 3_600_000L;

    @PositiveOrZero
    @Schema(description = "초기 유동성", example = "1000000000000")
    private long initialLiquidity;
}
