package dustin.perp.domains.admin.model.dto;

import java.util.ArrayList;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 마켓 생성 요청 DTO
 * Create Market Request DTO
 *
 * 유동성 풀 (LP 토큰 + 담보 토큰)을 만들고 같은 LP 토큰으로 마켓을 생성
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "마켓 생성 요청")
public class CreateMarketRequest {

    @NotBlank
    @Schema(description = "LP 토큰", example = "PLP", required = true)
    private String lpToken;

    @NotBlank
    @Schema(description = "견적 토큰", example = "USDC", required = true)
    private String quoteToken;

    @PositiveOrZero
    @Max(10000)
    @Schema(description = "프로토콜 수수료 비율 (bp)", example = "1000")
    private long protocolFeeShareBp;

    @Valid
    @NotEmpty
    @Builder.Default
    private List<CollateralTokenRequest> tokens = new ArrayList<>();
}
