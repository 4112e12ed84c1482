package dustin.perp.domains.trading.model.dto;

import java.util.ArrayList;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 포지션 담보 변경 요청 DTO
 * Position Collateral Request DTO
 *
 * - 증액: TOKEN 포지션은 amount, OPTION 포지션은 receiptIds
 * - 인출: TOKEN 포지션만 가능, amount만 사용
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "포지션 담보 증액/인출 요청")
public class CollateralRequest {

    @NotBlank(message = "LP 토큰은 필수입니다")
    @Schema(description = "마켓 LP 토큰", example = "PLP", required = true)
    private String lpToken;

    @NotBlank(message = "기초 자산은 필수입니다")
    @Schema(description = "심볼 기초 자산", example = "BTC", required = true)
    private String baseToken;

    @NotBlank(message = "담보 토큰은 필수입니다")
    @Schema(description = "포지션 담보 토큰", example = "USDC", required = true)
    private String collateralToken;

    @PositiveOrZero(message = "수량은 0 이상이어야 합니다")
    @Schema(description = "토큰 수량", example = "500000000")
    private long amount;

    @Builder.Default
    @Schema(description = "추가할 bid receipt id 목록 (OPTION 포지션만)")
    private List<String> receiptIds = new ArrayList<>();

    @Builder.Default
    @Schema(description = "true면 증액분을 계정 잔고에서 인출", example = "true")
    private boolean fromAccount = true;
}
