package dustin.perp.domains.trading.model.dto;

import java.util.ArrayList;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 요청 DTO
 * Create Order Request DTO
 *
 * 역할:
 * - 지정가/스탑 조건부 주문 생성 요청
 * - 모든 수치는 엔진 고정소수점 정수 (size: sizeDecimal, triggerPrice: 오라클 decimal)
 *
 * 주문 조합:
 * 1. 지정가 롱: side=LONG, stopOrder=false → 오라클 가격 <= triggerPrice일 때 체결
 * 2. 지정가 숏: side=SHORT, stopOrder=false → 오라클 가격 >= triggerPrice일 때 체결
 * 3. 스탑 롱: side=LONG, stopOrder=true → 오라클 가격 >= triggerPrice일 때 체결
 * 4. 스탑 숏: side=SHORT, stopOrder=true → 오라클 가격 <= triggerPrice일 때 체결
 *
 * 담보:
 * - TOKEN: collateralToken + collateralAmount (fromAccount=true면 계정에서 인출)
 * - OPTION: collateralToken = 볼트 bid 토큰, vaultIndex + receiptIds
 *
 * 예시:
 * - "BTC 0.1개 롱, 가격이 60000 이하로 내려오면, USDC 1000 담보"
 *   → side=LONG, stopOrder=false, size=100000 (sizeDecimal 6), triggerPrice=6000000000000 (decimal 8),
 *     collateralToken=USDC, collateralAmount=1000000000 (decimal 6)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "주문 생성 요청")
public class CreateOrderRequest {

    @NotBlank(message = "LP 토큰은 필수입니다")
    @Schema(description = "마켓 LP 토큰", example = "PLP", required = true)
    private String lpToken;

    @NotBlank(message = "기초 자산은 필수입니다")
    @Schema(description = "심볼 기초 자산", example = "BTC", required = true)
    private String baseToken;

    @NotBlank(message = "방향은 필수입니다 (LONG 또는 SHORT)")
    @Schema(description = "방향: LONG 또는 SHORT", example = "LONG", required = true)
    private String side;

    @Schema(description = "스탑 주문 여부 (false면 지정가)", example = "false")
    private boolean stopOrder;

    @Schema(description = "연결 포지션 축소 전용", example = "false")
    private boolean reduceOnly;

    @NotNull(message = "주문 수량은 필수입니다")
    @Positive(message = "주문 수량은 0보다 커야 합니다")
    @Schema(description = "주문 수량 (sizeDecimal 자리 정수)", example = "100000", required = true)
    private Long size;

    @NotNull(message = "발동 가격은 필수입니다")
    @Positive(message = "발동 가격은 0보다 커야 합니다")
    @Schema(description = "발동 가격 (오라클 decimal 자리 정수)", example = "6000000000000", required = true)
    private Long triggerPrice;

    @Builder.Default
    @Schema(description = "담보 방식: TOKEN 또는 OPTION", example = "TOKEN")
    private String collateralMode = "TOKEN";

    @NotBlank(message = "담보 토큰은 필수입니다")
    @Schema(description = "담보 토큰 (OPTION이면 볼트 bid 토큰)", example = "USDC", required = true)
    private String collateralToken;

    @PositiveOrZero(message = "담보 수량은 0 이상이어야 합니다")
    @Schema(description = "토큰 담보 수량", example = "1000000000")
    private long collateralAmount;

    @Schema(description = "옵션 볼트 번호 (OPTION 담보만)")
    private Long vaultIndex;

    @Builder.Default
    @Schema(description = "bid receipt id 목록 (OPTION 담보만)")
    private List<String> receiptIds = new ArrayList<>();

    @Schema(description = "병합할 포지션 id")
    private Long linkedPositionId;

    @Builder.Default
    @Schema(description = "true면 토큰 담보를 계정 잔고에서 인출", example = "true")
    private boolean fromAccount = true;
}
