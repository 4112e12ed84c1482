package dustin.perp.domains.admin.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 오라클 가격 입력 요청 DTO
 * Oracle Price Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "오라클 가격 입력")
public class OraclePriceRequest {

    @NotNull
    @Positive
    @Schema(description = "가격 (오라클 decimal 자리 정수)", example = "6000000000000", required = true)
    private Long price;

    @Schema(description = "발행 시각 (ms, 생략 시 현재)")
    private Long publishedAtMs;
}
