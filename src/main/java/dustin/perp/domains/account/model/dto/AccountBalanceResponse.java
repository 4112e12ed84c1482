package dustin.perp.domains.account.model.dto;

import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계정 잔고 응답
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "사용자 계정 잔고")
public class AccountBalanceResponse {

    @Schema(description = "사용자", example = "alice")
    private String userId;

    @Schema(description = "토큰별 잔고 (토큰 최소 단위)")
    private Map<String, Long> balances;
}
