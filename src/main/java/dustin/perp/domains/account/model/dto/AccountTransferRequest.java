package dustin.perp.domains.account.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계정 입금/출금 요청
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "계정 입금/출금 요청")
public class AccountTransferRequest {

    @NotBlank
    @Schema(description = "토큰", example = "USDC")
    private String token;

    @Positive
    @Schema(description = "수량 (토큰 최소 단위)", example = "1000000000")
    private long amount;
}
