package dustin.perp.shared.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import dustin.perp.domains.engine.Payouts;
import dustin.perp.domains.engine.port.BidReceipt;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계정으로 입금되지 않은 지급분
 * Payouts returned directly to the caller
 *
 * 계정이 있는 사용자의 토큰은 이미 계정에 입금되어 여기 포함되지 않음
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "직접 반환된 토큰/receipt (사용자별)")
public class PayoutResponse {

    @Schema(description = "사용자 → 토큰 → 수량")
    private Map<String, Map<String, Long>> tokens;

    @Schema(description = "사용자 → receipt id 목록")
    private Map<String, List<String>> receipts;

    public static PayoutResponse from(Payouts payouts) {
        Map<String, Map<String, Long>> tokens = new LinkedHashMap<>();
        Map<String, List<String>> receipts = new LinkedHashMap<>();
        for (String user : payouts.users()) {
            Map<String, Long> owed = payouts.tokensOf(user);
            if (!owed.isEmpty()) {
                tokens.put(user, owed);
            }
            List<BidReceipt> returned = payouts.receiptsOf(user);
            if (!returned.isEmpty()) {
                receipts.put(user, returned.stream().map(BidReceipt::getReceiptId).collect(Collectors.toList()));
            }
        }
        return PayoutResponse.builder().tokens(tokens).receipts(receipts).build();
    }
}
