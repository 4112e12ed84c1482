package dustin.perp.domains.admin.model.dto;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import dustin.perp.domains.engine.market.Market;
import dustin.perp.domains.engine.market.SymbolMarket;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 마켓 응답 DTO
 * Market Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "마켓 정보")
public class MarketResponse {

    private Long marketIndex;
    private String lpToken;
    private String quoteToken;
    private boolean active;
    private Long protocolFeeShareBp;
    private List<String> symbols;
    @Schema(description = "토큰별 누적 프로토콜 수수료")
    private Map<String, Long> protocolFees;
    @Schema(description = "정산 대기 중인 receipt 보관 기록 수")
    private int unsettledReceipts;

    public static MarketResponse from(Market market) {
        return MarketResponse.builder()
                .marketIndex(market.getMarketIndex())
                .lpToken(market.getLpToken())
                .quoteToken(market.getQuoteToken())
                .active(market.isActive())
                .protocolFeeShareBp(market.getProtocolFeeShareBp())
                .symbols(market.symbolMarkets().stream().map(SymbolMarket::getBaseToken).collect(Collectors.toList()))
                .protocolFees(market.getProtocolFees())
                .unsettledReceipts(market.getUnsettledReceipts().size())
                .build();
    }
}
