package dustin.perp.domains.admin.model.dto;

import dustin.perp.domains.engine.market.MarketConfig;
import dustin.perp.domains.engine.market.MarketInfo;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 심볼 상태 응답 DTO
 * Symbol Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "심볼 상태와 설정")
public class SymbolResponse {

    private String baseToken;
    private boolean active;
    private int sizeDecimal;
    private Long longPositionSize;
    private Long shortPositionSize;
    private Long longOrderSize;
    private Long shortOrderSize;
    private Long lastFundingTs;
    private String cumulativeFundingIndex;
    private MarketConfig config;

    public static SymbolResponse from(String baseToken, MarketInfo info, MarketConfig config) {
        return SymbolResponse.builder()
                .baseToken(baseToken)
                .active(info.isActive())
                .sizeDecimal(info.getSizeDecimal())
                .longPositionSize(info.getUserLongPositionSize())
                .shortPositionSize(info.getUserShortPositionSize())
                .longOrderSize(info.getUserLongOrderSize())
                .shortOrderSize(info.getUserShortOrderSize())
                .lastFundingTs(info.getLastFundingTs())
                .cumulativeFundingIndex(info.getCumulativeFundingIndex().toString())
                .config(config)
                .build();
    }
}
