package dustin.perp.domains.admin.service;

import java.util.stream.Collectors;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import dustin.perp.config.EngineProperties;
import dustin.perp.domains.admin.model.dto.AddSymbolRequest;
import dustin.perp.domains.admin.model.dto.CollateralTokenRequest;
import dustin.perp.domains.admin.model.dto.CreateMarketRequest;
import dustin.perp.domains.engine.PerpEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 마켓 초기 구성 서비스
 * Market Bootstrap Service
 *
 * 역할:
 * - 서버 시작 시 perp.bootstrap 설정으로 마켓/심볼 생성
 * - ApplicationReadyEvent 이후 실행 (이벤트 리스너 등록 완료 상태)
 *
 * 처리 흐름:
 * 1. perp.bootstrap.enabled 확인
 * 2. 첫 번째 관리자 계정으로 마켓 생성 (담보 토큰, 초기 유동성)
 * 3. 심볼 추가
 *
 * 이미 존재하는 마켓은 건너뜀
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketBootstrapService {

    private final EngineProperties properties;
    private final PerpEngine perpEngine;
    private final MarketAdminService marketAdminService;

    @EventListener(ApplicationReadyEvent.class)
    public void bootstrapOnStartup() {
        EngineProperties.Bootstrap bootstrap = properties.getBootstrap();
        if (!bootstrap.isEnabled()) {
            return;
        }
        if (perpEngine.marketTokens().contains(bootstrap.getLpToken())) {
            log.info("[MarketBootstrapService] 마켓이 이미 존재하여 건너뜀: lpToken={}", bootstrap.getLpToken());
            return;
        }
        String admin = properties.getAdmins().get(0);
        log.info("[MarketBootstrapService] 마켓 초기 구성 시작: lpToken={}, symbols={}",
                bootstrap.getLpToken(), bootstrap.getSymbols().size());

        CreateMarketRequest market = CreateMarketRequest.builder()
                .lpToken(bootstrap.getLpToken())
                .quoteToken(bootstrap.getQuoteToken())
                .protocolFeeShareBp(bootstrap.getProtocolFeeShareBp())
                .tokens(bootstrap.getTokens().stream().map(MarketBootstrapService::toTokenRequest).collect(Collectors.toList()))
                .build();
        marketAdminService.createMarket(admin, market);

        for (EngineProperties.Symbol symbol : bootstrap.getSymbols()) {
            marketAdminService.addSymbol(admin, bootstrap.getLpToken(), toSymbolRequest(symbol));
        }
        log.info("[MarketBootstrapService] 마켓 초기 구성 완료: lpToken={}", bootstrap.getLpToken());
    }

    private static CollateralTokenRequest toTokenRequest(EngineProperties.CollateralToken token) {
        return CollateralTokenRequest.builder()
                .token(token.getToken())
                .decimal(token.getDecimal())
                .oracleId(token.getOracleId())
                .oracleDecimal(token.getOracleDecimal())
                .borrowRatePerInterval(token.getBorrowRatePerInterval())
                .borrowIntervalMs(token.getBorrowIntervalMs())
                .initialLiquidity(token.getInitialLiquidity())
                .build();
    }

    private static AddSymbolRequest toSymbolRequest(EngineProperties.Symbol symbol) {
        return AddSymbolRequest.builder()
                .baseToken(symbol.getBaseToken())
                .sizeDecimal(symbol.getSizeDecimal())
                .oracleId(symbol.getOracleId())
                .oracleDecimal(symbol.getOracleDecimal())
                .maxLeverageMbp(symbol.getMaxLeverageMbp())
                .optionCollateralMaxLeverageMbp(symbol.getOptionCollateralMaxLeverageMbp())
                .minSize(symbol.getMinSize())
                .lotSize(symbol.getLotSize())
                .baseTradingFeeMbp(symbol.getBaseTradingFeeMbp())
                .maxTradingFeeMbp(symbol.getMaxTradingFeeMbp())
                .allocatedExposureMbp(symbol.getAllocatedExposureMbp())
                .basicFundingRate(symbol.getBasicFundingRate())
                .fundingIntervalMs(symbol.getFundingIntervalMs())
                .maintenanceMarginBp(symbol.getMaintenanceMarginBp())
                .optionMaintenanceMarginBp(symbol.getOptionMaintenanceMarginBp())
                .maxOpenInterest(symbol.getMaxOpenInterest())
                .build();
    }
}
