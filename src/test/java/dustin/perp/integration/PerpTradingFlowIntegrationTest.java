package dustin.perp.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import dustin.perp.domains.account.model.dto.AccountTransferRequest;
import dustin.perp.domains.account.service.AccountService;
import dustin.perp.domains.admin.model.dto.AddSymbolRequest;
import dustin.perp.domains.admin.model.dto.CollateralTokenRequest;
import dustin.perp.domains.admin.model.dto.CreateMarketRequest;
import dustin.perp.domains.admin.model.dto.OraclePriceRequest;
import dustin.perp.domains.admin.service.MarketAdminService;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.event.model.entity.EngineEventLog;
import dustin.perp.domains.event.repository.EngineEventLogRepository;
import dustin.perp.domains.maintenance.model.dto.CrankReport;
import dustin.perp.domains.maintenance.service.MaintenanceService;
import dustin.perp.domains.trading.model.dto.CreateOrderRequest;
import dustin.perp.domains.trading.model.dto.CreateOrderResponse;
import dustin.perp.domains.trading.model.dto.PositionResponse;
import dustin.perp.domains.trading.service.TradingService;

/**
 * 거래 흐름 통합 테스트
 * Trading flow through the Spring services
 *
 * 마켓 생성 → 심볼 추가 → 오라클 가격 → 계정 입금 → 주문 → 이벤트 기록
 *
 * 엔진 빈은 테스트 간 공유되므로 테스트마다 고유한 LP 토큰/오라클/사용자를 사용
 */
@SpringBootTest
@ActiveProfiles("test")
class PerpTradingFlowIntegrationTest {

    private static final String ADMIN = "admin";
    private static final String USDC = "USDC";
    private static final String BTC = "BTC";
    private static final long ONE_BTC = 1_000_000_000L;

    @Autowired
    private MarketAdminService marketAdminService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private TradingService tradingService;

    @Autowired
    private EngineEventLogRepository engineEventLogRepository;

    @Autowired
    private MaintenanceService maintenanceService;

    private String lpToken;
    private String user;
    private String btcOracle;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        lpToken = "PLP-" + suffix;
        user = "alice-" + suffix;
        String usdcOracle = "USDC/USD-" + suffix;
        btcOracle = "BTC/USD-" + suffix;

        marketAdminService.createMarket(ADMIN, CreateMarketRequest.builder()
                .lpToken(lpToken)
                .quoteToken(USDC)
                .protocolFeeShareBp(1_000L)
                .tokens(List.of(CollateralTokenRequest.builder()
                        .token(USDC)
                        .decimal(6)
                        .oracleId(usdcOracle)
                        .initialLiquidity(usdc(10_000_000L))
                        .build()))
                .build());
        marketAdminService.addSymbol(ADMIN, lpToken, AddSymbolRequest.builder()
                .baseToken(BTC)
                .sizeDecimal(9)
                .oracleId(btcOracle)
                .maxLeverageMbp(1_000_000_000L)
                .optionCollateralMaxLeverageMbp(500_000_000L)
                .minSize(1_000_000L)
                .lotSize(1_000_000L)
                .baseTradingFeeMbp(10_000L)
                .maxTradingFeeMbp(100_000L)
                .basicFundingRate(10_000_000L)
                .fundingIntervalMs(3_600_000L)
                .maintenanceMarginBp(150L)
                .optionMaintenanceMarginBp(300L)
                .maxOpenInterest(1_000L * ONE_BTC)
                .build());
        marketAdminService.pushOraclePrice(ADMIN, usdcOracle, OraclePriceRequest.builder()
                .price(price(1L))
                .build());
        marketAdminService.pushOraclePrice(ADMIN, btcOracle, OraclePriceRequest.builder()
                .price(price(10_000L))
                .build());

        accountService.openAccount(user);
        accountService.deposit(user, AccountTransferRequest.builder().token(USDC).amount(usdc(5_000L)).build());
    }

    private CreateOrderRequest.CreateOrderRequestBuilder longOrder(long dollars) {
        return CreateOrderRequest.builder()
                .lpToken(lpToken)
                .baseToken(BTC)
                .side("LONG")
                .size(ONE_BTC)
                .triggerPrice(price(dollars))
                .collateralToken(USDC)
                .collateralAmount(usdc(2_000L));
    }

    @Test
    @DisplayName("발동 가격에 도달한 주문은 즉시 체결되고 담보는 계정에서 인출")
    void immediateFillFromAccount() {
        // when
        CreateOrderResponse response = tradingService.createOrder(user, longOrder(10_000L).build());

        // then
        assertThat(response.isFilled()).isTrue();
        assertThat(response.getFill().getAction()).isEqualTo("OPENED");
        assertThat(accountService.getBalances(user).getBalances()).containsEntry(USDC, usdc(3_000L));

        List<PositionResponse> positions = tradingService.getMyPositions(user, lpToken, BTC);
        assertThat(positions).hasSize(1);
        assertThat(positions.get(0).getPositionId()).isEqualTo(response.getFill().getPositionId());

        // 이벤트는 커밋 후 DB에 기록
        List<EngineEventLog> logs = engineEventLogRepository.findByPositionIdOrderByIdAsc(response.getFill().getPositionId());
        assertThat(logs).extracting(EngineEventLog::getEventType).contains("POSITION_OPENED");
        assertThat(engineEventLogRepository.findByUserIdOrderByIdDesc(user))
                .extracting(EngineEventLog::getMarket)
                .containsOnly(lpToken);
    }

    @Test
    @DisplayName("대기 주문을 취소하면 담보가 계정으로 반환")
    void cancelRestingOrderRefundsAccount() {
        // given: $9,000 지정가 롱은 대기
        CreateOrderResponse response = tradingService.createOrder(user, longOrder(9_000L).build());
        assertThat(response.isFilled()).isFalse();
        assertThat(accountService.getBalances(user).getBalances()).containsEntry(USDC, usdc(3_000L));

        // when
        tradingService.cancelOrder(user, lpToken, BTC, price(9_000L), response.getOrderId());

        // then
        assertThat(accountService.getBalances(user).getBalances()).containsEntry(USDC, usdc(5_000L));
        assertThat(engineEventLogRepository.findByMarketAndSymbolAndEventTypeOrderByIdDesc(lpToken, BTC, "ORDER_CANCELED"))
                .hasSize(1);
    }

    @Test
    @DisplayName("잔고 부족 주문은 실패하고 잔고와 이벤트 기록은 그대로")
    void failedOrderLeavesNoTrace() {
        // when & then
        assertThatThrownBy(() -> tradingService.createOrder(user, longOrder(10_000L)
                .collateralAmount(usdc(6_000L))
                .build()))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INSUFFICIENT_BALANCE);

        assertThat(accountService.getBalances(user).getBalances()).containsEntry(USDC, usdc(5_000L));
        assertThat(tradingService.getMyPositions(user, lpToken, BTC)).isEmpty();
        assertThat(engineEventLogRepository.findByUserIdOrderByIdDesc(user)).isEmpty();
    }

    @Test
    @DisplayName("크랭크: 가격이 내려오면 대기 주문 체결, 더 내려오면 청산")
    void crankFillsThenLiquidates() {
        // given: $9,000 지정가 롱, 담보 1,010 USDC
        CreateOrderResponse order = tradingService.createOrder(user, longOrder(9_000L)
                .collateralAmount(usdc(1_010L))
                .build());
        assertThat(order.isFilled()).isFalse();

        // when: $9,000 도달 후 매칭 크랭크
        marketAdminService.pushOraclePrice(ADMIN, btcOracle, OraclePriceRequest.builder().price(price(9_000L)).build());
        CrankReport matched = maintenanceService.matchAllTriggered("keeper", 10);

        // then
        assertThat(matched.getOrdersFilled()).isGreaterThanOrEqualTo(1);
        List<PositionResponse> positions = tradingService.getMyPositions(user, lpToken, BTC);
        assertThat(positions).hasSize(1);

        // when: 담보가 거의 소진되는 가격에서 청산 크랭크
        marketAdminService.pushOraclePrice(ADMIN, btcOracle, OraclePriceRequest.builder().price(price(8_000L)).build());
        CrankReport liquidated = maintenanceService.liquidateAll("keeper");

        // then
        assertThat(liquidated.getLiquidated()).isGreaterThanOrEqualTo(1);
        assertThat(tradingService.getMyPositions(user, lpToken, BTC)).isEmpty();
        assertThat(engineEventLogRepository.findByMarketAndSymbolAndEventTypeOrderByIdDesc(lpToken, BTC,
                "POSITION_LIQUIDATED"))
                .extracting(EngineEventLog::getPositionId)
                .containsExactly(positions.get(0).getPositionId());
    }

    @Test
    @DisplayName("크랭커가 아니면 수동 매칭 불가")
    void matchRequiresCranker() {
        assertThatThrownBy(() -> maintenanceService.requireCranker(user))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.UNAUTHORIZED);
    }

    @Test
    @DisplayName("관리자가 아니면 마켓 생성 불가")
    void nonAdminCannotCreateMarket() {
        assertThatThrownBy(() -> marketAdminService.createMarket(user, CreateMarketRequest.builder()
                .lpToken(lpToken + "-X")
                .quoteToken(USDC)
                .build()))
                .isInstanceOf(EngineException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.UNAUTHORIZED);
    }

    private static long usdc(long units) {
        return units * 1_000_000L;
    }

    private static long price(long dollars) {
        return dollars * 100_000_000L;
    }
}
