package dustin.perp.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * 엔진 설정
 * Engine Properties
 *
 * 역할:
 * - 관리자/크랭커 계정
 * - 오라클 가격 허용 지연
 * - 유지보수 스케줄러 스위치와 작업 예산
 * - Kafka 이벤트 발행 스위치
 * - 시작 시 생성할 마켓 정의 (bootstrap)
 *
 * 설정 방법:
 * - application.yml의 perp.* 항목
 * - 환경변수로 오버라이드 가능 (예: PERP_MAX_STALENESS_MS)
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "perp")
public class EngineProperties {

    /**
     * 관리자 계정 (최소 1명)
     */
    private List<String> admins = new ArrayList<>(List.of("admin"));

    /**
     * 매칭/receipt 정산 크랭커 계정
     */
    private List<String> crankers = new ArrayList<>();

    /**
     * 오라클 가격 허용 지연 (ms)
     */
    private long maxStalenessMs = 60_000L;

    private Scheduler scheduler = new Scheduler();

    private Kafka kafka = new Kafka();

    private Bootstrap bootstrap = new Bootstrap();

    @Data
    public static class Scheduler {
        /**
         * 스케줄러가 엔진을 호출할 때 사용하는 계정 (크랭커 권한 필요)
         */
        private String operator = "maintenance-bot";
        private boolean fundingEnabled = false;
        private boolean liquidationEnabled = false;
        private boolean matchingEnabled = false;
        private boolean receiptSettlementEnabled = false;
        private String fundingCron = "0 * * * * *";
        private long crankIntervalMs = 5_000L;
        /**
         * 한 번의 매칭/정산 호출에서 처리할 최대 항목 수
         */
        private int maxOps = 50;
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;
        private String topic = "perp-engine-events";
    }

    @Data
    public static class Bootstrap {
        private boolean enabled = false;
        private String lpToken = "PLP";
        private String quoteToken = "USDC";
        private long protocolFeeShareBp = 1_000L;
        private List<CollateralToken> tokens = new ArrayList<>();
        private List<Symbol> symbols = new ArrayList<>();
    }

    /**
     * 풀 담보 토큰 정의
     */
    @Data
    public static class CollateralToken {
        private String token;
        private int decimal;
        private String oracleId;
        private int oracleDecimal = 8;
        private long borrowRatePerInterval;
        private long borrowIntervalMs = 3_600_000L;
        private long initialLiquidity;
    }

    /**
     * 심볼 정의 (MarketConfig 값과 동일한 스케일)
     */
    @Data
    public static class Symbol {
        private String baseToken;
        private int sizeDecimal;
        private String oracleId;
        private int oracleDecimal = 8;
        private long maxLeverageMbp;
        private long optionCollateralMaxLeverageMbp;
        private long minSize;
        private long lotSize;
        private long baseTradingFeeMbp;
        private long maxTradingFeeMbp;
        private long allocatedExposureMbp;
        private long basicFundingRate;
        private long fundingIntervalMs;
        private long maintenanceMarginBp;
        private long optionMaintenanceMarginBp;
        private long maxOpenInterest;
    }
}
