package dustin.perp.domains.maintenance.scheduler;

import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import dustin.perp.config.EngineProperties;
import dustin.perp.domains.maintenance.model.dto.CrankReport;
import dustin.perp.domains.maintenance.service.MaintenanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 유지보수 스케줄러
 * Maintenance Scheduler
 *
 * 역할:
 * - 펀딩 인덱스 갱신 (cron)
 * - 청산 크랭크, 조건부 주문 매칭, 보관 receipt 정산 (fixed delay)
 *
 * 실행 조건:
 * - perp.scheduler.*-enabled=true인 작업만 실행 (기본값: 모두 꺼짐)
 * - 엔진 호출 계정: perp.scheduler.operator (크랭커 권한 자동 부여)
 *
 * 재시도:
 * - 펀딩 갱신 실패 시 최대 3회 재시도 (2초, 4초 backoff)
 * - 펀딩 갱신은 구간 전이면 no-op이므로 재시도해도 중복 적용되지 않음
 * - 최종 실패 시 @Recover에서 로깅 (다음 스케줄에서 다시 시도)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MaintenanceScheduler {

    private final MaintenanceService maintenanceService;
    private final EngineProperties properties;

    /**
     * 펀딩 인덱스 갱신
     * Funding index update
     *
     * 기본 cron: 매분 0초 (펀딩 구간 정렬은 엔진이 처리)
     */
    @Scheduled(cron = "${perp.scheduler.funding-cron:0 * * * * *}")
    @Retryable(
            retryFor = {RuntimeException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 2000, multiplier = 2)
    )
    public void updateFunding() {
        if (!properties.getScheduler().isFundingEnabled()) {
            return;
        }
        CrankReport report = maintenanceService.updateFundingForAllSymbols(properties.getScheduler().getOperator());
        if (report.getFundingUpdated() > 0) {
            log.info("[MaintenanceScheduler] 펀딩 갱신 완료: updated={}", report.getFundingUpdated());
        }
        if (report.getFailures() > 0) {
            throw new RuntimeException("펀딩 갱신 미완료: failures=" + report.getFailures());
        }
    }

    @Recover
    public void recoverUpdateFunding(RuntimeException e) {
        log.error("[MaintenanceScheduler] 펀딩 갱신 최종 실패 (다음 스케줄에서 재시도): {}", e.getMessage());
    }

    /**
     * 청산 → 매칭 → receipt 정산 크랭크
     * Liquidation, trigger-order and escrow crank
     */
    @Scheduled(fixedDelayString = "${perp.scheduler.crank-interval-ms:5000}")
    public void crank() {
        EngineProperties.Scheduler scheduler = properties.getScheduler();
        String operator = scheduler.getOperator();
        CrankReport report = new CrankReport();
        if (scheduler.isLiquidationEnabled()) {
            report.merge(maintenanceService.liquidateAll(operator));
        }
        if (scheduler.isMatchingEnabled()) {
            report.merge(maintenanceService.matchAllTriggered(operator, scheduler.getMaxOps()));
        }
        if (scheduler.isReceiptSettlementEnabled()) {
            report.merge(maintenanceService.settleAllReceipts(operator, scheduler.getMaxOps()));
        }
        if (report.getLiquidated() + report.getOrdersFilled() + report.getOrdersReleased()
                + report.getReceiptsSettled() + report.getFailures() > 0) {
            log.info("[MaintenanceScheduler] 크랭크 완료: report={}", report);
        }
    }
}
