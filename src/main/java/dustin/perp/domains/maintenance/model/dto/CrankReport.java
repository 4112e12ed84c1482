package dustin.perp.domains.maintenance.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 유지보수 크랭크 집계
 * Maintenance Crank Report
 */
@Data
@NoArgsConstructor
@Schema(description = "유지보수 크랭크 실행 결과")
public class CrankReport {

    private int fundingUpdated;
    private int liquidated;
    private int ordersFilled;
    private int ordersReleased;
    private int receiptsSettled;
    @Schema(description = "개별 항목 실패 수 (로그 참조)")
    private int failures;

    public void merge(CrankReport other) {
        fundingUpdated += other.fundingUpdated;
        liquidated += other.liquidated;
        ordersFilled += other.ordersFilled;
        ordersReleased += other.ordersReleased;
        receiptsSettled += other.receiptsSettled;
        failures += other.failures;
    }
}
