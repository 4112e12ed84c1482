package dustin.perp.domains.engine.order;

import java.util.ArrayList;
import java.util.List;

import dustin.perp.domains.engine.position.FillOutcome;
import lombok.Getter;
import lombok.ToString;

/**
 * 매칭 결과
 * Match Result
 *
 * 한 번의 매칭 호출(가격 레벨 또는 버킷 전체)에서 처리된 내역
 * - processed: 작업 예산을 소비한 주문 수
 * - filled: 체결된 주문
 * - releasedOrderIds: 연결 포지션이 사라져 환불된 주문
 * - requeued: 다시 주문장에 넣은 주문 수 (예산 초과분 + 체결 불가)
 */
@Getter
@ToString
public class MatchResult {

    private int processed;
    private int requeued;
    private final List<FillOutcome> fills = new ArrayList<>();
    private final List<Long> filledOrderIds = new ArrayList<>();
    private final List<Long> releasedOrderIds = new ArrayList<>();
    private final List<Long> blockedOrderIds = new ArrayList<>();

    void recordFill(long orderId, FillOutcome outcome) {
        processed++;
        filledOrderIds.add(orderId);
        fills.add(outcome);
    }

    void recordRelease(long orderId) {
        processed++;
        releasedOrderIds.add(orderId);
    }

    void recordBlocked(long orderId) {
        processed++;
        blockedOrderIds.add(orderId);
    }

    void addRequeued(int count) {
        requeued += count;
    }

    void merge(MatchResult other) {
        processed += other.processed;
        requeued += other.requeued;
        fills.addAll(other.fills);
        filledOrderIds.addAll(other.filledOrderIds);
        releasedOrderIds.addAll(other.releasedOrderIds);
        blockedOrderIds.addAll(other.blockedOrderIds);
    }

    public int filledCount() {
        return filledOrderIds.size();
    }
}
