package dustin.perp.domains.engine.fee;

import lombok.Getter;

/**
 * 동적 수수료 곡선 파라미터
 * Dynamic trading fee curve
 *
 * - baseFeeMbp: 불균형을 늘리지 않는 체결의 수수료
 * - maxFeeMbp: 노출 예산을 모두 소진하는 체결의 수수료
 * - allocatedExposureMbp: 풀 TVL 대비 허용 불균형 비율
 */
@Getter
public final class FeeCurve {

    private final long baseFeeMbp;
    private final long maxFeeMbp;
    private final long allocatedExposureMbp;

    public FeeCurve(long baseFeeMbp, long maxFeeMbp, long allocatedExposureMbp) {
        if (baseFeeMbp < 0 || maxFeeMbp < baseFeeMbp || allocatedExposureMbp < 0) {
            throw new IllegalArgumentException("Invalid fee curve: base=" + baseFeeMbp
                    + ", max=" + maxFeeMbp + ", exposure=" + allocatedExposureMbp);
        }
        this.baseFeeMbp = baseFeeMbp;
        this.maxFeeMbp = maxFeeMbp;
        this.allocatedExposureMbp = allocatedExposureMbp;
    }

    @Override
    public String toString() {
        return "FeeCurve{base=" + baseFeeMbp + ", max=" + maxFeeMbp + ", exposure=" + allocatedExposureMbp + "}";
    }
}
