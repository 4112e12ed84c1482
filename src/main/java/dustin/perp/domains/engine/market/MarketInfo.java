package dustin.perp.domains.engine.market;

import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.math.SignedAmount;
import dustin.perp.domains.engine.model.Side;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 심볼 마켓 상태
 * Symbol market runtime state
 *
 * 불변식:
 * - userLong/ShortOrderSize = 해당 방향 대기 주문 수량 합계
 * - userLong/ShortPositionSize = 해당 방향 포지션 수량 합계
 * - nextPositionId, nextOrderId 는 단조 증가
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MarketInfo {

    private boolean active;
    private int sizeDecimal;

    private long userLongPositionSize;
    private long userShortPositionSize;
    private long userLongOrderSize;
    private long userShortOrderSize;

    private long nextPositionId;
    private long nextOrderId;

    private long lastFundingTs;
    @Builder.Default
    private SignedAmount cumulativeFundingIndex = SignedAmount.ZERO;
    private long previousLastFundingTs;
    @Builder.Default
    private SignedAmount previousCumulativeFundingIndex = SignedAmount.ZERO;

    public long positionSize(Side side) {
        return side == Side.LONG ? userLongPositionSize : userShortPositionSize;
    }

    public long orderSize(Side side) {
        return side == Side.LONG ? userLongOrderSize : userShortOrderSize;
    }

    public void addPositionSize(Side side, long size) {
        if (side == Side.LONG) {
            userLongPositionSize = EngineMath.addExact(userLongPositionSize, size);
        } else {
            userShortPositionSize = EngineMath.addExact(userShortPositionSize, size);
        }
    }

    public void subPositionSize(Side side, long size) {
        if (side == Side.LONG) {
            userLongPositionSize = EngineMath.subExact(userLongPositionSize, size);
        } else {
            userShortPositionSize = EngineMath.subExact(userShortPositionSize, size);
        }
    }

    public void addOrderSize(Side side, long size) {
        if (side == Side.LONG) {
            userLongOrderSize = EngineMath.addExact(userLongOrderSize, size);
        } else {
            userShortOrderSize = EngineMath.addExact(userShortOrderSize, size);
        }
    }

    public void subOrderSize(Side side, long size) {
        if (side == Side.LONG) {
            userLongOrderSize = EngineMath.subExact(userLongOrderSize, size);
        } else {
            userShortOrderSize = EngineMath.subExact(userShortOrderSize, size);
        }
    }

    public long takeNextOrderId() {
        return nextOrderId++;
    }

    public long takeNextPositionId() {
        return nextPositionId++;
    }

    public MarketInfo copy() {
        return toBuilder().build();
    }
}
