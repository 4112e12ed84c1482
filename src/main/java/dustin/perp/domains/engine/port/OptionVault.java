package dustin.perp.domains.engine.port;

/**
 * 옵션 볼트
 * Option vault collaborator (bid receipts used as collateral)
 */
public interface OptionVault {

    /**
     * 볼트의 bid 토큰 (receipt 행사 시 지급되는 토큰)
     *
     * @throws dustin.perp.domains.engine.error.EngineException 볼트가 없으면 RECEIPT_NOT_FOUND
     */
    String bidToken(long vaultIndex);

    /**
     * 현재 행사 시 받을 bid 토큰 수량
     */
    long intrinsicValue(BidReceipt receipt, long nowMs);

    boolean isExpired(BidReceipt receipt, long nowMs);

    /**
     * 만기된 receipt 행사 (receipt 소멸)
     *
     * @return 지급된 bid 토큰 수량
     */
    long exercise(BidReceipt receipt, long nowMs);
}
