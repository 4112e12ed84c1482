package dustin.perp.domains.engine.port;

import java.util.Objects;

/**
 * 옵션 볼트 bid receipt
 * Option vault bid receipt (immutable handle)
 */
public final class BidReceipt {

    private final String receiptId;
    private final long vaultIndex;
    private final long shares;

    public BidReceipt(String receiptId, long vaultIndex, long shares) {
        this.receiptId = Objects.requireNonNull(receiptId, "receiptId");
        this.vaultIndex = vaultIndex;
        this.shares = shares;
    }

    public String getReceiptId() {
        return receiptId;
    }

    public long getVaultIndex() {
        return vaultIndex;
    }

    public long getShares() {
        return shares;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return receiptId.equals(((BidReceipt) o).receiptId);
    }

    @Override
    public int hashCode() {
        return receiptId.hashCode();
    }

    @Override
    public String toString() {
        return "BidReceipt{" + receiptId + ", vault=" + vaultIndex + ", shares=" + shares + "}";
    }
}
