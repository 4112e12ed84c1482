// =====================================================
// InMemoryOptionVault - 메모리 기반 옵션 볼트
// =====================================================
// 역할: 볼트별 bid receipt 발행, 내재가치 조회, 만기 후 행사
//
// 볼트:
// - bidToken: 행사 시 지급되는 토큰
// - expiryMs: 만기 시각 (이후 receipt 행사 가능)
// - valuePerShare: share 당 bid 토큰 가치 (1e9 스케일)
//
// receipt 내재가치 = shares * valuePerShare / 1e9
// 행사된 receipt는 소멸 (다시 조회하면 RECEIPT_NOT_FOUND)
// =====================================================

package dustin.perp.domains.vault;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dustin.perp.domains.engine.TransactionScope;
import dustin.perp.domains.engine.TransactionalState;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.port.BidReceipt;
import dustin.perp.domains.engine.port.OptionVault;
import lombok.extern.slf4j.Slf4j;

/**
 * 메모리 기반 옵션 볼트
 * In-memory option vault
 */
@Slf4j
public class InMemoryOptionVault implements OptionVault, TransactionalState {

    public static final long SHARE_SCALE = 1_000_000_000L;

    private final LinkedHashMap<Long, Vault> vaults = new LinkedHashMap<>();
    private final LinkedHashMap<String, BidReceipt> liveReceipts = new LinkedHashMap<>();
    private long nextReceiptId;
    private List<BidReceipt> exercisedInTransaction;

    public synchronized void createVault(long vaultIndex, String bidToken, long expiryMs, long valuePerShare) {
        if (vaults.containsKey(vaultIndex)) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Vault already exists: " + vaultIndex);
        }
        Vault vault = new Vault();
        vault.bidToken = bidToken;
        vault.expiryMs = expiryMs;
        vault.valuePerShare = valuePerShare;
        vaults.put(vaultIndex, vault);
        log.info("[InMemoryOptionVault] 볼트 생성: vaultIndex={}, bidToken={}, expiry={}", vaultIndex, bidToken, expiryMs);
    }

    /**
     * share 당 가치 갱신 (옵션 가격 변동 반영)
     */
    public synchronized void updateValuePerShare(long vaultIndex, long valuePerShare) {
        vault(vaultIndex).valuePerShare = valuePerShare;
    }

    public synchronized BidReceipt issueReceipt(long vaultIndex, long shares) {
        vault(vaultIndex);
        if (shares <= 0) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Receipt shares must be positive");
        }
        BidReceipt receipt = new BidReceipt("receipt-" + vaultIndex + "-" + nextReceiptId++, vaultIndex, shares);
        liveReceipts.put(receipt.getReceiptId(), receipt);
        return receipt;
    }

    public synchronized BidReceipt receipt(String receiptId) {
        BidReceipt receipt = liveReceipts.get(receiptId);
        if (receipt == null) {
            throw new EngineException(ErrorCode.RECEIPT_NOT_FOUND, "Receipt not found: " + receiptId);
        }
        return receipt;
    }

    @Override
    public synchronized String bidToken(long vaultIndex) {
        return vault(vaultIndex).bidToken;
    }

    @Override
    public synchronized long intrinsicValue(BidReceipt receipt, long nowMs) {
        live(receipt);
        return EngineMath.mulDiv(receipt.getShares(), vault(receipt.getVaultIndex()).valuePerShare, SHARE_SCALE);
    }

    @Override
    public synchronized boolean isExpired(BidReceipt receipt, long nowMs) {
        return nowMs >= vault(receipt.getVaultIndex()).expiryMs;
    }

    @Override
    public synchronized long exercise(BidReceipt receipt, long nowMs) {
        live(receipt);
        if (!isExpired(receipt, nowMs)) {
            throw new EngineException(ErrorCode.INVALID_PROCESS, "Receipt not expired: " + receipt.getReceiptId());
        }
        long value = intrinsicValue(receipt, nowMs);
        BidReceipt removed = liveReceipts.remove(receipt.getReceiptId());
        if (exercisedInTransaction != null) {
            exercisedInTransaction.add(removed);
        }
        return value;
    }

    /**
     * 엔진 트랜잭션 안에서는 행사(소멸)만 일어나므로 행사된 receipt만 기록
     */
    @Override
    public synchronized Runnable checkpoint(TransactionScope scope) {
        List<BidReceipt> journal = new ArrayList<>();
        exercisedInTransaction = journal;
        return () -> {
            synchronized (this) {
                journal.forEach(receipt -> liveReceipts.put(receipt.getReceiptId(), receipt));
            }
        };
    }

    @Override
    public synchronized void release() {
        exercisedInTransaction = null;
    }

    public synchronized Map<String, BidReceipt> liveReceipts() {
        return new LinkedHashMap<>(liveReceipts);
    }

    private void live(BidReceipt receipt) {
        if (!liveReceipts.containsKey(receipt.getReceiptId())) {
            throw new EngineException(ErrorCode.RECEIPT_NOT_FOUND, "Receipt not found: " + receipt.getReceiptId());
        }
    }

    private Vault vault(long vaultIndex) {
        Vault vault = vaults.get(vaultIndex);
        if (vault == null) {
            throw new EngineException(ErrorCode.RECEIPT_NOT_FOUND, "Vault not found: " + vaultIndex);
        }
        return vault;
    }

    private static final class Vault {
        String bidToken;
        long expiryMs;
        long valuePerShare;
    }
}
