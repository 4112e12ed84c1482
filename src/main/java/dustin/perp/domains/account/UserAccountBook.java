// =====================================================
// UserAccountBook - 사용자 계정 잔고 (메모리)
// =====================================================
// 역할: 계정이 있는 사용자의 토큰 잔고 보관
//
// 자료구조:
// 1. HashMap<AccountKey, Long>
//    - (user, token) → 잔고 (토큰 최소 단위)
//    - 조회/갱신 O(1)
// 2. LinkedHashSet<String>
//    - 계정을 연 사용자 (엔진은 계정이 있는 사용자에게만 입금)
//
// 엔진 트랜잭션 참여자: checkpoint 이후 처음 바뀌는 키의 이전 값만 기록 (undo log)
// 실패 시 기록된 값으로 복원, release 시 기록 폐기
// =====================================================

package dustin.perp.domains.account;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import dustin.perp.domains.engine.TransactionScope;
import dustin.perp.domains.engine.TransactionalState;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.port.UserAccountCustody;

/**
 * 메모리 기반 사용자 계정 장부
 * In-memory user account custody
 *
 * 예시:
 * ("alice", "USDC") -> 20_000_000
 * ("bob", "SUI") -> 5_000_000_000
 */
public class UserAccountBook implements UserAccountCustody, TransactionalState {

    private final HashMap<AccountKey, Long> balances = new HashMap<>();
    private final LinkedHashSet<String> accounts = new LinkedHashSet<>();

    // 트랜잭션 중 변경 기록: 키 → 이전 잔고 (null = 없던 키), 새로 연 계정
    private Map<AccountKey, Long> undoBalances;
    private List<String> undoAccounts;

    /**
     * 계정 개설 (이미 있으면 무시)
     */
    public synchronized void openAccount(String user) {
        if (user == null || user.isBlank()) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "User is required");
        }
        if (accounts.add(user) && undoAccounts != null) {
            undoAccounts.add(user);
        }
    }

    @Override
    public synchronized boolean hasAccount(String user) {
        return accounts.contains(user);
    }

    @Override
    public synchronized void deposit(String user, String token, long amount) {
        if (!accounts.contains(user)) {
            throw new EngineException(ErrorCode.INVALID_PROCESS, "No account for user " + user);
        }
        if (amount < 0) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Deposit amount must not be negative");
        }
        AccountKey key = new AccountKey(user, token);
        remember(key);
        balances.merge(key, amount, EngineMath::addExact);
    }

    /**
     * 잔고 인출
     *
     * @return 인출 후 잔고
     * @throws EngineException 잔고 부족 시 INSUFFICIENT_BALANCE
     */
    @Override
    public synchronized long withdraw(String user, String token, long amount) {
        if (amount < 0) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "Withdraw amount must not be negative");
        }
        AccountKey key = new AccountKey(user, token);
        long available = balances.getOrDefault(key, 0L);
        if (available < amount) {
            throw new EngineException(ErrorCode.INSUFFICIENT_BALANCE,
                    String.format("Insufficient balance: user=%s, token=%s, required=%d, available=%d",
                            user, token, amount, available));
        }
        long remaining = available - amount;
        remember(key);
        balances.put(key, remaining);
        return remaining;
    }

    @Override
    public synchronized long balanceOf(String user, String token) {
        return balances.getOrDefault(new AccountKey(user, token), 0L);
    }

    /**
     * 사용자의 토큰별 잔고
     */
    public synchronized Map<String, Long> balancesOf(String user) {
        Map<String, Long> result = new LinkedHashMap<>();
        balances.forEach((key, amount) -> {
            if (key.user.equals(user)) {
                result.put(key.token, amount);
            }
        });
        return result;
    }

    @Override
    public synchronized Runnable checkpoint(TransactionScope scope) {
        Map<AccountKey, Long> journal = new HashMap<>();
        List<String> opened = new ArrayList<>();
        undoBalances = journal;
        undoAccounts = opened;
        return () -> {
            synchronized (this) {
                journal.forEach((key, before) -> {
                    if (before == null) {
                        balances.remove(key);
                    } else {
                        balances.put(key, before);
                    }
                });
                opened.forEach(accounts::remove);
            }
        };
    }

    @Override
    public synchronized void release() {
        undoBalances = null;
        undoAccounts = null;
    }

    private void remember(AccountKey key) {
        if (undoBalances != null && !undoBalances.containsKey(key)) {
            undoBalances.put(key, balances.get(key));
        }
    }

    public synchronized Set<String> accounts() {
        return new LinkedHashSet<>(accounts);
    }

    /**
     * 잔고 키: (user, token)
     */
    private static final class AccountKey {
        private final String user;
        private final String token;

        AccountKey(String user, String token) {
            this.user = user;
            this.token = token;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            AccountKey that = (AccountKey) o;
            return Objects.equals(user, that.user) && Objects.equals(token, that.token);
        }

        @Override
        public int hashCode() {
            return Objects.hash(user, token);
        }
    }
}
