package dustin.perp.domains.account.service;

import org.springframework.stereotype.Service;

import dustin.perp.domains.account.UserAccountBook;
import dustin.perp.domains.account.model.dto.AccountBalanceResponse;
import dustin.perp.domains.account.model.dto.AccountTransferRequest;
import dustin.perp.domains.engine.PerpEngine;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 사용자 계정 서비스
 * Account Service
 *
 * 역할:
 * - 계정 개설, 입금/출금, 잔고 조회
 * - 계정이 있는 사용자는 주문 담보를 계정에서 차감하고 정산금을 계정으로 입금받음
 *
 * 주의사항:
 * - 엔진 트랜잭션과 섞이지 않도록 변경은 엔진 락 안에서 실행 (runExclusive)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final PerpEngine perpEngine;
    private final UserAccountBook userAccountBook;

    public AccountBalanceResponse openAccount(String userId) {
        perpEngine.runExclusive(() -> {
            userAccountBook.openAccount(userId);
            return null;
        });
        log.info("[AccountService] 계정 개설: userId={}", userId);
        return getBalances(userId);
    }

    public AccountBalanceResponse deposit(String userId, AccountTransferRequest request) {
        perpEngine.runExclusive(() -> {
            userAccountBook.deposit(userId, request.getToken(), request.getAmount());
            return null;
        });
        log.info("[AccountService] 입금: userId={}, token={}, amount={}", userId, request.getToken(), request.getAmount());
        return getBalances(userId);
    }

    public AccountBalanceResponse withdraw(String userId, AccountTransferRequest request) {
        long remaining = perpEngine.runExclusive(() ->
                userAccountBook.withdraw(userId, request.getToken(), request.getAmount()));
        log.info("[AccountService] 출금: userId={}, token={}, amount={}, remaining={}",
                userId, request.getToken(), request.getAmount(), remaining);
        return getBalances(userId);
    }

    public AccountBalanceResponse getBalances(String userId) {
        if (!userAccountBook.hasAccount(userId)) {
            throw new EngineException(ErrorCode.ACCOUNT_NOT_FOUND, "No account for user " + userId);
        }
        return AccountBalanceResponse.builder()
                .userId(userId)
                .balances(userAccountBook.balancesOf(userId))
                .build();
    }
}
