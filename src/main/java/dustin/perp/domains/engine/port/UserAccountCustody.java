package dustin.perp.domains.engine.port;

/**
 * 사용자 계정 보관소 (선택)
 * User account custody collaborator
 *
 * 계정이 있는 사용자에게는 환불/지급을 입금하고,
 * 계정이 없는 사용자에게는 호출 결과로 직접 돌려줌
 */
public interface UserAccountCustody {

    boolean hasAccount(String user);

    void deposit(String user, String token, long amount);

    /**
     * @throws dustin.perp.domains.engine.error.EngineException 잔고 부족 시 INSUFFICIENT_BALANCE
     */
    long withdraw(String user, String token, long amount);

    long balanceOf(String user, String token);
}
