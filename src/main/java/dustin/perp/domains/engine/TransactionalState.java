package dustin.perp.domains.engine;

/**
 * 트랜잭션 참여 상태
 * State that takes part in an engine transition
 *
 * checkpoint(scope)가 반환한 작업을 실행하면 범위 안의 상태가 checkpoint 시점으로 복원됨
 * 전이가 끝나면 (커밋/복원 모두) release 호출
 */
public interface TransactionalState {

    Runnable checkpoint(TransactionScope scope);

    /**
     * 변경 기록 정리
     */
    default void release() {
    }
}
