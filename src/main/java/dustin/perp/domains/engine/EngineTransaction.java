// =====================================================
// EngineTransaction - 엔진 상태 전이 단위
// =====================================================
// 역할: 모든 공개 작업을 하나의 직렬화된 원자적 전이로 실행
//
// 처리 흐름:
// 1. 엔진 락 획득 (공정 락, 한 번에 하나의 전이)
// 2. 작업 범위의 참여 상태 checkpoint (해당 마켓/심볼, 해당 풀, 계정/볼트 변경 기록, 역할 테이블)
// 3. 작업 실행, 이벤트는 버퍼에 쌓음
// 4. 예외 발생 → 역순으로 복원 후 예외 재전파 (이벤트 폐기)
// 5. 성공 → 발행 락을 잡고 엔진 락 해제 후 리스너에 발행 (리스너 예외는 로깅만)
//    발행 락으로 커밋 순서대로 발행되며 리스너는 다음 전이를 막지 않음
// =====================================================

package dustin.perp.domains.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

import dustin.perp.domains.engine.event.EngineEvent;
import dustin.perp.domains.engine.event.EngineEventListener;
import lombok.extern.slf4j.Slf4j;

/**
 * 엔진 트랜잭션 템플릿
 * Serializable, all-or-nothing engine transition
 */
@Slf4j
public class EngineTransaction {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final ReentrantLock publishLock = new ReentrantLock(true);
    private final List<TransactionalState> participants = new CopyOnWriteArrayList<>();
    private final List<EngineEventListener> listeners = new CopyOnWriteArrayList<>();

    public void register(TransactionalState participant) {
        if (!participants.contains(participant)) {
            participants.add(participant);
        }
    }

    public void addListener(EngineEventListener listener) {
        listeners.add(listener);
    }

    /**
     * 상태 변경 작업 실행
     *
     * @param operation 로그용 작업 이름
     * @param scope 작업이 변경할 수 있는 상태 범위
     * @param work 이벤트 버퍼를 받아 결과를 반환하는 작업
     */
    public <T> T execute(String operation, TransactionScope scope, Function<List<EngineEvent>, T> work) {
        List<EngineEvent> events = new ArrayList<>();
        T result;
        lock.lock();
        try {
            List<Runnable> rollbacks = new ArrayList<>(participants.size());
            try {
                for (TransactionalState participant : participants) {
                    rollbacks.add(participant.checkpoint(scope));
                }
                result = work.apply(events);
            } catch (RuntimeException e) {
                for (int i = rollbacks.size() - 1; i >= 0; i--) {
                    rollbacks.get(i).run();
                }
                log.warn("[EngineTransaction] 작업 실패, 상태 복원: operation={}, scope={}, reason={}",
                        operation, scope, e.getMessage());
                throw e;
            } finally {
                participants.forEach(TransactionalState::release);
            }
            publishLock.lock();
        } finally {
            lock.unlock();
        }

        try {
            publish(events);
        } finally {
            publishLock.unlock();
        }
        return result;
    }

    /**
     * 읽기 전용 작업 (checkpoint 없음)
     */
    public <T> T read(Supplier<T> work) {
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private void publish(List<EngineEvent> events) {
        for (EngineEvent event : events) {
            for (EngineEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.error("[EngineTransaction] 이벤트 리스너 실패: type={}, error={}", event.getType(), e.getMessage(), e);
                }
            }
        }
    }
}
