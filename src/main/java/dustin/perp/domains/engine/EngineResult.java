package dustin.perp.domains.engine;

import java.util.Collections;
import java.util.List;

import dustin.perp.domains.engine.event.EngineEvent;

/**
 * 엔진 작업 결과
 * Engine operation result
 *
 * payouts: 계정이 없는 사용자에게 직접 돌려줄 토큰/receipt
 * events: 커밋된 이벤트 (발행 순서)
 */
public class EngineResult<T> {

    private final T value;
    private final Payouts payouts;
    private final List<EngineEvent> events;

    public EngineResult(T value, Payouts payouts, List<EngineEvent> events) {
        this.value = value;
        this.payouts = payouts;
        this.events = Collections.unmodifiableList(events);
    }

    public T getValue() {
        return value;
    }

    public Payouts getPayouts() {
        return payouts;
    }

    public List<EngineEvent> getEvents() {
        return events;
    }
}
