package dustin.perp.domains.engine.event;

/**
 * 엔진 이벤트 수신자
 * Receives events after a transition has committed
 *
 * 수신자 예외는 엔진 상태에 영향을 주지 않음 (로깅만)
 */
@FunctionalInterface
public interface EngineEventListener {

    void onEvent(EngineEvent event);
}
