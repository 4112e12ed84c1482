package dustin.perp.domains.engine.error;

/**
 * 엔진 오류 분류
 * Engine error category
 *
 * HTTP 상태 매핑과 로그 레벨 결정에 사용
 */
public enum ErrorCategory {
    /** 권한 없는 호출자 */
    AUTHORIZATION,
    /** 비활성 마켓/심볼, 존재하지 않는 주문/포지션, 잘못된 처리 순서 */
    LIFECYCLE,
    /** 최소 수량, lot 정렬, 미결제약정 한도, reduce-only 규칙 */
    SIZING,
    /** 담보 부족, 레버리지 초과, 유동성 준비금 부족, 청산 판정 */
    SOLVENCY,
    /** 오라클 식별자 불일치, 오래된 가격 */
    ORACLE,
    /** 담보 토큰/옵션 bid 토큰 불일치 */
    DOMAIN,
    /** 고정소수점 연산 오버플로 */
    NUMERIC,
    /** 요청 값 자체가 잘못됨 */
    VALIDATION
}
