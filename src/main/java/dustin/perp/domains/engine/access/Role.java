package dustin.perp.domains.engine.access;

/**
 * 엔진 역할
 * ADMIN: 마켓/심볼 관리, 역할 부여, 프로토콜 수수료 인출, 강제 취소
 * CRANKER: 주문 매칭, receipt 정산
 */
public enum Role {
    ADMIN,
    CRANKER
}
