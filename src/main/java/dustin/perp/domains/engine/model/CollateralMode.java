package dustin.perp.domains.engine.model;

/**
 * 담보 방식
 * Collateral mode
 *
 * - TOKEN: 풀에 등록된 토큰 잔고를 담보로 사용
 * - OPTION: 옵션 볼트의 bid receipt를 담보로 사용 (가치 = 내재가치)
 */
public enum CollateralMode {
    TOKEN,
    OPTION
}
