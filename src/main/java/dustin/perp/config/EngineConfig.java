package dustin.perp.config;

import java.time.Clock;
import java.util.List;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dustin.perp.domains.account.UserAccountBook;
import dustin.perp.domains.engine.PerpEngine;
import dustin.perp.domains.engine.access.AccessControl;
import dustin.perp.domains.engine.access.Role;
import dustin.perp.domains.engine.event.EngineEventListener;
import dustin.perp.domains.oracle.OracleRegistry;
import dustin.perp.domains.vault.InMemoryOptionVault;
import lombok.extern.slf4j.Slf4j;

/**
 * 엔진 빈 구성
 * Engine Configuration
 *
 * 역할:
 * - 엔진 외부 협력자 (오라클, 계정 보관소, 옵션 볼트) 생성
 * - 역할 테이블 초기화 (admins, crankers, 스케줄러 계정)
 * - PerpEngine 생성 후 이벤트 리스너 등록 (DB 기록, Kafka 발행)
 *
 * 엔진 코어는 Spring에 의존하지 않으므로 여기서 직접 new로 생성
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock engineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public OracleRegistry oracleRegistry() {
        return new OracleRegistry();
    }

    @Bean
    public UserAccountBook userAccountBook() {
        return new UserAccountBook();
    }

    @Bean
    public InMemoryOptionVault optionVault() {
        return new InMemoryOptionVault();
    }

    @Bean
    public AccessControl accessControl(EngineProperties properties) {
        AccessControl accessControl = new AccessControl(properties.getAdmins());
        for (String cranker : properties.getCrankers()) {
            accessControl.grant(cranker, Role.CRANKER);
        }
        accessControl.grant(properties.getScheduler().getOperator(), Role.CRANKER);
        log.info("[EngineConfig] 역할 초기화: admins={}, crankers={}",
                accessControl.members(Role.ADMIN), accessControl.members(Role.CRANKER));
        return accessControl;
    }

    @Bean
    public PerpEngine perpEngine(Clock engineClock,
                                 EngineProperties properties,
                                 AccessControl accessControl,
                                 UserAccountBook userAccountBook,
                                 InMemoryOptionVault optionVault,
                                 ObjectProvider<EngineEventListener> listeners) {
        PerpEngine engine = new PerpEngine(engineClock, properties.getMaxStalenessMs(), accessControl,
                userAccountBook, optionVault);
        List<EngineEventListener> ordered = listeners.orderedStream().toList();
        ordered.forEach(engine::addListener);
        log.info("[EngineConfig] PerpEngine 생성 완료: maxStalenessMs={}, listeners={}",
                properties.getMaxStalenessMs(), ordered.size());
        return engine;
    }
}
