package dustin.perp.domains.engine.access;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import dustin.perp.domains.engine.TransactionScope;
import dustin.perp.domains.engine.TransactionalState;
import dustin.perp.domains.engine.error.EngineException;
import dustin.perp.domains.engine.error.ErrorCode;

/**
 * 역할 테이블
 * Role table checked at each engine boundary
 *
 * 마지막 ADMIN은 제거할 수 없음
 * 엔진 밖 서비스에서도 조회하므로 모든 접근은 동기화
 */
public class AccessControl implements TransactionalState {

    private Map<String, EnumSet<Role>> roles = new LinkedHashMap<>();

    public AccessControl(Collection<String> admins) {
        for (String admin : admins) {
            grant(admin, Role.ADMIN);
        }
    }

    public synchronized boolean hasRole(String user, Role role) {
        EnumSet<Role> granted = user == null ? null : roles.get(user);
        return granted != null && granted.contains(role);
    }

    /**
     * 주어진 역할 중 하나라도 있어야 통과
     *
     * @throws EngineException UNAUTHORIZED
     */
    public synchronized void requireAny(String user, Role... required) {
        for (Role role : required) {
            if (hasRole(user, role)) {
                return;
            }
        }
        throw new EngineException(ErrorCode.UNAUTHORIZED, "Caller " + user + " lacks role " + Arrays.toString(required));
    }

    public synchronized void grant(String user, Role role) {
        if (user == null || user.isBlank()) {
            throw new EngineException(ErrorCode.INVALID_ARGUMENT, "User is required");
        }
        roles.computeIfAbsent(user, u -> EnumSet.noneOf(Role.class)).add(role);
    }

    public synchronized void revoke(String user, Role role) {
        if (role == Role.ADMIN && hasRole(user, Role.ADMIN) && members(Role.ADMIN).size() == 1) {
            throw new EngineException(ErrorCode.INVALID_PROCESS, "Cannot revoke the last admin");
        }
        EnumSet<Role> granted = roles.get(user);
        if (granted != null) {
            granted.remove(role);
            if (granted.isEmpty()) {
                roles.remove(user);
            }
        }
    }

    public synchronized Set<String> members(Role role) {
        Set<String> members = new TreeSet<>();
        roles.forEach((user, granted) -> {
            if (granted.contains(role)) {
                members.add(user);
            }
        });
        return members;
    }

    @Override
    public synchronized Runnable checkpoint(TransactionScope scope) {
        Map<String, EnumSet<Role>> saved = new LinkedHashMap<>();
        roles.forEach((user, granted) -> saved.put(user, EnumSet.copyOf(granted)));
        return () -> {
            synchronized (this) {
                roles = saved;
            }
        };
    }
}
