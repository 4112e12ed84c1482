package dustin.perp.domains.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import dustin.perp.domains.engine.math.EngineMath;
import dustin.perp.domains.engine.port.BidReceipt;

/**
 * 작업 결과 지급 목록
 * Tokens and receipts owed to users by one engine operation
 *
 * 계정이 있는 사용자분은 커밋 전에 보관소로 입금되고 목록에서 빠짐
 * 나머지는 호출자에게 그대로 반환됨
 */
public class Payouts {

    private final Map<String, Map<String, Long>> tokens = new LinkedHashMap<>();
    private final Map<String, List<BidReceipt>> receipts = new LinkedHashMap<>();

    public void credit(String user, String token, long amount) {
        if (amount <= 0) {
            return;
        }
        tokens.computeIfAbsent(user, u -> new LinkedHashMap<>())
                .merge(token, amount, EngineMath::addExact);
    }

    public void returnReceipts(String user, List<BidReceipt> returned) {
        if (returned.isEmpty()) {
            return;
        }
        receipts.computeIfAbsent(user, u -> new ArrayList<>()).addAll(returned);
    }

    public long tokenAmount(String user, String token) {
        Map<String, Long> byToken = tokens.get(user);
        return byToken == null ? 0L : byToken.getOrDefault(token, 0L);
    }

    public Map<String, Long> tokensOf(String user) {
        Map<String, Long> byToken = tokens.get(user);
        return byToken == null ? Collections.emptyMap() : Collections.unmodifiableMap(byToken);
    }

    public List<BidReceipt> receiptsOf(String user) {
        List<BidReceipt> list = receipts.get(user);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public Set<String> users() {
        Set<String> users = new LinkedHashSet<>(tokens.keySet());
        users.addAll(receipts.keySet());
        return users;
    }

    /**
     * 사용자의 토큰 지급분을 목록에서 제거하고 반환
     */
    public Map<String, Long> drainTokens(String user) {
        Map<String, Long> drained = tokens.remove(user);
        return drained == null ? Collections.emptyMap() : drained;
    }

    public boolean isEmpty() {
        Iterator<Map<String, Long>> it = tokens.values().iterator();
        while (it.hasNext()) {
            if (!it.next().isEmpty()) {
                return false;
            }
        }
        return receipts.isEmpty();
    }

    @Override
    public String toString() {
        return "Payouts{tokens=" + tokens + ", receipts=" + receipts + "}";
    }
}
