// =====================================================
// OrderBook - 심볼별 조건부 주문장
// =====================================================
// 역할: 8개 버킷에 발동 가격별로 주문을 보관
//
// 자료구조:
// 1. EnumMap<OrderBucket, TreeMap<Long, ArrayList<TradingOrder>>>
//    - 버킷: enum 인덱스 (문자열 태그 조회 없음)
//    - 가격 레벨: TreeMap (정렬, 범위 조회 O(log n))
//    - 같은 가격의 주문: ArrayList (뒤에서부터 처리, LIFO)
//
// 처리 흐름:
// 1. add: 가격 레벨 리스트 끝에 추가
// 2. popLevel: 가격 레벨 전체를 꺼냄 (매칭 대상)
// 3. requeue: 처리 못한 주문을 다시 넣음
// 4. triggeredPrices: 오라클 가격 기준 발동된 가격 레벨 목록
// =====================================================

package dustin.perp.domains.engine.order;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import dustin.perp.domains.engine.model.Side;

/**
 * 조건부 주문장
 * Conditional order book of one symbol market
 */
public class OrderBook {

    private final EnumMap<OrderBucket, TreeMap<Long, ArrayList<TradingOrder>>> buckets;

    public OrderBook() {
        this.buckets = new EnumMap<>(OrderBucket.class);
        for (OrderBucket bucket : OrderBucket.values()) {
            buckets.put(bucket, new TreeMap<>());
        }
    }

    /**
     * 주문 추가 (해당 가격 레벨의 끝)
     */
    public void add(TradingOrder order) {
        buckets.get(order.bucket())
                .computeIfAbsent(order.getTriggerPrice(), p -> new ArrayList<>())
                .add(order);
    }

    public Optional<TradingOrder> find(OrderBucket bucket, long triggerPrice, long orderId) {
        List<TradingOrder> level = buckets.get(bucket).get(triggerPrice);
        if (level == null) {
            return Optional.empty();
        }
        return level.stream().filter(o -> o.getOrderId() == orderId).findFirst();
    }

    /**
     * (가격, 주문 id)로 전체 버킷에서 주문 위치 탐색
     */
    public Optional<OrderBucket> locate(long triggerPrice, long orderId) {
        for (OrderBucket bucket : OrderBucket.values()) {
            if (find(bucket, triggerPrice, orderId).isPresent()) {
                return Optional.of(bucket);
            }
        }
        return Optional.empty();
    }

    /**
     * 주문 제거, 가격 레벨이 비면 레벨도 제거
     */
    public Optional<TradingOrder> remove(OrderBucket bucket, long triggerPrice, long orderId) {
        TreeMap<Long, ArrayList<TradingOrder>> levels = buckets.get(bucket);
        ArrayList<TradingOrder> level = levels.get(triggerPrice);
        if (level == null) {
            return Optional.empty();
        }
        Iterator<TradingOrder> it = level.iterator();
        while (it.hasNext()) {
            TradingOrder order = it.next();
            if (order.getOrderId() == orderId) {
                it.remove();
                if (level.isEmpty()) {
                    levels.remove(triggerPrice);
                }
                return Optional.of(order);
            }
        }
        return Optional.empty();
    }

    /**
     * 가격 레벨 전체를 꺼냄 (없으면 빈 리스트)
     */
    public List<TradingOrder> popLevel(OrderBucket bucket, long triggerPrice) {
        ArrayList<TradingOrder> level = buckets.get(bucket).remove(triggerPrice);
        return level == null ? new ArrayList<>() : level;
    }

    /**
     * 처리하지 못한 주문을 원래 가격 레벨에 다시 넣음 (순서 유지)
     */
    public void requeue(OrderBucket bucket, long triggerPrice, List<TradingOrder> orders) {
        if (orders.isEmpty()) {
            return;
        }
        buckets.get(bucket)
                .computeIfAbsent(triggerPrice, p -> new ArrayList<>())
                .addAll(orders);
    }

    /**
     * 오라클 가격 기준 발동된 가격 레벨 (가격 오름차순)
     */
    public List<Long> triggeredPrices(OrderBucket bucket, long oraclePrice) {
        TreeMap<Long, ArrayList<TradingOrder>> levels = buckets.get(bucket);
        NavigableMap<Long, ArrayList<TradingOrder>> range = bucket.triggersAtOrAbove()
                ? levels.tailMap(oraclePrice, true)
                : levels.headMap(oraclePrice, true);
        return new ArrayList<>(range.keySet());
    }

    public List<Long> priceLevels(OrderBucket bucket) {
        return new ArrayList<>(buckets.get(bucket).keySet());
    }

    public List<TradingOrder> orders(OrderBucket bucket) {
        List<TradingOrder> result = new ArrayList<>();
        buckets.get(bucket).values().forEach(result::addAll);
        return result;
    }

    public List<TradingOrder> allOrders() {
        List<TradingOrder> result = new ArrayList<>();
        for (OrderBucket bucket : OrderBucket.values()) {
            result.addAll(orders(bucket));
        }
        return result;
    }

    public List<TradingOrder> ordersOf(String user) {
        List<TradingOrder> result = new ArrayList<>();
        for (TradingOrder order : allOrders()) {
            if (order.getUser().equals(user)) {
                result.add(order);
            }
        }
        return result;
    }

    /**
     * 방향별 대기 주문 수량 합계
     */
    public long restingSize(Side side) {
        long total = 0;
        for (Map.Entry<OrderBucket, TreeMap<Long, ArrayList<TradingOrder>>> entry : buckets.entrySet()) {
            if (entry.getKey().getSide() != side) {
                continue;
            }
            for (List<TradingOrder> level : entry.getValue().values()) {
                for (TradingOrder order : level) {
                    total += order.getSize();
                }
            }
        }
        return total;
    }

    public int orderCount() {
        int count = 0;
        for (TreeMap<Long, ArrayList<TradingOrder>> levels : buckets.values()) {
            for (List<TradingOrder> level : levels.values()) {
                count += level.size();
            }
        }
        return count;
    }

    public boolean isEmpty() {
        return orderCount() == 0;
    }

    public OrderBook copy() {
        OrderBook copy = new OrderBook();
        for (Map.Entry<OrderBucket, TreeMap<Long, ArrayList<TradingOrder>>> entry : buckets.entrySet()) {
            TreeMap<Long, ArrayList<TradingOrder>> target = copy.buckets.get(entry.getKey());
            for (Map.Entry<Long, ArrayList<TradingOrder>> level : entry.getValue().entrySet()) {
                ArrayList<TradingOrder> orders = new ArrayList<>(level.getValue().size());
                for (TradingOrder order : level.getValue()) {
                    orders.add(order.copy());
                }
                target.put(level.getKey(), orders);
            }
        }
        return copy;
    }
}
