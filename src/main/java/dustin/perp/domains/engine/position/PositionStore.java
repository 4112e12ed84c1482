// =====================================================
// PositionStore - 포지션 저장소 (arena)
// =====================================================
// 역할: 안정적인 정수 id로 포지션을 보관
//
// 자료구조:
// 1. ArrayList<Position> slots
//    - 연속 저장, 순회 O(n)
// 2. HashMap<Long, Integer> index
//    - positionId → slot 위치
//    * 조회: O(1) average
//    * 삭제: 마지막 원소와 교체 후 제거 (swap-remove, O(1))
//
// 주의: 삭제 시 순서가 바뀜 (순회 순서에 의존하지 않음)
// =====================================================

package dustin.perp.domains.engine.position;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * 포지션 저장소
 * Arena of positions keyed by stable id
 */
public class PositionStore {

    private final ArrayList<Position> slots = new ArrayList<>();
    private final HashMap<Long, Integer> index = new HashMap<>();

    public void insert(Position position) {
        if (index.containsKey(position.getPositionId())) {
            throw new IllegalStateException("Duplicate position id: " + position.getPositionId());
        }
        index.put(position.getPositionId(), slots.size());
        slots.add(position);
    }

    public Optional<Position> get(long positionId) {
        Integer slot = index.get(positionId);
        return slot == null ? Optional.empty() : Optional.of(slots.get(slot));
    }

    public boolean contains(long positionId) {
        return index.containsKey(positionId);
    }

    /**
     * swap-remove
     */
    public Optional<Position> remove(long positionId) {
        Integer slot = index.remove(positionId);
        if (slot == null) {
            return Optional.empty();
        }
        int last = slots.size() - 1;
        Position removed = slots.get(slot);
        if (slot != last) {
            Position moved = slots.get(last);
            slots.set(slot, moved);
            index.put(moved.getPositionId(), slot);
        }
        slots.remove(last);
        return Optional.of(removed);
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public List<Position> all() {
        return new ArrayList<>(slots);
    }

    public List<Position> ofUser(String user) {
        List<Position> result = new ArrayList<>();
        for (Position position : slots) {
            if (position.getUser().equals(user)) {
                result.add(position);
            }
        }
        return result;
    }

    public PositionStore copy() {
        PositionStore copy = new PositionStore();
        for (Position position : slots) {
            copy.insert(position.copy());
        }
        return copy;
    }
}
