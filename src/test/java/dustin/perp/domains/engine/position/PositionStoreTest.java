package dustin.perp.domains.engine.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.perp.domains.engine.model.Side;

/**
 * 포지션 저장소 테스트
 */
class PositionStoreTest {

    private static Position position(long id, String user) {
        return Position.builder()
                .positionId(id)
                .user(user)
                .side(Side.LONG)
                .size(1L)
                .build();
    }

    @Test
    @DisplayName("swap-remove 후에도 남은 포지션은 id로 조회됨")
    void swapRemoveKeepsIndex() {
        // given
        PositionStore store = new PositionStore();
        store.insert(position(0L, "alice"));
        store.insert(position(1L, "bob"));
        store.insert(position(2L, "carol"));

        // when
        assertThat(store.remove(0L)).isPresent();

        // then
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.contains(0L)).isFalse();
        assertThat(store.get(2L)).map(Position::getUser).contains("carol");
        assertThat(store.get(1L)).map(Position::getUser).contains("bob");
        assertThat(store.all().stream().map(Position::getPositionId).collect(Collectors.toList()))
                .containsExactly(2L, 1L);
        assertThat(store.remove(0L)).isEmpty();
    }

    @Test
    @DisplayName("같은 id 중복 삽입은 거부")
    void duplicateIdRejected() {
        PositionStore store = new PositionStore();
        store.insert(position(5L, "alice"));

        assertThatThrownBy(() -> store.insert(position(5L, "bob")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("사용자별 조회와 깊은 복사")
    void ofUserAndCopy() {
        PositionStore store = new PositionStore();
        store.insert(position(0L, "alice"));
        store.insert(position(1L, "bob"));
        store.insert(position(2L, "alice"));

        PositionStore copy = store.copy();
        copy.get(0L).orElseThrow().setSize(99L);
        copy.remove(2L);

        assertThat(store.ofUser("alice")).hasSize(2);
        assertThat(store.get(0L).orElseThrow().getSize()).isEqualTo(1L);
        assertThat(copy.size()).isEqualTo(2);
    }
}
