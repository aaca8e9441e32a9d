package fr.lapetina.kvrouter.domain.picker;

import fr.lapetina.kvrouter.domain.model.CandidateServer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static fr.lapetina.kvrouter.domain.picker.PickerTestSupport.server;
import static fr.lapetina.kvrouter.domain.picker.PickerTestSupport.threeServers;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoundRobinCursorTest {

    @Test
    @DisplayName("should cycle through servers sorted by name")
    void cyclesSorted() {
        RoundRobinCursor cursor = new RoundRobinCursor();
        List<CandidateServer> shuffled = List.of(server("ns/c", 3), server("ns/a", 1), server("ns/b", 2));

        List<String> names = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            names.add(cursor.next(shuffled).getName());
        }

        assertThat(names).containsExactly("ns/a", "ns/b", "ns/c", "ns/a", "ns/b", "ns/c");
        assertThat(cursor.position()).isEqualTo(6);
    }

    @Test
    @DisplayName("should not modify the caller's list")
    void doesNotSort() {
        List<CandidateServer> shuffled = new ArrayList<>(List.of(server("ns/b", 2), server("ns/a", 1)));

        new RoundRobinCursor().next(shuffled);

        assertThat(shuffled).extracting(CandidateServer::getName).containsExactly("ns/b", "ns/a");
    }

    @Test
    @DisplayName("should wrap when the candidate set shrinks")
    void shrinkingSet() {
        RoundRobinCursor cursor = new RoundRobinCursor(new AtomicLong(5));

        assertThat(cursor.next(List.of(server("ns/a", 1), server("ns/b", 2))).getName()).isEqualTo("ns/b");
    }

    @Test
    @DisplayName("should survive cursor overflow")
    void overflow() {
        RoundRobinCursor cursor = new RoundRobinCursor(new AtomicLong(Long.MAX_VALUE));

        assertThat(cursor.next(threeServers())).isNotNull();
        assertThat(cursor.next(threeServers())).isNotNull();
    }

    @Test
    @DisplayName("reset restarts from the first server")
    void reset() {
        RoundRobinCursor cursor = new RoundRobinCursor();
        cursor.next(threeServers());
        cursor.next(threeServers());

        cursor.reset();

        assertThat(cursor.next(threeServers()).getName()).isEqualTo("ns/a");
    }

    @Test
    @DisplayName("should reject an empty candidate list")
    void emptyList() {
        assertThatThrownBy(() -> new RoundRobinCursor().next(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
