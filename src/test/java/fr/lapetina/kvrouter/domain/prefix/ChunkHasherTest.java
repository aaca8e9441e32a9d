package fr.lapetina.kvrouter.domain.prefix;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkHasherTest {

    private final ChunkHasher hasher = new ChunkHasher(8);

    @Test
    @DisplayName("prompt of exactly one chunk produces one hash")
    void exactChunkProducesOneHash() {
        assertThat(hasher.hash("abcdefgh")).hasSize(1);
    }

    @Test
    @DisplayName("one extra byte adds a second hash and keeps the first")
    void extraByteAddsSecondHash() {
        long[] one = hasher.hash("abcdefgh");
        long[] two = hasher.hash("abcdefghi");

        assertThat(two).hasSize(2);
        assertThat(two[0]).isEqualTo(one[0]);
        assertThat(two[1]).isNotEqualTo(one[0]);
    }

    @Test
    @DisplayName("empty prompt has no chunks")
    void emptyPromptHasNoChunks() {
        assertThat(hasher.hash("")).isEmpty();
    }

    @Test
    @DisplayName("hashes are order sensitive")
    void hashesAreOrderSensitive() {
        long[] forward = hasher.hash("aaaaaaaabbbbbbbb");
        long[] reversed = hasher.hash("bbbbbbbbaaaaaaaa");

        assertThat(forward[0]).isEqualTo(reversed[1]);
        assertThat(forward).isNotEqualTo(reversed);
    }

    @Test
    @DisplayName("chunks are measured in UTF-8 bytes")
    void chunksCountBytes() {
        // 4 two-byte characters fill one 8-byte chunk, the fifth starts another
        assertThat(hasher.hash("éééé")).hasSize(1);
        assertThat(hasher.hash("ééééé")).hasSize(2);
    }

    @Test
    @DisplayName("default chunk size is 128 bytes")
    void defaultChunkSize() {
        assertThat(new ChunkHasher().getChunkSize()).isEqualTo(128);
        assertThat(new ChunkHasher().hash("x".repeat(128))).hasSize(1);
        assertThat(new ChunkHasher().hash("x".repeat(129))).hasSize(2);
    }

    @Test
    @DisplayName("should reject non-positive chunk size")
    void rejectsNonPositiveChunkSize() {
        assertThatThrownBy(() -> new ChunkHasher(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
