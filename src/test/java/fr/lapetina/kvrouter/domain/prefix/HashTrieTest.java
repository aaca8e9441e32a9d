package fr.lapetina.kvrouter.domain.prefix;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashTrieTest {

    private static final Set<String> ALL = Set.of("a", "b", "c");

    private HashTrie trie;

    @BeforeEach
    void setUp() {
        trie = new HashTrie(4);
    }

    @Nested
    @DisplayName("longestPrefixMatch")
    class LookupTests {

        @Test
        @DisplayName("should return empty on an empty trie")
        void emptyTrie() {
            assertThat(trie.longestPrefixMatch("hello world", ALL)).isEmpty();
        }

        @Test
        @DisplayName("should return the server recorded for the same prompt")
        void samePrompt() {
            trie.insert("hello world", "b");

            assertThat(trie.longestPrefixMatch("hello world", ALL)).containsExactly("b");
        }

        @Test
        @DisplayName("should follow the deepest shared chunk")
        void deepestSharedChunk() {
            trie.insert("aaaabbbbcccc", "a");
            trie.insert("aaaabbbbdddd", "b");

            assertThat(trie.longestPrefixMatch("aaaabbbbcccc", ALL)).containsExactly("a");
            assertThat(trie.longestPrefixMatch("aaaabbbbdddd", ALL)).containsExactly("b");
            assertThat(trie.longestPrefixMatch("aaaabbbbeeee", ALL)).containsExactlyInAnyOrder("a", "b");
        }

        @Test
        @DisplayName("should stop descending when the deeper set has no available server")
        void stopsAtUnavailable() {
            trie.insert("aaaabbbb", "a");
            trie.insert("aaaacccc", "b");

            assertThat(trie.longestPrefixMatch("aaaabbbb", Set.of("b", "c"))).containsExactly("b");
        }

        @Test
        @DisplayName("disjoint prompt matches only the root history")
        void disjointPromptMatchesRoot() {
            trie.insert("aaaabbbb", "a");

            assertThat(trie.longestPrefixMatch("zzzzyyyy", ALL)).containsExactly("a");
        }

        @Test
        @DisplayName("should return empty when no recorded server is available")
        void nothingAvailable() {
            trie.insert("aaaabbbb", "a");

            assertThat(trie.longestPrefixMatch("aaaabbbb", Set.of("b"))).isEmpty();
        }

        @Test
        @DisplayName("empty prompt matches the root")
        void emptyPromptMatchesRoot() {
            trie.insert("aaaa", "a");
            trie.insert("bbbb", "b");

            assertThat(trie.longestPrefixMatch("", ALL)).containsExactlyInAnyOrder("a", "b");
        }
    }

    @Nested
    @DisplayName("insert")
    class InsertTests {

        @Test
        @DisplayName("should create one node per chunk")
        void createsNodes() {
            trie.insert("aaaabbbbcc", "a");

            assertThat(trie.nodeCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("should share nodes between prompts with a common prefix")
        void sharesPrefixNodes() {
            trie.insert("aaaabbbb", "a");
            trie.insert("aaaacccc", "b");

            assertThat(trie.nodeCount()).isEqualTo(4);
        }

        @Test
        @DisplayName("clear should drop all history")
        void clearDropsHistory() {
            trie.insert("aaaabbbb", "a");
            trie.clear();

            assertThat(trie.nodeCount()).isEqualTo(1);
            assertThat(trie.longestPrefixMatch("aaaabbbb", ALL)).isEmpty();
        }
    }

    @Nested
    @DisplayName("bounded capacity")
    class PruningTests {

        @Test
        @DisplayName("should keep node count under the limit")
        void keepsUnderLimit() {
            HashTrie bounded = new HashTrie(new ChunkHasher(4), 10);

            for (int i = 0; i < 100; i++) {
                bounded.insert(String.format("%04d%04d", i, i), "a");
                assertThat(bounded.nodeCount()).isLessThanOrEqualTo(10);
            }
        }

        @Test
        @DisplayName("should evict the least recently inserted prompts first")
        void evictsOldestFirst() {
            HashTrie bounded = new HashTrie(new ChunkHasher(4), 6);

            bounded.insert("old1old2", "a");
            bounded.insert("new1new2", "b");
            bounded.insert("new3new4", "b");

            assertThat(bounded.longestPrefixMatch("new3new4", Set.of("a", "b"))).containsExactly("b");
            assertThat(bounded.nodeCount()).isLessThanOrEqualTo(6);
            // old1 path is gone, only the root history is left for it
            assertThat(bounded.longestPrefixMatch("old1old2", Set.of("a"))).containsExactly("a");
            assertThat(bounded.longestPrefixMatch("old1old2", Set.of("b"))).containsExactly("b");
        }

        @Test
        @DisplayName("should reject negative limit")
        void rejectsNegativeLimit() {
            assertThatThrownBy(() -> new HashTrie(new ChunkHasher(), -1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should stay consistent under concurrent inserts and lookups")
    void concurrentAccess() throws Exception {
        int threads = 100;
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger failures = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            String server = "s" + (i % 5);
            String prompt = "shared-prefix " + i;
            executor.submit(() -> {
                try {
                    start.await();
                    trie.longestPrefixMatch(prompt, Set.of(server));
                    trie.insert(prompt, server);
                    if (!trie.longestPrefixMatch(prompt, Set.of(server)).contains(server)) {
                        failures.incrementAndGet();
                    }
                } catch (Exception e) {
                    failures.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(failures).hasValue(0);
        assertThat(trie.longestPrefixMatch("", Set.of("s0", "s1", "s2", "s3", "s4")))
                .containsExactlyInAnyOrder("s0", "s1", "s2", "s3", "s4");
    }
}
