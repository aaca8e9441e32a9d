package fr.lapetina.kvrouter.domain.prefix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Approximate prefix index keyed by the chunk-hash sequence of prompts.
 *
 * Each node records the servers that were chosen for any prompt whose chunk path passes
 * through it; the root therefore records every server ever inserted. A child's set is kept
 * independently of its parent's and is intersected with the available servers at lookup time.
 *
 * One read/write lock covers the whole trie: lookups share the read lock, inserts take the
 * write lock.
 *
 * With {@code maxNodes > 0} the trie is bounded: once an insert pushes the node count past
 * the limit, the least recently inserted leaves are pruned until the count is back under
 * 90% of the limit. The root is never pruned.
 */
public final class HashTrie {

    private static final Logger log = LoggerFactory.getLogger(HashTrie.class);

    private static final double PRUNE_LOW_WATERMARK = 0.9;

    private final ChunkHasher hasher;
    private final int maxNodes;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Guarded by lock
    private final Node root = new Node(null, 0L);
    private int nodeCount = 1;
    private long tick;

    public HashTrie(ChunkHasher hasher, int maxNodes) {
        if (maxNodes < 0) {
            throw new IllegalArgumentException("maxNodes must be >= 0: " + maxNodes);
        }
        this.hasher = hasher;
        this.maxNodes = maxNodes;
    }

    public HashTrie(int chunkSize) {
        this(new ChunkHasher(chunkSize), 0);
    }

    public HashTrie() {
        this(new ChunkHasher(), 0);
    }

    /**
     * Records {@code server} on every node along the prompt's chunk path, root included.
     */
    public void insert(String prompt, String server) {
        long[] hashes = hasher.hash(prompt);

        lock.writeLock().lock();
        try {
            long now = ++tick;
            Node node = root;
            node.touch(server, now);
            for (long h : hashes) {
                Node child = node.children.get(h);
                if (child == null) {
                    child = new Node(node, h);
                    node.children.put(h, child);
                    nodeCount++;
                }
                node = child;
                node.touch(server, now);
            }

            if (maxNodes > 0 && nodeCount > maxNodes) {
                prune();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Walks the prompt's chunk path and returns the servers recorded at the deepest node whose
     * set still intersects {@code available}. Returns an empty set when nothing matches, not
     * even at the root.
     */
    public Set<String> longestPrefixMatch(String prompt, Set<String> available) {
        long[] hashes = hasher.hash(prompt);

        lock.readLock().lock();
        try {
            Node node = root;
            Set<String> matched = intersect(node.servers, available);

            for (long h : hashes) {
                Node child = node.children.get(h);
                if (child == null) {
                    break;
                }
                Set<String> candidate = intersect(child.servers, available);
                if (candidate.isEmpty()) {
                    break;
                }
                node = child;
                matched = candidate;
            }
            return matched;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int nodeCount() {
        lock.readLock().lock();
        try {
            return nodeCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getChunkSize() {
        return hasher.getChunkSize();
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            root.children.clear();
            root.servers.clear();
            nodeCount = 1;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static Set<String> intersect(Set<String> recorded, Set<String> available) {
        Set<String> result = new HashSet<>();
        for (String server : recorded) {
            if (available.contains(server)) {
                result.add(server);
            }
        }
        return result;
    }

    // Caller holds the write lock
    private void prune() {
        int target = Math.max(1, (int) (maxNodes * PRUNE_LOW_WATERMARK));
        int before = nodeCount;

        PriorityQueue<Node> leaves = new PriorityQueue<>(Comparator.comparingLong(n -> n.lastInsert));
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node.children.isEmpty() && node != root) {
                leaves.add(node);
            } else {
                node.children.values().forEach(stack::push);
            }
        }

        while (nodeCount > target && !leaves.isEmpty()) {
            Node leaf = leaves.poll();
            Node parent = leaf.parent;
            parent.children.remove(leaf.hash);
            nodeCount--;
            if (parent != root && parent.children.isEmpty()) {
                leaves.add(parent);
            }
        }

        log.debug("Prefix trie pruned: nodesBefore={}, nodesAfter={}, maxNodes={}",
                before, nodeCount, maxNodes);
    }

    private static final class Node {
        private final Node parent;
        private final long hash;
        private final Map<Long, Node> children = new HashMap<>();
        private final Set<String> servers = new HashSet<>();
        private long lastInsert;

        Node(Node parent, long hash) {
            this.parent = parent;
            this.hash = hash;
        }

        void touch(String server, long now) {
            servers.add(server);
            lastInsert = now;
        }
    }
}
