package fr.lapetina.kvrouter.domain.prefix;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Splits a prompt into fixed-size UTF-8 byte chunks and hashes each chunk to 64 bits.
 *
 * The last chunk may be shorter. An empty prompt has no chunks. Chunk boundaries are byte
 * offsets, so a multi-byte character may straddle two chunks; both sides hash consistently.
 */
public final class ChunkHasher {

    public static final int DEFAULT_CHUNK_SIZE = 128;

    private static final HashFunction HASH = Hashing.murmur3_128();

    private final int chunkSize;

    public ChunkHasher(int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public ChunkHasher() {
        this(DEFAULT_CHUNK_SIZE);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public long[] hash(String prompt) {
        byte[] bytes = prompt.getBytes(StandardCharsets.UTF_8);
        int chunks = (bytes.length + chunkSize - 1) / chunkSize;
        long[] hashes = new long[chunks];
        for (int i = 0; i < chunks; i++) {
            int offset = i * chunkSize;
            int length = Math.min(chunkSize, bytes.length - offset);
            hashes[i] = HASH.hashBytes(bytes, offset, length).asLong();
        }
        return hashes;
    }
}
