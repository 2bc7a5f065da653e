package com.example.aurawatch.rpc;

import com.example.aurawatch.model.AuthoritySet;
import com.example.aurawatch.model.BlockHeader;

import java.util.Optional;

/**
 * The chain operations the monitor consumes. Every call blocks until the node
 * answers and throws {@link com.example.aurawatch.exception.TransportException}
 * when it cannot. An empty result means the node has no such value.
 */
public interface ChainRpc {

    /**
     * {@code Timestamp.Now} at the best block, in milliseconds.
     */
    Optional<Long> getTimestamp();

    /**
     * {@code Timestamp.Now} as of the given block.
     */
    Optional<Long> getTimestampAt(String blockHash);

    long getSlotDuration();

    AuthoritySet getAuthorities();

    Optional<String> getBestBlockHash();

    Optional<String> getFinalizedBlockHash();

    Optional<String> getBlockHash(long blockNumber);

    Optional<BlockHeader> getHeader(String blockHash);

    /**
     * Whether the node keystore holds {@code publicKeyHex} for {@code keyType}.
     */
    boolean hasKey(String publicKeyHex, String keyType);
}
