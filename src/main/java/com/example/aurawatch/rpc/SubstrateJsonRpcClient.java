package com.example.aurawatch.rpc;

import com.example.aurawatch.config.MonitorConfig;
import com.example.aurawatch.exception.ErrorCode;
import com.example.aurawatch.exception.TransportException;
import com.example.aurawatch.model.AuthoritySet;
import com.example.aurawatch.model.BlockHeader;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.BufferUnderflowException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * {@link ChainRpc} over Substrate JSON-RPC 2.0, sent as HTTP POST.
 */
@Component
@Slf4j
public class SubstrateJsonRpcClient implements ChainRpc {

    /** twox128("Timestamp") ++ twox128("Now"). */
    static final String TIMESTAMP_NOW_KEY =
        "0xf0c365c3cf59d671eb72da0e7a4113c49f1f0515f462cdcf84e0f1d6045dfcbb";

    private final RestTemplate restTemplate;
    private final String url;
    private final AtomicLong nextId = new AtomicLong(1);

    public SubstrateJsonRpcClient(RestTemplate restTemplate, MonitorConfig config) {
        this.restTemplate = restTemplate;
        this.url = toHttpUrl(config.getEndpoint());
    }

    /**
     * Substrate nodes serve HTTP and WebSocket on the same port.
     */
    static String toHttpUrl(String endpoint) {
        if (endpoint.startsWith("ws://")) {
            return "http://" + endpoint.substring("ws://".length());
        }
        if (endpoint.startsWith("wss://")) {
            return "https://" + endpoint.substring("wss://".length());
        }
        return endpoint;
    }

    @Override
    public Optional<Long> getTimestamp() {
        return call("state_getStorage", List.of(TIMESTAMP_NOW_KEY), this::decodeU64);
    }

    @Override
    public Optional<Long> getTimestampAt(String blockHash) {
        return call("state_getStorage", List.of(TIMESTAMP_NOW_KEY, blockHash), this::decodeU64);
    }

    @Override
    public long getSlotDuration() {
        return call("state_call", List.of("AuraApi_slot_duration", "0x"), this::decodeU64)
            .orElseThrow(() -> new TransportException(ErrorCode.MISSING_CHAIN_DATA,
                "node returned no Aura slot duration"));
    }

    @Override
    public AuthoritySet getAuthorities() {
        return call("state_call", List.of("AuraApi_authorities", "0x"),
                node -> new AuthoritySet(ScaleCodec.readAuthorities(ScaleCodec.fromHex(node.asText()))))
            .orElseGet(AuthoritySet::empty);
    }

    @Override
    public Optional<String> getBestBlockHash() {
        return call("chain_getBlockHash", List.of(), JsonNode::asText);
    }

    @Override
    public Optional<String> getFinalizedBlockHash() {
        return call("chain_getFinalizedHead", List.of(), JsonNode::asText);
    }

    @Override
    public Optional<String> getBlockHash(long blockNumber) {
        return call("chain_getBlockHash", List.of(blockNumber), JsonNode::asText);
    }

    @Override
    public Optional<BlockHeader> getHeader(String blockHash) {
        return call("chain_getHeader", List.of(blockHash), this::decodeHeader);
    }

    @Override
    public boolean hasKey(String publicKeyHex, String keyType) {
        return call("author_hasKey", List.of(publicKeyHex, keyType), JsonNode::asBoolean)
            .orElse(false);
    }

    private Long decodeU64(JsonNode node) {
        return ScaleCodec.readU64(ScaleCodec.fromHex(node.asText()));
    }

    private BlockHeader decodeHeader(JsonNode node) {
        long number = Long.decode(node.path("number").asText());
        List<String> logs = new ArrayList<>();
        for (JsonNode item : node.path("digest").path("logs")) {
            logs.add(item.asText());
        }
        OptionalLong slot = ScaleCodec.readAuraSlot(logs);
        return new BlockHeader(number, slot.isPresent() ? slot.getAsLong() : null);
    }

    private <T> Optional<T> call(String method, List<Object> params, Function<JsonNode, T> decoder) {
        JsonRpcRequest request = new JsonRpcRequest(nextId.getAndIncrement(), method, params);
        JsonRpcResponse response;
        try {
            response = restTemplate.postForObject(url, request, JsonRpcResponse.class);
        } catch (RestClientException e) {
            throw new TransportException(ErrorCode.RPC_FAILED,
                method + " RPC failed against " + url + ": " + e.getMessage(), e);
        }
        if (response == null) {
            throw new TransportException(ErrorCode.RPC_FAILED, method + " RPC returned an empty body");
        }
        if (response.getError() != null) {
            throw new TransportException(ErrorCode.RPC_ERROR_RESPONSE, String.format("%s RPC error %d: %s",
                method, response.getError().getCode(), response.getError().getMessage()));
        }
        if (!response.hasResult()) {
            log.debug("{} {} -> null", method, params);
            return Optional.empty();
        }
        try {
            T value = decoder.apply(response.getResult());
            log.debug("{} {} -> {}", method, params, value);
            return Optional.of(value);
        } catch (IllegalArgumentException | IllegalStateException | BufferUnderflowException | ArithmeticException e) {
            throw new TransportException(ErrorCode.RPC_MALFORMED_RESULT,
                method + " returned an undecodable result " + response.getResult() + ": " + e.getMessage(), e);
        }
    }
}
