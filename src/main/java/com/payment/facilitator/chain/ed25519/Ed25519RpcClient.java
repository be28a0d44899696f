package com.payment.facilitator.chain.ed25519;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.facilitator.chain.ChainUnavailableException;
import com.payment.facilitator.config.FacilitatorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Minimal JSON-RPC 2.0 client for Ed25519 (Solana-style) nodes. One RestTemplate per network,
 * with that network's timeout.
 */
@Slf4j
@Component
public class Ed25519RpcClient {

    private final Map<String, RestTemplate> templates = new ConcurrentHashMap<>();
    private final AtomicLong requestIds = new AtomicLong();

    /**
     * Sends one request and returns the whole response object, so callers can inspect
     * either {@code result} or {@code error}.
     *
     * @throws ChainUnavailableException on transport failure or an empty response
     */
    public JsonNode call(FacilitatorProperties.Network network, String method, List<Object> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestIds.incrementAndGet());
        body.put("method", method);
        body.put("params", params);
        JsonNode response;
        try {
            response = template(network).postForObject(network.getRpcUrl(), body, JsonNode.class);
        } catch (RestClientException e) {
            throw new ChainUnavailableException(network.getName(), method + " failed: " + e.getMessage(), e);
        }
        if (response == null) {
            throw new ChainUnavailableException(network.getName(), method + " returned an empty response");
        }
        log.debug("RPC {} on network={} -> error={}", method, network.getName(), response.has("error"));
        return response;
    }

    private RestTemplate template(FacilitatorProperties.Network network) {
        return templates.computeIfAbsent(network.getName(), name -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(network.getRpcTimeoutMs());
            factory.setReadTimeout(network.getRpcTimeoutMs());
            return new RestTemplate(factory);
        });
    }
}
