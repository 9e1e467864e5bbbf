package com.bftchain.networking.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

@Getter
@Setter
@Slf4j
@NoArgsConstructor
public class NetworkConfig {
    private int connectionTimeoutMs = 2000;
    private int readTimeoutMs = 2000;
    // consecutive failed sends before a peer is reported unreachable
    private int failureThreshold = 3;

    // Validator URLs: validatorId -> base URL
    private Map<String, String> nodeUrls = new LinkedHashMap<>();

    public String getNodeUrl(String nodeId) {
        String url = nodeUrls.get(nodeId);
        if (url == null) {
            url = resolveNodeUrl(nodeId);
            nodeUrls.put(nodeId, url);
            log.info("Auto-resolved URL for validator {}: {}", nodeId, url);
        }
        return url;
    }

    public String resolveNodeUrl(String nodeId) {
        return "http://" + nodeId + ":8080";
    }

    /**
     * Every known validator except the given one
     */
    public List<String> getPeerIds(String selfId) {
        List<String> peers = new ArrayList<>();
        for (String nodeId : nodeUrls.keySet()) {
            if (!nodeId.equals(selfId)) {
                peers.add(nodeId);
            }
        }
        return peers;
    }

    public RestTemplate createRestTemplate() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectionTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(requestFactory);
    }

    public void addNodeUrl(String nodeId, String url) {
        nodeUrls.put(nodeId, url);
    }
}
