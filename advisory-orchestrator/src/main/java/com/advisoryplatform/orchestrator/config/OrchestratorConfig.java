package com.advisoryplatform.orchestrator.config;

import com.advisoryplatform.common.consensus.ConsensusAdvisor;
import com.advisoryplatform.common.consensus.SoftmaxConsensusAdvisor;
import com.advisoryplatform.orchestrator.acquirer.EndpointDiscovery;
import com.advisoryplatform.orchestrator.acquirer.PeerEndpoint;
import com.advisoryplatform.orchestrator.acquirer.VerdictAcquirer;
import com.advisoryplatform.orchestrator.audit.AuditMatrix;
import com.advisoryplatform.orchestrator.coordinator.KeywordPeerInferrer;
import com.advisoryplatform.orchestrator.coordinator.PeerInferrer;
import com.advisoryplatform.orchestrator.hub.StateHub;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
public class OrchestratorConfig {

    @Value("${advisory.peers.endpoints-json:}")
    private String endpointsJson;

    @Value("${advisory.peers.endpoints-file:}")
    private String endpointsFile;

    @Value("${advisory.peers.base-dir:.}")
    private String baseDir;

    @Value("${advisory.peers.default-core-name:UCM_Core_ECM}")
    private String defaultCoreName;

    @Value("${advisory.peers.default-url:http://localhost:8002/api/adjudicate}")
    private String defaultUrl;

    @Value("${advisory.peers.connect-timeout-ms:2000}")
    private int connectTimeoutMs;

    @Value("${advisory.peers.timeout-ms:5000}")
    private long peerTimeoutMs;

    @Value("${advisory.peers.deadline-grace-ms:1000}")
    private long deadlineGraceMs;

    @Value("${advisory.consensus.temperature:1.0}")
    private double temperature;

    @Value("${advisory.audit.capacity:1000}")
    private int auditCapacity;

    @Value("${advisory.hub.event-capacity:500}")
    private int eventCapacity;

    @Value("${advisory.hub.control-capacity:1000}")
    private int controlCapacity;

    @Bean
    public WebClient peerClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofMillis(peerTimeoutMs));

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ConsensusAdvisor consensusAdvisor() {
        return new SoftmaxConsensusAdvisor(temperature);
    }

    @Bean
    public EndpointDiscovery endpointDiscovery(ObjectMapper objectMapper) {
        Path base = Path.of(baseDir);
        return new EndpointDiscovery(
            endpointsJson,
            endpointsFile,
            List.of(base, base.resolve("config")),
            PeerEndpoint.of(defaultCoreName, defaultUrl),
            objectMapper);
    }

    @Bean
    public VerdictAcquirer verdictAcquirer(WebClient peerClient, EndpointDiscovery endpointDiscovery,
                                           ObjectMapper objectMapper) {
        return new VerdictAcquirer(peerClient, endpointDiscovery, objectMapper, Duration.ofMillis(deadlineGraceMs));
    }

    @Bean
    public AuditMatrix auditMatrix(ObjectMapper objectMapper, Clock clock) {
        return new AuditMatrix(auditCapacity, objectMapper, clock);
    }

    @Bean
    public StateHub stateHub(Clock clock) {
        return new StateHub(eventCapacity, controlCapacity, clock);
    }

    @Bean
    public PeerInferrer peerInferrer() {
        return new KeywordPeerInferrer();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            LoggerFactory.getLogger(OrchestratorConfig.class)
                .debug("Outbound peer request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
