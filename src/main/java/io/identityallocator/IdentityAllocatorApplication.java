package io.identityallocator;

import io.etcd.jetcd.Client;
import io.identityallocator.allocator.IdentityAllocatorManager;
import io.identityallocator.allocator.IdentityAllocatorOwner;
import io.identityallocator.allocator.NodeAllocatorOwner;
import io.identityallocator.backend.AllocatorBackendFactory;
import io.identityallocator.backend.etcd.EtcdAllocatorBackendFactory;
import io.identityallocator.config.IdentityAllocatorConfig;
import io.identityallocator.identity.ReservedIdentities;
import io.identityallocator.metrics.MetricsProvider;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * Spring Boot entry point running the identity allocator as a node-local service.
 */
@Slf4j
@SpringBootApplication
public class IdentityAllocatorApplication {

    public static void main(String[] args) {
        log.info("Starting Identity Allocator");

        try {
            SpringApplication.run(IdentityAllocatorApplication.class, args);
            log.info("Identity Allocator started successfully");
        } catch (Exception e) {
            log.error("Failed to start Identity Allocator: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public IdentityAllocatorConfig config() {
        IdentityAllocatorConfig config = new IdentityAllocatorConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean(destroyMethod = "close")
    public Client etcdClient(IdentityAllocatorConfig config) {
        log.info("Connecting to etcd at {}", String.join(", ", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public AllocatorBackendFactory allocatorBackendFactory(Client etcdClient) {
        return new EtcdAllocatorBackendFactory(etcdClient);
    }

    @Bean
    public ReservedIdentities reservedIdentities() {
        return new ReservedIdentities();
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry registry, IdentityAllocatorConfig config) {
        return new MetricsProvider(registry, config.getNodeName());
    }

    @Bean
    public IdentityAllocatorOwner identityAllocatorOwner(IdentityAllocatorConfig config) {
        return new NodeAllocatorOwner(config.getNodeName());
    }

    @Bean
    public IdentityAllocatorManager identityAllocatorManager(IdentityAllocatorConfig config,
                                                             AllocatorBackendFactory allocatorBackendFactory,
                                                             ReservedIdentities reservedIdentities,
                                                             MetricsProvider metricsProvider) {
        log.info("Initializing IdentityAllocatorManager");
        return new IdentityAllocatorManager(config, allocatorBackendFactory, reservedIdentities, metricsProvider);
    }
}
