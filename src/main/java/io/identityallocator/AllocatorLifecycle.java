package io.identityallocator;

import io.identityallocator.allocator.IdentityAllocatorManager;
import io.identityallocator.allocator.IdentityAllocatorOwner;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ties the allocator's init/close to the application context.
 */
@Slf4j
@Component
public class AllocatorLifecycle {

    private final IdentityAllocatorManager allocator;
    private final IdentityAllocatorOwner owner;

    public AllocatorLifecycle(IdentityAllocatorManager allocator, IdentityAllocatorOwner owner) {
        this.allocator = allocator;
        this.owner = owner;
    }

    @PostConstruct
    public void start() {
        try {
            allocator.init(owner);
        } catch (Exception e) {
            log.error("Failed to initialize identity allocator: {}", e.getMessage(), e);
            throw new RuntimeException("Identity allocator initialization failed", e);
        }
    }

    @PreDestroy
    public void stop() {
        if (allocator.isInitialized()) {
            allocator.close();
        }
    }
}
