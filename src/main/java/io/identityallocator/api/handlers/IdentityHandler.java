package io.identityallocator.api.handlers;

import io.identityallocator.allocator.IdentityAllocatorManager;
import io.identityallocator.api.models.requests.AllocateRequest;
import io.identityallocator.api.models.responses.AllocatorStatusResponse;
import io.identityallocator.api.models.responses.ErrorResponse;
import io.identityallocator.api.models.responses.IdentityResponse;
import io.identityallocator.api.models.responses.ReleaseResponse;
import io.identityallocator.context.OperationContext;
import io.identityallocator.exceptions.AllocatorNotInitializedException;
import io.identityallocator.exceptions.OperationCancelledException;
import io.identityallocator.identity.AllocationResult;
import io.identityallocator.identity.Identity;
import io.identityallocator.labels.Labels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * REST API handler for identity allocation.
 *
 * Supported operations:
 * - POST /identities - Allocate (or reference) the identity of a label set
 * - POST /identities/_lookup - Resolve a label set without allocating
 * - GET /identities/{id} - Identity and labels for a numeric id
 * - DELETE /identities/{id} - Release one reference
 * - GET /identities/_status - Allocator lifecycle state
 */
@Slf4j
@RestController
@RequestMapping("/identities")
public class IdentityHandler {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final IdentityAllocatorManager allocator;

    public IdentityHandler(IdentityAllocatorManager allocator) {
        this.allocator = allocator;
    }

    /**
     * Allocate the identity of a label set.
     * POST /identities
     */
    @PostMapping
    public ResponseEntity<Object> allocate(@RequestBody AllocateRequest request) {
        try {
            Labels labels = parseLabels(request);
            log.info("Allocating identity for {}", labels);
            AllocationResult result = allocator.allocate(OperationContext.withTimeout(REQUEST_TIMEOUT), labels);
            return ResponseEntity.status(result.isNew() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(IdentityResponse.allocated(result.getIdentity(), result.isNew()));
        } catch (Exception e) {
            return errorResponse("allocating identity", e);
        }
    }

    /**
     * Resolve a label set to its identity without allocating one.
     * POST /identities/_lookup
     */
    @PostMapping("/_lookup")
    public ResponseEntity<Object> lookup(@RequestBody AllocateRequest request) {
        try {
            Labels labels = parseLabels(request);
            Optional<Identity> identity = allocator.lookupIdentity(labels);
            if (identity.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Identity for " + labels));
            }
            return ResponseEntity.ok(IdentityResponse.of(identity.get()));
        } catch (Exception e) {
            return errorResponse("looking up identity", e);
        }
    }

    /**
     * GET /identities/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<Object> getIdentity(@PathVariable long id) {
        Optional<Identity> identity = allocator.lookupIdentityById(id);
        if (identity.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Identity " + id));
        }
        return ResponseEntity.ok(IdentityResponse.of(identity.get()));
    }

    /**
     * Release one reference on an identity.
     * DELETE /identities/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Object> release(@PathVariable long id) {
        try {
            Optional<Identity> identity = allocator.lookupIdentityById(id);
            if (identity.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Identity " + id));
            }
            log.info("Releasing identity {}", identity.get());
            boolean lastUse = allocator.release(OperationContext.withTimeout(REQUEST_TIMEOUT), identity.get());
            return ResponseEntity.ok(ReleaseResponse.builder().acknowledged(true).id(id).lastUse(lastUse).build());
        } catch (Exception e) {
            return errorResponse("releasing identity " + id, e);
        }
    }

    /**
     * GET /identities/_status
     */
    @GetMapping("/_status")
    public ResponseEntity<Object> status() {
        return ResponseEntity.ok(AllocatorStatusResponse.builder()
            .initialized(allocator.isInitialized())
            .ready(allocator.isReady())
            .keepAliveTasks(new ArrayList<>(allocator.getKeepAliveTaskNames()))
            .build());
    }

    private Labels parseLabels(AllocateRequest request) {
        List<String> raw = request != null ? request.getLabels() : null;
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("labels must not be empty");
        }
        return Labels.parse(raw);
    }

    private ResponseEntity<Object> errorResponse(String action, Exception e) {
        if (e instanceof IllegalArgumentException) {
            log.warn("Invalid request while {}: {}", action, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest(e.getMessage()));
        }
        if (e instanceof AllocatorNotInitializedException) {
            log.warn("Allocator unavailable while {}", action);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.unavailable(e.getMessage()));
        }
        if (e instanceof OperationCancelledException) {
            log.warn("Timed out {}: {}", action, e.getMessage());
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(ErrorResponse.timeout(e.getMessage()));
        }
        log.error("Error {}: {}", action, e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
    }
}
