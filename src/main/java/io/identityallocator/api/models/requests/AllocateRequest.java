package io.identityallocator.api.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request model for allocating or looking up an identity.
 *
 * Example usage:
 * <pre>
 * {
 *   "labels": ["k8s:app=frontend", "k8s:io.kubernetes.pod.namespace=shop"]
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AllocateRequest {
    /**
     * Labels in {@code [source:]key[=value]} form.
     */
    private List<String> labels;
}
