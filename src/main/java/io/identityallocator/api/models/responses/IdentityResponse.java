package io.identityallocator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.identityallocator.identity.Identity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * An identity and its labels.
 *
 * Example response:
 * <pre>
 * {
 *   "id": 256,
 *   "labels": ["k8s:app=frontend"],
 *   "is_new": true
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IdentityResponse {
    private long id;
    private List<String> labels;
    /**
     * Only set on allocation.
     */
    private Boolean isNew;

    public static IdentityResponse of(Identity identity) {
        return IdentityResponse.builder()
            .id(identity.getId())
            .labels(identity.getLabels().toStrings())
            .build();
    }

    public static IdentityResponse allocated(Identity identity, boolean isNew) {
        IdentityResponse response = of(identity);
        response.setIsNew(isNew);
        return response;
    }
}
