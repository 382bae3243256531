package io.identityallocator.identity;

import io.identityallocator.labels.Labels;
import lombok.Getter;

import static io.identityallocator.config.Constants.LOCAL_IDENTITY_FLAG;
import static io.identityallocator.config.Constants.MINIMAL_NUMERIC_IDENTITY;

/**
 * A numeric security identity and the label set it stands for.
 * Two identities are equal iff their numeric values are equal.
 */
@Getter
public final class Identity {

    private final long id;
    private final Labels labels;

    public Identity(long id, Labels labels) {
        this.id = id;
        this.labels = labels != null ? labels : Labels.empty();
    }

    /**
     * Reserved and well-known identities live below the first allocatable number.
     */
    public boolean isReserved() {
        return id > 0 && id < MINIMAL_NUMERIC_IDENTITY;
    }

    /**
     * Identities only meaningful on this node carry the local-scope flag.
     */
    public boolean isLocal() {
        return (id & LOCAL_IDENTITY_FLAG) != 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identity)) {
            return false;
        }
        return id == ((Identity) o).id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return id + " " + labels;
    }
}
