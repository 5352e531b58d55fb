package com.example.jsonapi.dispatch;

import com.example.jsonapi.common.JsonApiConstants;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Path shapes served below a resource's mount point.
 */
public enum PathTemplate {

    /** {@code /posts} */
    COLLECTION,

    /** {@code /posts/{id}} */
    MEMBER,

    /** {@code /posts/{id}/relationships/{rel}} */
    RELATIONSHIP,

    /** {@code /posts/{id}/{rel}} */
    RELATED;

    /**
     * Match the segments that follow the resource name.
     */
    public static Optional<Match> match(List<String> rest) {
        return switch (rest.size()) {
            case 0 -> Optional.of(new Match(COLLECTION, null, null));
            case 1 -> Optional.of(new Match(MEMBER, rest.get(0), null));
            case 2 -> Optional.of(new Match(RELATED, rest.get(0), rest.get(1)));
            case 3 -> JsonApiConstants.RELATIONSHIPS_SEGMENT.equals(rest.get(1))
                    ? Optional.of(new Match(RELATIONSHIP, rest.get(0), rest.get(2)))
                    : Optional.empty();
            default -> Optional.empty();
        };
    }

    public boolean hasRelationship() {
        return this == RELATIONSHIP || this == RELATED;
    }

    public record Match(PathTemplate template, @Nullable String id, @Nullable String relationship) {
    }
}
