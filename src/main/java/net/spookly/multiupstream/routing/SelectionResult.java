package net.spookly.multiupstream.routing;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Upstream selection outcome for a flow. {@code upstream} is null when no route applies.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class SelectionResult {
    public static final String NOT_LOADED = "not_loaded";
    public static final String AFFINITY = "affinity";
    public static final String MATCHED = "matched";
    public static final String WEIGHTED = "weighted";
    public static final String DEFAULT = "default";
    public static final String NO_MATCH = "no_match";

    private final UpstreamProxy upstream;
    private final ConnectionIdentity identity;
    private final String reason;

    public boolean selected() {
        return upstream != null;
    }
}
