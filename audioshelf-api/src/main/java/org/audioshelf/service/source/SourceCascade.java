package org.audioshelf.service.source;

import java.util.List;

/**
 * The adapters consulted for missing fields, highest priority first.
 */
public record SourceCascade(List<SourceAdapter> adapters) {

    public SourceCascade {
        adapters = List.copyOf(adapters);
    }
}
