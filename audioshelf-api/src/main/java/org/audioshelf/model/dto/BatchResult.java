package org.audioshelf.model.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatchResult {
    int total;
    int resolved;
    int incomplete;
    int failed;
    boolean cancelled;
}
