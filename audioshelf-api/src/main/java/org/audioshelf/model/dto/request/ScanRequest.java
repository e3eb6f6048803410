package org.audioshelf.model.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanRequest {
    /**
     * Directory to scan; falls back to {@code app.library-root} when blank.
     */
    private String rootPath;
    private boolean resolve;
}
