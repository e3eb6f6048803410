package org.audioshelf.model.dto.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.audioshelf.model.dto.DiscardedProposal;
import org.audioshelf.model.enums.ApprovalStatus;
import org.audioshelf.model.enums.FolderPattern;

import java.util.List;

/**
 * One entry of the persisted document, keyed by entity id. Also the REST view of an entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BookEntityRecord {

    private String id;

    @JsonProperty("source_path")
    private String sourcePath;

    @JsonProperty("relative_path")
    private String relativePath;

    private FolderPattern pattern;

    private List<String> files;

    private FieldRecord author;

    private FieldRecord series;

    @JsonProperty("series_index")
    private FieldRecord seriesIndex;

    private FieldRecord title;

    @JsonProperty("cover_image_path")
    private String coverImagePath;

    private ApprovalStatus status;

    /**
     * Author and title both resolved. Derived, ignored when reading the document back.
     */
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    private boolean complete;

    @JsonProperty(value = "discarded_proposals", access = JsonProperty.Access.READ_ONLY)
    private List<DiscardedProposal> discardedProposals;
}
