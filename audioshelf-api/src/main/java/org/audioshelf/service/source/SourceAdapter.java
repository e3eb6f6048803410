package org.audioshelf.service.source;

import org.audioshelf.exception.SourceUnavailableException;
import org.audioshelf.model.dto.FieldProposal;
import org.audioshelf.model.dto.ProposalRequest;
import org.audioshelf.model.enums.Provenance;

import java.util.List;

/**
 * One strategy of the resolution cascade. Given the fields still missing and what is already
 * known, proposes values with a confidence. An adapter that has nothing to say returns an empty
 * list; a source that cannot be reached throws {@link SourceUnavailableException}.
 */
public interface SourceAdapter {

    List<FieldProposal> propose(ProposalRequest request) throws SourceUnavailableException;

    Provenance provenance();

    default String name() {
        return provenance().getTag();
    }
}
