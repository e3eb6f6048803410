package org.audioshelf.service.source.heuristic;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.audioshelf.config.AppProperties;
import org.audioshelf.model.dto.BookCandidate;
import org.audioshelf.model.dto.FieldProposal;
import org.audioshelf.model.dto.FieldValue;
import org.audioshelf.model.dto.ProposalRequest;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.model.enums.FolderPattern;
import org.audioshelf.model.enums.Provenance;
import org.audioshelf.service.source.SourceAdapter;
import org.audioshelf.util.FileNameUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Last resort: reads fields off file and folder names with {@link NamePatterns} and the hints
 * the grouper derived from the folder layout.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatternHeuristicAdapter implements SourceAdapter {

    private final AppProperties appProperties;

    @Override
    public Provenance provenance() {
        return Provenance.HEURISTIC;
    }

    @Override
    public List<FieldProposal> propose(ProposalRequest request) {
        BookCandidate candidate = request.getCandidate();
        Optional<NameParse> parsed = parseNames(candidate);

        String series = parsed.map(NameParse::series).orElse(null);
        if (series == null) {
            series = request.knownOrHint(CanonicalField.SERIES);
        }
        Integer index = parsed.map(NameParse::index).orElse(null);

        String title = parsed.map(NameParse::title).orElse(null);
        if (title == null) {
            title = hint(candidate, CanonicalField.TITLE);
        }
        if (title == null && candidate.getPrimaryFile() != null && !isFolderLevel(candidate)) {
            title = FileNameUtils.cleanFragment(FileNameUtils.stem(candidate.getPrimaryFile()));
        }
        title = NamePatterns.stripSeriesSuffix(title, series);

        double confidence = appProperties.getHeuristic().getConfidence();
        List<FieldProposal> proposals = new ArrayList<>();
        add(proposals, request, CanonicalField.AUTHOR, hint(candidate, CanonicalField.AUTHOR), confidence);
        add(proposals, request, CanonicalField.SERIES, series, confidence);
        add(proposals, request, CanonicalField.SERIES_INDEX, index == null ? null : String.valueOf(index), confidence);
        add(proposals, request, CanonicalField.TITLE, title, confidence);
        log.debug("Heuristic proposals for {}: {}", candidate.getRelativePath(), proposals.size());
        return proposals;
    }

    /**
     * Folder-level candidates are named by their folder; a lone file in a folder may also carry
     * the pattern in its own name. Chapter file names are never read as book names.
     */
    private Optional<NameParse> parseNames(BookCandidate candidate) {
        if (isFolderLevel(candidate)) {
            Optional<NameParse> fromFolder = NamePatterns.parse(FileNameUtils.folderName(candidate.getDirectory()));
            if (fromFolder.isPresent() || candidate.getFiles().size() > 1) {
                return fromFolder;
            }
        }
        if (candidate.getPrimaryFile() == null) {
            return Optional.empty();
        }
        return NamePatterns.parse(FileNameUtils.stem(candidate.getPrimaryFile()));
    }

    private boolean isFolderLevel(BookCandidate candidate) {
        return candidate.getPattern() != FolderPattern.MULTI_BOOK_FOLDER
                && candidate.getDirectory() != null
                && candidate.getDirectory().equals(candidate.getRootPath());
    }

    private String hint(BookCandidate candidate, CanonicalField field) {
        return Optional.ofNullable(candidate.getFolderHints().get(field))
                .filter(FieldValue::isResolved)
                .map(FieldValue::getValue)
                .orElse(null);
    }

    private void add(List<FieldProposal> proposals, ProposalRequest request, CanonicalField field, String value, double confidence) {
        if (StringUtils.isNotBlank(value) && request.wants(field)) {
            proposals.add(new FieldProposal(field, value, confidence, Provenance.HEURISTIC));
        }
    }
}
