package org.audioshelf.service.source;

import lombok.experimental.UtilityClass;
import org.audioshelf.model.dto.ProposalRequest;
import org.audioshelf.model.enums.CanonicalField;
import org.audioshelf.service.source.heuristic.NameParse;
import org.audioshelf.service.source.heuristic.NamePatterns;
import org.audioshelf.util.FileNameUtils;

import java.nio.file.Path;

@UtilityClass
public class SearchTerms {

    /**
     * Best available title to search with: a known or folder-derived title, else the title part
     * of the primary file name, else the cleaned file name itself.
     */
    public String title(ProposalRequest request) {
        String title = request.knownOrHint(CanonicalField.TITLE);
        if (title != null) {
            return title;
        }
        Path primary = request.getCandidate().getPrimaryFile();
        if (primary == null) {
            return null;
        }
        String stem = FileNameUtils.stem(primary);
        String series = request.knownOrHint(CanonicalField.SERIES);
        String parsed = NamePatterns.parse(stem).map(NameParse::title).orElse(null);
        String guess = parsed != null ? parsed : FileNameUtils.cleanFragment(stem);
        guess = NamePatterns.stripSeriesSuffix(guess, series);
        return guess == null || guess.isBlank() ? null : guess;
    }
}
