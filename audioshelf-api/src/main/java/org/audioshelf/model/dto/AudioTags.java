package org.audioshelf.model.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Container-level tags read from one audio file.
 */
@Value
@Builder
public class AudioTags {
    String title;
    String album;
    String author;
    String series;
    Integer track;
    byte[] artwork;
    String artworkMimeType;

    public boolean hasArtwork() {
        return artwork != null && artwork.length > 0;
    }
}
