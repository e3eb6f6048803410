package org.audioshelf.service.metadata;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.audioshelf.exception.ExtractionException;
import org.audioshelf.model.dto.AudioTags;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.KeyNotFoundException;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.images.Artwork;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads container-level tags of a single audio file through jaudiotagger.
 */
@Slf4j
@Component
public class AudioTagReader {

    static {
        Logger.getLogger("org.jaudiotagger").setLevel(Level.WARNING);
    }

    public AudioTags read(Path file) throws ExtractionException {
        AudioFile audioFile;
        try {
            audioFile = AudioFileIO.read(file.toFile());
        } catch (Exception e) {
            throw new ExtractionException(file, "Unreadable audio container: " + e.getMessage(), e);
        }

        Tag tag = audioFile.getTag();
        if (tag == null) {
            return AudioTags.builder().build();
        }

        AudioTags.AudioTagsBuilder builder = AudioTags.builder()
                .title(first(tag, FieldKey.TITLE))
                .album(first(tag, FieldKey.ALBUM))
                .series(first(tag, FieldKey.GROUPING));

        String albumArtist = first(tag, FieldKey.ALBUM_ARTIST);
        builder.author(albumArtist != null ? albumArtist : first(tag, FieldKey.ARTIST));

        String trackNo = first(tag, FieldKey.TRACK);
        if (trackNo != null) {
            try {
                String trackNum = trackNo.contains("/") ? trackNo.split("/")[0] : trackNo;
                builder.track(Integer.parseInt(trackNum.trim()));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric track '{}' in {}", trackNo, file.getFileName());
            }
        }

        try {
            Artwork artwork = tag.getFirstArtwork();
            if (artwork != null && artwork.getBinaryData() != null) {
                builder.artwork(artwork.getBinaryData()).artworkMimeType(artwork.getMimeType());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to read embedded artwork from {}: {}", file.getFileName(), e.getMessage());
        }
        return builder.build();
    }

    private String first(Tag tag, FieldKey key) {
        try {
            String value = tag.getFirst(key);
            return StringUtils.isNotBlank(value) ? value.trim() : null;
        } catch (KeyNotFoundException | UnsupportedOperationException e) {
            // some container formats have no mapping for a key
            return null;
        }
    }
}
