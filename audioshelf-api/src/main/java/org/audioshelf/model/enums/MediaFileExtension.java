package org.audioshelf.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

@RequiredArgsConstructor
@Getter
public enum MediaFileExtension {
    M4B("m4b", MediaKind.AUDIO),
    M4A("m4a", MediaKind.AUDIO),
    MP3("mp3", MediaKind.AUDIO),
    AAC("aac", MediaKind.AUDIO),
    FLAC("flac", MediaKind.AUDIO),
    OPUS("opus", MediaKind.AUDIO),
    OGG("ogg", MediaKind.AUDIO),
    JPG("jpg", MediaKind.IMAGE),
    JPEG("jpeg", MediaKind.IMAGE),
    PNG("png", MediaKind.IMAGE),
    WEBP("webp", MediaKind.IMAGE);

    private final String extension;
    private final MediaKind type;

    public static Optional<MediaFileExtension> fromFileName(String fileName) {
        String lower = fileName.toLowerCase();
        return Arrays.stream(values())
                .filter(e -> lower.endsWith("." + e.extension))
                .findFirst();
    }

    public static boolean isAudio(String fileName) {
        return fromFileName(fileName).map(e -> e.type == MediaKind.AUDIO).orElse(false);
    }

    public static boolean isImage(String fileName) {
        return fromFileName(fileName).map(e -> e.type == MediaKind.IMAGE).orElse(false);
    }
}
