package org.audioshelf.model.enums;

public enum MediaKind {
    AUDIO,
    IMAGE
}
