package com.camdecoder.camdecoder.model;

public enum MediaKind {
    VIDEO,
    AUDIO
}
