package com.releasefeed.pipeline.validation;

public enum Verdict {
    VALID,
    NOT_FOUND,
    ERROR
}
