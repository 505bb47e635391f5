package com.phillippitts.imageoptimizer.domain;

/**
 * Kind of a {@link ProgressEvent}.
 */
public enum ProgressType {
    START,
    UPDATE,
    COMPLETE,
    ERROR
}
