package dev.sitesage.model;

public enum FailureKind {
    TIMEOUT,
    CONNECTION_ERROR,
    HTTP_ERROR,
    TOO_LARGE,
    INTERNAL
}
