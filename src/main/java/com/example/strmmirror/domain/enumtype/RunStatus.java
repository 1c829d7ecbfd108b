package com.example.strmmirror.domain.enumtype;

public enum RunStatus {
    COMPLETED,
    CANCELED,
    ABORTED
}
