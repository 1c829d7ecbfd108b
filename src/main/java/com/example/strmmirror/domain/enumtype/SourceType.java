package com.example.strmmirror.domain.enumtype;

public enum SourceType {
    ALIST,
    WEBDAV
}
