package com.example.strmmirror.domain.enumtype;

/**
 * Which string a generated .strm pointer file carries.
 */
public enum AddressingMode {

    /** URL proxied through the listing server. */
    ALIST_URL,

    /** Direct URL of the underlying storage. */
    RAW_URL,

    /** The remote path itself. */
    ALIST_PATH
}
