package com.example.strmmirror.infrastructure.remote;

import com.example.strmmirror.domain.model.RemoteEntry;
import java.io.Closeable;
import java.time.Duration;

public interface RemoteListingClient extends Closeable {

    /**
     * Lazily walk the remote tree below {@code rootPath}, directories included. Every call to
     * {@code iterator()} starts a fresh walk.
     *
     * @param waitTime delay before each remote request
     * @param detail   resolve size, timestamps and direct URLs for every file instead of names only
     * @throws RemoteListingException from the iterator when the remote tree cannot be read
     */
    Iterable<RemoteEntry> listTree(String rootPath, Duration waitTime, boolean detail);
}
