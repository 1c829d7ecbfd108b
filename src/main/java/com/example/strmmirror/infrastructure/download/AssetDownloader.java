package com.example.strmmirror.infrastructure.download;

import java.io.IOException;
import java.nio.file.Path;

public interface AssetDownloader {

    /**
     * Blocking full transfer of {@code url} to {@code destination}. The destination is replaced
     * only once the transfer completed.
     *
     * @throws IOException on any transport or HTTP failure
     */
    void download(String url, Path destination) throws IOException;
}
