package com.example.strmmirror.infrastructure.remote;

import com.example.strmmirror.infrastructure.download.AssetDownloader;
import java.io.IOException;

/**
 * Listing client and downloader bound to one source for the duration of one run.
 */
public class RemoteSession implements AutoCloseable {

    private final RemoteListingClient listingClient;
    private final AssetDownloader downloader;

    public RemoteSession(RemoteListingClient listingClient, AssetDownloader downloader) {
        this.listingClient = listingClient;
        this.downloader = downloader;
    }

    public RemoteListingClient getListingClient() {
        return listingClient;
    }

    public AssetDownloader getDownloader() {
        return downloader;
    }

    @Override
    public void close() throws IOException {
        listingClient.close();
    }
}
