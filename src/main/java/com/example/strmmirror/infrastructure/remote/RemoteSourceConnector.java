package com.example.strmmirror.infrastructure.remote;

import com.example.strmmirror.common.config.AppHttpProperties;
import com.example.strmmirror.domain.enumtype.SourceType;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.infrastructure.alist.AlistApiClient;
import com.example.strmmirror.infrastructure.download.HttpAssetDownloader;
import com.example.strmmirror.infrastructure.webdav.SardineRemoteListingClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import javax.annotation.PreDestroy;
import org.apache.http.impl.client.CloseableHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Opens the listing client and downloader matching a source's type.
 */
@Component
public class RemoteSourceConnector {

    private static final Logger log = LoggerFactory.getLogger(RemoteSourceConnector.class);

    private final HttpAssetDownloader httpAssetDownloader;
    private final ObjectMapper objectMapper;
    private final CloseableHttpClient apiHttpClient;

    public RemoteSourceConnector(HttpAssetDownloader httpAssetDownloader,
                                 ObjectMapper objectMapper,
                                 AppHttpProperties appHttpProperties) {
        this.httpAssetDownloader = httpAssetDownloader;
        this.objectMapper = objectMapper;
        this.apiHttpClient = HttpAssetDownloader.buildClient(appHttpProperties);
    }

    public RemoteSession open(MirrorConfiguration config) {
        if (config.getSourceType() == SourceType.WEBDAV) {
            SardineRemoteListingClient client = new SardineRemoteListingClient(config);
            return new RemoteSession(client, client);
        }
        return new RemoteSession(new AlistApiClient(config, apiHttpClient, objectMapper), httpAssetDownloader);
    }

    @PreDestroy
    public void shutdown() {
        try {
            apiHttpClient.close();
        } catch (IOException e) {
            log.debug("Alist API client shutdown failed", e);
        }
    }
}
