package com.example.strmmirror.infrastructure.download;

import com.example.strmmirror.common.config.AppHttpProperties;
import com.example.strmmirror.common.util.LocalFileUtil;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import javax.annotation.PreDestroy;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Plain HTTP GET downloader for pre-signed direct URLs.
 */
@Component
public class HttpAssetDownloader implements AssetDownloader {

    private static final Logger log = LoggerFactory.getLogger(HttpAssetDownloader.class);

    private final CloseableHttpClient httpClient;

    @Autowired
    public HttpAssetDownloader(AppHttpProperties appHttpProperties) {
        this(buildClient(appHttpProperties));
    }

    HttpAssetDownloader(CloseableHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public void download(String url, Path destination) throws IOException {
        if (url == null || url.trim().isEmpty()) {
            throw new IOException("No download URL for " + destination);
        }
        HttpGet request = new HttpGet(url);
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            if (status < 200 || status >= 300) {
                EntityUtils.consumeQuietly(entity);
                throw new IOException("Download failed, status=" + status + ", url=" + url);
            }
            if (entity == null) {
                throw new IOException("Download returned no body, url=" + url);
            }
            try (InputStream in = entity.getContent()) {
                LocalFileUtil.copyAtomically(in, destination);
            }
        }
        log.debug("Downloaded {} -> {}", url, destination);
    }

    @PreDestroy
    public void shutdown() {
        try {
            httpClient.close();
        } catch (IOException e) {
            log.debug("HTTP client shutdown failed", e);
        }
    }

    public static CloseableHttpClient buildClient(AppHttpProperties properties) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(properties.getConnectTimeoutMs())
                .setSocketTimeout(properties.getSocketTimeoutMs())
                .build();
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(properties.getMaxConnections());
        cm.setDefaultMaxPerRoute(properties.getMaxConnections());
        return HttpClients.custom()
                .setConnectionManager(cm)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }
}
