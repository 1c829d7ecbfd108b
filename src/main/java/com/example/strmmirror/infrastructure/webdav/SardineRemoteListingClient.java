package com.example.strmmirror.infrastructure.webdav;

import com.example.strmmirror.common.util.LocalFileUtil;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import com.example.strmmirror.domain.model.RemoteEntry;
import com.example.strmmirror.infrastructure.download.AssetDownloader;
import com.example.strmmirror.infrastructure.remote.RemoteListingClient;
import com.example.strmmirror.infrastructure.remote.RemoteListingException;
import com.github.sardine.DavResource;
import com.github.sardine.Sardine;
import com.github.sardine.SardineFactory;
import com.github.sardine.impl.SardineException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a plain WebDAV share (for example Alist's {@code /dav} endpoint) with PROPFIND depth 1
 * per directory. The same authenticated session serves auxiliary downloads.
 */
public class SardineRemoteListingClient implements RemoteListingClient, AssetDownloader {

    private static final Logger log = LoggerFactory.getLogger(SardineRemoteListingClient.class);

    private final Sardine sardine;
    private final URI baseUri;
    /** Raw path of the share root without trailing slash, empty for a host root. */
    private final String basePath;

    public SardineRemoteListingClient(MirrorConfiguration config) {
        this(SardineFactory.begin(config.getUsername(), config.getPassword()), config.getUrl());
    }

    SardineRemoteListingClient(Sardine sardine, String baseUrl) {
        this.sardine = sardine;
        this.baseUri = parseShareUrl(baseUrl);
        this.basePath = trimTrailingSlash(baseUri.getRawPath());
    }

    @Override
    public Iterable<RemoteEntry> listTree(String rootPath, Duration waitTime, boolean detail) {
        String rootUrl = directoryUrl(rootPath);
        return () -> new TreeIterator(rootUrl, waitTime == null ? Duration.ZERO : waitTime);
    }

    @Override
    public void download(String url, Path destination) throws IOException {
        try (InputStream in = sardine.get(url)) {
            LocalFileUtil.copyAtomically(in, destination);
        } catch (SardineException e) {
            throw new IOException(statusMessage(e.getStatusCode()), e);
        }
    }

    @Override
    public void close() {
        try {
            sardine.shutdown();
        } catch (IOException e) {
            log.debug("WebDAV client shutdown failed", e);
        }
    }

    RemoteEntry toEntry(String href, DavResource resource) {
        String path = toRemotePath(href);
        String name = path.substring(path.lastIndexOf('/') + 1);
        boolean directory = resource.isDirectory();
        Long contentLength = resource.getContentLength();
        return RemoteEntry.builder()
                .path(path)
                .name(name)
                .directory(directory)
                .size(contentLength == null || contentLength < 0 ? 0L : contentLength)
                .modifiedTimestamp(resource.getModified() == null ? 0D : resource.getModified().getTime() / 1000D)
                .primaryUrl(directory ? null : href)
                .rawUrl(directory ? null : href)
                .build();
    }

    String toRemotePath(String href) {
        String hrefPath;
        try {
            hrefPath = trimTrailingSlash(URI.create(href).getRawPath());
        } catch (IllegalArgumentException e) {
            throw new RemoteListingException("Unparseable WebDAV href: " + href, e);
        }
        String relative = hrefPath.startsWith(basePath) ? hrefPath.substring(basePath.length()) : hrefPath;
        if (!relative.startsWith("/")) {
            relative = "/" + relative;
        }
        try {
            return URLDecoder.decode(relative.replace("+", "%2B"), StandardCharsets.UTF_8.name());
        } catch (UnsupportedEncodingException e) {
            throw new IllegalStateException("UTF-8 not supported", e);
        }
    }

    /**
     * Absolute, encoded URL of the remote directory {@code remotePath} below the share root,
     * always ending in {@code /}.
     */
    String directoryUrl(String remotePath) {
        String relative = remotePath == null ? "" : remotePath.trim().replace('\\', '/');
        String decodedBase = baseUri.getPath() == null ? "" : trimTrailingSlash(baseUri.getPath());
        String path = trimTrailingSlash(decodedBase + "/" + relative).replaceAll("/{2,}", "/") + "/";
        try {
            return new URI(baseUri.getScheme(), baseUri.getRawAuthority(), path, null, null).toASCIIString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid WebDAV path: " + remotePath, e);
        }
    }

    private List<DavResource> list(String dirUrl) {
        try {
            return sardine.list(dirUrl, 1);
        } catch (SardineException e) {
            throw new RemoteListingException(statusMessage(e.getStatusCode()) + ", url=" + dirUrl, e);
        } catch (IOException e) {
            throw new RemoteListingException("WebDAV listing failed, url=" + dirUrl + ": " + e.getMessage(), e);
        }
    }

    private static URI parseShareUrl(String url) {
        if (url == null || url.trim().isEmpty()) {
            throw new IllegalArgumentException("WebDAV url must not be blank");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid WebDAV url: " + url, e);
        }
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("WebDAV url needs scheme and host: " + url);
        }
        return uri;
    }

    private static String statusMessage(int status) {
        switch (status) {
            case 401:
            case 403:
                return "WebDAV authentication failed, status=" + status;
            case 404:
                return "WebDAV resource not found";
            default:
                return "WebDAV request failed, status=" + status;
        }
    }

    private static String trimTrailingSlash(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path;
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private class TreeIterator implements Iterator<RemoteEntry> {

        private final Deque<String> pendingDirs = new ArrayDeque<>();
        private final Deque<RemoteEntry> buffer = new ArrayDeque<>();
        private final Duration waitTime;

        private TreeIterator(String rootUrl, Duration waitTime) {
            this.waitTime = waitTime;
            pendingDirs.push(rootUrl);
        }

        @Override
        public boolean hasNext() {
            while (buffer.isEmpty() && !pendingDirs.isEmpty()) {
                URI currentDir = URI.create(pendingDirs.pop());
                String currentPath = trimTrailingSlash(currentDir.getRawPath());
                pause();
                List<String> subdirs = new ArrayList<>();
                for (DavResource resource : list(currentDir.toString())) {
                    URI child = resource.getHref() == null ? currentDir : currentDir.resolve(resource.getHref());
                    if (currentPath.equals(trimTrailingSlash(child.getRawPath()))) {
                        continue;
                    }
                    String href = child.toString();
                    if (resource.isDirectory()) {
                        String dirUrl = href.endsWith("/") ? href : href + "/";
                        buffer.add(toEntry(trimTrailingSlash(href), resource));
                        subdirs.add(dirUrl);
                    } else {
                        buffer.add(toEntry(href, resource));
                    }
                }
                for (int i = subdirs.size() - 1; i >= 0; i--) {
                    pendingDirs.push(subdirs.get(i));
                }
            }
            return !buffer.isEmpty();
        }

        @Override
        public RemoteEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return buffer.poll();
        }

        private void pause() {
            if (waitTime.isZero()) {
                return;
            }
            try {
                Thread.sleep(waitTime.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteListingException("WebDAV listing interrupted");
            }
        }
    }
}
