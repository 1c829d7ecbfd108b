package com.example.strmmirror.infrastructure.webdav;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.strmmirror.domain.model.RemoteEntry;
import com.example.strmmirror.infrastructure.remote.RemoteListingException;
import com.github.sardine.DavResource;
import com.github.sardine.Sardine;
import com.github.sardine.impl.SardineException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SardineRemoteListingClientTest {

    private static final String BASE = "http://dav.example.com/dav";

    @TempDir
    Path tempDir;

    @Test
    void listTreeShouldDecodePathsAndSkipSelfEntries() throws IOException {
        Sardine sardine = mock(Sardine.class);
        when(sardine.list(BASE + "/movies/", 1)).thenReturn(Arrays.asList(
                resource("/dav/movies/", true, null),
                resource("/dav/movies/A%20B/", true, null),
                resource("/dav/movies/x.mkv", false, 2048L)));
        when(sardine.list(BASE + "/movies/A%20B/", 1)).thenReturn(Arrays.asList(
                resource("/dav/movies/A%20B/", true, null),
                resource("/dav/movies/A%20B/c%2Bd.srt", false, 12L)));
        SardineRemoteListingClient client = new SardineRemoteListingClient(sardine, BASE);

        List<RemoteEntry> entries = new ArrayList<>();
        client.listTree("/movies", Duration.ZERO, true).forEach(entries::add);

        assertEquals(Arrays.asList("/movies/A B", "/movies/x.mkv", "/movies/A B/c+d.srt"),
                entries.stream().map(RemoteEntry::getPath).collect(Collectors.toList()));
        RemoteEntry video = entries.get(1);
        assertEquals(2048L, video.getSize());
        assertEquals(1700000000D, video.getModifiedTimestamp());
        assertEquals(BASE + "/movies/x.mkv", video.getPrimaryUrl());
        assertEquals(video.getPrimaryUrl(), video.getRawUrl());
        assertTrue(entries.get(0).isDirectory());
    }

    @Test
    void relativeHrefsShouldResolveAgainstCurrentDirectory() throws IOException {
        Sardine sardine = mock(Sardine.class);
        when(sardine.list(BASE + "/TV%20Shows/", 1)).thenReturn(Arrays.asList(
                resource("./", true, null),
                resource("S01/", true, null),
                resource("http://dav.example.com/dav/TV%20Shows/pilot.mp4", false, 1L)));
        when(sardine.list(BASE + "/TV%20Shows/S01/", 1)).thenReturn(Arrays.asList(
                resource("e01.mkv", false, 3L)));
        SardineRemoteListingClient client = new SardineRemoteListingClient(sardine, BASE + "/");

        List<RemoteEntry> entries = new ArrayList<>();
        client.listTree("TV Shows/", Duration.ZERO, true).forEach(entries::add);

        assertEquals(Arrays.asList("/TV Shows/S01", "/TV Shows/pilot.mp4", "/TV Shows/S01/e01.mkv"),
                entries.stream().map(RemoteEntry::getPath).collect(Collectors.toList()));
        assertEquals(BASE + "/TV%20Shows/S01/e01.mkv", entries.get(2).getRawUrl());
    }

    @Test
    void authenticationFailureShouldSurfaceAsListingException() throws IOException {
        Sardine sardine = mock(Sardine.class);
        when(sardine.list(BASE + "/", 1)).thenThrow(new SardineException("Unauthorized", 401, "Unauthorized"));
        SardineRemoteListingClient client = new SardineRemoteListingClient(sardine, BASE);

        RemoteListingException e = assertThrows(RemoteListingException.class,
                () -> client.listTree("/", Duration.ZERO, false).iterator().hasNext());
        assertTrue(e.getMessage().contains("authentication failed"));
    }

    @Test
    void downloadShouldUseAuthenticatedSession() throws IOException {
        Sardine sardine = mock(Sardine.class);
        when(sardine.get(BASE + "/movies/a.srt"))
                .thenReturn(new ByteArrayInputStream("1\n00:00:01,000".getBytes(StandardCharsets.UTF_8)));
        SardineRemoteListingClient client = new SardineRemoteListingClient(sardine, BASE);
        Path destination = tempDir.resolve("a.srt");

        client.download(BASE + "/movies/a.srt", destination);
        client.close();

        assertEquals("1\n00:00:01,000", new String(Files.readAllBytes(destination), StandardCharsets.UTF_8));
        verify(sardine).shutdown();
    }

    private static DavResource resource(String href, boolean directory, Long length) {
        DavResource resource = mock(DavResource.class);
        when(resource.getHref()).thenReturn(URI.create(href));
        when(resource.isDirectory()).thenReturn(directory);
        when(resource.getContentLength()).thenReturn(length);
        when(resource.getModified()).thenReturn(new Date(1700000000000L));
        return resource;
    }
}
