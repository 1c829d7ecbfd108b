package com.example.strmmirror.common.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.strmmirror.domain.enumtype.AddressingMode;
import com.example.strmmirror.domain.enumtype.SourceType;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class AppMirrorPropertiesTest {

    @Test
    void crontabExpressionShouldGainSecondsField() {
        assertEquals("0 */5 * * * *", AppMirrorProperties.normalizeCron("*/5 * * * *"));
        assertEquals("30 0 3 * * ?", AppMirrorProperties.normalizeCron(" 30 0 3 * * ? "));
        assertThrows(IllegalArgumentException.class, () -> AppMirrorProperties.normalizeCron("every hour"));
    }

    @Test
    void defaultsShouldMatchDocumentedValues() {
        MirrorConfiguration config = source().toConfiguration();

        assertEquals(SourceType.ALIST, config.getSourceType());
        assertEquals("http://localhost:5244", config.getUrl());
        assertEquals("/", config.getSourceDir());
        assertEquals(AddressingMode.ALIST_URL, config.getMode());
        assertEquals(50, config.getMaxWorkers());
        assertEquals(5, config.getMaxDownloaders());
        assertEquals(Duration.ZERO, config.getWaitTime());
        assertNull(config.getSyncIgnore());
        assertTrue(config.getTargetDir().isAbsolute());
    }

    @Test
    void yamlStyleKeysShouldBind() {
        Map<String, Object> values = new HashMap<>();
        values.put("app.mirror.sources[0].id", "anime");
        values.put("app.mirror.sources[0].source-type", "webdav");
        values.put("app.mirror.sources[0].url", "http://nas:5244/dav/");
        values.put("app.mirror.sources[0].target-dir", "/tmp/anime");
        values.put("app.mirror.sources[0].mode", "AlistPath");
        values.put("app.mirror.sources[0].wait-time", "2");
        values.put("app.mirror.sources[0].other-ext", "txt,.mka");
        values.put("app.mirror.sources[0].sync-ignore", "\\.keep$");
        values.put("app.mirror.sources[0].cron", "0 3 * * *");

        AppMirrorProperties properties = new Binder(new MapConfigurationPropertySource(values))
                .bind("app.mirror", AppMirrorProperties.class)
                .get();
        MirrorConfiguration config = properties.getSources().get(0).toConfiguration();

        assertEquals(SourceType.WEBDAV, config.getSourceType());
        assertEquals(AddressingMode.ALIST_PATH, config.getMode());
        assertEquals("http://nas:5244/dav", config.getUrl());
        assertEquals(Duration.ofSeconds(2), config.getWaitTime());
        assertEquals(Paths.get("/tmp/anime").toAbsolutePath(), config.getTargetDir());
        assertTrue(config.getSyncIgnore().matcher("poster.keep").find());
        assertTrue(config.downloadExtensions().containsAll(new LinkedHashSet<>(Arrays.asList(".txt", ".mka"))));
    }

    @Test
    void invalidOptionsShouldBeRejected() {
        AppMirrorProperties.Source badIgnore = source();
        badIgnore.setSyncIgnore("([");
        AppMirrorProperties.Source badBudget = source();
        badBudget.setMaxWorkers(2);
        badBudget.setMaxDownloaders(3);
        AppMirrorProperties.Source noTarget = source();
        noTarget.setTargetDir(null);
        AppMirrorProperties.Source badCron = source();
        badCron.setCron("61 * * * *");

        assertThrows(IllegalArgumentException.class, badIgnore::toConfiguration);
        assertThrows(IllegalArgumentException.class, badBudget::toConfiguration);
        assertThrows(IllegalArgumentException.class, noTarget::toConfiguration);
        assertThrows(IllegalArgumentException.class, badCron::toConfiguration);
    }

    @Test
    void flattenModeShouldDisableEveryAuxiliaryCategory() {
        AppMirrorProperties.Source source = source();
        source.setFlattenMode(true);
        source.setSubtitle(true);
        source.setImage(true);
        source.setNfo(true);
        source.setOtherExt("txt");

        MirrorConfiguration config = source.toConfiguration();

        assertTrue(config.downloadExtensions().isEmpty());
        assertTrue(!config.requiresDetail());
    }

    private static AppMirrorProperties.Source source() {
        AppMirrorProperties.Source source = new AppMirrorProperties.Source();
        source.setId("movies");
        source.setTargetDir("strm/movies");
        return source;
    }
}
