package com.example.strmmirror.common.config;

import com.example.strmmirror.domain.enumtype.AddressingMode;
import com.example.strmmirror.domain.enumtype.SourceType;
import com.example.strmmirror.domain.model.MirrorConfiguration;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.util.StringUtils;

@Data
@ConfigurationProperties(prefix = "app.mirror", ignoreUnknownFields = false)
public class AppMirrorProperties {

    /**
     * Configured remote sources, each mirrored into its own target directory.
     */
    private List<Source> sources = new ArrayList<>();

    /**
     * Worker threads running whole mirror passes. Passes of different sources run in parallel up to this count.
     */
    private int runnerThreadCount = 2;

    /**
     * Queued passes waiting for a runner thread.
     */
    private int runnerQueueSize = 16;

    /**
     * Accepts both crontab (5 fields) and Spring (6 fields) expressions; returns the Spring form.
     *
     * @throws IllegalArgumentException when the expression is not a valid cron
     */
    public static String normalizeCron(String cron) {
        String trimmed = cron.trim();
        String normalized = trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        if (!CronExpression.isValidExpression(normalized)) {
            throw new IllegalArgumentException("invalid cron expression: " + cron);
        }
        return normalized;
    }

    @Data
    public static class Source {

        private String id;

        private SourceType sourceType = SourceType.ALIST;

        private String url = MirrorConfiguration.DEFAULT_URL;

        private String username = "";

        private String password = "";

        /**
         * Alist permanent token. Takes precedence over username/password.
         */
        private String token = "";

        private String sourceDir = MirrorConfiguration.DEFAULT_SOURCE_DIR;

        private String targetDir;

        private AddressingMode mode = AddressingMode.ALIST_URL;

        private boolean flattenMode;

        private boolean subtitle;

        private boolean image;

        private boolean nfo;

        /**
         * Comma separated extra extensions downloaded as assets, e.g. "txt,mka".
         */
        private String otherExt = "";

        private boolean overwrite;

        private int maxWorkers = MirrorConfiguration.DEFAULT_MAX_WORKERS;

        private int maxDownloaders = MirrorConfiguration.DEFAULT_MAX_DOWNLOADERS;

        /**
         * Pause between two listing requests. Plain numbers are seconds.
         */
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration waitTime = Duration.ZERO;

        /**
         * Delete local files that no longer exist remotely.
         */
        private boolean syncServer;

        /**
         * Regex; local file names it finds a match in are never deleted.
         */
        private String syncIgnore;

        /**
         * Cron schedule. Empty means the source only runs on demand.
         */
        private String cron;

        public MirrorConfiguration toConfiguration() {
            if (!StringUtils.hasText(targetDir)) {
                throw new IllegalArgumentException("mirror source '" + id + "': target-dir is required");
            }
            if (hasCron()) {
                try {
                    normalizeCron(cron);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("mirror source '" + id + "': " + e.getMessage(), e);
                }
            }
            return MirrorConfiguration.builder()
                    .id(id)
                    .sourceType(sourceType)
                    .url(trimTrailingSlash(url))
                    .username(nullToEmpty(username))
                    .password(nullToEmpty(password))
                    .token(nullToEmpty(token))
                    .sourceDir(sourceDir)
                    .targetDir(Paths.get(targetDir).toAbsolutePath().normalize())
                    .mode(mode)
                    .flattenMode(flattenMode)
                    .subtitle(subtitle)
                    .image(image)
                    .nfo(nfo)
                    .otherExt(nullToEmpty(otherExt))
                    .overwrite(overwrite)
                    .maxWorkers(maxWorkers)
                    .maxDownloaders(maxDownloaders)
                    .waitTime(waitTime == null ? Duration.ZERO : waitTime)
                    .syncServer(syncServer)
                    .syncIgnore(compileIgnore())
                    .build()
                    .validate();
        }

        public boolean hasCron() {
            return StringUtils.hasText(cron);
        }

        private Pattern compileIgnore() {
            if (!StringUtils.hasText(syncIgnore)) {
                return null;
            }
            try {
                return Pattern.compile(syncIgnore);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("mirror source '" + id + "': invalid sync-ignore pattern "
                        + syncIgnore, e);
            }
        }

        private static String trimTrailingSlash(String value) {
            if (value == null) {
                return null;
            }
            String trimmed = value.trim();
            while (trimmed.endsWith("/")) {
                trimmed = trimmed.substring(0, trimmed.length() - 1);
            }
            return trimmed;
        }

        private static String nullToEmpty(String value) {
            return value == null ? "" : value;
        }
    }
}
