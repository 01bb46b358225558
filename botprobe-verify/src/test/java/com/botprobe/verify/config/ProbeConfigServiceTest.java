package com.botprobe.verify.config;

import com.botprobe.common.logging.LogLevel;
import com.botprobe.common.logging.SubsystemLogger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProbeConfigServiceTest {

    @TempDir
    Path tempDir;
    private Path configPath;

    @BeforeEach
    void setUp() {
        configPath = tempDir.resolve("probes.json");
    }

    @AfterEach
    void resetLogging() {
        SubsystemLogger.setMinLevel(null);
        SubsystemLogger.setSubsystemFilter();
    }

    private ProbeConfigService service(Map<String, String> env) {
        return new ProbeConfigService(configPath, Duration.ofMinutes(1), env::get);
    }

    @Test
    void resolveSettings_mergesDefaultsAndProfile() throws IOException {
        Files.writeString(configPath, """
                {
                  "defaults": { "maxWaitSeconds": 90, "retryDelaySeconds": 30, "autoDeleteOnFailure": false },
                  "probes": {
                    "solution": {
                      "responderIdentity": "pleiades-epsilon-bot",
                      "channelIdentity": "owner/repo#12",
                      "retryDelaySeconds": 15
                    }
                  }
                }
                """);

        ProbeSettings settings = service(Map.of()).resolveSettings("solution");

        assertEquals("pleiades-epsilon-bot", settings.responderIdentity());
        assertEquals("owner/repo#12", settings.channelIdentity());
        assertEquals(Duration.ofSeconds(90), settings.maxWait());
        assertEquals(Duration.ofSeconds(5), settings.pollInterval());
        assertEquals(3, settings.maxRetries());
        assertEquals(Duration.ofSeconds(15), settings.retryDelay());
        assertFalse(settings.autoDeleteOnFailure());
    }

    @Test
    void envPlaceholders_substitutedBeforeParsing() throws IOException {
        Files.writeString(configPath, """
                {
                  "probes": {
                    "solution": {
                      "responderIdentity": "${PROBE_BOT}",
                      "channelIdentity": "${PROBE_CHANNEL:-owner/repo#1}"
                    }
                  }
                }
                """);

        ProbeSettings settings = service(Map.of("PROBE_BOT", "ci-bot")).resolveSettings("solution");

        assertEquals("ci-bot", settings.responderIdentity());
        assertEquals("owner/repo#1", settings.channelIdentity());
    }

    @Test
    void substituteEnvVars_plainString_noChange() {
        assertEquals("hello", service(Map.of()).substituteEnvVars("hello"));
    }

    @Test
    void substituteEnvVars_missingWithoutDefault_becomesEmpty() {
        assertEquals("[]", service(Map.of()).substituteEnvVars("[${__UNLIKELY_VAR_XYZ}]"));
    }

    @Test
    void unknownProfile_rejected() throws IOException {
        Files.writeString(configPath, """
                { "probes": { "solution": { "responderIdentity": "bot", "channelIdentity": "c" } } }
                """);

        var err = assertThrows(ProbeConfigException.class, () -> service(Map.of()).resolveSettings("other"));
        assertTrue(err.getMessage().contains("solution"));
    }

    @Test
    void invalidProfile_rejectedWithProfileName() throws IOException {
        Files.writeString(configPath, """
                { "probes": { "broken": {
                    "responderIdentity": "bot", "channelIdentity": "c",
                    "maxWaitSeconds": 10, "pollIntervalSeconds": 20 } } }
                """);

        var err = assertThrows(ProbeConfigException.class, () -> service(Map.of()).resolveSettings("broken"));
        assertTrue(err.getMessage().startsWith("Probe profile 'broken'"));
    }

    @Test
    void malformedJson_rejected() throws IOException {
        Files.writeString(configPath, "{ \"probes\": ");

        assertThrows(ProbeConfigException.class, () -> service(Map.of()).loadConfig());
    }

    @Test
    void missingFile_yieldsEmptyConfig() {
        ProbeConfigService service = new ProbeConfigService(tempDir.resolve("nonexistent.json"));
        ProbeConfig config = service.loadConfig();

        assertNotNull(config);
        assertTrue(service.profileNames().isEmpty());
    }

    @Test
    void configPath_expandsHome() {
        var service = new ProbeConfigService(Path.of("~/.botprobe/probes.json"));

        assertEquals(Path.of(System.getProperty("user.home"), ".botprobe", "probes.json"), service.getConfigPath());
        assertEquals(configPath, service(Map.of()).getConfigPath());
    }

    @Test
    void unknownFields_ignored() throws IOException {
        Files.writeString(configPath, """
                { "version": 2, "probes": { "a": { "responderIdentity": "bot", "channelIdentity": "c", "color": "red" } } }
                """);

        assertEquals("bot", service(Map.of()).resolveSettings("a").responderIdentity());
    }

    @Test
    void loadConfig_isCachedUntilReload() throws IOException {
        Files.writeString(configPath, """
                { "probes": { "a": { "responderIdentity": "bot", "channelIdentity": "c" } } }
                """);
        ProbeConfigService service = service(Map.of());
        ProbeConfig first = service.loadConfig();
        assertSame(first, service.loadConfig());

        Files.writeString(configPath, """
                { "probes": { "a": {}, "b": {} } }
                """);
        assertSame(first, service.loadConfig());
        assertEquals(List.of("a", "b"), List.copyOf(service.reloadConfig().getProbes().keySet()));
    }

    @Test
    void applyLogging_setsLevelAndFilters() throws IOException {
        Files.writeString(configPath, """
                { "logging": { "level": "warn", "subsystems": ["probe/owner"] } }
                """);

        service(Map.of()).applyLogging();

        assertEquals(LogLevel.WARN, SubsystemLogger.getMinLevel());
        assertTrue(SubsystemLogger.create("probe/owner/repo").shouldLog());
        assertFalse(SubsystemLogger.create("config").shouldLog());
    }
}
