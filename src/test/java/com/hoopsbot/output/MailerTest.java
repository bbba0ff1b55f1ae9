package com.hoopsbot.output;

import com.hoopsbot.config.Config;
import jakarta.mail.MessagingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-15T17:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void loadSettings_shouldResolveDryRunDirAgainstWorkingDir() {
        Config config = Config.fromConfigurationProperties(tempDir, Map.of(
                "email", Map.of("to", List.of("a@example.com", "b@example.com"), "smtp_user", "bot@example.com"),
                "mail", Map.of("dry_run", Map.of("dir", "mail_out"))
        ));

        Mailer.Settings settings = new Mailer(CLOCK).loadSettings(config);

        assertEquals(List.of("a@example.com", "b@example.com"), settings.to);
        assertEquals("bot@example.com", settings.from);
        assertEquals(tempDir.resolve("mail_out"), settings.dryRunDir);
        assertEquals("[HoopsBot]", settings.subjectPrefix);
    }

    @Test
    void send_shouldWriteDryRunArtifacts() throws Exception {
        Mailer.Settings settings = settings();
        settings.dryRun = true;

        boolean sent = new Mailer(CLOCK).send(settings, "[HoopsBot] Lineup 2024-01-15", "report body");

        assertTrue(sent);
        Path eml = settings.dryRunDir.resolve("mail_20240115_170000.eml");
        String content = Files.readString(eml, StandardCharsets.UTF_8);
        assertTrue(content.contains("Subject: [HoopsBot] Lineup 2024-01-15\n"));
        assertTrue(content.endsWith("report body"));
        assertEquals("report body", Files.readString(settings.dryRunDir.resolve("mail_20240115_170000.txt"), StandardCharsets.UTF_8));
    }

    @Test
    void send_shouldSkipWhenDisabled() throws Exception {
        Mailer.Settings settings = settings();
        settings.enabled = false;

        assertFalse(new Mailer(CLOCK).send(settings, "subject", "body"));
    }

    @Test
    void send_shouldReportIncompleteSmtpSettings() throws Exception {
        Mailer.Settings settings = settings();
        settings.pass = "";

        assertFalse(new Mailer(CLOCK).send(settings, "subject", "body"));

        settings.failFast = true;
        assertThrows(MessagingException.class, () -> new Mailer(CLOCK).send(settings, "subject", "body"));
    }

    private Mailer.Settings settings() {
        Mailer.Settings settings = new Mailer.Settings();
        settings.enabled = true;
        settings.host = "smtp.example.com";
        settings.port = 587;
        settings.user = "bot@example.com";
        settings.pass = "secret";
        settings.from = "bot@example.com";
        settings.to = List.of("owner@example.com");
        settings.subjectPrefix = "[HoopsBot]";
        settings.dryRunDir = tempDir.resolve("mail_dry_run");
        return settings;
    }
}
