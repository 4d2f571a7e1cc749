package com.mailexchange.config;

import com.mailexchange.rules.ForwardRule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ForwarderConfigTest {

    private static final String FIXTURE = "src/test/resources/cfg/forwarder.json5";

    @Test
    void loadsFixture() throws IOException, ConfigurationException {
        ForwarderConfig config = new ForwarderConfig(FIXTURE);
        config.validate();

        ImapConfig imap = config.getImap();
        assertEquals("imap.test.local", imap.getHost());
        assertEquals(993, imap.getPort());
        assertEquals("inbox@test.local", imap.getUser());
        assertEquals("secret", imap.getPassword());
        assertTrue(imap.isTls());
        assertEquals("Forward", imap.getFolder());
        assertEquals(5L, imap.getReconnectDelaySeconds());
        assertEquals(60L, imap.getPollIntervalSeconds());

        SmtpConfig smtp = config.getSmtp();
        assertEquals("smtp.test.local", smtp.getHost());
        assertEquals(587, smtp.getPort());
        assertFalse(smtp.isSecure());
        assertEquals("relay@test.local", smtp.getUser());
        assertEquals("secret", smtp.getPassword());
        assertEquals("relay@test.local", smtp.getFrom());

        List<ForwardRule> rules = config.getRules();
        assertEquals(2, rules.size());
        assertEquals("[PHOTO]", rules.get(0).getTag());
        assertEquals(List.of("a@x.com", "b@x.com"), rules.get(0).getRecipients());
        assertEquals("[DOC]", rules.get(1).getTag());

        assertFalse(config.getDashboard().isEnabled());
        assertEquals("[Fwd]", config.getForwardPrefix());
        assertEquals(List.of("@Example.com", "boss@corp.com"), config.getAllowedSenders());
        assertEquals(5, config.getRetryCount());
        assertEquals(250L, config.getRetryDelayMillis());
        assertEquals("target/data", config.getDataDir());
        assertEquals("DEBUG", config.getLogLevel());
        assertFalse(config.isNotifySender());
    }

    @Test
    void defaults() {
        ForwarderConfig config = new ForwarderConfig(new HashMap<>());

        assertEquals(3, config.getRetryCount());
        assertEquals(1000L, config.getRetryDelayMillis());
        assertTrue(config.getDashboard().isEnabled());
        assertEquals(3000, config.getDashboard().getPort(0));
        assertEquals("0.0.0.0", config.getDashboard().getBind());
        assertNull(config.getForwardPrefix());
        assertTrue(config.getAllowedSenders().isEmpty());
        assertTrue(config.isNotifySender());
        assertNull(config.getLogLevel());
        assertEquals(465, config.getSmtp().getPort());
        assertTrue(config.getSmtp().isSecure());
        assertTrue(config.getRules().isEmpty());
    }

    @Test
    void blankPrefixIsIgnored() {
        ForwarderConfig config = new ForwarderConfig(new HashMap<>(Map.of("forwardPrefix", "  ")));
        assertNull(config.getForwardPrefix());
    }

    @Test
    void explicitFromOverridesAuthUser() {
        Map<String, Object> smtp = new HashMap<>();
        smtp.put("from", "noreply@test.local");
        smtp.put("auth", Map.of("user", "relay@test.local"));
        ForwarderConfig config = new ForwarderConfig(new HashMap<>(Map.of("smtp", smtp)));

        assertEquals("noreply@test.local", config.getSmtp().getFrom());
    }

    @Test
    void emptyConfigIsInvalid() {
        ForwarderConfig config = new ForwarderConfig(new HashMap<>());

        ConfigurationException e = assertThrows(ConfigurationException.class, config::validate);
        assertTrue(e.getMessage().contains("imap.host is required"));
        assertTrue(e.getMessage().contains("smtp.host is required"));
        assertTrue(e.getMessage().contains("at least one rule is required"));
    }

    @Test
    void invalidRulesAndRetry(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("forwarder.json5");
        Files.writeString(file, "{\n" +
                "  imap: { host: 'imap', user: 'u' },\n" +
                "  smtp: { host: 'smtp', auth: { user: 'relay@x.com' } },\n" +
                "  rules: [ { tag: '', recipients: ['a@x.com'] }, { tag: '[X]', recipients: [] } ],\n" +
                "  retryCount: 0\n" +
                "}");

        ForwarderConfig config = new ForwarderConfig(file.toString());
        ConfigurationException e = assertThrows(ConfigurationException.class, config::validate);
        assertTrue(e.getMessage().contains("rules[0].tag is required"));
        assertTrue(e.getMessage().contains("rules[1].recipients must not be empty"));
        assertTrue(e.getMessage().contains("retryCount must be at least 1"));
        assertFalse(e.getMessage().contains("imap.host"));
    }

    @Test
    void malformedFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("forwarder.json5");
        Files.writeString(file, "{ imap: { host: ");

        assertThrows(IOException.class, () -> new ForwarderConfig(file.toString()));
    }
}
