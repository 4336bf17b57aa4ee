package com.staybot.notify;

import com.staybot.config.Config;
import com.staybot.model.Candidate;
import com.staybot.model.PriceDropReport;
import com.staybot.model.SearchCriteria;
import com.staybot.model.TrackedItem;
import com.staybot.testutil.MutableClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailNotifierTest {

    @TempDir
    Path tempDir;

    @Test
    void notifyNewItems_dryRun_shouldWriteRenderedMail() throws Exception {
        MailNotifier notifier = notifier(Map.of());

        assertTrue(notifier.notifyNewItems(List.of(item()), criteria()));

        String html = readSingle(".html");
        String eml = readSingle(".eml");
        assertTrue(html.contains("Hotel Central"));
        assertTrue(html.contains("1234.00 RON"));
        assertTrue(html.contains("https://www.booking.com/hotel/ro/central.ro.html"));
        assertTrue(eml.contains("Subject: [StayBot] Found 1 new accommodations in "));
        assertTrue(eml.contains("1. Hotel Central | 1234.00 RON | rating 8.7"));
    }

    @Test
    void notifyPriceDrops_dryRun_shouldShowBothPrices() throws Exception {
        MailNotifier notifier = notifier(Map.of());
        PriceDropReport drop = PriceDropReport.builder()
                .itemId(1L)
                .title("Hotel Central")
                .location("Centrul Vechi")
                .source("booking")
                .url("https://www.booking.com/hotel/ro/central.ro.html")
                .previousPrice(500.0)
                .currentPrice(400.0)
                .currency("RON")
                .previousObservedAt(Instant.parse("2026-02-28T10:00:00Z"))
                .currentObservedAt(Instant.parse("2026-03-01T10:00:00Z"))
                .currentObservationId(2L)
                .dropPercent(20.0)
                .build();

        assertTrue(notifier.notifyPriceDrops(List.of(drop)));

        String html = readSingle(".html");
        assertTrue(html.contains("500.00 RON"));
        assertTrue(html.contains("400.00 RON"));
        assertTrue(html.contains("20.0%"));
    }

    @Test
    void notifyBelowTarget_dryRun_shouldListCandidates() throws Exception {
        MailNotifier notifier = notifier(Map.of());
        Candidate cheap = Candidate.builder()
                .title("Garden Studio")
                .location("Floreasca")
                .price(300.0)
                .currency("RON")
                .source("booking")
                .amenities(List.of())
                .build();

        assertTrue(notifier.notifyBelowTarget(List.of(cheap), 400.0, "RON"));
        assertTrue(readSingle(".eml").contains("Garden Studio: 300.00 RON (saves 100.00 RON)"));
    }

    @Test
    void emptyBatches_shouldSucceedWithoutSending() throws Exception {
        MailNotifier notifier = notifier(Map.of());

        assertTrue(notifier.notifyNewItems(List.of(), criteria()));
        assertTrue(notifier.notifyPriceDrops(List.of()));
        assertFalse(Files.exists(tempDir.resolve("outputs/mail_dry_run")));
    }

    @Test
    void sendTest_disabledMail_shouldReportNotSent() throws Exception {
        MailNotifier notifier = notifier(Map.of("email.enabled", "false"));

        assertFalse(notifier.sendTest());
    }

    @Test
    void incompleteSmtpSettings_shouldFailSoftOrFast() throws Exception {
        assertFalse(notifier(Map.of("mail.dry_run", "false")).sendTest());

        MailNotifier strict = notifier(Map.of("mail.dry_run", "false", "mail.fail_fast", "true"));
        NotifyException e = assertThrows(NotifyException.class, strict::sendTest);
        assertTrue(e.getMessage().contains("smtp_settings_incomplete"));
    }

    private MailNotifier notifier(Map<String, String> overrides) {
        Map<String, String> values = new HashMap<>();
        values.put("mail.dry_run", "true");
        values.putAll(overrides);
        Config config = Config.fromMap(tempDir, values);
        return new MailNotifier(new Mailer(), Mailer.loadSettings(config), new MailTemplateRenderer(),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
    }

    private String readSingle(String suffix) throws Exception {
        Path dir = tempDir.resolve("outputs/mail_dry_run");
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing.filter(p -> p.getFileName().toString().endsWith(suffix)).collect(Collectors.toList());
        }
        assertEquals(1, files.size());
        return Files.readString(files.get(0), StandardCharsets.UTF_8);
    }

    private static TrackedItem item() {
        return TrackedItem.builder()
                .id(1L)
                .identityKey("k")
                .title("Hotel Central")
                .price(1234.0)
                .currency("RON")
                .rating(8.7)
                .location("Centrul Vechi")
                .url("https://www.booking.com/hotel/ro/central.ro.html")
                .amenities(List.of())
                .source("booking")
                .firstSeen(Instant.parse("2026-03-01T09:00:00Z"))
                .lastSeen(Instant.parse("2026-03-01T09:00:00Z"))
                .timesSeen(1)
                .build();
    }

    private static SearchCriteria criteria() {
        return SearchCriteria.builder()
                .destination("București, România")
                .checkIn(LocalDate.of(2026, 4, 1))
                .checkOut(LocalDate.of(2026, 4, 3))
                .guests(2)
                .maxPrice(1500.0)
                .currency("RON")
                .propertyTypes(List.of("hotel"))
                .minRating(7.0)
                .build();
    }
}
