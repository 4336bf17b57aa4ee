package com.staybot.notify;

import com.staybot.model.Candidate;
import com.staybot.model.PriceDropReport;
import com.staybot.model.SearchCriteria;
import com.staybot.model.TrackedItem;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.thymeleaf.exceptions.TemplateEngineException;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * E-mail channel: Thymeleaf HTML plus a plain-text part, delivered through {@link Mailer}.
 */
public final class MailNotifier implements Notifier {
    private static final Logger LOG = LogManager.getLogger(MailNotifier.class);
    private static final DateTimeFormatter DISPLAY_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneId.systemDefault());

    private final Mailer mailer;
    private final Mailer.Settings settings;
    private final MailTemplateRenderer renderer;
    private final Clock clock;

    public MailNotifier(Mailer mailer, Mailer.Settings settings, MailTemplateRenderer renderer, Clock clock) {
        this.mailer = mailer;
        this.settings = settings;
        this.renderer = renderer;
        this.clock = clock;
    }

    @Override
    public boolean notifyNewItems(List<TrackedItem> items, SearchCriteria criteria) throws NotifyException {
        if (items == null || items.isEmpty()) {
            return true;
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        text.append("New accommodations for ").append(criteria.destination)
                .append(" (").append(criteria.checkIn).append(" - ").append(criteria.checkOut)
                .append(", ").append(criteria.guests).append(" guests)\n\n");
        int index = 1;
        for (TrackedItem item : items) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("index", index);
            row.put("title", item.title);
            row.put("location", item.location);
            row.put("price", money(item.price, item.currency));
            row.put("rating", item.rating > 0.0 ? String.format(Locale.US, "%.1f", item.rating) : "-");
            row.put("url", item.url);
            row.put("imageUrl", item.imageUrl);
            row.put("source", item.source);
            rows.add(row);
            text.append(index++).append(". ").append(item.title)
                    .append(" | ").append(money(item.price, item.currency))
                    .append(" | rating ").append(row.get("rating"))
                    .append(" | ").append(nullToEmpty(item.location)).append('\n');
            if (item.url != null) {
                text.append("   ").append(item.url).append('\n');
            }
        }

        Map<String, Object> vars = baseVariables();
        vars.put("criteria", criteriaView(criteria));
        vars.put("items", rows);
        String subject = subject("Found " + items.size() + " new accommodations in " + criteria.destination);
        return deliver(subject, text.toString(), MailTemplateRenderer.NEW_ITEMS, vars);
    }

    @Override
    public boolean notifyPriceDrops(List<PriceDropReport> drops) throws NotifyException {
        if (drops == null || drops.isEmpty()) {
            return true;
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        StringBuilder text = new StringBuilder("Price drops on tracked accommodations\n\n");
        for (PriceDropReport drop : drops) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("title", drop.title);
            row.put("location", drop.location);
            row.put("previousPrice", money(drop.previousPrice, drop.currency));
            row.put("currentPrice", money(drop.currentPrice, drop.currency));
            row.put("dropPercent", String.format(Locale.US, "%.1f%%", drop.dropPercent));
            row.put("observedAt", DISPLAY_TS.format(drop.currentObservedAt));
            row.put("url", drop.url);
            rows.add(row);
            text.append("- ").append(drop.title).append(": ")
                    .append(row.get("previousPrice")).append(" -> ").append(row.get("currentPrice"))
                    .append(" (-").append(row.get("dropPercent")).append(")\n");
        }
        Map<String, Object> vars = baseVariables();
        vars.put("drops", rows);
        String subject = subject("Price drop: " + drops.size() + " accommodations got cheaper");
        return deliver(subject, text.toString(), MailTemplateRenderer.PRICE_DROPS, vars);
    }

    @Override
    public boolean notifyBelowTarget(List<Candidate> candidates, double targetPrice, String currency) throws NotifyException {
        if (candidates == null || candidates.isEmpty()) {
            return true;
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        StringBuilder text = new StringBuilder("Accommodations at or below ")
                .append(money(targetPrice, currency)).append("\n\n");
        for (Candidate candidate : candidates) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("title", candidate.title);
            row.put("location", candidate.location);
            row.put("price", money(candidate.price, candidate.currency));
            row.put("savings", money(targetPrice - candidate.price, currency));
            row.put("url", candidate.url);
            rows.add(row);
            text.append("- ").append(candidate.title).append(": ").append(row.get("price"))
                    .append(" (saves ").append(row.get("savings")).append(")\n");
        }
        Map<String, Object> vars = baseVariables();
        vars.put("target", money(targetPrice, currency));
        vars.put("items", rows);
        String subject = subject("Price alert: " + candidates.size() + " accommodations under " + money(targetPrice, currency));
        return deliver(subject, text.toString(), MailTemplateRenderer.BELOW_TARGET, vars);
    }

    @Override
    public boolean sendTest() throws NotifyException {
        Map<String, Object> vars = baseVariables();
        String text = "Test message from the accommodation agent. Mail delivery is configured correctly.";
        return deliver(subject("Test - accommodation agent"), text, MailTemplateRenderer.TEST, vars);
    }

    private boolean deliver(String subject, String text, String template, Map<String, Object> vars) throws NotifyException {
        String html;
        try {
            html = renderer.render(template, vars);
        } catch (TemplateEngineException e) {
            throw new NotifyException("failed to render " + template + ": " + e.getMessage(), e);
        }
        boolean sent = mailer.send(settings, subject, text, html);
        LOG.info("Notification {} subject={}", sent ? "delivered" : "not delivered", subject);
        return sent;
    }

    private Map<String, Object> baseVariables() {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("generatedAt", DISPLAY_TS.format(clock.instant()));
        return vars;
    }

    private Map<String, Object> criteriaView(SearchCriteria criteria) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("destination", criteria.destination);
        view.put("checkIn", criteria.checkIn.toString());
        view.put("checkOut", criteria.checkOut.toString());
        view.put("guests", criteria.guests);
        view.put("maxPrice", money(criteria.maxPrice, criteria.currency));
        view.put("minRating", String.format(Locale.US, "%.1f", criteria.minRating));
        return view;
    }

    private String subject(String body) {
        String prefix = settings.subjectPrefix == null ? "" : settings.subjectPrefix.trim();
        return prefix.isEmpty() ? body : prefix + " " + body;
    }

    static String money(double amount, String currency) {
        return String.format(Locale.US, "%.2f %s", amount, currency == null ? "" : currency);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
