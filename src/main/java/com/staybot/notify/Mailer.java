package com.staybot.notify;

import com.staybot.config.Config;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * SMTP mail sender with a dry-run mode that writes messages to disk.
 */
public final class Mailer {
    private static final Logger LOG = LogManager.getLogger(Mailer.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS")
            .withZone(ZoneId.systemDefault());

    private final AtomicInteger dryRunSequence = new AtomicInteger();

    public static final class Settings {
        public boolean enabled;
        public String host;
        public int port;
        public String user;
        public String pass;
        public String from;
        public List<String> to;
        public String subjectPrefix;
        public boolean dryRun;
        public boolean failFast;
        public Path dryRunDir;
        public int timeoutMs;
    }

    public static Settings loadSettings(Config config) {
        Settings settings = new Settings();
        settings.enabled = config.getBoolean("email.enabled", true);
        settings.host = config.getString("email.smtp_host", "smtp.gmail.com");
        settings.port = config.getInt("email.smtp_port", 587);
        settings.user = config.getString("email.smtp_user", "");
        settings.pass = config.getString("email.smtp_pass", "");
        settings.from = config.getString("email.from", settings.user);
        settings.to = config.getList("email.to");
        settings.subjectPrefix = config.getString("email.subject_prefix", "[StayBot]");
        settings.dryRun = config.getBoolean("mail.dry_run", false);
        settings.failFast = config.getBoolean("mail.fail_fast", false);
        settings.timeoutMs = Math.max(1000, config.getInt("email.timeout_ms", 30_000));

        String customDryRunDir = config.getString("mail.dry_run.dir", "");
        settings.dryRunDir = customDryRunDir.isBlank()
                ? config.getPath("outputs.dir").resolve("mail_dry_run")
                : config.workingDir().resolve(customDryRunDir).normalize();
        return settings;
    }

    /**
     * Returns true when the message was handed to SMTP or written in dry-run mode.
     * With {@code mail.fail_fast} a failure throws instead of returning false.
     */
    public boolean send(Settings s, String subject, String textBody, String htmlBody) throws NotifyException {
        if (!s.enabled) {
            LOG.info("Mail disabled, skipping subject={}", subject);
            return false;
        }
        String safeSubject = subject == null ? "" : subject;
        String safeText = textBody == null ? "" : textBody;
        String safeHtml = htmlBody == null ? "" : htmlBody;

        if (s.dryRun) {
            try {
                Path written = writeDryRun(s, safeSubject, safeText, safeHtml);
                LOG.info("Mail dry-run saved. file={}", written);
                return true;
            } catch (IOException e) {
                return handleFailure(s, "dry_run_write_failed", e);
            }
        }

        if (isBlank(s.host) || isBlank(s.user) || isBlank(s.pass) || s.to == null || s.to.isEmpty()) {
            return handleFailure(s, "smtp_settings_incomplete",
                    new IllegalArgumentException("email enabled but smtp settings are incomplete"));
        }

        try {
            Properties props = new Properties();
            props.put("mail.smtp.auth", "true");
            props.put("mail.smtp.starttls.enable", "true");
            props.put("mail.smtp.host", s.host);
            props.put("mail.smtp.port", String.valueOf(s.port));
            props.put("mail.smtp.connectiontimeout", String.valueOf(s.timeoutMs));
            props.put("mail.smtp.timeout", String.valueOf(s.timeoutMs));
            props.put("mail.smtp.writetimeout", String.valueOf(s.timeoutMs));

            Session session = Session.getInstance(props, new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    return new PasswordAuthentication(s.user, s.pass);
                }
            });

            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(isBlank(s.from) ? s.user : s.from));
            String toJoined = s.to.stream().map(String::trim).filter(v -> !v.isEmpty()).collect(Collectors.joining(","));
            message.setRecipients(Message.RecipientType.TO, InternetAddress.parse(toJoined));
            message.setSubject(safeSubject, "UTF-8");

            MimeMultipart alternative = new MimeMultipart("alternative");
            MimeBodyPart textPart = new MimeBodyPart();
            textPart.setText(safeText, "UTF-8");
            alternative.addBodyPart(textPart);
            if (!safeHtml.isBlank()) {
                MimeBodyPart htmlPart = new MimeBodyPart();
                htmlPart.setContent(safeHtml, "text/html; charset=UTF-8");
                alternative.addBodyPart(htmlPart);
            }
            message.setContent(alternative);

            Transport.send(message);
            LOG.info("Mail sent. subject={} to={}", safeSubject, maskAddresses(s.to));
            return true;
        } catch (MessagingException e) {
            return handleFailure(s, "smtp_send_failed", e);
        }
    }

    private Path writeDryRun(Settings s, String subject, String textBody, String htmlBody) throws IOException {
        Files.createDirectories(s.dryRunDir);
        String stamp = STAMP.format(Instant.now()) + "_" + dryRunSequence.incrementAndGet();
        Path emlPath = s.dryRunDir.resolve("mail_" + stamp + ".eml");
        Path htmlPath = s.dryRunDir.resolve("mail_" + stamp + ".html");

        String eml = "From: " + safe(s.from) + "\n"
                + "To: " + (s.to == null ? "" : String.join(",", s.to)) + "\n"
                + "Subject: " + subject + "\n"
                + "MIME-Version: 1.0\n"
                + "Content-Type: text/plain; charset=UTF-8\n\n"
                + textBody;
        Files.writeString(emlPath, eml, StandardCharsets.UTF_8);
        Files.writeString(htmlPath, htmlBody, StandardCharsets.UTF_8);
        return htmlPath;
    }

    private boolean handleFailure(Settings s, String stage, Exception e) throws NotifyException {
        String message = "Mail send failed stage=" + stage
                + " smtp=" + safe(s.host) + ":" + s.port
                + " from=" + maskAddress(s.from)
                + " to=" + maskAddresses(s.to)
                + " err=" + (e == null ? "" : safe(e.getMessage()));
        if (s.failFast) {
            throw new NotifyException(message, e);
        }
        LOG.warn(message);
        return false;
    }

    private String maskAddresses(List<String> to) {
        if (to == null || to.isEmpty()) {
            return "";
        }
        return to.stream().map(this::maskAddress).collect(Collectors.joining(","));
    }

    private String maskAddress(String raw) {
        String value = safe(raw);
        int at = value.indexOf('@');
        if (at <= 0) {
            return value;
        }
        String local = value.substring(0, at);
        String domain = value.substring(at + 1);
        return (local.length() <= 1 ? "*" : local.charAt(0) + "***") + "@" + domain;
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
