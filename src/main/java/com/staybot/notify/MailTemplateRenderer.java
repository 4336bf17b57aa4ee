package com.staybot.notify;

import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.Locale;
import java.util.Map;

/**
 * Renders mail bodies from the classpath templates under {@code templates/mail/}.
 */
public final class MailTemplateRenderer {
    static final String NEW_ITEMS = "mail/new_items";
    static final String PRICE_DROPS = "mail/price_drops";
    static final String BELOW_TARGET = "mail/below_target";
    static final String TEST = "mail/test";

    private final TemplateEngine templateEngine;

    public MailTemplateRenderer() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(true);

        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(resolver);
    }

    public String render(String template, Map<String, Object> variables) {
        Context context = new Context(Locale.ROOT);
        if (variables != null) {
            variables.forEach(context::setVariable);
        }
        return templateEngine.process(template, context);
    }
}
