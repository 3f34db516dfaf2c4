package dk.lawoffice.intranet.frontend.web;

import dk.lawoffice.intranet.frontend.format.StatusPalette;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the pages of the web front-end from the Thymeleaf templates on the classpath.
 * Every template gets the {@code fmt} helper for dates, money and status colours.
 */
@JBossLog
@ApplicationScoped
public class PageRenderer {

    static final String TEMPLATE_PREFIX = "META-INF/resources/thymeleaf/web/";
    static final String TEMPLATE_SUFFIX = ".html";

    @Inject
    StatusPalette statusPalette;

    private TemplateEngine templateEngine;

    @PostConstruct
    void init() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix(TEMPLATE_PREFIX);
        resolver.setSuffix(TEMPLATE_SUFFIX);
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resolver.setCacheable(true);
        resolver.setCheckExistence(true);

        templateEngine = new TemplateEngine();
        templateEngine.setTemplateResolver(resolver);
        log.infof("Web templates resolved from %s", TEMPLATE_PREFIX);
    }

    public String render(String template, Map<String, Object> variables) {
        Context context = new Context(Locale.US);
        context.setVariables(variables);
        context.setVariable("fmt", new TemplateHelpers(statusPalette));
        return templateEngine.process(template, context);
    }
}
