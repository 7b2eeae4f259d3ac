package com.screenir.compiler.report;

import com.screenir.compiler.exception.DesignDocumentException;
import com.screenir.compiler.mapping.TokenMappings;
import com.screenir.compiler.pipeline.ScreenAnalysis;
import com.screenir.compiler.pipeline.ScreenIr;
import com.screenir.compiler.styles.DesignTokens;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders a Markdown summary of one compiled screen from the
 * {@code screen-report.md.ftl} template.
 */
public class ScreenReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ScreenReportGenerator.class);

    static final String TEMPLATE_NAME = "screen-report.md.ftl";

    private final Configuration freemarkerConfig;

    public ScreenReportGenerator() {
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setLocale(Locale.ROOT);
        cfg.setNumberFormat("computer");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(ScreenAnalysis analysis) {
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(dataModel(analysis), out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new DesignDocumentException("Cannot render screen report: " + e.getMessage(), e);
        }
    }

    public void write(Path file, ScreenAnalysis analysis) {
        String report = render(analysis);
        try {
            Files.writeString(file, report);
            log.debug("Wrote report {}", file);
        } catch (IOException e) {
            throw new DesignDocumentException("Cannot write " + file, e);
        }
    }

    Map<String, Object> dataModel(ScreenAnalysis analysis) {
        ScreenIr screen = analysis.getScreen();

        Map<String, Integer> roleCounts = new TreeMap<>();
        screen.getRoot().walk(node -> roleCounts.merge(node.getSemanticType().getDisplayName(), 1, Integer::sum));

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("screen", screen);
        model.put("nodeCount", screen.getRoot().countNodes());
        model.put("styleCount", screen.getStylesBundle().getStyles().size());
        model.put("roleCounts", roleCounts);
        model.put("tokenCategories", tokenCategories(screen.getStylesBundle().getTokens(), analysis.getTokenMappings()));
        model.put("detection", analysis.getDetection());
        return model;
    }

    private static List<Map<String, Object>> tokenCategories(DesignTokens tokens, TokenMappings mappings) {
        List<Map<String, Object>> categories = new ArrayList<>();
        categories.add(category("Colors", tokens.getColors().size(), mappings.getColors()));
        categories.add(category("Spacing", tokens.getSpacing().size(), mappings.getSpacing()));
        categories.add(category("Radii", tokens.getRadii().size(), mappings.getRadii()));
        categories.add(category("Typography", tokens.getTypography().size(), mappings.getTypography()));
        categories.add(category("Shadows", tokens.getShadows().size(), mappings.getShadows()));
        return categories;
    }

    private static Map<String, Object> category(String name, int extracted, Map<String, String> mapped) {
        List<Map<String, String>> entries = new ArrayList<>();
        int matched = 0;
        for (Map.Entry<String, String> entry : mapped.entrySet()) {
            boolean isMatch = !entry.getKey().equals(entry.getValue());
            if (isMatch) {
                matched++;
            }
            Map<String, String> row = new LinkedHashMap<>();
            row.put("source", entry.getKey());
            row.put("target", isMatch ? entry.getValue() : "(unmatched)");
            entries.add(row);
        }
        Map<String, Object> category = new LinkedHashMap<>();
        category.put("name", name);
        category.put("extracted", extracted);
        category.put("matched", matched);
        category.put("entries", entries);
        return category;
    }
}
