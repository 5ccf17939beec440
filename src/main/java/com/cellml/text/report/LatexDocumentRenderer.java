package com.cellml.text.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cellml.text.generator.ComponentEquations;
import com.cellml.text.generator.LatexGenerator;
import com.cellml.text.model.ModelNode;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a standalone LaTeX document listing the equations of every component.
 */
public class LatexDocumentRenderer {
    private static final Logger log = LoggerFactory.getLogger(LatexDocumentRenderer.class);

    static final String TEMPLATE_NAME = "equations.tex.ftl";

    private final Configuration freemarkerConfig;
    private final LatexGenerator latexGenerator;

    public LatexDocumentRenderer() {
        this(new LatexGenerator());
    }

    public LatexDocumentRenderer(LatexGenerator latexGenerator) {
        this.latexGenerator = latexGenerator;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(ModelNode model) {
        String title = model.getName() != null ? model.getName() : "unnamed_model";
        return render(title, latexGenerator.convertAll(model));
    }

    public String render(String title, List<ComponentEquations> components) {
        Map<String, Object> dataModel = new HashMap<>();
        dataModel.put("title", escapeText(title));
        dataModel.put("components", components.stream()
                .map(c -> new ComponentEquations(escapeText(c.getName() != null ? c.getName() : "unnamed_component"),
                        c.getEquations()))
                .toList());

        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE_NAME);
            StringWriter out = new StringWriter();
            template.process(dataModel, out);
            log.debug("Rendered LaTeX document '{}' with {} components", title, components.size());
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ReportRenderException("Failed to render " + TEMPLATE_NAME + ": " + e.getMessage(), e);
        }
    }

    /**
     * Escape characters that are special in LaTeX running text.
     */
    static String escapeText(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '_', '&', '%', '#', '$', '{', '}' -> sb.append('\\').append(c);
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
