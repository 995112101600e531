package com.verilog.hierarchy.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * FreeMarker templates for the plain-text reports, loaded from {@code /templates}.
 */
public class ReportTemplates {

    public static final String MODULE_SUMMARY = "module-summary.ftl";
    public static final String MULTI_DEFINED = "multi-defined.ftl";
    public static final String UNUSED_MODULES = "unused-modules.ftl";
    public static final String UNUSED_FILES = "unused-files.ftl";

    private final Configuration freemarkerConfig;

    public ReportTemplates() {
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

    public String render(String templateName, Map<String, Object> model) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new ReportRenderingException("Failed to render report template " + templateName, e);
        }
    }
}
