package com.integration.migrator.export;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.integration.migrator.analysis.TriggerAnalysis;
import com.integration.migrator.batch.UnitOutcome;
import com.integration.migrator.transform.MigrationDiagnostics;
import com.integration.migrator.transform.TransformationResult;
import com.integration.migrator.util.FileWriteUtil;
import com.integration.migrator.workflow.Workflow;
import com.integration.migrator.workflow.WorkflowAction;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders the Markdown migration report. Reads results only.
 */
public class MigrationReportWriter {

    private static final Logger log = LoggerFactory.getLogger(MigrationReportWriter.class);

    private static final String TEMPLATE = "migration-report.md.ftl";

    private final Configuration freemarkerConfig = createFreemarkerConfig();

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public String render(List<ReportUnit> units) throws IOException {
        Map<String, Object> model = new HashMap<>();
        model.put("units", units);
        model.put("failedCount", units.stream().filter(u -> u.getFailure() != null).count());
        model.put("blockedCount", units.stream().filter(u -> u.getFailure() == null && !u.isValid()).count());
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(model, out);
            return out.toString();
        } catch (TemplateException e) {
            throw new IOException("Cannot render migration report: " + e.getMessage(), e);
        }
    }

    public void write(List<ReportUnit> units, Path reportFile) throws IOException {
        FileWriteUtil.safeWriteString(reportFile, render(units));
        log.info("Wrote migration report {}", reportFile);
    }

    public static ReportUnit fromOutcome(UnitOutcome outcome) {
        if (!outcome.isSuccess()) {
            return ReportUnit.builder()
                    .name(outcome.getSource().getFileName().toString())
                    .source(outcome.getSource().toString())
                    .pattern("n/a")
                    .valid(false)
                    .failure(outcome.getFailure().orElse("unknown failure"))
                    .build();
        }
        TransformationResult result = outcome.getResult().orElseThrow();
        return fromResult(result.getWorkflow(), result, outcome.getSource().toString());
    }

    public static ReportUnit fromResult(Workflow workflow, TransformationResult result, String source) {
        MigrationDiagnostics diagnostics = result.getDiagnostics();
        ReportUnit.ReportUnitBuilder builder = ReportUnit.builder()
                .name(workflow.getName())
                .source(source)
                .pattern(result.getAnalysis().map(a -> a.getPattern().name()).orElse("BINDINGS"))
                .valid(result.getAnalysis().map(TriggerAnalysis::isValid).orElse(true))
                .errors(diagnostics.getErrors())
                .warnings(diagnostics.getWarnings())
                .infos(diagnostics.getInfos());

        Map<String, Integer> counts = new TreeMap<>();
        for (WorkflowAction action : workflow.allActions()) {
            counts.merge(action.getKind().name(), 1, Integer::sum);
        }
        counts.forEach(builder::actionCount);

        workflow.getSynthesizedVariableNames().forEach(builder::synthesizedVariable);
        return builder.build();
    }
}
