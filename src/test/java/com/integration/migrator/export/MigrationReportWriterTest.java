package com.integration.migrator.export;

import static com.integration.migrator.support.OdxFixtures.el;
import static com.integration.migrator.support.OdxFixtures.prop;
import static com.integration.migrator.support.OdxFixtures.receive;
import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.integration.migrator.batch.UnitOutcome;
import com.integration.migrator.support.OdxFixtures;
import com.integration.migrator.transform.TransformationResult;
import com.integration.migrator.transform.WorkflowTransformer;

/**
 * Unit tests for MigrationReportWriter.
 */
class MigrationReportWriterTest {

    @TempDir
    Path tempDir;

    private static ReportUnit migratedUnit() {
        TransformationResult result = new WorkflowTransformer().transform(
                OdxFixtures.parse("Ns", "Approval", "",
                        receive("Receive_In", "In", "Msg", true)
                                + el("Decision", prop("Name", "Check"),
                                        el("DecisionBranch", prop("Name", "Yes"), prop("Expression", "approvalLimit > 10")),
                                        el("DecisionBranch", prop("Name", "Else")))),
                null, null);
        return MigrationReportWriter.fromOutcome(UnitOutcome.success(Path.of("Approval.odx"), result));
    }

    @Test
    void testFromOutcomeSummarizesResult() {
        ReportUnit unit = migratedUnit();

        assertThat(unit.getName()).isEqualTo("Ns.Approval");
        assertThat(unit.getPattern()).isEqualTo("SINGLE_TRIGGER");
        assertThat(unit.isValid()).isTrue();
        assertThat(unit.getActionCounts()).containsEntry("IF", 1).containsEntry("INITIALIZE_VARIABLE", 1);
        assertThat(unit.getSynthesizedVariables()).containsExactly("approvalLimit");
    }

    @Test
    void testFailureOutcome() {
        ReportUnit unit = MigrationReportWriter.fromOutcome(UnitOutcome.failure(Path.of("in", "Broken.odx"), "boom"));

        assertThat(unit.getName()).isEqualTo("Broken.odx");
        assertThat(unit.isValid()).isFalse();
        assertThat(unit.getFailure()).isEqualTo("boom");
    }

    @Test
    void testRenderListsUnitsAndCounts() throws Exception {
        ReportUnit failed = MigrationReportWriter.fromOutcome(UnitOutcome.failure(Path.of("Broken.odx"), "missing #endif"));

        String report = new MigrationReportWriter().render(List.of(migratedUnit(), failed));

        assertThat(report).startsWith("# Orchestration Migration Report");
        assertThat(report).contains("Units: 2 | Failed: 1 | Blocked: 0");
        assertThat(report).contains("## Ns.Approval", "## Broken.odx");
        assertThat(report).contains("- Failure: missing #endif");
        assertThat(report).contains("| IF | 1 |");
        assertThat(report).contains("- `approvalLimit`");
    }

    @Test
    void testWriteCreatesParentDirectories() throws Exception {
        Path reportFile = tempDir.resolve("reports/migration.md");

        new MigrationReportWriter().write(List.of(migratedUnit()), reportFile);

        assertThat(Files.readString(reportFile)).contains("## Ns.Approval");
    }
}
