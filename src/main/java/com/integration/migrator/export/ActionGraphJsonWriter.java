package com.integration.migrator.export;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.integration.migrator.util.FileWriteUtil;
import com.integration.migrator.workflow.Workflow;

/**
 * Dumps action graphs as indented JSON, one file per workflow.
 */
public class ActionGraphJsonWriter {

    private static final Logger log = LoggerFactory.getLogger(ActionGraphJsonWriter.class);

    static final String FILE_SUFFIX = ".actions.json";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public String toJson(Workflow workflow) {
        try {
            return objectMapper.writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize workflow " + workflow.getName(), e);
        }
    }

    /**
     * @return the files written, in workflow order
     */
    public List<Path> write(List<Workflow> workflows, Path outputDir) throws IOException {
        List<Path> written = new ArrayList<>();
        for (Workflow workflow : workflows) {
            Path file = outputDir.resolve(FileWriteUtil.safeFileName(workflow.getName()) + FILE_SUFFIX);
            FileWriteUtil.safeWriteString(file, toJson(workflow));
            log.info("Wrote {}", file);
            written.add(file);
        }
        return written;
    }
}
