package com.releasefeed.service.report;

import com.releasefeed.core.model.RunReport;
import com.releasefeed.core.util.JsonUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public class RunReportWriter {
    private final Path file;

    public RunReportWriter(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public void write(RunReport report) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                JsonUtils.prettyWriter().writeValue(out, report);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing run report to " + file, e);
        }
    }
}
