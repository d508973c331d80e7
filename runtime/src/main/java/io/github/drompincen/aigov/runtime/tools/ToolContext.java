package io.github.drompincen.aigov.runtime.tools;

import java.nio.file.Path;

public record ToolContext(
        String sessionId,
        String projectId,
        String roleName,
        String repository,
        Path workingDirectory
) {}
