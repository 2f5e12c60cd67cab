package io.convotest.core.config;

import java.nio.file.Path;

public record InitResult(Path configPath, Path workspacePath, boolean createdConfig, boolean overwrittenConfig) {
}
