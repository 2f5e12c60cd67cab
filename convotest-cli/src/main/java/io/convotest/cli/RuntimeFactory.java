package io.convotest.cli;

import io.convotest.core.config.model.ConvotestConfig;
import io.convotest.core.runtime.ConvotestRuntime;
import java.io.IOException;

@FunctionalInterface
public interface RuntimeFactory {
    ConvotestRuntime open(ConvotestConfig config, boolean forceLegacy) throws IOException;
}
