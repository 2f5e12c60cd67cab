package io.convotest.core.experiment;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ExperimentStore {
    void saveVariant(Variant variant) throws IOException;

    Optional<Variant> findVariant(String variantId) throws IOException;

    Optional<Variant> findVariantByHash(String contentHash, String targetFile) throws IOException;

    List<Variant> variantsForFile(String targetFile) throws IOException;

    List<Variant> allVariants() throws IOException;

    Optional<Variant> baselineFor(String targetFile) throws IOException;

    void setBaseline(String variantId) throws IOException;

    void saveExperiment(Experiment experiment) throws IOException;

    Optional<Experiment> findExperiment(String experimentId) throws IOException;

    List<Experiment> listExperiments() throws IOException;

    long appendRun(ExperimentRun run) throws IOException;

    List<ExperimentRun> runsFor(String experimentId) throws IOException;

    List<RunCount> countRuns(String experimentId) throws IOException;
}
