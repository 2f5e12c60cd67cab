package io.convotest.core.experiment;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class SqliteExperimentStore implements ExperimentStore {
    private static final TypeReference<List<ExperimentVariant>> EXPERIMENT_VARIANTS = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {
    };

    private static final String VARIANT_COLUMNS = """
        variant_id, variant_type, target_file, name, description, content, content_hash,
        baseline_variant_id, source_fix_id, is_baseline, created_at, created_by
        """;
    private static final String EXPERIMENT_COLUMNS = """
        experiment_id, name, description, hypothesis, status, experiment_type, variants_json, test_ids_json,
        min_sample_size, max_sample_size, significance_threshold, created_at, started_at, completed_at,
        winning_variant_id, conclusion
        """;
    private static final String RUN_COLUMNS = """
        id, experiment_id, run_id, test_id, variant_id, variant_role, started_at, completed_at, metrics_json
        """;

    private final String jdbcUrl;
    private final ObjectMapper mapper;

    public SqliteExperimentStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        init();
    }

    @Override
    public synchronized void saveVariant(Variant variant) throws IOException {
        String sql = "INSERT INTO ab_variants (" + VARIANT_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, variant.variantId());
            statement.setString(2, variant.variantType().key());
            statement.setString(3, variant.targetFile());
            statement.setString(4, variant.name());
            statement.setString(5, variant.description());
            statement.setString(6, variant.content());
            statement.setString(7, variant.contentHash());
            statement.setString(8, variant.baselineVariantId());
            statement.setString(9, variant.sourceFixId());
            statement.setInt(10, variant.baseline() ? 1 : 0);
            statement.setString(11, text(variant.createdAt()));
            statement.setString(12, variant.createdBy());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to save variant " + variant.variantId(), e);
        }
    }

    @Override
    public synchronized Optional<Variant> findVariant(String variantId) throws IOException {
        List<Variant> found = queryVariants("WHERE variant_id = ?", variantId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public synchronized Optional<Variant> findVariantByHash(String contentHash, String targetFile) throws IOException {
        List<Variant> found = queryVariants("WHERE content_hash = ? AND target_file = ?", contentHash, targetFile);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public synchronized List<Variant> variantsForFile(String targetFile) throws IOException {
        return queryVariants("WHERE target_file = ?", targetFile);
    }

    @Override
    public synchronized List<Variant> allVariants() throws IOException {
        return queryVariants("");
    }

    @Override
    public synchronized Optional<Variant> baselineFor(String targetFile) throws IOException {
        List<Variant> found = queryVariants("WHERE target_file = ? AND is_baseline = 1", targetFile);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public synchronized void setBaseline(String variantId) throws IOException {
        String clear = """
            UPDATE ab_variants SET is_baseline = 0
            WHERE target_file = (SELECT target_file FROM ab_variants WHERE variant_id = ?)
            """;
        String mark = "UPDATE ab_variants SET is_baseline = 1 WHERE variant_id = ?";
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement clearStatement = connection.prepareStatement(clear);
                 PreparedStatement markStatement = connection.prepareStatement(mark)) {
                clearStatement.setString(1, variantId);
                clearStatement.executeUpdate();
                markStatement.setString(1, variantId);
                if (markStatement.executeUpdate() == 0) {
                    connection.rollback();
                    throw new IllegalArgumentException("Variant " + variantId + " not found");
                }
                connection.commit();
            }
        } catch (SQLException e) {
            throw new IOException("Failed to set baseline " + variantId, e);
        }
    }

    @Override
    public synchronized void saveExperiment(Experiment experiment) throws IOException {
        String sql = """
            INSERT INTO ab_experiments (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(experiment_id) DO UPDATE SET
                status = excluded.status,
                started_at = excluded.started_at,
                completed_at = excluded.completed_at,
                winning_variant_id = excluded.winning_variant_id,
                conclusion = excluded.conclusion
            """.formatted(EXPERIMENT_COLUMNS);
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, experiment.experimentId());
            statement.setString(2, experiment.name());
            statement.setString(3, experiment.description());
            statement.setString(4, experiment.hypothesis());
            statement.setString(5, experiment.status().key());
            statement.setString(6, experiment.experimentType() == null ? null : experiment.experimentType().key());
            statement.setString(7, mapper.writeValueAsString(experiment.variants()));
            statement.setString(8, mapper.writeValueAsString(experiment.testIds()));
            statement.setInt(9, experiment.minSampleSize());
            statement.setInt(10, experiment.maxSampleSize());
            statement.setDouble(11, experiment.significanceThreshold());
            statement.setString(12, text(experiment.createdAt()));
            statement.setString(13, text(experiment.startedAt()));
            statement.setString(14, text(experiment.completedAt()));
            statement.setString(15, experiment.winningVariantId());
            statement.setString(16, experiment.conclusion());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to save experiment " + experiment.experimentId(), e);
        }
    }

    @Override
    public synchronized Optional<Experiment> findExperiment(String experimentId) throws IOException {
        List<Experiment> found = queryExperiments("WHERE experiment_id = ?", experimentId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public synchronized List<Experiment> listExperiments() throws IOException {
        return queryExperiments("ORDER BY created_at DESC");
    }

    @Override
    public synchronized long appendRun(ExperimentRun run) throws IOException {
        String sql = """
            INSERT INTO ab_experiment_runs
                (experiment_id, run_id, test_id, variant_id, variant_role, started_at, completed_at, passed, metrics_json)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            statement.setString(1, run.experimentId());
            statement.setString(2, run.runId());
            statement.setString(3, run.testId());
            statement.setString(4, run.variantId());
            statement.setString(5, run.variantRole().key());
            statement.setString(6, text(run.startedAt()));
            statement.setString(7, text(run.completedAt()));
            statement.setInt(8, run.passed() ? 1 : 0);
            statement.setString(9, mapper.writeValueAsString(run.metrics()));
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to record experiment run for " + run.experimentId(), e);
        }
    }

    @Override
    public synchronized List<ExperimentRun> runsFor(String experimentId) throws IOException {
        String sql = "SELECT " + RUN_COLUMNS + " FROM ab_experiment_runs WHERE experiment_id = ? ORDER BY id ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, experimentId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ExperimentRun> runs = new ArrayList<>();
                while (resultSet.next()) {
                    runs.add(new ExperimentRun(
                        resultSet.getLong("id"),
                        resultSet.getString("experiment_id"),
                        resultSet.getString("run_id"),
                        resultSet.getString("test_id"),
                        resultSet.getString("variant_id"),
                        VariantRole.fromKey(resultSet.getString("variant_role")),
                        instant(resultSet.getString("started_at")),
                        instant(resultSet.getString("completed_at")),
                        mapper.readValue(resultSet.getString("metrics_json"), RunMetrics.class)
                    ));
                }
                return runs;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list runs for experiment " + experimentId, e);
        }
    }

    @Override
    public synchronized List<RunCount> countRuns(String experimentId) throws IOException {
        String sql = """
            SELECT variant_id, COUNT(*) AS run_count, SUM(passed) AS pass_count
            FROM ab_experiment_runs
            WHERE experiment_id = ?
            GROUP BY variant_id
            ORDER BY variant_id
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, experimentId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<RunCount> counts = new ArrayList<>();
                while (resultSet.next()) {
                    counts.add(new RunCount(
                        resultSet.getString("variant_id"),
                        resultSet.getInt("run_count"),
                        resultSet.getInt("pass_count")
                    ));
                }
                return counts;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to count runs for experiment " + experimentId, e);
        }
    }

    private List<Variant> queryVariants(String where, String... args) throws IOException {
        String sql = "SELECT " + VARIANT_COLUMNS + " FROM ab_variants " + where;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                statement.setString(i + 1, args[i]);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                List<Variant> variants = new ArrayList<>();
                while (resultSet.next()) {
                    variants.add(new Variant(
                        resultSet.getString("variant_id"),
                        VariantType.fromKey(resultSet.getString("variant_type")),
                        resultSet.getString("target_file"),
                        resultSet.getString("name"),
                        resultSet.getString("description"),
                        resultSet.getString("content"),
                        resultSet.getString("content_hash"),
                        resultSet.getString("baseline_variant_id"),
                        resultSet.getString("source_fix_id"),
                        resultSet.getInt("is_baseline") == 1,
                        instant(resultSet.getString("created_at")),
                        resultSet.getString("created_by")
                    ));
                }
                return variants;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to query variants", e);
        }
    }

    private List<Experiment> queryExperiments(String clause, String... args) throws IOException {
        String sql = "SELECT " + EXPERIMENT_COLUMNS + " FROM ab_experiments " + clause;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                statement.setString(i + 1, args[i]);
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                List<Experiment> experiments = new ArrayList<>();
                while (resultSet.next()) {
                    String type = resultSet.getString("experiment_type");
                    experiments.add(new Experiment(
                        resultSet.getString("experiment_id"),
                        resultSet.getString("name"),
                        resultSet.getString("description"),
                        resultSet.getString("hypothesis"),
                        ExperimentStatus.fromKey(resultSet.getString("status")),
                        type == null ? null : VariantType.fromKey(type),
                        mapper.readValue(resultSet.getString("variants_json"), EXPERIMENT_VARIANTS),
                        mapper.readValue(resultSet.getString("test_ids_json"), STRINGS),
                        resultSet.getInt("min_sample_size"),
                        resultSet.getInt("max_sample_size"),
                        resultSet.getDouble("significance_threshold"),
                        instant(resultSet.getString("created_at")),
                        instant(resultSet.getString("started_at")),
                        instant(resultSet.getString("completed_at")),
                        resultSet.getString("winning_variant_id"),
                        resultSet.getString("conclusion")
                    ));
                }
                return experiments;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to query experiments", e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String variants = """
            CREATE TABLE IF NOT EXISTS ab_variants (
                variant_id TEXT PRIMARY KEY,
                variant_type TEXT NOT NULL,
                target_file TEXT NOT NULL,
                name TEXT NOT NULL,
                description TEXT,
                content TEXT NOT NULL,
                content_hash TEXT NOT NULL,
                baseline_variant_id TEXT,
                source_fix_id TEXT,
                is_baseline INTEGER NOT NULL DEFAULT 0,
                created_at TEXT,
                created_by TEXT
            )
            """;
        String experiments = """
            CREATE TABLE IF NOT EXISTS ab_experiments (
                experiment_id TEXT PRIMARY KEY,
                name TEXT NOT NULL,
                description TEXT,
                hypothesis TEXT,
                status TEXT NOT NULL,
                experiment_type TEXT,
                variants_json TEXT NOT NULL,
                test_ids_json TEXT NOT NULL,
                min_sample_size INTEGER NOT NULL,
                max_sample_size INTEGER NOT NULL,
                significance_threshold REAL NOT NULL,
                created_at TEXT,
                started_at TEXT,
                completed_at TEXT,
                winning_variant_id TEXT,
                conclusion TEXT
            )
            """;
        String runs = """
            CREATE TABLE IF NOT EXISTS ab_experiment_runs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                experiment_id TEXT NOT NULL,
                run_id TEXT NOT NULL,
                test_id TEXT NOT NULL,
                variant_id TEXT NOT NULL,
                variant_role TEXT NOT NULL,
                started_at TEXT,
                completed_at TEXT,
                passed INTEGER NOT NULL,
                metrics_json TEXT NOT NULL
            )
            """;
        String hashIdx = "CREATE INDEX IF NOT EXISTS idx_ab_variants_hash ON ab_variants(content_hash, target_file)";
        String runIdx = "CREATE INDEX IF NOT EXISTS idx_ab_runs_experiment ON ab_experiment_runs(experiment_id, variant_id)";
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(variants);
            statement.execute(experiments);
            statement.execute(runs);
            statement.execute(hashIdx);
            statement.execute(runIdx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite experiment store", e);
        }
    }

    private static String text(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant instant(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value);
    }
}
