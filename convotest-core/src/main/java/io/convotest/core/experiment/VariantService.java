package io.convotest.core.experiment;

import io.convotest.core.observability.EventTypes;
import io.convotest.core.observability.ObservabilityService;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class VariantService {
    private static final Logger LOG = LoggerFactory.getLogger(VariantService.class);

    private final ExperimentStore store;
    private final Path workingDirectory;
    private final ObservabilityService observability;
    private final Clock clock;
    private final Map<String, Optional<byte[]>> originals = new LinkedHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> dirty = ConcurrentHashMap.newKeySet();

    public VariantService(ExperimentStore store, Path workingDirectory, ObservabilityService observability, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        this.observability = Objects.requireNonNull(observability, "observability must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Variant createVariant(CreateVariantRequest request) throws IOException {
        Objects.requireNonNull(request, "request must not be null");
        String targetFile = canonical(request.targetFile());
        String hash = hash(request.content());
        Optional<Variant> existing = store.findVariantByHash(hash, targetFile);
        if (existing.isPresent()) {
            LOG.debug("Variant with hash {} already exists for {}: {}", hash, targetFile, existing.get().variantId());
            return existing.get();
        }
        Variant variant = new Variant(
            newVariantId(request.variantType()),
            request.variantType(),
            targetFile,
            request.name(),
            request.description(),
            request.content(),
            hash,
            request.baselineVariantId(),
            request.sourceFixId(),
            false,
            clock.instant(),
            request.createdBy()
        );
        store.saveVariant(variant);
        LOG.info("Created variant {} for {}", variant.variantId(), targetFile);
        return variant;
    }

    public Optional<Variant> getVariant(String variantId) throws IOException {
        return store.findVariant(variantId);
    }

    public Variant requireVariant(String variantId) throws IOException {
        return store.findVariant(variantId)
            .orElseThrow(() -> new IllegalArgumentException("Variant " + variantId + " not found"));
    }

    public List<Variant> getVariantsForFile(String targetFile) throws IOException {
        return store.variantsForFile(canonical(targetFile));
    }

    public List<Variant> getAllVariants() throws IOException {
        return store.allVariants();
    }

    public Optional<Variant> getBaseline(String targetFile) throws IOException {
        return store.baselineFor(canonical(targetFile));
    }

    public void setAsBaseline(String variantId) throws IOException {
        requireVariant(variantId);
        store.setBaseline(variantId);
    }

    public Variant captureBaseline(String targetFile, VariantType type) throws IOException {
        String canonical = canonical(targetFile);
        Path path = resolve(canonical);
        if (!Files.exists(path)) {
            throw new IOException("Cannot capture baseline, file does not exist: " + path);
        }
        String content = Files.readString(path, StandardCharsets.UTF_8);
        String fileName = path.getFileName().toString();
        Variant variant = createVariant(new CreateVariantRequest(
            type,
            canonical,
            "Baseline: " + fileName,
            "Original baseline captured from " + fileName,
            content,
            null,
            null,
            "manual"
        ));
        store.setBaseline(variant.variantId());
        return variant.asBaseline(true);
    }

    /**
     * Writes the variant's content over its target file, replacing whatever was there.
     */
    public void applyVariant(String variantId) throws IOException {
        Variant variant = requireVariant(variantId);
        String targetFile = variant.targetFile();
        if (dirty.contains(targetFile)) {
            throw new IllegalStateException("Target file " + targetFile + " is dirty after a failed rollback");
        }
        Path path = resolve(targetFile);
        synchronized (originals) {
            if (!originals.containsKey(targetFile)) {
                originals.put(targetFile, Files.exists(path) ? Optional.of(Files.readAllBytes(path)) : Optional.empty());
            }
        }
        write(path, variant.content().getBytes(StandardCharsets.UTF_8));
        LOG.info("Applied variant {} to {}", variantId, targetFile);
        observability.recordSafely(EventTypes.VARIANT_APPLIED, Map.of(
            "variant_id", variantId,
            "target_file", targetFile
        ));
    }

    /**
     * Restores the content that was live before the first apply against this file. Does nothing when
     * no variant is applied. On failure the file is marked dirty and the error is rethrown.
     */
    public void rollback(String targetFile) throws IOException {
        String canonical = canonical(targetFile);
        Optional<byte[]> original;
        synchronized (originals) {
            if (!originals.containsKey(canonical)) {
                return;
            }
            original = originals.get(canonical);
        }
        Path path = resolve(canonical);
        try {
            if (original.isPresent()) {
                write(path, original.get());
            } else {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            dirty.add(canonical);
            LOG.error("Rollback of {} failed, file marked dirty: {}", canonical, e.getMessage(), e);
            observability.recordSafely(EventTypes.VARIANT_ROLLBACK_FAILED, Map.of(
                "target_file", canonical,
                "error", String.valueOf(e.getMessage())
            ));
            throw e;
        }
        synchronized (originals) {
            originals.remove(canonical);
        }
        LOG.info("Rolled back {}", canonical);
        observability.recordSafely(EventTypes.VARIANT_ROLLED_BACK, Map.of("target_file", canonical));
    }

    public void rollbackAll() throws IOException {
        List<String> applied;
        synchronized (originals) {
            applied = List.copyOf(originals.keySet());
        }
        IOException first = null;
        for (String targetFile : applied) {
            try {
                rollback(targetFile);
            } catch (IOException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        if (first != null) {
            throw first;
        }
    }

    public Variant restoreBaseline(String targetFile) throws IOException {
        String canonical = canonical(targetFile);
        Variant baseline = store.baselineFor(canonical)
            .orElseThrow(() -> new IllegalStateException("No baseline variant for " + canonical));
        synchronized (originals) {
            originals.remove(canonical);
        }
        dirty.remove(canonical);
        write(resolve(canonical), baseline.content().getBytes(StandardCharsets.UTF_8));
        LOG.info("Restored baseline {} to {}", baseline.variantId(), canonical);
        observability.recordSafely(EventTypes.VARIANT_ROLLED_BACK, Map.of(
            "target_file", canonical,
            "variant_id", baseline.variantId()
        ));
        return baseline;
    }

    public void commitApplied(String targetFile) {
        synchronized (originals) {
            originals.remove(canonical(targetFile));
        }
    }

    public boolean hasActiveVariant(String targetFile) {
        synchronized (originals) {
            return originals.containsKey(canonical(targetFile));
        }
    }

    public boolean isDirty(String targetFile) {
        return dirty.contains(canonical(targetFile));
    }

    public void clearDirty(String targetFile) {
        String canonical = canonical(targetFile);
        if (dirty.remove(canonical)) {
            synchronized (originals) {
                originals.remove(canonical);
            }
            LOG.info("Cleared dirty flag on {}", canonical);
        }
    }

    /**
     * Lock that serializes apply, run and rollback for one target file.
     */
    public ReentrantLock lockFor(String targetFile) {
        return locks.computeIfAbsent(canonical(targetFile), key -> new ReentrantLock(true));
    }

    public Optional<String> getVariantContent(String variantId) throws IOException {
        return store.findVariant(variantId).map(Variant::content);
    }

    static String hash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String newVariantId(VariantType type) {
        String upper = type.name().toUpperCase(Locale.ROOT);
        String prefix = upper.substring(0, Math.min(4, upper.length()));
        String timestamp = Long.toString(clock.millis(), 36);
        String random = UUID.randomUUID().toString().substring(0, 8);
        return "VAR-" + prefix + "-" + timestamp + "-" + random;
    }

    static String canonical(String targetFile) {
        Objects.requireNonNull(targetFile, "targetFile must not be null");
        String normalized = targetFile.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    private Path resolve(String targetFile) {
        Path path = Path.of(targetFile);
        return path.isAbsolute() ? path : workingDirectory.resolve(path).normalize();
    }

    private static void write(Path path, byte[] bytes) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, bytes);
    }
}
