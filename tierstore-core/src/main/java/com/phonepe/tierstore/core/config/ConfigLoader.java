package com.phonepe.tierstore.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.tierstore.core.errors.ParameterValidationError;
import com.phonepe.tierstore.core.errors.StorageError;
import com.phonepe.tierstore.core.utils.JsonUtils;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Loads {@link TierStoreConfig} from disk
 */
@UtilityClass
@Slf4j
public class ConfigLoader {
    private static final ObjectMapper MAPPER = JsonUtils.createMapper();

    /**
     * Reads and validates the config file. If the file does not exist, defaults are written to it and returned.
     *
     * @param path Config file location
     * @return Validated configuration
     * @throws ParameterValidationError if the configuration is invalid
     */
    public static TierStoreConfig loadOrCreate(final Path path) {
        final TierStoreConfig config;
        if (Files.exists(path)) {
            config = JsonUtils.read(MAPPER, readAll(path), TierStoreConfig.class, path.toString());
            log.info("Loaded configuration from {}", path);
        }
        else {
            config = TierStoreConfig.defaults();
            save(config, path);
            log.info("No configuration at {}, wrote defaults", path);
        }
        validate(config);
        return config;
    }

    public static void save(final TierStoreConfig config, final Path path) {
        try {
            final var parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(config));
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
    }

    /**
     * @throws ParameterValidationError listing every problem found
     */
    public static void validate(final TierStoreConfig config) {
        final var errors = new ArrayList<String>();
        final var memory = config.getMemory();
        if (memory == null) {
            errors.add("memory options are missing");
        }
        else {
            if (memory.getActiveLimit() < 1) {
                errors.add("activeLimit must be >= 1");
            }
            if (memory.getEvictionBatchSize() < 1 || memory.getEvictionBatchSize() > memory.getActiveLimit()) {
                errors.add("evictionBatchSize must be between 1 and activeLimit");
            }
            checkThreshold(errors, "connectionStrongOverlap", memory.getConnectionStrongOverlap());
            checkThreshold(errors, "connectionWeakOverlap", memory.getConnectionWeakOverlap());
            checkThreshold(errors, "connectionValenceTolerance", memory.getConnectionValenceTolerance());
            checkThreshold(errors, "consolidationOverlap", memory.getConsolidationOverlap());
            if (memory.getMergeExcerptLength() < 1) {
                errors.add("mergeExcerptLength must be >= 1");
            }
            if (memory.getArchiveFilesPerRecall() < 0) {
                errors.add("archiveFilesPerRecall must be >= 0");
            }
        }
        if (config.getSnapshotIntervalMs() <= 0) {
            errors.add("snapshotIntervalMs must be > 0");
        }
        if (config.getSnapshotRetention() < 1) {
            errors.add("snapshotRetention must be >= 1");
        }
        if (!errors.isEmpty()) {
            throw new ParameterValidationError("Invalid configuration: " + String.join(", ", errors));
        }
    }

    private static void checkThreshold(final ArrayList<String> errors, final String name, double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            errors.add(name + " must be within (0, 1]");
        }
    }

    private static byte[] readAll(final Path path) {
        try {
            return Files.readAllBytes(path);
        }
        catch (IOException e) {
            throw StorageError.ioFailure(e);
        }
    }
}
