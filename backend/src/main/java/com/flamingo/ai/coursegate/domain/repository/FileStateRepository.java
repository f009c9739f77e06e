package com.flamingo.ai.coursegate.domain.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flamingo.ai.coursegate.config.PipelineConfig;
import com.flamingo.ai.coursegate.domain.state.Checkpoint;
import com.flamingo.ai.coursegate.domain.state.PipelineState;
import com.flamingo.ai.coursegate.exception.StateCorruptedException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * Stores each run as {@code <basePath>/<runId>/state.json} with checkpoints under {@code
 * <basePath>/<runId>/checkpoints/<name>.json}. Every write goes to a temporary file in the target
 * directory and is then renamed over the destination.
 */
@Repository
@Slf4j
public class FileStateRepository implements StateRepository {

  static final String STATE_FILE = "state.json";
  static final String CHECKPOINT_DIR = "checkpoints";
  static final String JSON_SUFFIX = ".json";
  static final String TEMP_SUFFIX = ".tmp";

  private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

  private final Path basePath;
  private final ObjectMapper objectMapper;

  @Autowired
  public FileStateRepository(PipelineConfig pipelineConfig) {
    this(Paths.get(pipelineConfig.getState().getBasePath()));
  }

  public FileStateRepository(Path basePath) {
    this.basePath = basePath;
    this.objectMapper =
        JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();
  }

  @Override
  public Optional<PipelineState> load(String runId) {
    Path file = stateFile(runId);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    PipelineState state = parse(runId, file, PipelineState.class);
    requireSchema(runId, state, file);
    return Optional.of(state);
  }

  @Override
  public void save(PipelineState state) {
    Path file = stateFile(state.getRunId());
    writeAtomically(file, serialize(state));
    log.debug("Saved state of run {} at version {}", state.getRunId(), state.getVersion());
  }

  @Override
  public Optional<Checkpoint> loadCheckpoint(String runId, String name) {
    Path file = checkpointFile(runId, name);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    Checkpoint checkpoint = parse(runId, file, Checkpoint.class);
    if (checkpoint.name() == null || checkpoint.createdAt() == null) {
      throw new StateCorruptedException(
          runId, "Checkpoint " + file + " is missing its name or timestamp");
    }
    if (checkpoint.snapshot() == null) {
      throw new StateCorruptedException(runId, "Checkpoint " + file + " has no snapshot");
    }
    requireSchema(runId, checkpoint.snapshot(), file);
    return Optional.of(checkpoint);
  }

  @Override
  public void saveCheckpoint(String runId, Checkpoint checkpoint) {
    Path file = checkpointFile(runId, checkpoint.name());
    if (Files.exists(file)) {
      throw new UncheckedIOException(
          new FileAlreadyExistsException(
              file.toString(), null, "checkpoint records are immutable"));
    }
    writeAtomically(file, serialize(checkpoint));
    log.debug("Saved checkpoint {} of run {}", checkpoint.name(), runId);
  }

  @Override
  public boolean checkpointExists(String runId, String name) {
    return Files.exists(checkpointFile(runId, name));
  }

  @Override
  public List<String> listCheckpointNames(String runId) {
    Path dir = runDir(runId).resolve(CHECKPOINT_DIR);
    if (!Files.isDirectory(dir)) {
      return List.of();
    }
    try (Stream<Path> files = Files.list(dir)) {
      List<String> names = new ArrayList<>();
      files
          .map(path -> path.getFileName().toString())
          .filter(fileName -> fileName.endsWith(JSON_SUFFIX))
          .map(fileName -> fileName.substring(0, fileName.length() - JSON_SUFFIX.length()))
          .sorted()
          .forEach(names::add);
      return names;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to list checkpoints of run " + runId, e);
    }
  }

  Path runDir(String runId) {
    return basePath.resolve(requireSafe(runId, "run id"));
  }

  private Path stateFile(String runId) {
    return runDir(runId).resolve(STATE_FILE);
  }

  private Path checkpointFile(String runId, String name) {
    return runDir(runId)
        .resolve(CHECKPOINT_DIR)
        .resolve(requireSafe(name, "checkpoint name") + JSON_SUFFIX);
  }

  private <T> T parse(String runId, Path file, Class<T> type) {
    try {
      return objectMapper.readValue(Files.readAllBytes(file), type);
    } catch (JsonProcessingException e) {
      throw new StateCorruptedException(
          runId, "Unparseable record " + file + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + file, e);
    }
  }

  private byte[] serialize(Object value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  private void writeAtomically(Path target, byte[] content) {
    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), TEMP_SUFFIX);
      Files.write(temp, content);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.warn("Atomic move not supported for {}, falling back to replace", target);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      temp = null;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write " + target, e);
    } finally {
      if (temp != null) {
        deleteQuietly(temp);
      }
    }
  }

  private void deleteQuietly(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
    }
  }

  private void requireSchema(String runId, PipelineState state, Path file) {
    List<String> missing = new ArrayList<>();
    if (state.getRunId() == null) {
      missing.add("runId");
    }
    if (state.getStatus() == null) {
      missing.add("status");
    }
    if (state.getCreatedAt() == null) {
      missing.add("createdAt");
    }
    if (state.getLastModified() == null) {
      missing.add("lastModified");
    }
    if (state.getSections() == null
        || state.getSections().values().stream()
            .anyMatch(s -> s == null || s.getStatus() == null || s.getSteps() == null)) {
      missing.add("sections");
    }
    if (state.getErrors() == null) {
      missing.add("errors");
    }
    if (state.getCheckpoints() == null) {
      missing.add("checkpoints");
    }
    if (!missing.isEmpty()) {
      throw new StateCorruptedException(
          runId, "Schema-invalid record " + file + ": missing " + missing);
    }
    if (!state.getRunId().equals(runId)) {
      throw new StateCorruptedException(
          runId, "Record " + file + " belongs to run " + state.getRunId());
    }
  }

  private static String requireSafe(String name, String what) {
    if (name == null || !SAFE_NAME.matcher(name).matches()) {
      throw new IllegalArgumentException("Invalid " + what + ": " + name);
    }
    return name;
  }
}
