package dev.henneberger.vertx.sync.core;

import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Persists the state snapshot in a JSON file. Writes go to a sibling temp file that is then
 * moved over the target, so readers never see a partial snapshot.
 */
public final class FileStateStore implements StateStore {

  private final Path file;
  private final Object monitor = new Object();

  public FileStateStore(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public Optional<JsonObject> load() throws IOException {
    synchronized (monitor) {
      if (Files.notExists(file)) {
        return Optional.empty();
      }
      String raw = Files.readString(file, StandardCharsets.UTF_8);
      if (raw.isBlank()) {
        return Optional.empty();
      }
      return Optional.of(new JsonObject(raw));
    }
  }

  @Override
  public void save(JsonObject state) throws IOException {
    Objects.requireNonNull(state, "state");
    synchronized (monitor) {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = file.resolveSibling(file.getFileName() + ".tmp");
      Files.writeString(temp, state.encodePrettily(), StandardCharsets.UTF_8);
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
  }
}
