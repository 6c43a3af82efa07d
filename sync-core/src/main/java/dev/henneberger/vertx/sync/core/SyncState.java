package dev.henneberger.vertx.sync.core;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bookmarks for every stream of a run. Mutated only by the component syncing a stream and
 * serialized as one combined snapshot.
 */
public final class SyncState {

  private static final Logger LOG = LoggerFactory.getLogger(SyncState.class);

  static final String BOOKMARKS_FIELD = "bookmarks";
  static final String CURRENTLY_SYNCING_FIELD = "currently_syncing";

  private final Map<String, StreamBookmark> bookmarks = new LinkedHashMap<>();
  private String currentlySyncing;

  public static SyncState fromJson(JsonObject json) {
    SyncState state = new SyncState();
    if (json == null) {
      return state;
    }
    JsonObject stored = json.getJsonObject(BOOKMARKS_FIELD);
    if (stored != null) {
      for (String stream : stored.fieldNames()) {
        JsonObject bookmark = stored.getJsonObject(stream);
        if (bookmark != null && !bookmark.isEmpty()) {
          state.bookmarks.put(stream, StreamBookmark.fromJson(bookmark));
        }
      }
    }
    state.currentlySyncing = json.getString(CURRENTLY_SYNCING_FIELD);
    return state;
  }

  public Optional<StreamBookmark> bookmark(String stream) {
    return Optional.ofNullable(bookmarks.get(Objects.requireNonNull(stream, "stream")));
  }

  public void setBookmark(String stream, StreamBookmark bookmark) {
    bookmarks.put(Objects.requireNonNull(stream, "stream"), Objects.requireNonNull(bookmark, "bookmark"));
  }

  public void clearBookmark(String stream) {
    bookmarks.remove(Objects.requireNonNull(stream, "stream"));
  }

  /**
   * Moves a stream's LSN bookmark forward. Lower values are ignored so the bookmark never decreases.
   *
   * @return whether the bookmark changed
   */
  public boolean advanceLsn(String stream, long lsn) {
    StreamBookmark current = bookmarks.get(Objects.requireNonNull(stream, "stream"));
    if (current != null && current.kind() == StreamBookmark.Kind.LSN) {
      if (lsn < current.lsnValue()) {
        LOG.warn("Ignoring LSN {} for stream {} behind bookmark {}", lsn, stream, current.lsnValue());
        return false;
      }
      if (lsn == current.lsnValue()) {
        return false;
      }
    }
    bookmarks.put(stream, StreamBookmark.lsn(lsn));
    return true;
  }

  public Optional<String> currentlySyncing() {
    return Optional.ofNullable(currentlySyncing);
  }

  public void setCurrentlySyncing(String stream) {
    this.currentlySyncing = stream;
  }

  public Map<String, StreamBookmark> bookmarks() {
    return Collections.unmodifiableMap(bookmarks);
  }

  public JsonObject toJson() {
    JsonObject stored = new JsonObject();
    bookmarks.forEach((stream, bookmark) -> stored.put(stream, bookmark.toJson()));
    return new JsonObject()
      .put(BOOKMARKS_FIELD, stored)
      .put(CURRENTLY_SYNCING_FIELD, currentlySyncing);
  }
}
