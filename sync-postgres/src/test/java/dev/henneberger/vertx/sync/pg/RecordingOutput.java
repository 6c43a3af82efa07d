/*
 * Copyright (C) 2026 Daniel Henneberger
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.henneberger.vertx.sync.pg;

import dev.henneberger.vertx.sync.core.ChangeRecord;
import dev.henneberger.vertx.sync.core.SyncOutput;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

final class RecordingOutput implements SyncOutput {

  final List<ChangeRecord> records = new ArrayList<>();
  final List<JsonObject> states = new ArrayList<>();

  @Override
  public Future<Void> emitRecord(ChangeRecord record) {
    records.add(record);
    return Future.succeededFuture();
  }

  @Override
  public Future<Void> emitState(JsonObject state) {
    states.add(state);
    return Future.succeededFuture();
  }

  List<ChangeRecord> records(String stream) {
    return records.stream().filter(r -> r.getStream().equals(stream)).collect(Collectors.toList());
  }

  JsonObject lastState() {
    return states.isEmpty() ? null : states.get(states.size() - 1);
  }
}
