/*
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
package io.github.bckfnn.couch;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.bckfnn.couch.model.CreatedResponse;
import io.github.bckfnn.couch.model.DatabaseIndexList;
import io.github.bckfnn.couch.model.DesignCreated;
import io.github.bckfnn.couch.model.Index;
import io.github.bckfnn.couch.model.IndexCreated;
import io.github.bckfnn.couch.model.IndexFields;
import io.vertx.core.json.JsonObject;

/**
 * Handle to one named database on the server of its {@link Client}.
 * Obtained from {@link Client#openDatabase(String)} or {@link Client#createDatabase(String)}.
 */
public class Database {
    private final static Logger log = LoggerFactory.getLogger(Database.class);

    private final Client client;
    private final String databaseName;

    Database(Client client, String databaseName) {
        this.client = client;
        this.databaseName = databaseName;
    }

    /**
     * @return the effective name, including the client's prefix.
     */
    public String getName() {
        return databaseName;
    }

    public String dbPath() {
        return "/" + databaseName;
    }

    public Client getClient() {
        return client;
    }

    public DatabaseIndexList readIndexes() {
        return client.process(client.get(dbPath() + "/_index", null).expecting(DatabaseIndexList.class));
    }

    /**
     * Create a json index.
     * @param name the index name.
     * @param def the indexed fields.
     * @return the server's answer, with result "created" or "exists".
     */
    public IndexCreated insertIndex(String name, IndexFields def) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("index", def);

        IndexCreated created = client.process(client.post(dbPath() + "/_index", JsonCodec.encode(body)).expecting(IndexCreated.class));
        checkCreated(created);
        log.debug("index {} on {}: {}", name, databaseName, created.getResult());
        return created;
    }

    /**
     * Create an index unless one with the same name already exists.
     * @return true if the index was created.
     */
    public boolean ensureIndex(String name, IndexFields def) {
        for (Index index : readIndexes().getIndexes()) {
            if (name.equals(index.getName())) {
                return false;
            }
        }
        insertIndex(name, def);
        return true;
    }

    /**
     * Store a design document holding javascript views.
     * @param name the design name, without the <code>_design/</code> prefix.
     * @param views the view definitions, keyed by view name.
     * @return the server's answer.
     */
    public DesignCreated createDesign(String name, JsonObject views) {
        JsonObject doc = new JsonObject()
                .put("language", "javascript")
                .put("views", views);

        DesignCreated created = client.process(client.put(dbPath() + "/_design/" + name, doc.encode()).expecting(DesignCreated.class));
        checkCreated(created);
        return created;
    }

    private static void checkCreated(CreatedResponse response) {
        if (response.getError() != null) {
            throw ServerException.fromEnvelope(response.getReason(), response.getError());
        }
    }

    @Override
    public String toString() {
        return "Database[" + databaseName + "]";
    }
}
