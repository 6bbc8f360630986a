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

import java.io.UnsupportedEncodingException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;

import io.github.bckfnn.couch.model.CouchResponse;
import io.github.bckfnn.couch.model.CouchStatus;
import io.vertx.core.AsyncResult;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;

/**
 * Connection to one couch server. Owns the connection options, builds request uris and
 * creates, opens and destroys databases.
 * <p>
 * All operations except {@link #process(Operation, Handler)} block the calling thread until the
 * response arrives or the timeout expires, and must not be called from a vert.x event loop thread.
 */
public class Client implements AutoCloseable {
    private final static Logger log = LoggerFactory.getLogger(Client.class);

    private final HttpDriver.Factory driverFactory;
    private final Vertx ownedVertx;
    private final AtomicReference<HttpDriver> httpDriver = new AtomicReference<>();
    private final List<HttpDriver> retiredDrivers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private ClientOptions options;

    public Client(Vertx vertx, ClientOptions options) {
        this(VertxHttpDriver.factory(vertx), options, null);
    }

    public Client(HttpDriver.Factory driverFactory, ClientOptions options) {
        this(driverFactory, options, null);
    }

    private Client(HttpDriver.Factory driverFactory, ClientOptions options, Vertx ownedVertx) {
        this.driverFactory = driverFactory;
        this.ownedVertx = ownedVertx;
        this.options = options.copy();
        parseBaseUri(this.options.getUri());
        checkTimeout(this.options.getTimeout());
        httpDriver.set(buildDriver(this.options));
    }

    /**
     * Create a client with default options and its own vert.x instance.
     * @param uri the base uri of the server, e.g. <code>http://localhost:5984</code>.
     * @return the client.
     */
    public static Client create(String uri) {
        return create(new ClientOptions(uri));
    }

    public static Client create(ClientOptions options) {
        Vertx vertx;
        try {
            vertx = Vertx.vertx();
        } catch (RuntimeException e) {
            throw new TransportException("Unable to start vert.x", e);
        }
        try {
            return new Client(VertxHttpDriver.factory(vertx), options, vertx);
        } catch (RuntimeException e) {
            vertx.close();
            throw e;
        }
    }

    public synchronized String getUri() {
        return options.getUri();
    }

    /**
     * Change the base uri. The value is not validated until the next request is built.
     * @param uri the new base uri.
     */
    public synchronized void setUri(String uri) {
        options.setUri(uri);
    }

    public synchronized String getNamePrefix() {
        return options.getPrefix();
    }

    public synchronized void setNamePrefix(String prefix) {
        options.setPrefix(prefix);
    }

    /**
     * @return a copy of the current options.
     */
    public synchronized ClientOptions getOptions() {
        return options.copy();
    }

    /**
     * Enable or disable gzip and rebuild the http transport. Requests already sent complete on the old transport.
     * @param enabled true to ask the server for compressed responses.
     */
    public synchronized void setCompression(boolean enabled) {
        rebuild(options.copy().setGzip(enabled));
    }

    /**
     * Change the per request timeout and rebuild the http transport. Requests already sent keep their old timeout.
     * @param seconds the timeout in seconds.
     */
    public synchronized void setTimeout(int seconds) {
        checkTimeout(seconds);
        rebuild(options.copy().setTimeout(seconds));
    }

    public List<String> listDatabaseNames() {
        return process(get("/_all_dbs", null).expecting(new TypeReference<List<String>>() {}));
    }

    /**
     * Open a database, creating it when the server does not report it as existing.
     * <p>
     * Any status other than 200 on the existence check, including 401 and 500, leads to a create attempt.
     * @param name the database name without prefix.
     * @return the database.
     */
    public Database openDatabase(String name) {
        Database db = new Database(this, databaseName(name));

        int status = process(head(db.dbPath(), null).statusCode());
        if (status == 200) {
            log.debug("database {} exists", db.getName());
            return db;
        }
        if (status != 404) {
            log.warn("HEAD {} returned {}, trying to create the database", db.dbPath(), status);
        }
        return createDatabase(name);
    }

    public Database createDatabase(String name) {
        Database db = new Database(this, databaseName(name));

        CouchResponse response = process(put(db.dbPath(), null).expecting(CouchResponse.class));
        if (response.succeeded()) {
            log.info("database {} created", db.getName());
            return db;
        }
        throw ServerException.fromEnvelope(response.getReason(), response.getError());
    }

    /**
     * Delete a database.
     * @param name the database name without prefix.
     * @return the <code>ok</code> field of the response, false when it is missing.
     */
    public boolean destroyDatabase(String name) {
        String dbName = databaseName(name);

        CouchResponse response = process(delete("/" + dbName, null).expecting(CouchResponse.class));
        log.info("database {} destroyed: {}", dbName, response);
        return response.succeeded();
    }

    public CouchStatus serverStatus() {
        return process(get("/", null).expecting(CouchStatus.class));
    }

    /**
     * Build a request against the server. The request is not sent.
     * @param method the http method.
     * @param path the path relative to the base uri. A leading slash is ignored.
     * @param params query parameters, may be null.
     * @return the request, decoding its response as a json object.
     */
    public Operation<JsonObject> request(String method, String path, Map<String, String> params) {
        String uri = createPath(path, params);
        return new Operation<>(method, uri, null, (status, body) -> JsonCodec.decodeObject(body));
    }

    public Operation<JsonObject> get(String path, Map<String, String> params) {
        return request("GET", path, params);
    }

    public Operation<JsonObject> post(String path, String body) {
        Operation<JsonObject> op = request("POST", path, null);
        op.setBody(body);
        return op;
    }

    public Operation<JsonObject> put(String path, String body) {
        Operation<JsonObject> op = request("PUT", path, null);
        op.setBody(body);
        return op;
    }

    public Operation<JsonObject> head(String path, Map<String, String> params) {
        return request("HEAD", path, params);
    }

    public Operation<JsonObject> delete(String path, Map<String, String> params) {
        return request("DELETE", path, params);
    }

    /**
     * Send an operation on the current transport and wait for the result.
     * @param op the operation.
     * @param <T> the decoded response type.
     * @return the decoded response.
     */
    public <T> T process(Operation<T> op) {
        if (Context.isOnEventLoopThread()) {
            throw new IllegalStateException("Blocking couch call from an event loop thread: " + op);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        process(op, ar -> {
            if (ar.succeeded()) {
                result.complete(ar.result());
            } else {
                result.completeExceptionally(ar.cause());
            }
        });
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while waiting for " + op.getMethod() + " " + op.getUri(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CouchException) {
                throw (CouchException) cause;
            }
            throw new TransportException(op.getMethod() + " " + op.getUri() + " failed: " + cause, cause);
        }
    }

    public <T> void process(Operation<T> op, Handler<AsyncResult<T>> handler) {
        if (closed.get()) {
            handler.handle(Future.failedFuture(new IllegalStateException("Client is closed")));
            return;
        }
        httpDriver.get().process(op, handler);
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        httpDriver.get().close();
        for (HttpDriver driver : retiredDrivers) {
            driver.close();
        }
        retiredDrivers.clear();
        if (ownedVertx != null) {
            ownedVertx.close();
        }
    }

    private String databaseName(String name) {
        return getNamePrefix() + name;
    }

    private void rebuild(ClientOptions newOptions) {
        HttpDriver driver = buildDriver(newOptions);
        options = newOptions;
        HttpDriver old = httpDriver.getAndSet(driver);
        retiredDrivers.add(old);
        log.debug("http transport rebuilt with {}", newOptions);
    }

    private HttpDriver buildDriver(ClientOptions snapshot) {
        try {
            return driverFactory.create(snapshot.copy());
        } catch (CouchException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("unable to build http transport for {}", snapshot, e);
            throw new TransportException("Unable to build http client: " + e.getMessage(), e);
        }
    }

    /**
     * Join the base uri and a relative path, and append the query parameters.
     */
    private String createPath(String path, Map<String, String> params) {
        URI base = parseBaseUri(getUri());

        StringBuilder p = new StringBuilder(base.getPath() == null ? "" : base.getPath());
        if (p.length() == 0 || p.charAt(p.length() - 1) != '/') {
            p.append('/');
        }
        String rel = path == null ? "" : path;
        int start = 0;
        while (start < rel.length() && rel.charAt(start) == '/') {
            start++;
        }
        p.append(rel, start, rel.length());

        StringBuilder sb = new StringBuilder();
        sb.append(base.getScheme()).append("://").append(base.getRawAuthority());
        try {
            sb.append(new URI(null, null, p.toString(), null, null).toASCIIString());
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid request path " + path + ": " + e.getMessage(), e);
        }

        if (params != null) {
            boolean seenParms = false;
            for (Map.Entry<String, String> e : params.entrySet()) {
                sb.append(seenParms ? '&' : '?');
                sb.append(encode(e.getKey()));
                sb.append('=');
                sb.append(encode(e.getValue() == null ? "" : e.getValue()));
                seenParms = true;
            }
        }
        return sb.toString();
    }

    private static URI parseBaseUri(String uri) {
        if (uri == null) {
            throw new ConfigurationException("No base uri configured");
        }
        URI base;
        try {
            base = new URI(uri);
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Invalid base uri " + uri + ": " + e.getMessage(), e);
        }
        // hosts such as couch_db only parse as a registry authority, getHost() is null for them
        if (!base.isAbsolute() || base.isOpaque() || base.getRawAuthority() == null) {
            throw new ConfigurationException("Base uri must be absolute: " + uri);
        }
        return base;
    }

    private static void checkTimeout(int seconds) {
        if (seconds <= 0) {
            throw new ConfigurationException("Timeout must be positive: " + seconds);
        }
    }

    private static String encode(String value) {
        try {
            return URLEncoder.encode(value, "UTF-8");
        } catch (UnsupportedEncodingException e) {
            throw new ConfigurationException("Unable to encode " + value, e);
        }
    }
}
