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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.ServerSocket;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.bckfnn.couch.model.CouchStatus;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

/**
 * Runs the client with the vert.x driver against a minimal in-process couch server.
 */
class ClientIntegrationTest {
    private Vertx vertx;
    private HttpServer server;
    private Client client;
    private final Set<String> dbs = new ConcurrentSkipListSet<>();
    private final List<Received> received = new CopyOnWriteArrayList<>();

    static class Received {
        final String method;
        final String path;
        final String referer;
        final String contentType;
        final String acceptEncoding;

        Received(HttpServerRequest req) {
            this.method = req.rawMethod();
            this.path = req.path();
            this.referer = req.getHeader("Referer");
            this.contentType = req.getHeader("Content-Type");
            this.acceptEncoding = req.getHeader("Accept-Encoding");
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        vertx = Vertx.vertx();
        CompletableFuture<HttpServer> started = new CompletableFuture<>();
        vertx.createHttpServer()
                .requestHandler(req -> {
                    received.add(new Received(req));
                    req.bodyHandler(body -> handle(req));
                })
                .listen(0, "localhost", ar -> {
                    if (ar.succeeded()) {
                        started.complete(ar.result());
                    } else {
                        started.completeExceptionally(ar.cause());
                    }
                });
        server = started.get(10, TimeUnit.SECONDS);
        client = new Client(vertx, new ClientOptions("http://localhost:" + server.actualPort()).setPrefix("it_"));
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        CompletableFuture<Void> closed = new CompletableFuture<>();
        vertx.close(ar -> closed.complete(null));
        closed.get(10, TimeUnit.SECONDS);
    }

    private void handle(HttpServerRequest req) {
        HttpServerResponse resp = req.response().putHeader("Content-Type", "application/json");
        String path = req.path();

        if (path.equals("/_slow")) {
            return;
        }
        if (path.equals("/")) {
            resp.end(new JsonObject()
                    .put("couchdb", "Welcome")
                    .put("version", "3.3.2")
                    .put("uuid", "85fb71bf700c17267fef77535820e371")
                    .put("vendor", new JsonObject().put("name", "The Apache Software Foundation"))
                    .encode());
            return;
        }
        if (path.equals("/_all_dbs")) {
            resp.end(new JsonArray(new ArrayList<>(dbs)).encode());
            return;
        }

        String db = path.substring(1);
        switch (req.method()) {
        case HEAD:
            resp.setStatusCode(dbs.contains(db) ? 200 : 404).end();
            break;
        case PUT:
            if (dbs.add(db)) {
                resp.setStatusCode(201).end("{\"ok\":true}");
            } else {
                resp.setStatusCode(412).end("{\"error\":\"file_exists\",\"reason\":\"The database could not be created, the file already exists.\"}");
            }
            break;
        case DELETE:
            if (dbs.remove(db)) {
                resp.setStatusCode(200).end("{\"ok\":true}");
            } else {
                resp.setStatusCode(404).end("{\"error\":\"not_found\",\"reason\":\"Database does not exist.\"}");
            }
            break;
        default:
            resp.setStatusCode(405).end("{\"error\":\"method_not_allowed\",\"reason\":\"Only DELETE,HEAD,PUT allowed\"}");
        }
    }

    private List<String> methods() {
        List<String> methods = new ArrayList<>();
        for (Received r : received) {
            methods.add(r.method);
        }
        return methods;
    }

    @Test
    void readsServerStatus() {
        CouchStatus status = client.serverStatus();

        assertThat(status.getCouchVersion()).isEqualTo("Welcome");
        assertThat(status.getApiVersion()).isEqualTo("3.3.2");
        assertThat(status.getVendor().getVersion()).isNull();
    }

    @Test
    void databaseLifecycle() {
        Database db = client.openDatabase("orders");
        assertThat(db.getName()).isEqualTo("it_orders");
        assertThat(methods()).containsExactly("HEAD", "PUT");

        received.clear();
        client.openDatabase("orders");
        assertThat(methods()).containsExactly("HEAD");

        assertThat(client.listDatabaseNames()).containsExactly("it_orders");

        assertThatThrownBy(() -> client.createDatabase("orders"))
                .isInstanceOf(ServerException.class)
                .hasMessage("The database could not be created, the file already exists.");

        assertThat(client.destroyDatabase("orders")).isTrue();
        assertThat(client.destroyDatabase("orders")).isFalse();
        assertThat(client.listDatabaseNames()).isEmpty();
    }

    @Test
    void sendsJsonAndRefererHeaders() {
        client.listDatabaseNames();

        Received r = received.get(0);
        assertThat(r.path).isEqualTo("/_all_dbs");
        assertThat(r.contentType).isEqualTo("application/json");
        assertThat(r.referer).isEqualTo("http://localhost:" + server.actualPort() + "/_all_dbs");
    }

    @Test
    void compressionChangeAppliesToNextRequest() {
        client.listDatabaseNames();
        client.setCompression(false);
        client.listDatabaseNames();

        assertThat(received.get(0).acceptEncoding).contains("gzip");
        assertThat(received.get(1).acceptEncoding).isNull();
    }

    @Test
    void timeoutSurfacesAsTransportError() {
        client.setTimeout(1);

        long start = System.nanoTime();
        assertThatThrownBy(() -> client.process(client.get("/_slow", null)))
                .isInstanceOf(TransportException.class);
        assertThat(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start)).isLessThan(4);
    }

    @Test
    void refusedConnectionSurfacesAsTransportError() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        client.setUri("http://localhost:" + port);

        assertThatThrownBy(() -> client.serverStatus()).isInstanceOf(TransportException.class);
    }

    @Test
    void blockingCallFromEventLoopIsRejected() throws Exception {
        CompletableFuture<Throwable> failure = new CompletableFuture<>();
        vertx.runOnContext(v -> {
            try {
                client.listDatabaseNames();
                failure.complete(null);
            } catch (RuntimeException e) {
                failure.complete(e);
            }
        });

        assertThat(failure.get(10, TimeUnit.SECONDS)).isInstanceOf(IllegalStateException.class);
        assertThat(received).isEmpty();
    }

    @Test
    void sendsNonStandardMethod() {
        JsonObject answer = client.process(client.request("COPY", "/it_orders/doc", null));

        assertThat(answer.getString("error")).isEqualTo("method_not_allowed");
        assertThat(methods()).containsExactly("COPY");
    }

    @Test
    void driverReportsRequestSetupFailure() throws Exception {
        VertxHttpDriver driver = new VertxHttpDriver(vertx, new ClientOptions("http://localhost:" + server.actualPort()).setTimeout(0));
        CompletableFuture<Throwable> failure = new CompletableFuture<>();
        driver.process(client.get("/_all_dbs", null), ar -> failure.complete(ar.failed() ? ar.cause() : null));

        assertThat(failure.get(10, TimeUnit.SECONDS)).isInstanceOf(TransportException.class);
        driver.close();
    }

    @Test
    void asyncProcessDeliversOnHandler() throws Exception {
        CompletableFuture<JsonObject> result = new CompletableFuture<>();
        client.process(client.get("/", null), ar -> {
            if (ar.succeeded()) {
                result.complete(ar.result());
            } else {
                result.completeExceptionally(ar.cause());
            }
        });

        assertThat(result.get(10, TimeUnit.SECONDS).getString("uuid")).isEqualTo("85fb71bf700c17267fef77535820e371");
    }
}
