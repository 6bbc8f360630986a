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

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpMethod;

/**
 * {@link HttpDriver} on top of a vert.x {@link HttpClient}.
 */
public class VertxHttpDriver implements HttpDriver {
    private final static Logger log = LoggerFactory.getLogger(VertxHttpDriver.class);

    private final HttpClient httpClient;
    private final long timeoutMillis;

    public VertxHttpDriver(Vertx vertx, ClientOptions options) {
        this.timeoutMillis = options.getTimeout() * 1000L;
        HttpClientOptions httpOptions = new HttpClientOptions()
                .setTryUseCompression(options.isGzip())
                .setConnectTimeout((int) timeoutMillis);
        this.httpClient = vertx.createHttpClient(httpOptions);
        log.debug("http client created gzip={} timeout={}s", options.isGzip(), options.getTimeout());
    }

    public static HttpDriver.Factory factory(Vertx vertx) {
        return options -> new VertxHttpDriver(vertx, options);
    }

    @Override
    public <T> void process(Operation<T> req, Handler<AsyncResult<T>> handler) {
        log.debug("{} {}", req.getMethod(), req.getUri());

        AtomicBoolean fired = new AtomicBoolean(false);
        Handler<AsyncResult<T>> once = result -> {
            if (!fired.getAndSet(true)) {
                handler.handle(result);
            }
        };

        HttpMethod method = method(req.getMethod());
        HttpClientRequest r = null;
        try {
            r = httpClient.requestAbs(method, req.getUri(), resp -> {
                resp.exceptionHandler(e -> {
                    once.handle(Future.failedFuture(new TransportException("Response to " + req.getMethod() + " " + req.getUri() + " failed: " + e, e)));
                });
                resp.bodyHandler(body -> {
                    T result;
                    try {
                        result = req.handleResponse(resp.statusCode(), body.toString("UTF-8"));
                    } catch (CouchException e) {
                        once.handle(Future.failedFuture(e));
                        return;
                    } catch (RuntimeException e) {
                        once.handle(Future.failedFuture(new DecodeException("Unable to handle response to " + req.getMethod() + " " + req.getUri(), e)));
                        return;
                    }
                    once.handle(Future.succeededFuture(result));
                });
            });
            if (method == HttpMethod.OTHER) {
                r.setRawMethod(req.getMethod());
            }
            r.exceptionHandler(e -> {
                log.error("couch request {} {} failed: {}", req.getMethod(), req.getUri(), e.toString());
                once.handle(Future.failedFuture(new TransportException(req.getMethod() + " " + req.getUri() + " failed: " + e, e)));
            });
            r.setTimeout(timeoutMillis);
            for (Map.Entry<String, String> header : req.getHeaders().entrySet()) {
                r.putHeader(header.getKey(), header.getValue());
            }
            if (req.getBody() != null) {
                r.end(req.getBody());
            } else {
                r.end();
            }
        } catch (RuntimeException e) {
            if (r != null) {
                r.reset();
            }
            once.handle(Future.failedFuture(new TransportException("Unable to send request " + req.getMethod() + " " + req.getUri() + ": " + e.getMessage(), e)));
        }
    }

    private static HttpMethod method(String method) {
        try {
            return HttpMethod.valueOf(method);
        } catch (IllegalArgumentException e) {
            return HttpMethod.OTHER;
        }
    }

    @Override
    public void close() {
        httpClient.close();
    }
}
