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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * A fully resolved request that has not been sent yet, together with the way its response is decoded.
 * Operations are built by {@link Client} and executed by an {@link HttpDriver}.
 *
 * @param <T> the decoded response type.
 */
public class Operation<T> {
    private final static Logger log = LoggerFactory.getLogger(Operation.class);

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String REFERER = "Referer";
    public static final String APPLICATION_JSON = "application/json";

    private final String method;
    private final String uri;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private String body;
    private final ResponseHandler<T> responseHandler;

    /**
     * Turns the status and body of a response into the result of an operation.
     */
    @FunctionalInterface
    public interface ResponseHandler<T> {
        T handle(int statusCode, String body);
    }

    public Operation(String method, String uri, String body, ResponseHandler<T> responseHandler) {
        this.method = method;
        this.uri = uri;
        this.body = body;
        this.responseHandler = responseHandler;
        headers.put(CONTENT_TYPE, APPLICATION_JSON);
        headers.put(REFERER, uri);
    }

    public String getMethod() {
        return method;
    }

    public String getUri() {
        return uri;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public T handleResponse(int statusCode, String body) {
        log.debug("couch resp {} {}", statusCode, body);
        return responseHandler.handle(statusCode, body);
    }

    /**
     * Same request, with the body decoded into <code>type</code>.
     * @param type the class of the response.
     * @param <R> the response type.
     * @return a new operation.
     */
    public <R> Operation<R> expecting(Class<R> type) {
        return new Operation<>(method, uri, body, (status, b) -> JsonCodec.decode(b, type));
    }

    public <R> Operation<R> expecting(TypeReference<R> type) {
        return new Operation<>(method, uri, body, (status, b) -> JsonCodec.decode(b, type));
    }

    /**
     * Same request, with the response reduced to its status code. The body is ignored.
     * @return a new operation.
     */
    public Operation<Integer> statusCode() {
        return new Operation<>(method, uri, body, (status, b) -> status);
    }

    @Override
    public String toString() {
        return method + " " + uri + (body != null ? " " + body : "");
    }
}
