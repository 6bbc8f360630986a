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

import io.vertx.core.AsyncResult;
import io.vertx.core.Handler;

/**
 * The http transport used by a {@link Client}. A driver is built from one snapshot of the
 * client options and never changes afterwards; the client replaces the whole driver when
 * the compression or timeout settings change.
 */
public interface HttpDriver {
    /**
     * Send the request and pass the decoded response, or the failure, to the handler.
     * Transport failures are reported as {@link TransportException}, undecodable bodies as {@link DecodeException}.
     */
    public <T> void process(Operation<T> req, Handler<AsyncResult<T>> handler);

    public void close();

    @FunctionalInterface
    public interface Factory {
        public HttpDriver create(ClientOptions options);
    }
}
