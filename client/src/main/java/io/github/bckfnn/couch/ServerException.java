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

/**
 * The server answered with an envelope that reports failure.
 */
public class ServerException extends CouchException {
    private static final long serialVersionUID = 1L;

    static final String UNSPECIFIED_ERROR = "unspecified error";

    public ServerException(String message) {
        super(message);
    }

    /**
     * Build an exception from the <code>reason</code> and <code>error</code> fields of a response,
     * preferring the reason.
     * @param reason the reason field, may be null.
     * @param error the error field, may be null.
     * @return the exception.
     */
    public static ServerException fromEnvelope(String reason, String error) {
        if (reason != null) {
            return new ServerException(reason);
        }
        if (error != null) {
            return new ServerException(error);
        }
        return new ServerException(UNSPECIFIED_ERROR);
    }
}
