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
package io.github.bckfnn.couch.model;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * The <code>{ok, error, reason}</code> envelope returned by mutating calls.
 * Every field is optional. A missing or false <code>ok</code> means failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CouchResponse {
    private Boolean ok;
    private String error;
    private String reason;

    public CouchResponse() {
    }

    public CouchResponse(Boolean ok, String error, String reason) {
        this.ok = ok;
        this.error = error;
        this.reason = reason;
    }

    public Boolean getOk() {
        return ok;
    }

    public void setOk(Boolean ok) {
        this.ok = ok;
    }

    /**
     * @return true only when the server sent <code>"ok": true</code>.
     */
    public boolean succeeded() {
        return Boolean.TRUE.equals(ok);
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CouchResponse)) {
            return false;
        }
        CouchResponse other = (CouchResponse) o;
        return Objects.equals(ok, other.ok) && Objects.equals(error, other.error) && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ok, error, reason);
    }

    @Override
    public String toString() {
        return "CouchResponse[ok=" + ok + " error=" + error + " reason=" + reason + "]";
    }
}
