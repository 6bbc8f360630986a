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
 * Common shape of the responses to index and design document creation.
 * A populated <code>error</code> signals failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class CreatedResponse {
    private String result;
    private String id;
    private String name;
    private String error;
    private String reason;

    protected CreatedResponse() {
    }

    protected CreatedResponse(String result, String id, String name, String error, String reason) {
        this.result = result;
        this.id = id;
        this.name = name;
        this.error = error;
        this.reason = reason;
    }

    /**
     * @return "created" or "exists" for an index, null otherwise.
     */
    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
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
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        CreatedResponse other = (CreatedResponse) o;
        return Objects.equals(result, other.result)
                && Objects.equals(id, other.id)
                && Objects.equals(name, other.name)
                && Objects.equals(error, other.error)
                && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), result, id, name, error, reason);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[result=" + result + " id=" + id + " name=" + name
                + " error=" + error + " reason=" + reason + "]";
    }
}
