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
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The welcome document returned by <code>GET /</code>.
 * A snapshot, fetched on demand.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CouchStatus {
    @JsonProperty("couchdb")
    private String couchVersion;
    @JsonProperty("uuid")
    private String instanceUuid;
    @JsonProperty("version")
    private String apiVersion;
    private CouchVendor vendor;

    public CouchStatus() {
    }

    public CouchStatus(String couchVersion, String instanceUuid, String apiVersion, CouchVendor vendor) {
        this.couchVersion = couchVersion;
        this.instanceUuid = instanceUuid;
        this.apiVersion = apiVersion;
        this.vendor = vendor;
    }

    /**
     * @return the value of the <code>couchdb</code> field, usually "Welcome".
     */
    public String getCouchVersion() {
        return couchVersion;
    }

    public void setCouchVersion(String couchVersion) {
        this.couchVersion = couchVersion;
    }

    public String getInstanceUuid() {
        return instanceUuid;
    }

    public void setInstanceUuid(String instanceUuid) {
        this.instanceUuid = instanceUuid;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public void setApiVersion(String apiVersion) {
        this.apiVersion = apiVersion;
    }

    public CouchVendor getVendor() {
        return vendor;
    }

    public void setVendor(CouchVendor vendor) {
        this.vendor = vendor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CouchStatus)) {
            return false;
        }
        CouchStatus other = (CouchStatus) o;
        return Objects.equals(couchVersion, other.couchVersion)
                && Objects.equals(instanceUuid, other.instanceUuid)
                && Objects.equals(apiVersion, other.apiVersion)
                && Objects.equals(vendor, other.vendor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(couchVersion, instanceUuid, apiVersion, vendor);
    }

    @Override
    public String toString() {
        return "CouchStatus[" + couchVersion + " " + instanceUuid + " " + apiVersion + " " + vendor + "]";
    }
}
