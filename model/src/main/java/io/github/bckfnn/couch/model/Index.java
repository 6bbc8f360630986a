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
 * A secondary index as listed by <code>GET /{db}/_index</code>.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Index {
    private String ddoc;
    private String name;
    @JsonProperty("type")
    private String indexType;
    private IndexFields def;

    public Index() {
    }

    public Index(String ddoc, String name, String indexType, IndexFields def) {
        this.ddoc = ddoc;
        this.name = name;
        this.indexType = indexType;
        this.def = def;
    }

    /**
     * @return id of the owning design document, null for the special primary index.
     */
    public String getDdoc() {
        return ddoc;
    }

    public void setDdoc(String ddoc) {
        this.ddoc = ddoc;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getIndexType() {
        return indexType;
    }

    public void setIndexType(String indexType) {
        this.indexType = indexType;
    }

    public IndexFields getDef() {
        return def;
    }

    public void setDef(IndexFields def) {
        this.def = def;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Index)) {
            return false;
        }
        Index other = (Index) o;
        return Objects.equals(ddoc, other.ddoc)
                && Objects.equals(name, other.name)
                && Objects.equals(indexType, other.indexType)
                && Objects.equals(def, other.def);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ddoc, name, indexType, def);
    }

    @Override
    public String toString() {
        return "Index[" + ddoc + " " + name + " " + indexType + " " + def + "]";
    }
}
