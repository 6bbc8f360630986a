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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The <code>def</code> / <code>index</code> part of an index definition.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IndexFields {
    private List<SortSpec> fields = new ArrayList<>();

    public IndexFields() {
    }

    public IndexFields(List<SortSpec> fields) {
        this.fields = fields == null ? new ArrayList<>() : new ArrayList<>(fields);
    }

    public List<SortSpec> getFields() {
        return fields;
    }

    /**
     * @param fields the fields, null is stored as an empty list.
     */
    public void setFields(List<SortSpec> fields) {
        this.fields = fields == null ? new ArrayList<>() : fields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IndexFields)) {
            return false;
        }
        return Objects.equals(fields, ((IndexFields) o).fields);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(fields);
    }

    @Override
    public String toString() {
        return "IndexFields" + fields;
    }
}
