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
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseIndexList {
    @JsonProperty("total_rows")
    private int totalRows;
    private List<Index> indexes = new ArrayList<>();

    public DatabaseIndexList() {
    }

    public DatabaseIndexList(int totalRows, List<Index> indexes) {
        this.totalRows = totalRows;
        this.indexes = indexes == null ? new ArrayList<>() : new ArrayList<>(indexes);
    }

    public int getTotalRows() {
        return totalRows;
    }

    public void setTotalRows(int totalRows) {
        this.totalRows = totalRows;
    }

    public List<Index> getIndexes() {
        return indexes;
    }

    /**
     * @param indexes the indexes, null is stored as an empty list.
     */
    public void setIndexes(List<Index> indexes) {
        this.indexes = indexes == null ? new ArrayList<>() : indexes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DatabaseIndexList)) {
            return false;
        }
        DatabaseIndexList other = (DatabaseIndexList) o;
        return totalRows == other.totalRows && Objects.equals(indexes, other.indexes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalRows, indexes);
    }

    @Override
    public String toString() {
        return "DatabaseIndexList[" + totalRows + " " + indexes + "]";
    }
}
