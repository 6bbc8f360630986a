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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One entry of an index or sort definition. Either a bare field name,
 * serialized as <code>"field"</code>, or a map from field name to direction,
 * serialized as <code>{"field": "asc"}</code>.
 */
public final class SortSpec {
    private final String field;
    private final Map<String, SortDirection> directions;

    private SortSpec(String field, Map<String, SortDirection> directions) {
        this.field = field;
        this.directions = directions;
    }

    public static SortSpec field(String field) {
        return new SortSpec(Objects.requireNonNull(field), null);
    }

    public static SortSpec field(String field, SortDirection direction) {
        Map<String, SortDirection> map = new LinkedHashMap<>();
        map.put(Objects.requireNonNull(field), Objects.requireNonNull(direction));
        return new SortSpec(null, map);
    }

    public static SortSpec fields(Map<String, SortDirection> directions) {
        return new SortSpec(null, new LinkedHashMap<>(directions));
    }

    public boolean isSimple() {
        return field != null;
    }

    /**
     * @return the field name of a simple spec, null otherwise.
     */
    public String getField() {
        return field;
    }

    /**
     * @return the field directions of a complex spec, empty for a simple one.
     */
    public Map<String, SortDirection> getDirections() {
        return directions == null ? Collections.emptyMap() : Collections.unmodifiableMap(directions);
    }

    @JsonValue
    public Object toJson() {
        return field != null ? field : directions;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SortSpec fromJson(Object value) {
        if (value instanceof String) {
            return field((String) value);
        }
        if (value instanceof Map) {
            Map<String, SortDirection> map = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                map.put(String.valueOf(e.getKey()), SortDirection.of(String.valueOf(e.getValue())));
            }
            return new SortSpec(null, map);
        }
        throw new IllegalArgumentException("Sort spec must be a string or an object: " + value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SortSpec)) {
            return false;
        }
        SortSpec other = (SortSpec) o;
        return Objects.equals(field, other.field) && Objects.equals(directions, other.directions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, directions);
    }

    @Override
    public String toString() {
        return String.valueOf(toJson());
    }
}
