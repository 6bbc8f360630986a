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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

class ModelJsonTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private <T> T roundTrip(T value, Class<T> type) throws Exception {
        return mapper.readValue(mapper.writeValueAsString(value), type);
    }

    @Test
    void couchResponseKeepsPopulatedAndAbsentFields() throws Exception {
        CouchResponse full = new CouchResponse(false, "file_exists", "The database could not be created, the file already exists.");
        CouchResponse empty = new CouchResponse();

        assertThat(roundTrip(full, CouchResponse.class)).isEqualTo(full);
        assertThat(roundTrip(empty, CouchResponse.class)).isEqualTo(empty);
        assertThat(mapper.writeValueAsString(empty)).isEqualTo("{}");
    }

    @Test
    void couchResponseTreatsNullLikeAbsent() throws Exception {
        CouchResponse explicitNull = mapper.readValue("{\"ok\":null,\"error\":null}", CouchResponse.class);

        assertThat(explicitNull).isEqualTo(new CouchResponse());
        assertThat(explicitNull.succeeded()).isFalse();
        assertThat(mapper.readValue("{\"ok\":true}", CouchResponse.class).succeeded()).isTrue();
    }

    @Test
    void couchResponseRejectsIncompatibleType() {
        assertThatThrownBy(() -> mapper.readValue("{\"ok\":{\"nested\":1}}", CouchResponse.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    void couchStatusMapsServerFieldNames() throws Exception {
        String json = "{\"couchdb\":\"Welcome\",\"version\":\"3.3.2\",\"git_sha\":\"11a234070\","
                + "\"uuid\":\"1d9f5a8c\",\"features\":[\"access-ready\"],"
                + "\"vendor\":{\"name\":\"The Apache Software Foundation\"}}";

        CouchStatus status = mapper.readValue(json, CouchStatus.class);

        assertThat(status.getCouchVersion()).isEqualTo("Welcome");
        assertThat(status.getApiVersion()).isEqualTo("3.3.2");
        assertThat(status.getInstanceUuid()).isEqualTo("1d9f5a8c");
        assertThat(status.getVendor()).isEqualTo(new CouchVendor("The Apache Software Foundation", null));
        assertThat(roundTrip(status, CouchStatus.class)).isEqualTo(status);
    }

    @Test
    void sortSpecUsesStringOrObjectForm() throws Exception {
        IndexFields fields = new IndexFields(Arrays.asList(
                SortSpec.field("name"),
                SortSpec.field("age", SortDirection.DESC)));

        String json = mapper.writeValueAsString(fields);

        assertThat(json).isEqualTo("{\"fields\":[\"name\",{\"age\":\"desc\"}]}");
        assertThat(mapper.readValue(json, IndexFields.class)).isEqualTo(fields);
    }

    @Test
    void sortSpecKeepsFieldOrder() throws Exception {
        Map<String, SortDirection> directions = new LinkedHashMap<>();
        directions.put("b", SortDirection.ASC);
        directions.put("a", SortDirection.DESC);

        SortSpec spec = mapper.readValue(mapper.writeValueAsString(SortSpec.fields(directions)), SortSpec.class);

        assertThat(spec.isSimple()).isFalse();
        assertThat(spec.getDirections()).containsExactly(
                Map.entry("b", SortDirection.ASC),
                Map.entry("a", SortDirection.DESC));
    }

    @Test
    void sortSpecRejectsUnknownDirection() {
        assertThatThrownBy(() -> mapper.readValue("{\"a\":\"sideways\"}", SortSpec.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    void indexListDecodesServerResponse() throws Exception {
        String json = "{\"total_rows\":2,\"indexes\":["
                + "{\"ddoc\":null,\"name\":\"_all_docs\",\"type\":\"special\",\"def\":{\"fields\":[{\"_id\":\"asc\"}]}},"
                + "{\"ddoc\":\"_design/a5f4711fc9448864a13c81dc71e660b524d7410c\",\"name\":\"foo-index\",\"type\":\"json\","
                + "\"partitioned\":false,\"def\":{\"fields\":[{\"foo\":\"asc\"}]}}]}";

        DatabaseIndexList list = mapper.readValue(json, DatabaseIndexList.class);

        assertThat(list.getTotalRows()).isEqualTo(2);
        assertThat(list.getIndexes()).extracting(Index::getName).containsExactly("_all_docs", "foo-index");
        assertThat(list.getIndexes().get(0).getDdoc()).isNull();
        assertThat(list.getIndexes().get(1).getIndexType()).isEqualTo("json");
        assertThat(list.getIndexes().get(1).getDef().getFields())
                .containsExactly(SortSpec.field("foo", SortDirection.ASC));
        assertThat(roundTrip(list, DatabaseIndexList.class)).isEqualTo(list);
    }

    @Test
    void explicitNullListsDecodeAsEmpty() throws Exception {
        DatabaseIndexList list = mapper.readValue("{\"total_rows\":0,\"indexes\":null}", DatabaseIndexList.class);
        IndexFields fields = mapper.readValue("{\"fields\":null}", IndexFields.class);

        assertThat(list.getIndexes()).isEmpty();
        assertThat(list).isEqualTo(mapper.readValue("{\"total_rows\":0}", DatabaseIndexList.class));
        assertThat(fields.getFields()).isEmpty();
        assertThat(fields).isEqualTo(new IndexFields());
    }

    @Test
    void indexRoundTripsPopulatedAndEmpty() throws Exception {
        Index full = new Index("_design/idx", "by-name", "json",
                new IndexFields(Collections.singletonList(SortSpec.field("name"))));

        assertThat(roundTrip(full, Index.class)).isEqualTo(full);
        assertThat(roundTrip(new Index(), Index.class)).isEqualTo(new Index());
        assertThat(roundTrip(new DatabaseIndexList(), DatabaseIndexList.class)).isEqualTo(new DatabaseIndexList());
    }

    @Test
    void createdResponsesRoundTrip() throws Exception {
        IndexCreated index = new IndexCreated("created", "_design/x", "by-name", null, null);
        DesignCreated failed = new DesignCreated(null, null, null, "conflict", "Document update conflict.");

        assertThat(roundTrip(index, IndexCreated.class)).isEqualTo(index);
        assertThat(roundTrip(failed, DesignCreated.class)).isEqualTo(failed);
        assertThat(roundTrip(new DesignCreated(), DesignCreated.class)).isEqualTo(new DesignCreated());
        assertThat(index).isNotEqualTo(new DesignCreated("created", "_design/x", "by-name", null, null));
    }
}
