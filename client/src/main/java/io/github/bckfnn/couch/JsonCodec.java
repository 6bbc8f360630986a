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

import java.io.IOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.vertx.core.json.JsonObject;

/**
 * Jackson binding between response bodies and the resource model.
 */
final class JsonCodec {
    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonCodec() {
    }

    static <T> T decode(String body, Class<T> type) {
        return decode(body, mapper.getTypeFactory().constructType(type));
    }

    static <T> T decode(String body, TypeReference<T> type) {
        return decode(body, mapper.getTypeFactory().constructType(type));
    }

    static JsonObject decodeObject(String body) {
        if (body == null || body.isEmpty()) {
            throw new DecodeException("Empty response body, expected a json object");
        }
        try {
            return new JsonObject(body);
        } catch (io.vertx.core.json.DecodeException e) {
            throw new DecodeException("Response is not a json object: " + abbreviate(body), e);
        }
    }

    static String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to encode " + value, e);
        }
    }

    private static <T> T decode(String body, JavaType type) {
        if (body == null || body.isEmpty()) {
            throw new DecodeException("Empty response body, expected " + type.getRawClass().getSimpleName());
        }
        T value;
        try {
            value = mapper.readValue(body, type);
        } catch (IOException e) {
            throw new DecodeException("Unable to decode " + type.getRawClass().getSimpleName() + " from " + abbreviate(body), e);
        }
        if (value == null) {
            throw new DecodeException("Null response body, expected " + type.getRawClass().getSimpleName());
        }
        return value;
    }

    private static String abbreviate(String body) {
        String s = body.replace('\n', ' ').replace('\r', ' ');
        return s.length() > 200 ? s.substring(0, 200) + "..." : s;
    }
}
