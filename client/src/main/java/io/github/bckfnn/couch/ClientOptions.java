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

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Connection configuration of a {@link Client}. Plain value data, copied by the client.
 */
public class ClientOptions {
    public static final boolean DEFAULT_GZIP = true;
    public static final int DEFAULT_TIMEOUT = 4;

    private String uri;
    private String prefix = "";
    private boolean gzip = DEFAULT_GZIP;
    private int timeout = DEFAULT_TIMEOUT;

    public ClientOptions() {
    }

    public ClientOptions(String uri) {
        this.uri = uri;
    }

    public ClientOptions(ClientOptions other) {
        this.uri = other.uri;
        this.prefix = other.prefix;
        this.gzip = other.gzip;
        this.timeout = other.timeout;
    }

    /**
     * Read the options from a <code>couch</code> config block. Missing keys fall back to reference.conf.
     * @param config the block holding uri, prefix, gzip and timeout.
     * @return the options.
     */
    public static ClientOptions fromConfig(Config config) {
        Config c = config.withFallback(ConfigFactory.defaultReference().getConfig("couch"));
        return new ClientOptions(c.getString("uri"))
                .setPrefix(c.getString("prefix"))
                .setGzip(c.getBoolean("gzip"))
                .setTimeout(c.getInt("timeout"));
    }

    public static ClientOptions load() {
        return fromConfig(ConfigFactory.load().getConfig("couch"));
    }

    public ClientOptions copy() {
        return new ClientOptions(this);
    }

    public String getUri() {
        return uri;
    }

    public ClientOptions setUri(String uri) {
        this.uri = uri;
        return this;
    }

    public String getPrefix() {
        return prefix;
    }

    public ClientOptions setPrefix(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
        return this;
    }

    public boolean isGzip() {
        return gzip;
    }

    public ClientOptions setGzip(boolean gzip) {
        this.gzip = gzip;
        return this;
    }

    /**
     * @return the per request timeout in seconds.
     */
    public int getTimeout() {
        return timeout;
    }

    public ClientOptions setTimeout(int timeout) {
        this.timeout = timeout;
        return this;
    }

    @Override
    public String toString() {
        return "ClientOptions[uri=" + uri + " prefix=" + prefix + " gzip=" + gzip + " timeout=" + timeout + "]";
    }
}
