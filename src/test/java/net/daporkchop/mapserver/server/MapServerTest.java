/*
 * Adapted from The MIT License (MIT)
 *
 * Copyright (c) 2020-2022 DaPorkchop_
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation
 * files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy,
 * modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software
 * is furnished to do so, subject to the following conditions:
 *
 * Any persons and/or organizations using this software must include the above copyright notice and this permission notice,
 * provide sufficient credit to the original authors of the project (IE: DaPorkchop_), as well as provide a link to the original project.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES
 * OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS
 * BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 *
 */

package net.daporkchop.mapserver.server;

import com.google.common.io.ByteStreams;
import net.daporkchop.mapserver.TestDatasets;
import net.daporkchop.mapserver.field.FieldRef;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class MapServerTest {
    private static MapServerConfig config() {
        return new MapServerConfig().host("127.0.0.1").port(0).field("density").routePrefix("").takeLog(false).colormap("viridis");
    }

    private static MapServer start(MapServerConfig config) throws IOException {
        MapServer server = new MapServer(config, TestDatasets.unitGrid());
        server.start(5000, true);
        return server;
    }

    private static final class Reply {
        final int status;
        final String contentType;
        final byte[] body;

        Reply(HttpURLConnection connection) throws IOException {
            this.status = connection.getResponseCode();
            this.contentType = connection.getContentType();
            try (InputStream in = this.status < 400 ? connection.getInputStream() : connection.getErrorStream()) {
                this.body = in == null ? new byte[0] : ByteStreams.toByteArray(in);
            }
        }

        String text() {
            return new String(this.body, StandardCharsets.UTF_8);
        }
    }

    private static Reply request(MapServer server, String method, String path) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) new URL("http://127.0.0.1:" + server.getListeningPort() + path).openConnection();
        try {
            connection.setRequestMethod(method);
            if ("POST".equals(method)) {
                connection.setDoOutput(true);
                connection.getOutputStream().close();
            }
            return new Reply(connection);
        } finally {
            connection.disconnect();
        }
    }

    //the server may append a charset
    private static void assertContentType(String expected, Reply reply) {
        String actual = reply.contentType;
        assertNotNull(actual);
        int idx = actual.indexOf(';');
        assertEquals(expected, (idx < 0 ? actual : actual.substring(0, idx)).trim());
    }

    private static Reply get(MapServer server, String path) throws IOException {
        return request(server, "GET", path);
    }

    @Test
    void rejectsInvalidConfig() {
        assertThrows(IllegalArgumentException.class, () -> new MapServer(config().field(null), TestDatasets.unitGrid()));
        assertThrows(IllegalArgumentException.class, () -> new MapServer(config().routePrefix("yt"), TestDatasets.unitGrid()));
        assertThrows(IllegalArgumentException.class, () -> new MapServer(config().routePrefix("/yt/"), TestDatasets.unitGrid()));
    }

    @Test
    void assetContentTypes() {
        assertEquals("image/png", MapServer.assetContentType("logo.PNG"));
        assertEquals("image/gif", MapServer.assetContentType("a/b.gif"));
        assertEquals("image/jpg", MapServer.assetContentType("photo.jpg"));
        assertEquals("text/css", MapServer.assetContentType("map.css"));
        assertEquals("text/javascript", MapServer.assetContentType("map.js"));
        assertEquals("text/html", MapServer.assetContentType("map_index.html"));
        assertEquals("application/octet-stream", MapServer.assetContentType("README"));
    }

    @Test
    @DisplayName("the configured log and colormap defaults apply to tiles requested without query parameters")
    void configuredDefaults() throws IOException {
        MapServer plain = start(config());
        MapServer styled = start(config().takeLog(true).colormap("grey"));
        try {
            byte[] plainTile = get(plain, "/map/density/0/0/0.png").body;
            Reply styledTile = get(styled, "/map/density/0/0/0.png");
            assertEquals(200, styledTile.status);
            assertFalse(Arrays.equals(plainTile, styledTile.body));
            assertArrayEquals(get(plain, "/map/density/0/0/0.png?log=true&cmap=gray").body, styledTile.body);

            JSONObject list = new JSONObject(get(styled, "/list").text());
            assertTrue(list.getBoolean("log"));
            assertEquals("gray", list.getString("cmap"));
        } finally {
            plain.stop();
            styled.stop();
        }
    }

    @Nested
    class WithoutPrefix {
        MapServer server;

        @BeforeEach
        void start() throws IOException {
            this.server = MapServerTest.start(config());
        }

        @AfterEach
        void stop() {
            this.server.stop();
        }

        @Test
        void tile() throws IOException {
            Reply reply = get(this.server, "/map/density/0/0/0.png");
            assertEquals(200, reply.status);
            assertContentType("image/png", reply);
            assertEquals(256, ImageIO.read(new ByteArrayInputStream(reply.body)).getWidth());

            Reply again = get(this.server, "/map/density/0/0/0.png");
            assertArrayEquals(reply.body, again.body);
        }

        @Test
        void tileQueryParameters() throws IOException {
            Reply plain = get(this.server, "/map/gas,density/1/0/1.png");
            Reply styled = get(this.server, "/map/gas,density/1/0/1.png?log=true&cmap=hot");
            assertEquals(200, styled.status);
            assertFalse(Arrays.equals(plain.body, styled.body));
        }

        @Test
        @DisplayName("malformed tile addresses are client errors")
        void badTiles() throws IOException {
            assertEquals(400, get(this.server, "/map/density/1/2/0.png").status);
            assertEquals(400, get(this.server, "/map/density/a/0/0.png").status);
            assertEquals(400, get(this.server, "/map/density/0/0.png").status);
        }

        @Test
        @DisplayName("render failures are server errors")
        void failedTiles() throws IOException {
            assertEquals(500, get(this.server, "/map/temperature/0/0/0.png?log=true").status);
            assertEquals(500, get(this.server, "/map/pressure/0/0/0.png").status);
            assertEquals(500, get(this.server, "/map/density/0/0/0.png?cmap=jet").status);

            //the server keeps working after a failure
            assertEquals(200, get(this.server, "/map/density/0/0/0.png").status);
        }

        @Test
        void list() throws IOException {
            Reply reply = get(this.server, "/list");
            assertEquals(200, reply.status);
            assertContentType("application/json", reply);

            JSONObject json = new JSONObject(reply.text());
            assertEquals("density", json.getString("active"));
            assertEquals(1.0d, json.getDouble("width"), 1e-12);
            assertEquals("kpc", json.getString("unit"));

            JSONArray gas = json.getJSONObject("data").getJSONArray("gas");
            assertEquals(2, gas.length());
            assertEquals(1, json.getJSONObject("data").getJSONArray("PartType0").length());
            assertFalse(json.getBoolean("log"));
            assertEquals("viridis", json.getString("cmap"));
        }

        @Test
        @DisplayName("every field in the list can be rendered")
        void everyListedFieldIsServed() throws IOException {
            JSONObject data = new JSONObject(get(this.server, "/list").text()).getJSONObject("data");
            int served = 0;
            for (String type : data.keySet()) {
                JSONArray entries = data.getJSONArray(type);
                for (int i = 0; i < entries.length(); i++) {
                    JSONArray field = entries.getJSONArray(i).getJSONArray(0);
                    String path = "/map/" + field.getString(0) + ',' + field.getString(1) + "/0/0/0.png";
                    assertEquals(200, get(this.server, path).status, path);
                    served++;
                }
            }
            assertEquals(3, served);
        }

        @Test
        void index() throws IOException {
            Reply root = get(this.server, "/");
            assertEquals(200, root.status);
            assertContentType("text/html", root);
            assertTrue(root.text().contains("leaflet"));

            assertEquals(200, get(this.server, "/index.html").status);
        }

        @Test
        void fieldRouteSelectsActiveField() throws IOException {
            Reply reply = get(this.server, "/gas,temperature");
            assertEquals(200, reply.status);
            assertContentType("text/html", reply);
            assertEquals(FieldRef.compound("gas", "temperature"), this.server.state().activeField());

            JSONArray active = new JSONObject(get(this.server, "/list").text()).getJSONArray("active");
            assertEquals("gas", active.getString(0));
            assertEquals("temperature", active.getString(1));
        }

        @Test
        void staticAssets() throws IOException {
            Reply css = get(this.server, "/map.css");
            assertEquals(200, css.status);
            assertContentType("text/css", css);

            Reply js = get(this.server, "/map.js");
            assertEquals(200, js.status);
            assertContentType("text/javascript", js);

            assertEquals(404, get(this.server, "/missing.css").status);
            assertEquals(404, get(this.server, "/nested/missing.js").status);
        }

        @Test
        void onlyGet() throws IOException {
            assertEquals(405, request(this.server, "POST", "/list").status);
        }
    }

    @Nested
    class WithPrefix {
        MapServer server;

        @BeforeEach
        void start() throws IOException {
            this.server = MapServerTest.start(config().routePrefix("/yt"));
        }

        @AfterEach
        void stop() {
            this.server.stop();
        }

        @Test
        void routesAreMounted() throws IOException {
            assertEquals(200, get(this.server, "/yt/list").status);
            assertEquals(200, get(this.server, "/yt/").status);
            assertEquals(200, get(this.server, "/yt").status);

            HttpURLConnection connection = (HttpURLConnection) new URL("http://127.0.0.1:" + this.server.getListeningPort() + "/yt").openConnection();
            try {
                connection.setInstanceFollowRedirects(false);
                assertEquals(301, connection.getResponseCode());
                assertEquals("/yt/", connection.getHeaderField("Location"));
            } finally {
                connection.disconnect();
            }
            assertContentType("image/png", get(this.server, "/yt/map/density/0/0/0.png"));
        }

        @Test
        void unprefixedRoutesAreAssets() throws IOException {
            assertEquals(404, get(this.server, "/list").status);
            assertEquals(200, get(this.server, "/map.css").status);
            assertEquals(200, get(this.server, "/yt/map.js").status);
        }
    }
}
