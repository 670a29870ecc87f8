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

import com.google.common.io.Resources;
import fi.iki.elonen.NanoHTTPD;
import lombok.Getter;
import lombok.NonNull;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.data.Dataset;
import net.daporkchop.mapserver.error.InvalidAddressException;
import net.daporkchop.mapserver.error.MapServerException;
import net.daporkchop.mapserver.error.UnknownFieldException;
import net.daporkchop.mapserver.field.FieldCatalog;
import net.daporkchop.mapserver.field.FieldRef;
import net.daporkchop.mapserver.render.Colormap;
import net.daporkchop.mapserver.render.PngTileEncoder;
import net.daporkchop.mapserver.render.TileEncoder;
import net.daporkchop.mapserver.render.TileRenderer;
import net.daporkchop.mapserver.render.ValueNormalizer;
import net.daporkchop.mapserver.resample.PixelizingResampler;
import net.daporkchop.mapserver.resample.Resampler;
import net.daporkchop.mapserver.resample.ResamplerAdapter;
import net.daporkchop.mapserver.tilematrix.DomainTileMatrix;
import net.daporkchop.mapserver.tilematrix.TileMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URL;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.google.common.base.Preconditions.*;

/**
 * Serves the tiles, field list and UI of a pannable map over one {@link Dataset}.
 * <p>
 * Routes, relative to {@link MapServerConfig#routePrefix()} (the bare prefix redirects to the prefix followed by {@code /}):
 * <ul>
 *     <li>{@code /map/<field>/<zoom>/<x>/<y>.png}: a rendered tile. Accepts the query parameters {@code log} and {@code cmap}.</li>
 *     <li>{@code /}, {@code /index.html}, {@code /<field>}: the map UI. The last form also selects the active field.</li>
 *     <li>{@code /list}: the {@link FieldCatalog field catalog} as JSON.</li>
 * </ul>
 * Any other path is served from the static assets under {@link #ASSET_ROOT} on the classpath.
 *
 * @author DaPorkchop_
 */
@Getter
@Accessors(fluent = true)
public class MapServer extends NanoHTTPD {
    private static final Logger LOGGER = LoggerFactory.getLogger(MapServer.class);

    public static final String ASSET_ROOT = "html/";
    public static final String INDEX_PAGE = "map_index.html";

    protected static final String MIME_JSON = "application/json";
    protected static final String MIME_OCTET_STREAM = "application/octet-stream";

    protected final MapServerConfig config;
    protected final String routePrefix;
    protected final RenderState state;
    protected final TileMatrix tileMatrix;
    protected final TileRenderer renderer;
    protected final FieldCatalog catalog;
    protected final Colormap defaultColormap;

    public MapServer(@NonNull MapServerConfig config, @NonNull Dataset dataset) {
        this(config, dataset, new PixelizingResampler(), new PngTileEncoder());
    }

    public MapServer(@NonNull MapServerConfig config, @NonNull Dataset dataset, @NonNull Resampler resampler, @NonNull TileEncoder encoder) {
        super(config.host(), config.port());
        checkArgument(config.field() != null, "no initial field given");
        checkArgument(config.routePrefix().isEmpty() || (config.routePrefix().startsWith("/") && !config.routePrefix().endsWith("/")),
                "routePrefix must be empty or start (but not end) with '/': \"%s\"", config.routePrefix());

        this.config = config;
        this.routePrefix = config.routePrefix();
        this.defaultColormap = Colormap.byName(config.colormap());

        FieldRef initialField = FieldRef.parse(config.field());
        this.state = new RenderState(dataset, initialField);
        this.state.gate().call(() -> dataset.resolve(initialField));

        this.tileMatrix = new DomainTileMatrix(dataset.domain(), config.tileSize());
        this.renderer = new TileRenderer(this.state, this.tileMatrix,
                new ResamplerAdapter(dataset, resampler, this.state.gate(), config.tileSize()),
                new ValueNormalizer(dataset, this.state.gate(), config.tileSize(), config.cacheBounds()),
                encoder);
        this.catalog = new FieldCatalog(this.state, config.displayUnit(), config.displayScale(),
                config.takeLog(), this.defaultColormap.name().toLowerCase(Locale.ROOT));
    }

    @Override
    public void start(int timeout, boolean daemon) throws IOException {
        super.start(timeout, daemon);
        LOGGER.info("map server listening on http://{}:{}{}/", this.config.host(), this.getListeningPort(), this.routePrefix);
    }

    @Override
    public void stop() {
        super.stop();
        LOGGER.info("map server stopped");
    }

    @Override
    public Response serve(IHTTPSession session) {
        String uri = session.getUri();
        LOGGER.debug("{} {}", session.getMethod(), uri);

        if (session.getMethod() != Method.GET) {
            return newFixedLengthResponse(Response.Status.METHOD_NOT_ALLOWED, MIME_PLAINTEXT, "Method Not Allowed");
        }

        String path = uri;
        if (!this.routePrefix.isEmpty()) {
            if (uri.equals(this.routePrefix)) {
                //the UI's URLs are relative to the page, which needs the trailing '/'
                Response response = newFixedLengthResponse(Response.Status.REDIRECT, MIME_PLAINTEXT, "Moved Permanently");
                response.addHeader("Location", this.routePrefix + '/');
                return response;
            } else if (uri.startsWith(this.routePrefix + '/')) {
                path = uri.substring(this.routePrefix.length());
            } else {
                return this.serveAsset(uri);
            }
        }

        if (path.isEmpty() || "/".equals(path) || ("/" + INDEX_PAGE).equals(path) || "/index.html".equals(path)) {
            return this.serveIndex(null);
        } else if ("/list".equals(path)) {
            return this.serveList();
        } else if (path.startsWith("/map/") && path.endsWith(".png")) {
            return this.serveTile(path.substring("/map/".length(), path.length() - ".png".length()), session.getParameters());
        } else if (path.indexOf('/', 1) < 0 && path.indexOf('.') < 0) {
            return this.serveIndex(path.substring(1));
        } else {
            return this.serveAsset(path);
        }
    }

    protected Response serveTile(@NonNull String address, @NonNull Map<String, List<String>> parameters) {
        String[] parts = address.split("/");
        if (parts.length != 4) {
            return newFixedLengthResponse(Response.Status.BAD_REQUEST, MIME_PLAINTEXT, "Invalid tile path");
        }

        int zoom;
        long x;
        long y;
        try {
            zoom = Integer.parseInt(parts[1]);
            x = Long.parseLong(parts[2]);
            y = Long.parseLong(parts[3]);
        } catch (NumberFormatException e) {
            LOGGER.warn("invalid tile coordinates: {}", address);
            return newFixedLengthResponse(Response.Status.BAD_REQUEST, MIME_PLAINTEXT, "Invalid tile coordinates");
        }

        try {
            boolean log = parameters.containsKey("log") ? Boolean.parseBoolean(parameters.get("log").get(0)) : this.config.takeLog();
            Colormap colormap = parameters.containsKey("cmap") ? Colormap.byName(parameters.get("cmap").get(0)) : this.defaultColormap;

            byte[] tile = this.renderer.render(FieldRef.parse(parts[0]), zoom, x, y, log, colormap);
            return newFixedLengthResponse(Response.Status.OK, this.renderer.encoder().contentType(), new ByteArrayInputStream(tile), tile.length);
        } catch (InvalidAddressException e) {
            LOGGER.warn("rejected tile request {}: {}", address, e.getMessage());
            return newFixedLengthResponse(Response.Status.BAD_REQUEST, MIME_PLAINTEXT, e.getMessage());
        } catch (MapServerException e) {
            LOGGER.error("failed to render tile {}", address, e);
            return newFixedLengthResponse(Response.Status.INTERNAL_ERROR, MIME_PLAINTEXT, e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("unexpected error while rendering tile {}", address, e);
            return newFixedLengthResponse(Response.Status.INTERNAL_ERROR, MIME_PLAINTEXT, "Internal error");
        }
    }

    protected Response serveIndex(String field) {
        if (field != null) {
            try {
                this.state.activeField(FieldRef.parse(field));
            } catch (UnknownFieldException e) {
                return newFixedLengthResponse(Response.Status.BAD_REQUEST, MIME_PLAINTEXT, e.getMessage());
            }
        }
        return this.serveAsset(INDEX_PAGE);
    }

    protected Response serveList() {
        return newFixedLengthResponse(Response.Status.OK, MIME_JSON, this.catalog.listFields().toJson().toString());
    }

    protected Response serveAsset(@NonNull String path) {
        while (path.startsWith("/")) {
            path = path.substring(1);
        }

        URL url = path.isEmpty() || path.contains("..") ? null : MapServer.class.getClassLoader().getResource(ASSET_ROOT + path);
        if (url == null) {
            LOGGER.debug("no such asset: {}", path);
            return newFixedLengthResponse(Response.Status.NOT_FOUND, MIME_PLAINTEXT, "Not Found");
        }

        byte[] data;
        try {
            data = Resources.toByteArray(url);
        } catch (IOException e) {
            LOGGER.error("failed to read asset {}", path, e);
            return newFixedLengthResponse(Response.Status.INTERNAL_ERROR, MIME_PLAINTEXT, "Internal error");
        }
        return newFixedLengthResponse(Response.Status.OK, assetContentType(path), new ByteArrayInputStream(data), data.length);
    }

    /**
     * Guesses the content type of a static asset from its file extension.
     */
    public static String assetContentType(@NonNull String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".png") || lower.endsWith(".gif") || lower.endsWith(".jpg")) {
            return "image/" + lower.substring(lower.length() - 3);
        } else if (lower.endsWith(".css")) {
            return "text/css";
        } else if (lower.endsWith(".js")) {
            return "text/javascript";
        } else if (lower.endsWith(".html")) {
            return MIME_HTML;
        } else {
            return MIME_OCTET_STREAM;
        }
    }
}
