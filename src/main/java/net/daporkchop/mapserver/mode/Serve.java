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

package net.daporkchop.mapserver.mode;

import fi.iki.elonen.NanoHTTPD;
import lombok.NonNull;
import lombok.SneakyThrows;
import net.daporkchop.mapserver.server.MapServer;
import net.daporkchop.mapserver.server.MapServerConfig;
import net.daporkchop.mapserver.util.option.Arguments;
import net.daporkchop.mapserver.util.option.Option;

import java.io.IOException;

/**
 * @author DaPorkchop_
 */
public class Serve extends DatasetMode {
    private static final Option<String> HOST = Option.text("-host", null);
    private static final Option<Integer> PORT = Option.integer("-port", null, 0, 65535);
    private static final Option<String> ROUTE_PREFIX = Option.text("-routePrefix", null);
    private static final Option<Boolean> CACHE_BOUNDS = Option.flag("-cacheBounds");

    @Override
    public void printUsage() {
        System.err.println("  serve:");
        System.err.println("    Serves a pannable map of a sample table over HTTP.");
        System.err.println();
        System.err.println("    Usage:");
        System.err.println("      serve [options] <sample_table>");
        System.err.println();
        System.err.println("    Options:");
        System.err.println("      --host <address>            The address to listen on. Default: 127.0.0.1");
        System.err.println("      --port <port>               The port to listen on. Default: 8080");
        System.err.println("      --routePrefix <prefix>      A path prefix for all routes, e.g. /map. Default: none");
        System.err.println("      --cacheBounds               If present, remember color bounds per field and zoom level instead of recomputing them.");
        printDatasetUsage();
    }

    @Override
    public Arguments arguments() {
        return new Arguments(true, false, datasetOptions(HOST, PORT, ROUTE_PREFIX, CACHE_BOUNDS));
    }

    @Override
    public String name() {
        return "serve";
    }

    @Override
    @SneakyThrows(IOException.class)
    public void run(@NonNull Arguments args) {
        MapServerConfig config = this.config(args);
        args.ifPresent(HOST, config::host);
        args.ifPresent(PORT, config::port);
        args.ifPresent(ROUTE_PREFIX, config::routePrefix);
        args.ifPresent(CACHE_BOUNDS, config::cacheBounds);

        MapServer server = new MapServer(config, this.loadDataset(args));
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "mapserver-shutdown"));
        server.start(NanoHTTPD.SOCKET_READ_TIMEOUT, false);
    }
}
