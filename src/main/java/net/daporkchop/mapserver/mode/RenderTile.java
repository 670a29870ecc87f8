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

import lombok.NonNull;
import lombok.SneakyThrows;
import net.daporkchop.mapserver.render.Colormap;
import net.daporkchop.mapserver.server.MapServer;
import net.daporkchop.mapserver.server.MapServerConfig;
import net.daporkchop.mapserver.util.option.Arguments;
import net.daporkchop.mapserver.util.option.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders a single tile to a file, exactly as the server would serve it.
 *
 * @author DaPorkchop_
 */
public class RenderTile extends DatasetMode {
    private static final Option<Integer> ZOOM = Option.integer("-zoom", 0, 0, 31);
    private static final Option<Integer> X = Option.integer("-x", 0, 0, Integer.MAX_VALUE);
    private static final Option<Integer> Y = Option.integer("-y", 0, 0, Integer.MAX_VALUE);

    @Override
    public void printUsage() {
        System.err.println("  tile:");
        System.err.println("    Renders one map tile of a sample table to a PNG file.");
        System.err.println();
        System.err.println("    Usage:");
        System.err.println("      tile [options] <sample_table> <output_file>");
        System.err.println();
        System.err.println("    Options:");
        System.err.println("      --zoom <zoom>               The zoom level of the tile. Default: 0");
        System.err.println("      --x <x>                     The x coordinate of the tile. Default: 0");
        System.err.println("      --y <y>                     The y coordinate of the tile. Default: 0");
        printDatasetUsage();
    }

    @Override
    public Arguments arguments() {
        return new Arguments(true, true, datasetOptions(ZOOM, X, Y));
    }

    @Override
    public String name() {
        return "tile";
    }

    @Override
    @SneakyThrows(IOException.class)
    public void run(@NonNull Arguments args) {
        MapServerConfig config = this.config(args);
        MapServer server = new MapServer(config, this.loadDataset(args));

        int zoom = args.get(ZOOM);
        int x = args.get(X);
        int y = args.get(Y);
        byte[] tile = server.renderer().render(server.state().activeField(), zoom, x, y, config.takeLog(), Colormap.byName(config.colormap()));

        Path destination = args.getDestination().toAbsolutePath();
        if (destination.getParent() != null) {
            Files.createDirectories(destination.getParent());
        }
        Files.write(destination, tile);
        System.out.printf("wrote tile %d/%d/%d of %s (%d bytes) to %s\n", zoom, x, y, server.state().activeField(), tile.length, destination);
    }
}
