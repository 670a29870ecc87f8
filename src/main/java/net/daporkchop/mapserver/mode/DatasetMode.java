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
import net.daporkchop.mapserver.data.InMemoryDataset;
import net.daporkchop.mapserver.data.SampleTableReader;
import net.daporkchop.mapserver.server.MapServer;
import net.daporkchop.mapserver.server.MapServerConfig;
import net.daporkchop.mapserver.util.option.Arguments;
import net.daporkchop.mapserver.util.option.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Base for modes which load a sample table and set up a {@link MapServer} over it.
 *
 * @author DaPorkchop_
 */
public abstract class DatasetMode implements Mode {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetMode.class);

    protected static final Option<List<String>> PARTICLE_TYPES = Option.commaSeparated("-particleTypes");
    protected static final Option<String> FIELD = Option.text("-field", null);
    protected static final Option<String> COLORMAP = Option.text("-colormap", null);
    protected static final Option<Boolean> LOG = Option.flag("-log");
    protected static final Option<Integer> TILE_SIZE = Option.integer("-tileSize", null, 1, 1 << 14);
    protected static final Option<String> DISPLAY_UNIT = Option.text("-displayUnit", null);
    protected static final Option<Double> DISPLAY_SCALE = Option.ofDouble("-displayScale", null, Double.MIN_VALUE, Double.MAX_VALUE);

    protected static void printDatasetUsage() {
        System.err.println("      --particleTypes <type,...>  Particle types whose deposit fields are offered in the field list. Default: none");
        System.err.println("      --field <field>             The field to show initially, either <name> or <category>,<name>. Required unless set by -Dmapserver.field");
        System.err.println("      --colormap <name>           The default colormap. Default: viridis");
        System.err.println("      --log                       If present, color by the base-10 logarithm of the field values.");
        System.err.println("      --tileSize <size>           Sets the horizontal and vertical resolution of each tile. Default: 256");
        System.err.println("      --displayUnit <unit>        The unit the domain width is reported in. Default: kpc");
        System.err.println("      --displayScale <scale>      The number of display units per dataset length unit. Default: 1.0");
    }

    protected static Option<?>[] datasetOptions(@NonNull Option<?>... extra) {
        Option<?>[] base = { PARTICLE_TYPES, FIELD, COLORMAP, LOG, TILE_SIZE, DISPLAY_UNIT, DISPLAY_SCALE };
        Option<?>[] all = new Option<?>[base.length + extra.length];
        System.arraycopy(base, 0, all, 0, base.length);
        System.arraycopy(extra, 0, all, base.length, extra.length);
        return all;
    }

    /**
     * @return a {@link MapServerConfig} with the system property defaults overridden by the given arguments
     */
    protected MapServerConfig config(@NonNull Arguments args) {
        MapServerConfig config = new MapServerConfig();
        args.ifPresent(FIELD, config::field);
        args.ifPresent(COLORMAP, config::colormap);
        args.ifPresent(LOG, config::takeLog);
        args.ifPresent(TILE_SIZE, config::tileSize);
        args.ifPresent(DISPLAY_UNIT, config::displayUnit);
        args.ifPresent(DISPLAY_SCALE, config::displayScale);
        return config;
    }

    @SneakyThrows(IOException.class)
    protected InMemoryDataset loadDataset(@NonNull Arguments args) {
        Path source = args.getSource();
        InMemoryDataset dataset = new SampleTableReader(args.get(PARTICLE_TYPES)).read(source);
        LOGGER.info("loaded {}: {} fields, domain {}", source, dataset.derivedFieldList().size(), dataset.domain());
        return dataset;
    }
}
