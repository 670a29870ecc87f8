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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;
import net.daporkchop.mapserver.render.Colormap;

/**
 * Settings of a {@link MapServer}. Every setting defaults to the system property {@code mapserver.<name>}.
 *
 * @author DaPorkchop_
 */
@Getter
@Setter
@ToString
@EqualsAndHashCode
@Accessors(fluent = true)
public class MapServerConfig {
    protected String host = System.getProperty("mapserver.host", "127.0.0.1");
    protected int port = Integer.getInteger("mapserver.port", 8080);

    /**
     * Prepended to every route except static assets. Either empty or starting with {@code /}.
     */
    protected String routePrefix = System.getProperty("mapserver.routePrefix", "");

    /**
     * The field which is active when the server starts.
     */
    protected String field = System.getProperty("mapserver.field");

    protected String colormap = System.getProperty("mapserver.colormap", Colormap.DEFAULT.name());
    protected boolean takeLog = Boolean.getBoolean("mapserver.takeLog");

    /**
     * The width and height of every tile, in pixels.
     */
    protected int tileSize = Integer.getInteger("mapserver.tileSize", 256);

    protected String displayUnit = System.getProperty("mapserver.displayUnit", "kpc");

    /**
     * The number of {@link #displayUnit()}s per dataset length unit.
     */
    protected double displayScale = Double.parseDouble(System.getProperty("mapserver.displayScale", "1.0"));

    /**
     * Whether to remember the color bounds of each field and zoom level instead of recomputing them for every tile.
     */
    protected boolean cacheBounds = Boolean.getBoolean("mapserver.cacheBounds");
}
