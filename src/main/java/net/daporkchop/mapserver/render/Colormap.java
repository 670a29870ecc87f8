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

package net.daporkchop.mapserver.render;

import com.google.common.base.Splitter;
import lombok.NonNull;
import net.daporkchop.mapserver.error.UnknownColormapException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.*;

/**
 * Colormaps which tiles may be rendered with.
 * <p>
 * Each colormap is a piecewise-linear gradient between color stops, sampled into a {@link #SIZE}-entry lookup table.
 *
 * @author DaPorkchop_
 */
public enum Colormap {
    Gray("0:000000 1:ffffff", "grey", "gist_gray"),
    Hot("0:0b0000 0.365:ff0000 0.746:ffff00 1:ffffff"),
    Viridis("0:440154 0.25:3b528b 0.5:21918c 0.75:5ec962 1:fde725"),
    Inferno("0:000004 0.25:420a68 0.5:932667 0.75:dd513a 1:fcffa4"),
    Bwr("0:0000ff 0.5:ffffff 1:ff0000", "coolwarm");

    public static final int SIZE = 256;

    /**
     * Color of pixels without a finite value.
     */
    public static final int TRANSPARENT = 0x00000000;

    public static final Colormap DEFAULT = Viridis;

    private static final Map<String, Colormap> BY_NAME = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    static {
        for (Colormap c : values()) {
            register(c.name(), c);
            for (String alias : c.aliases) {
                register(alias, c);
            }
        }
    }

    private static void register(@NonNull String name, @NonNull Colormap colormap) {
        Colormap value = BY_NAME.putIfAbsent(name, colormap);
        checkState(value == null || value == colormap, "duplicate colormap for name \"%s\": %s, %s", name, value, colormap);
    }

    public static Colormap byName(@NonNull String name) {
        Colormap colormap = BY_NAME.get(name);
        if (colormap == null) {
            throw new UnknownColormapException(String.format("unknown colormap: \"%s\"!", name));
        }
        return colormap;
    }

    private final String[] aliases;

    private final int[] lut = new int[SIZE];

    Colormap(@NonNull String stops, @NonNull String... aliases) {
        this.aliases = aliases;

        List<String> words = Splitter.on(' ').omitEmptyStrings().splitToList(stops);
        double[] positions = new double[words.size()];
        int[] colors = new int[words.size()];
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            int idx = word.indexOf(':');
            positions[i] = Double.parseDouble(word.substring(0, idx));
            colors[i] = Integer.parseInt(word.substring(idx + 1), 16);
        }

        for (int i = 0, stop = 0; i < SIZE; i++) {
            double t = i / (SIZE - 1.0d);
            while (stop < positions.length - 2 && t > positions[stop + 1]) {
                stop++;
            }
            double f = (t - positions[stop]) / (positions[stop + 1] - positions[stop]);
            this.lut[i] = 0xFF000000 | lerp(colors[stop], colors[stop + 1], Math.min(Math.max(f, 0.0d), 1.0d));
        }
    }

    private static int lerp(int rgb0, int rgb1, double f) {
        int rgb = 0;
        for (int shift = 0; shift < 24; shift += 8) {
            int c0 = (rgb0 >>> shift) & 0xFF;
            int c1 = (rgb1 >>> shift) & 0xFF;
            rgb |= ((int) Math.round(c0 + (c1 - c0) * f)) << shift;
        }
        return rgb;
    }

    /**
     * @param normalized a value in {@code [0, 1]}
     * @return the ARGB color of the given value
     */
    public int color(double normalized) {
        return this.lut[(int) (normalized * (SIZE - 1) + 0.5d)];
    }

    /**
     * Colors every value of a grid.
     *
     * @param grid   a {@code [height][width]} grid of values
     * @param bounds the values mapped to the ends of this colormap
     * @return the ARGB pixels, row by row
     */
    public int[] apply(@NonNull double[][] grid, @NonNull ColorBounds bounds) {
        int height = grid.length;
        int width = height == 0 ? 0 : grid[0].length;
        int[] argb = new int[width * height];
        for (int row = 0, i = 0; row < height; row++) {
            double[] values = grid[row];
            for (int col = 0; col < width; col++, i++) {
                double value = values[col];
                argb[i] = Double.isFinite(value) && !bounds.isEmpty() ? this.color(bounds.normalize(value)) : TRANSPARENT;
            }
        }
        return argb;
    }
}
