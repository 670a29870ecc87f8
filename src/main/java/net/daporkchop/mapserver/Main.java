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

package net.daporkchop.mapserver;

import net.daporkchop.mapserver.mode.ListFields;
import net.daporkchop.mapserver.mode.Mode;
import net.daporkchop.mapserver.mode.RenderTile;
import net.daporkchop.mapserver.mode.Serve;
import net.daporkchop.mapserver.util.option.Arguments;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Command line entry point. The first argument selects a {@link Mode}, the rest are passed to it.
 *
 * @author DaPorkchop_
 */
public class Main {
    private static final Map<String, Supplier<Mode>> MODES = new TreeMap<>();

    static {
        register(ListFields::new);
        register(RenderTile::new);
        register(Serve::new);
    }

    private static void register(Supplier<Mode> factory) {
        MODES.put(factory.get().name(), factory);
    }

    private static void printModes() {
        System.err.println("Available modes:");
        MODES.values().forEach(factory -> factory.get().printUsage());
    }

    public static void main(String... args) {
        if (args.length < 1) {
            System.err.println("usage: mapserver <mode name> [arguments]...");
            System.err.println();
            printModes();
            return;
        }

        Supplier<Mode> modeFactory = MODES.get(args[0]);
        if (modeFactory == null) {
            System.err.println("Unknown mode: '" + args[0] + '\'');
            System.err.println();
            printModes();
            System.exit(1);
        }

        Mode mode = modeFactory.get();
        Arguments arguments = mode.arguments();
        try {
            arguments.load(Arrays.asList(args).subList(1, args.length).iterator());
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println();
            mode.printUsage();
            System.exit(1);
        }

        mode.run(arguments);
    }
}
