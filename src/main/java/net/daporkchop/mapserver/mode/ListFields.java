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
import net.daporkchop.mapserver.server.MapServer;
import net.daporkchop.mapserver.util.option.Arguments;

/**
 * Prints the field list which the server would report for a sample table.
 *
 * @author DaPorkchop_
 */
public class ListFields extends DatasetMode {
    @Override
    public void printUsage() {
        System.err.println("  list:");
        System.err.println("    Prints the selectable fields of a sample table as JSON.");
        System.err.println();
        System.err.println("    Usage:");
        System.err.println("      list [options] <sample_table>");
        System.err.println();
        System.err.println("    Options:");
        printDatasetUsage();
    }

    @Override
    public Arguments arguments() {
        return new Arguments(true, false, datasetOptions());
    }

    @Override
    public String name() {
        return "list";
    }

    @Override
    public void run(@NonNull Arguments args) {
        MapServer server = new MapServer(this.config(args), this.loadDataset(args));
        System.out.println(server.catalog().listFields().toJson().toString(4));
    }
}
