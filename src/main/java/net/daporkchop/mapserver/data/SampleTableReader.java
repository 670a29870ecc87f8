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

package net.daporkchop.mapserver.data;

import com.google.common.base.Splitter;
import lombok.NonNull;
import net.daporkchop.mapserver.util.geom.Bounds2d;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.google.common.base.Preconditions.*;

/**
 * Reads an {@link InMemoryDataset} from a comma-separated sample table.
 * <p>
 * The first non-comment line is the header {@code x,y,dx,dy,<category>:<name>,...}, where {@code dx} and {@code dy} are the half-widths of
 * each sample's footprint. Every following line is one sample. Lines starting with {@code #} are comments, except for
 * {@code # domain <xl> <xr> <yl> <yr>}, which sets the domain explicitly.
 *
 * @author DaPorkchop_
 */
public class SampleTableReader {
    protected static final Splitter COMMA = Splitter.on(',').trimResults();
    protected static final Splitter WHITESPACE = Splitter.onPattern("\\s+").omitEmptyStrings();

    protected static final String DOMAIN_DIRECTIVE = "domain";
    protected static final int POSITION_COLUMNS = 4;

    protected final List<String> particleTypes;

    public SampleTableReader(@NonNull List<String> particleTypes) {
        this.particleTypes = particleTypes;
    }

    public InMemoryDataset read(@NonNull Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return this.read(reader, file.toString());
        }
    }

    public InMemoryDataset read(@NonNull BufferedReader reader, @NonNull String sourceName) throws IOException {
        Bounds2d domain = null;
        List<String> header = null;
        List<double[]> rows = new ArrayList<>();

        int lineNumber = 0;
        for (String line; (line = reader.readLine()) != null; ) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            } else if (line.startsWith("#")) {
                List<String> words = WHITESPACE.splitToList(line.substring(1));
                if (!words.isEmpty() && DOMAIN_DIRECTIVE.equals(words.get(0).toLowerCase(Locale.ROOT))) {
                    checkArgument(words.size() == 5, "%s:%s: expected '# domain <xl> <xr> <yl> <yr>'", sourceName, lineNumber);
                    domain = new Bounds2d(Double.parseDouble(words.get(1)), Double.parseDouble(words.get(2)),
                            Double.parseDouble(words.get(3)), Double.parseDouble(words.get(4)));
                }
                continue;
            }

            List<String> cells = COMMA.splitToList(line);
            if (header == null) {
                checkArgument(cells.size() > POSITION_COLUMNS && cells.subList(0, POSITION_COLUMNS).equals(List.of("x", "y", "dx", "dy")),
                        "%s:%s: header must start with x,y,dx,dy and name at least one field", sourceName, lineNumber);
                header = cells;
                continue;
            }

            checkArgument(cells.size() == header.size(), "%s:%s: expected %s columns, found %s", sourceName, lineNumber, header.size(), cells.size());
            double[] row = new double[cells.size()];
            for (int i = 0; i < row.length; i++) {
                try {
                    row[i] = Double.parseDouble(cells.get(i));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException(String.format("%s:%d: invalid number in column '%s': \"%s\"", sourceName, lineNumber, header.get(i), cells.get(i)), e);
                }
            }
            rows.add(row);
        }
        checkArgument(header != null, "%s: missing header", sourceName);

        InMemoryDataset.Builder builder = InMemoryDataset.builder()
                .positions(column(rows, 0), column(rows, 1), column(rows, 2), column(rows, 3));
        for (int i = POSITION_COLUMNS; i < header.size(); i++) {
            String name = header.get(i);
            int idx = name.indexOf(':');
            checkArgument(idx > 0 && idx < name.length() - 1, "%s: field column '%s' must be named <category>:<name>", sourceName, name);
            builder.field(name.substring(0, idx), name.substring(idx + 1), column(rows, i));
        }
        this.particleTypes.forEach(builder::particleType);
        if (domain != null) {
            builder.domain(domain);
        }
        return builder.build();
    }

    protected static double[] column(@NonNull List<double[]> rows, int column) {
        return rows.stream().mapToDouble(row -> row[column]).toArray();
    }
}
