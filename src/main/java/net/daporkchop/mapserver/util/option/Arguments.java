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

package net.daporkchop.mapserver.util.option;

import lombok.NonNull;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;

import static com.google.common.base.Preconditions.*;

/**
 * The parsed command-line arguments of a mode.
 * <p>
 * Option words start with {@code -} or {@code --}. Every other word is positional: first the source path, then the destination path, for
 * whichever of the two the mode needs.
 *
 * @author DaPorkchop_
 */
public class Arguments {
    protected final boolean needsSource;
    protected final boolean needsDestination;
    protected final Map<String, Option<?>> options = new HashMap<>();
    protected final Map<Option<?>, Object> values = new HashMap<>();

    protected Path source;
    protected Path destination;

    public Arguments(boolean needsSource, boolean needsDestination, @NonNull Option<?>... options) {
        this.needsSource = needsSource;
        this.needsDestination = needsDestination;
        for (Option<?> option : options) {
            checkArgument(this.options.putIfAbsent(option.name(), option) == null, "duplicate option: %s", option.name());
        }
    }

    /**
     * Parses the given program arguments.
     *
     * @throws IllegalArgumentException if an argument is unknown or invalid
     */
    public void load(@NonNull Iterator<String> itr) {
        while (itr.hasNext()) {
            String word = itr.next();
            if (word.startsWith("-")) {
                Option<?> option = this.options.get(word);
                if (option == null) {
                    option = this.options.get(word.substring(1));
                }
                if (option == null) {
                    throw new IllegalArgumentException(String.format("Unknown option: '%s'", word));
                }
                this.values.put(option, option.parse(word, itr));
            } else if (this.needsSource && this.source == null) {
                this.source = Option.SOURCE.parse(word, itr);
            } else if (this.needsDestination && this.destination == null) {
                this.destination = Option.DESTINATION.parse(word, itr);
            } else {
                throw new IllegalArgumentException(String.format("Unexpected argument: '%s'", word));
            }
        }
    }

    /**
     * @return the value of the given option, or its fallback value if it was not given
     */
    public <V> V get(@NonNull Option<V> option) {
        return this.values.containsKey(option) ? this.value(option) : option.fallbackValue();
    }

    /**
     * Passes the value of the given option to the given action, if the option was given.
     */
    public <V> void ifPresent(@NonNull Option<V> option, @NonNull Consumer<V> action) {
        if (this.values.containsKey(option)) {
            action.accept(this.value(option));
        }
    }

    /**
     * Every value in {@link #values} was produced by {@link Option#parse(String, Iterator)} of its own key.
     */
    private <V> V value(Option<V> option) {
        return (V) this.values.get(option);
    }

    public Path getSource() {
        return this.source != null ? this.source : Option.SOURCE.fallbackValue();
    }

    public Path getDestination() {
        return this.destination != null ? this.destination : Option.DESTINATION.fallbackValue();
    }
}
