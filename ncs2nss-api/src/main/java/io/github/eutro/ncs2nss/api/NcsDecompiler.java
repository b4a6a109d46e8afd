package io.github.eutro.ncs2nss.api;

import io.github.eutro.ncs2nss.api.bits.Bit;
import io.github.eutro.ncs2nss.api.events.*;
import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * The entry point for decompiling scripts. Scripts are {@link #submit(ByteBuffer, GameVariant) submitted},
 * and the returned {@link Decompilation} is {@link Decompilation#run() run}.
 * <p>
 * A decompiler may be shared between threads; each decompilation owns all of its own state.
 */
public class NcsDecompiler extends EventSupplier<DecompilerEvent> {
    @NotNull
    private DecompileOptions options;

    public NcsDecompiler() {
        this(DecompileOptions.DEFAULT);
    }

    public NcsDecompiler(@NotNull DecompileOptions options) {
        this.options = options;
    }

    @NotNull
    public DecompileOptions getOptions() {
        return options;
    }

    /**
     * Set the options for decompilations submitted from now on.
     *
     * @param options The options.
     * @return This, for convenience.
     */
    public NcsDecompiler setOptions(@NotNull DecompileOptions options) {
        this.options = options;
        return this;
    }

    @Contract(pure = true)
    public Decompilation submit(InputStream stream, GameVariant variant) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[4096];
        int n;
        while ((n = stream.read(buf)) != -1) {
            out.write(buf, 0, n);
        }
        return submit(out.toByteArray(), variant);
    }

    @Contract(pure = true)
    public Decompilation submit(byte[] bytes, GameVariant variant) {
        return submit(ByteBuffer.wrap(bytes), variant);
    }

    @Contract(pure = true)
    public Decompilation submit(ByteBuffer buffer, GameVariant variant) {
        return newDecompilation(buffer, variant);
    }

    // it's not, but show a warning if the result is unused
    @Contract(pure = true)
    @NotNull
    private Decompilation newDecompilation(ByteBuffer buffer, GameVariant variant) {
        return new Decompilation(this, buffer.slice(), variant, options);
    }

    /**
     * Get a dispatcher on which listeners are registered with every decompilation run by this decompiler.
     *
     * @return The dispatcher.
     */
    public EventDispatcher<DecompilationEvent> lift() {
        return new EventDispatcher<DecompilationEvent>() {
            @Override
            public <T extends DecompilationEvent> void listen(Class<T> eventClass, @NotNull Consumer<T> listener) {
                NcsDecompiler.this.listen(RunDecompilationEvent.class, evt ->
                        evt.decompilation.listen(eventClass, listener));
            }
        };
    }

    public BlockingQueue<DecompileResult> outputsAsQueue() {
        BlockingQueue<DecompileResult> queue = new LinkedBlockingQueue<>();
        lift().listen(OutputEvent.class, evt -> queue.add(evt.result));
        return queue;
    }

    public <T> T add(Bit<? super NcsDecompiler, T> bit) {
        return bit.addTo(this);
    }
}
