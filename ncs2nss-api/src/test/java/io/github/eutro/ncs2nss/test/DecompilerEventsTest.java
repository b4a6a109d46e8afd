package io.github.eutro.ncs2nss.test;

import io.github.eutro.ncs2nss.api.Decompilation;
import io.github.eutro.ncs2nss.api.DecompileResult;
import io.github.eutro.ncs2nss.api.NcsDecompiler;
import io.github.eutro.ncs2nss.api.events.*;
import io.github.eutro.ncs2nss.core.DecompileOptions;
import io.github.eutro.ncs2nss.core.ncs.GameVariant;
import io.github.eutro.ncs2nss.core.ncs.MalformedBytecodeException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class DecompilerEventsTest {
    private static final byte[] HELLO = NcsAssembler.printing("hello");

    @Test
    void testEventOrder() {
        NcsDecompiler dc = new NcsDecompiler();
        List<String> fired = new ArrayList<>();
        dc.listen(RunDecompilationEvent.class, evt -> fired.add("run"));
        dc.lift().listen(DecodedEvent.class, evt -> fired.add("decoded"));
        dc.lift().listen(CfgBuiltEvent.class, evt -> fired.add("cfg"));
        dc.lift().listen(ScriptRecoveredEvent.class, evt -> fired.add("script"));
        dc.lift().listen(SourceEmittedEvent.class, evt -> fired.add("source"));
        dc.lift().listen(OutputEvent.class, evt -> fired.add("output"));

        DecompileResult result = dc.submit(HELLO, GameVariant.K1).run();
        assertEquals(Arrays.asList("run", "decoded", "cfg", "script", "source", "output"), fired);
        assertTrue(result.source.contains("PrintString(\"hello\");"), result.source);
        assertEquals(GameVariant.K1, result.variant);
    }

    @Test
    void testListenersOnOneDecompilation() {
        NcsDecompiler dc = new NcsDecompiler();
        Decompilation first = dc.submit(HELLO, GameVariant.K1);
        AtomicInteger outputs = new AtomicInteger();
        first.listen(OutputEvent.class, evt -> outputs.incrementAndGet());
        first.run();
        dc.submit(HELLO, GameVariant.K1).run();
        assertEquals(1, outputs.get());
    }

    @Test
    void testReplaceSource() {
        NcsDecompiler dc = new NcsDecompiler();
        dc.lift().listen(SourceEmittedEvent.class, evt -> evt.source = evt.source.replace("hello", "goodbye"));
        DecompileResult result = dc.submit(HELLO, GameVariant.K2).run();
        assertTrue(result.rawSource.contains("\"goodbye\""), result.rawSource);
        assertTrue(result.source.contains("\"goodbye\""), result.source);
        assertFalse(result.source.contains("hello"), result.source);
    }

    @Test
    void testCancelledOutput() {
        NcsDecompiler dc = new NcsDecompiler();
        AtomicInteger later = new AtomicInteger();
        dc.lift().listen(OutputEvent.class, OutputEvent::cancel);
        dc.lift().listen(OutputEvent.class, evt -> later.incrementAndGet());
        assertNotNull(dc.submit(HELLO, GameVariant.K1).run());
        assertEquals(0, later.get());
    }

    @Test
    void testOutputsAsQueue() {
        NcsDecompiler dc = new NcsDecompiler();
        BlockingQueue<DecompileResult> queue = dc.outputsAsQueue();
        DecompileResult first = dc.submit(HELLO, GameVariant.K1).run();
        DecompileResult second = dc.submit(NcsAssembler.printing("again"), GameVariant.K2).run();
        assertSame(first, queue.poll());
        assertSame(second, queue.poll());
        assertNull(queue.poll());
    }

    @Test
    void testSubmitStream() throws IOException {
        NcsDecompiler dc = new NcsDecompiler();
        DecompileResult fromStream = dc.submit(new ByteArrayInputStream(HELLO), GameVariant.K1).run();
        DecompileResult fromBytes = dc.submit(HELLO, GameVariant.K1).run();
        assertEquals(fromBytes.source, fromStream.source);
    }

    @Test
    void testOptionsApplyToLaterSubmissions() {
        NcsDecompiler dc = new NcsDecompiler();
        Decompilation before = dc.submit(HELLO, GameVariant.K1);
        DecompileOptions strict = DecompileOptions.builder().strictSignatures(true).build();
        dc.setOptions(strict);
        assertSame(DecompileOptions.DEFAULT, before.getOptions());
        assertSame(strict, dc.submit(HELLO, GameVariant.K1).getOptions());
    }

    @Test
    void testMalformedInput() {
        NcsDecompiler dc = new NcsDecompiler();
        AtomicInteger decoded = new AtomicInteger();
        dc.lift().listen(DecodedEvent.class, evt -> decoded.incrementAndGet());
        byte[] bytes = "NCS V2.0B\0\0\0\r".getBytes(StandardCharsets.ISO_8859_1);
        MalformedBytecodeException e = assertThrows(MalformedBytecodeException.class,
                () -> dc.submit(bytes, GameVariant.K1).run());
        assertEquals(5, e.getOffset());
        assertEquals(0, decoded.get());
    }
}
