package tessera.engine;

import tessera.commands.string.GetCommand;
import tessera.commands.string.IncrByCommand;
import tessera.commands.string.RenameCommand;
import tessera.commands.string.SetCommand;
import tessera.commands.string.SetNxCommand;
import tessera.db.Bytes;
import tessera.db.StoreContext;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class StringEngineConcurrencyTest {

    @Test
    public void testConcurrentIncrEndsAtTotal() throws Exception {
        Engine engine = new Engine(new StoreContext());
        Bytes key = Bytes.of("hits");

        int threadCount = 8;
        int perThread = 500;
        ExecutorService es = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threadCount; t++) {
            futures.add(es.submit(() -> {
                latch.await();
                for (int i = 0; i < perThread; i++) {
                    assertEquals(Reply.Type.INTEGER, engine.execute(new IncrByCommand(key, 1)).getType());
                }
                return null;
            }));
        }
        latch.countDown(); // Go!
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        es.shutdown();

        assertEquals(Reply.value(Bytes.of(String.valueOf(threadCount * perThread))),
                engine.execute(new GetCommand(key)));
    }

    @Test
    public void testSetNxRaceHasOneWinner() throws Exception {
        Engine engine = new Engine(new StoreContext());
        Bytes key = Bytes.of("leader");

        int threadCount = 16;
        ExecutorService es = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threadCount; t++) {
            final int id = t;
            futures.add(es.submit(() -> {
                latch.await();
                if (engine.execute(new SetNxCommand(key, Bytes.of("t" + id))).getInteger() == 1) {
                    winners.incrementAndGet();
                }
                return null;
            }));
        }
        latch.countDown(); // Go!
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        es.shutdown();

        assertEquals(1, winners.get(), "Exactly one SETNX should succeed");
        assertEquals(Reply.Type.VALUE, engine.execute(new GetCommand(key)).getType());
    }

    @Test
    public void testRenameRaceMovesValueOnce() throws Exception {
        Engine engine = new Engine(new StoreContext());
        Bytes source = Bytes.of("src");
        engine.execute(new SetCommand(source, Bytes.of("payload")));

        int threadCount = 16;
        ExecutorService es = Executors.newFixedThreadPool(threadCount);
        CountDownLatch latch = new CountDownLatch(1);
        AtomicInteger renamed = new AtomicInteger();
        List<Bytes> targets = new ArrayList<>();
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threadCount; t++) {
            Bytes target = Bytes.of("dst" + t);
            targets.add(target);
            futures.add(es.submit(() -> {
                latch.await();
                Reply r = engine.execute(new RenameCommand(source, target));
                if (r.equals(Reply.ok())) {
                    renamed.incrementAndGet();
                } else {
                    assertEquals(Reply.error("ERR no such key"), r);
                }
                return null;
            }));
        }
        latch.countDown(); // Go!
        for (Future<?> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        es.shutdown();

        assertEquals(1, renamed.get(), "Exactly one RENAME should find the key");
        int copies = 0;
        for (Bytes target : targets) {
            if (engine.execute(new GetCommand(target)).getType() == Reply.Type.VALUE) copies++;
        }
        assertEquals(1, copies);
        assertEquals(Reply.nil(), engine.execute(new GetCommand(source)));
    }
}
