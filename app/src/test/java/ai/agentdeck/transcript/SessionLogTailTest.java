package ai.agentdeck.transcript;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SessionLogTailTest {
    private static final String PROJECT = "/work/my-app";

    @TempDir
    Path tempDir;

    private TranscriptLocator locator;
    private RecordingListener listener;
    private SessionLogTail tail;

    private static final class RecordingListener implements TailListener {
        final List<List<TranscriptEntry>> appended = new CopyOnWriteArrayList<>();
        final List<List<TranscriptEntry>> resets = new CopyOnWriteArrayList<>();
        final List<String> notFound = new CopyOnWriteArrayList<>();
        final CountDownLatch notFoundLatch = new CountDownLatch(1);
        final CountDownLatch appendedLatch = new CountDownLatch(1);

        @Override
        public void onEntries(String consumerId, List<TranscriptEntry> entries) {
            appended.add(entries);
            appendedLatch.countDown();
        }

        @Override
        public void onReset(String consumerId, List<TranscriptEntry> entries) {
            resets.add(entries);
        }

        @Override
        public void onNotFound(String consumerId, String message) {
            notFound.add(message);
            notFoundLatch.countDown();
        }

        List<TranscriptEntry> allAppended() {
            return appended.stream().flatMap(List::stream).toList();
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        locator = new TranscriptLocator(tempDir.resolve("projects"));
        Files.createDirectories(locator.projectDir(PROJECT));
        listener = new RecordingListener();
        // timers effectively off; tests drive polling explicitly
        tail = new SessionLogTail(
                locator, listener, new TailSettings(Duration.ofHours(1), 2, Duration.ofHours(1), false));
    }

    @AfterEach
    void tearDown() {
        tail.close();
    }

    private static String line(String type, int n) {
        return "{\"type\":\"" + type + "\",\"n\":" + n + "}\n";
    }

    private Path write(String logId, String content) throws Exception {
        var file = locator.logFile(PROJECT, logId);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static void append(Path file, String content) throws Exception {
        Files.writeString(file, content, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    }

    @Test
    void testInitialEntriesThenIncrementalAppends() throws Exception {
        var file = write("s1", line("user", 0) + line("assistant", 1));

        var initial = tail.watch("panel", "s1", PROJECT);
        assertEquals(2, initial.size());
        assertEquals(TranscriptEntry.Kind.USER, initial.get(0).kind());

        append(file, line("user", 2) + "{\"type\":\"assis");
        tail.pollNow("panel");
        assertEquals(1, listener.appended.size());
        assertEquals(2, listener.appended.get(0).get(0).raw().get("n").asInt());

        append(file, "tant\",\"n\":3}\n");
        tail.pollNow("panel");
        assertEquals(2, listener.appended.size());
        var completed = listener.appended.get(1);
        assertEquals(1, completed.size());
        assertEquals("assistant", completed.get(0).type());
        assertEquals(3, completed.get(0).raw().get("n").asInt());

        tail.pollNow("panel");
        assertEquals(2, listener.appended.size());
        assertTrue(listener.resets.isEmpty());
    }

    @Test
    void testNothingIsDeliveredTwiceAcrossManyAppends() throws Exception {
        var file = write("s1", "");
        tail.watch("panel", "s1", PROJECT);

        for (int i = 0; i < 20; i++) {
            append(file, line("user", i));
            if (i % 3 == 0) {
                tail.pollNow("panel");
            }
        }
        tail.pollNow("panel");

        var numbers = listener.allAppended().stream().map(e -> e.raw().get("n").asInt()).toList();
        assertEquals(20, numbers.size());
        for (int i = 0; i < 20; i++) {
            assertEquals(i, numbers.get(i));
        }
    }

    @Test
    void testRewrittenFileIsDeliveredAsSingleReset() throws Exception {
        write("s1", line("user", 0) + line("assistant", 1) + line("user", 2));
        tail.watch("panel", "s1", PROJECT);

        write("s1", line("user", 9));
        tail.pollNow("panel");
        tail.pollNow("panel");

        assertEquals(1, listener.resets.size());
        assertEquals(1, listener.resets.get(0).size());
        assertEquals(9, listener.resets.get(0).get(0).raw().get("n").asInt());
        assertTrue(listener.appended.isEmpty());
    }

    @Test
    void testUnknownIdFollowsNewestTranscript() throws Exception {
        var older = write("older", line("user", 0));
        Files.setLastModifiedTime(older, FileTime.fromMillis(System.currentTimeMillis() - 60_000));

        var initial = tail.watch("panel", null, PROJECT);
        assertEquals(1, initial.size());
        assertEquals("older", tail.activeLogId("panel"));

        write("newer", line("user", 5) + line("assistant", 6));
        tail.pollNow("panel");

        assertEquals("newer", tail.activeLogId("panel"));
        assertEquals(1, listener.resets.size());
        assertEquals(2, listener.resets.get(0).size());

        append(locator.logFile(PROJECT, "newer"), line("user", 7));
        tail.pollNow("panel");
        assertEquals(1, listener.appended.size());
        assertEquals(7, listener.appended.get(0).get(0).raw().get("n").asInt());
    }

    @Test
    void testPinnedWatchIgnoresNewerTranscripts() throws Exception {
        var pinned = write("pinned", line("user", 0));
        Files.setLastModifiedTime(pinned, FileTime.fromMillis(System.currentTimeMillis() - 60_000));
        tail.watch("panel", "pinned", PROJECT);

        write("other", line("user", 1));
        tail.pollNow("panel");

        assertEquals("pinned", tail.activeLogId("panel"));
        assertTrue(listener.resets.isEmpty());
        assertTrue(listener.appended.isEmpty());
    }

    @Test
    void testMissingTranscriptIsReportedAfterAttachAttempts() throws Exception {
        var initial = tail.watch("panel", "ghost", PROJECT);
        assertTrue(initial.isEmpty());

        tail.attachNow("panel");
        assertTrue(listener.notFound.isEmpty());
        tail.attachNow("panel");

        assertTrue(listener.notFoundLatch.await(1, TimeUnit.SECONDS));
        assertEquals(1, listener.notFound.size());
        assertTrue(listener.notFound.get(0).startsWith("Session file not found after"));

        tail.attachNow("panel");
        assertEquals(1, listener.notFound.size());
    }

    @Test
    void testTranscriptAppearingLaterIsDeliveredOnce() throws Exception {
        tail.watch("panel", "late", PROJECT);
        tail.pollNow("panel");

        write("late", line("user", 0) + line("assistant", 1));
        tail.attachNow("panel");
        tail.pollNow("panel");
        tail.attachNow("panel");

        assertEquals(2, listener.allAppended().size());
        assertTrue(listener.notFound.isEmpty());
    }

    @Test
    void testUnwatchIsIdempotentAndStopsDelivery() throws Exception {
        var file = write("s1", line("user", 0));
        tail.watch("panel", "s1", PROJECT);

        tail.unwatch("panel");
        tail.unwatch("panel");
        tail.unwatch("never-registered");

        append(file, line("user", 1));
        tail.pollNow("panel");
        assertTrue(listener.appended.isEmpty());
        assertNull(tail.activeLogId("panel"));
    }

    @Test
    void testWatchReplacesPreviousWatchOfConsumer() throws Exception {
        write("a", line("user", 0));
        var b = write("b", line("user", 1));
        tail.watch("panel", "a", PROJECT);

        var initial = tail.watch("panel", "b", PROJECT);
        assertEquals(1, initial.get(0).raw().get("n").asInt());
        assertEquals("b", tail.activeLogId("panel"));

        append(b, line("assistant", 2));
        tail.pollNow("panel");
        assertEquals(1, listener.allAppended().size());
    }

    @Test
    void testReadAllSkipsMalformedLines() throws Exception {
        write("s1", line("user", 0) + "not json\n" + "{\"no_type\":true}\n" + line("assistant", 1) + "\n");

        var entries = tail.readAll("s1", PROJECT);

        assertEquals(2, entries.size());
        assertEquals(TranscriptEntry.Kind.ASSISTANT, entries.get(1).kind());
        assertTrue(tail.readAll("missing", PROJECT).isEmpty());
    }

    @Test
    void testFindLatestLogId() throws Exception {
        assertNull(tail.findLatestLogId("/no/such/project"));

        var first = write("first", line("user", 0));
        Files.setLastModifiedTime(first, FileTime.fromMillis(System.currentTimeMillis() - 60_000));
        write("second", line("user", 0));

        assertEquals("second", tail.findLatestLogId(PROJECT));
    }

    @Test
    void testFailingListenerDoesNotStopScheduledPolling() throws Exception {
        var file = write("s1", line("user", 0));
        var calls = new AtomicInteger();
        var failing = new TailListener() {
            @Override
            public void onEntries(String consumerId, List<TranscriptEntry> entries) {
                if (calls.incrementAndGet() == 1) {
                    throw new IllegalStateException("renderer crashed");
                }
            }
        };
        try (var pollingTail = new SessionLogTail(
                locator, failing, new TailSettings(Duration.ofMillis(50), 5, Duration.ofMillis(50), false))) {
            pollingTail.watch("panel", "s1", PROJECT);

            append(file, line("assistant", 1));
            awaitCalls(calls, 1);
            append(file, line("user", 2));
            awaitCalls(calls, 2);
        }
    }

    private static void awaitCalls(AtomicInteger calls, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (calls.get() < expected) {
            if (System.currentTimeMillis() > deadline) {
                fail("Expected " + expected + " deliveries but saw " + calls.get());
            }
            Thread.sleep(10);
        }
    }

    @Test
    void testNativeWatchDeliversAppendsWithoutPolling() throws Exception {
        var file = write("s1", line("user", 0));
        try (var nativeTail = new SessionLogTail(
                locator, listener, new TailSettings(Duration.ofHours(1), 2, Duration.ofHours(1), true))) {
            nativeTail.watch("panel", "s1", PROJECT);
            // give the watcher thread time to register
            Thread.sleep(500);

            append(file, line("assistant", 1));

            assertTrue(listener.appendedLatch.await(10, TimeUnit.SECONDS));
            assertEquals(1, listener.allAppended().get(0).raw().get("n").asInt());
        }
    }
}
