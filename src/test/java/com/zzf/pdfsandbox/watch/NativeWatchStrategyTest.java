package com.zzf.pdfsandbox.watch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class NativeWatchStrategyTest {

    @TempDir
    Path root;

    private final NativeWatchStrategy strategy = new NativeWatchStrategy();
    private final List<Path> changed = new CopyOnWriteArrayList<>();
    private final List<Path> directories = new CopyOnWriteArrayList<>();

    @AfterEach
    void tearDown() {
        strategy.stop();
    }

    @Test
    void startsAndStopsCleanly() throws IOException {
        Files.createDirectories(root.resolve("abc/partials"));

        strategy.start(root, (path, directory) -> { });
        strategy.start(root, (path, directory) -> { });

        assertTimeoutPreemptively(Duration.ofSeconds(5), strategy::stop);
        assertTimeoutPreemptively(Duration.ofSeconds(5), strategy::stop);
        assertEquals("native", strategy.name());
    }

    @Test
    void reportsModifiedFileInExistingWorkspace() throws Exception {
        Path workspace = Files.createDirectories(root.resolve("abc"));
        Path main = Files.writeString(workspace.resolve("index.html"), "<p>one</p>");
        strategy.start(root, this::record);

        Files.writeString(main, "<p>two, longer</p>");

        awaitChange(main);
        assertFalse(directories.contains(main));
    }

    @Test
    void reportsFilesInsideWorkspaceCreatedAfterStart() throws Exception {
        strategy.start(root, this::record);

        Path workspace = Files.createDirectories(root.resolve("newws"));
        awaitChange(workspace);
        assertTrue(directories.contains(workspace));

        Path partials = Files.createDirectories(workspace.resolve("partials"));
        awaitChange(partials);

        Path nested = Files.writeString(partials.resolve("footer.html"), "<footer>x</footer>");
        awaitChange(nested);
    }

    private void record(Path path, boolean directory) {
        changed.add(path);
        if (directory) {
            directories.add(path);
        }
    }

    private void awaitChange(Path path) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (!changed.contains(path)) {
            if (System.currentTimeMillis() > deadline) {
                fail("no change reported for " + path + ", saw " + changed);
            }
            Thread.sleep(20);
        }
    }
}
