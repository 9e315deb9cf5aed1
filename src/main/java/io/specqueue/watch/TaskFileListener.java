package io.specqueue.watch;

import java.nio.file.Path;

public interface TaskFileListener {
    void onTaskFile(Path specFile, String sourceId);

    // Events were dropped by the platform; rescan the source.
    default void onOverflow(String sourceId) {
    }
}
