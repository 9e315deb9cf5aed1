package io.specqueue.scan;

import java.nio.file.Path;
import java.util.regex.Pattern;

public final class TaskIds {
    private static final Pattern TASK_ID = Pattern.compile("^task-([0-9]{8})-([0-9]{6})(-.*)?$");

    private TaskIds() {
    }

    public static boolean isValid(String taskId) {
        return taskId != null && TASK_ID.matcher(taskId).matches();
    }

    public static String fromFileName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }

    public static String fromPath(Path file) {
        return fromFileName(file.getFileName().toString());
    }
}
