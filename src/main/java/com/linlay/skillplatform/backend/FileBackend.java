package com.linlay.skillplatform.backend;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File capability used by the agent's file tools. Paths are absolute, POSIX style.
 */
public interface FileBackend {

    List<FileInfo> ls(String path);

    String read(String path);

    void write(String path, String content);

    /**
     * Replaces {@code oldString} with {@code newString} and returns the number of replacements.
     * Without {@code replaceAll} the old string must occur exactly once.
     */
    default int edit(String path, String oldString, String newString, boolean replaceAll) {
        if (oldString == null || oldString.isEmpty()) {
            throw new FileBackendException(FileBackendException.EDIT_FAILED, "old_string must not be empty");
        }
        String content = read(path);
        int occurrences = countOccurrences(content, oldString);
        if (occurrences == 0) {
            throw new FileBackendException(FileBackendException.EDIT_FAILED, "String not found in file: " + path);
        }
        if (!replaceAll && occurrences > 1) {
            throw new FileBackendException(
                    FileBackendException.EDIT_FAILED,
                    "String appears " + occurrences + " times in " + path + "; use replace_all or add more context"
            );
        }
        String replacement = newString == null ? "" : newString;
        String updated = replaceAll
                ? content.replace(oldString, replacement)
                : content.replaceFirst(Pattern.quote(oldString), Matcher.quoteReplacement(replacement));
        write(path, updated);
        return replaceAll ? occurrences : 1;
    }

    private static int countOccurrences(String content, String needle) {
        int count = 0;
        int from = 0;
        while (true) {
            int idx = content.indexOf(needle, from);
            if (idx < 0) {
                return count;
            }
            count++;
            from = idx + needle.length();
        }
    }
}
