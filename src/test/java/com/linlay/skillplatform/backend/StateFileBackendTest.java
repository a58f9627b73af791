package com.linlay.skillplatform.backend;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateFileBackendTest {

    private final Map<String, Object> state = new HashMap<>();
    private final StateFileBackend backend = new StateFileBackend(state);

    @Test
    void shouldListDirectChildrenWithSubdirectoriesFirst() {
        backend.write("/work/a.txt", "a");
        backend.write("/work/sub/b.txt", "bb");
        backend.write("/other.txt", "c");

        assertThat(backend.ls("/work")).containsExactly(
                FileInfo.directory("/work/sub"),
                FileInfo.file("/work/a.txt", 1));
    }

    @Test
    void shouldEditExactlyOnceUnlessReplaceAll() {
        backend.write("/a.md", "x x y");

        assertThatThrownBy(() -> backend.edit("/a.md", "x", "z", false))
                .isInstanceOf(FileBackendException.class)
                .hasMessageContaining("2 times");
        assertThat(backend.edit("/a.md", "x", "z", true)).isEqualTo(2);
        assertThat(backend.edit("/a.md", "y", "$1", false)).isEqualTo(1);
        assertThat(backend.read("/a.md")).isEqualTo("z z $1");
        assertThatThrownBy(() -> backend.edit("/a.md", "missing", "z", false))
                .isInstanceOf(FileBackendException.class);
    }

    @Test
    void shouldReportMissingFiles() {
        assertThatThrownBy(() -> backend.read("/nope.txt"))
                .isInstanceOf(FileBackendException.class)
                .hasMessageContaining("/nope.txt");
    }
}
