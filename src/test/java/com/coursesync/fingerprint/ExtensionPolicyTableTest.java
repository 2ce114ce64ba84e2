package com.coursesync.fingerprint;

import com.coursesync.fingerprint.ExtensionPolicyTable.Window;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExtensionPolicyTableTest {

    private final ExtensionPolicyTable table = new ExtensionPolicyTable(
            Map.of(".ZIP", new Window(512, 512), "pdf", new Window(0, 65536)),
            new Window(0, 512));

    @Test
    void shouldLookUpCaseInsensitively() {
        assertEquals(new Window(512, 512), table.windowFor("zip"));
        assertEquals(new Window(512, 512), table.windowFor(".Zip"));
        assertEquals(new Window(0, 65536), table.windowFor("PDF"));
    }

    @Test
    void shouldFallBackToDefaultWindow() {
        assertEquals(new Window(0, 512), table.windowFor("docx"));
        assertEquals(new Window(0, 512), table.windowFor(""));
        assertEquals(new Window(0, 512), table.windowFor(null));
    }

    @Test
    void shouldRejectInvalidWindows() {
        assertThrows(IllegalArgumentException.class, () -> new Window(-1, 512));
        assertThrows(IllegalArgumentException.class, () -> new Window(0, 0));
        assertThrows(IllegalArgumentException.class, () -> ExtensionPolicyTable.of(null));
    }

    @Test
    void shouldRejectBlankExtensionKey() {
        Map<String, Window> windows = new HashMap<>();
        windows.put(".", new Window(0, 10));

        assertThrows(IllegalArgumentException.class, () -> new ExtensionPolicyTable(windows, new Window(0, 512)));
    }
}
