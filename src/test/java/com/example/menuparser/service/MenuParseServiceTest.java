package com.example.menuparser.service;

import com.example.menuparser.MenuFixtures;
import com.example.menuparser.util.menu.MenuParseException;
import com.example.menuparser.util.menu.MenuParseResult;
import com.example.menuparser.util.menu.dto.AssemblyMode;
import com.example.menuparser.util.menu.dto.DetectionMode;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class MenuParseServiceTest {

    private MenuParseService service;

    @BeforeEach
    public void setUp() {
        service = new MenuParseService();
        ReflectionTestUtils.setField(service, "pipelineConfig", PipelineConfig.loadDefault());
    }

    @Test
    public void testParseGeneratedMenu() throws Exception {
        MenuParseResult result = service.parse(MenuFixtures.sampleMenuPdf(), "sample.pdf",
                DetectionMode.PROXIMITY, AssemblyMode.TRIPLE);

        assertEquals(1, result.getPageCount());
        assertEquals(18, result.getTokenCount());
        assertEquals(MenuFixtures.SAMPLE_ITEMS.length, result.getItems().size());
        assertFalse(result.getBootstrap().isFallbackTriggered());

        MenuItem first = result.getItems().get(0);
        assertEquals("Grilled Salmon Fillet", first.getName());
        assertEquals(24.95, first.getPrice(), 1e-9);
        assertEquals("Fresh Atlantic salmon with lemon butter sauce", first.getDescription());
    }

    @Test
    public void testUnreadableBytesAreInputFailure() {
        MenuParseException e = assertThrows(MenuParseException.class,
                () -> service.parse("not a pdf".getBytes(StandardCharsets.UTF_8), "bad.pdf", null, null));

        assertEquals(FailureKind.INPUT, e.getKind());
    }
}
