package com.example.menuparser.util.menu;

import com.example.menuparser.MenuFixtures;
import com.example.menuparser.util.menu.dto.DetectionMode;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.PageTokens;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import com.example.menuparser.util.menu.dto.ProgressSnapshot;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 端到端流水线测试
 */
public class MenuParsingPipelineTest {

    private final MenuParsingPipeline pipeline = new MenuParsingPipeline();

    @Test
    public void testSampleMenuParsedFromRegions() throws MenuParseException {
        PipelineConfig config = PipelineConfig.loadDefault();
        ParseSession session = new ParseSession(config, Collections.singletonList(MenuFixtures.sampleMenuPage()));

        MenuParseResult result = pipeline.run(session);

        List<MenuItem> items = result.getItems();
        assertEquals(MenuFixtures.SAMPLE_ITEMS.length, items.size());
        for (int i = 0; i < items.size(); i++) {
            MenuItem item = items.get(i);
            assertEquals(MenuFixtures.SAMPLE_ITEMS[i][0], item.getName());
            assertEquals(MenuFixtures.SAMPLE_ITEMS[i][1], item.getDescription());
            assertEquals(Double.parseDouble(MenuFixtures.SAMPLE_ITEMS[i][2].substring(1)), item.getPrice(), 1e-9);
            assertEquals(ProcessingPhase.ASSEMBLY, item.getPhase());
            assertTrue(item.getConfidence() >= 0 && item.getConfidence() <= 1);
            assertNull(item.getRegionImage(), "没有渲染器时不生成缩略图");
        }

        assertFalse(result.getBootstrap().isFallbackTriggered(), "首轮结果已达标");
        assertEquals(6, result.getRegionCount());
        assertEquals(6, result.getAcceptedRegionCount());
        assertEquals(18, result.getTokenCount());
        assertEquals(session.getSessionId(), result.getSessionId());

        List<ProgressSnapshot> progress = result.getProgress();
        ProgressSnapshot last = progress.get(progress.size() - 1);
        assertEquals(ProcessingPhase.DONE, last.getPhase());
        assertEquals(100, last.getPercent());
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i).getPercent() >= progress.get(i - 1).getPercent(), "进度单调不减");
        }
        assertFalse(result.getLog().isEmpty());
    }

    @Test
    public void testAutoDetectionFallsBackToProximityAndRendersThumbnails() throws MenuParseException {
        AtomicInteger renders = new AtomicInteger();
        PageRasterizer rasterizer = (pageIndex, scale) -> {
            renders.incrementAndGet();
            return MenuFixtures.blankPage(scale);
        };
        ParseSession session = new ParseSession(PipelineConfig.loadDefault(),
                Collections.singletonList(MenuFixtures.sampleMenuPage()), rasterizer, null);

        MenuParseResult result = pipeline.run(session);

        assertEquals(MenuFixtures.SAMPLE_ITEMS.length, result.getItems().size(), "空白页面没有格子，退化为邻近度模式");
        for (MenuItem item : result.getItems()) {
            assertNotNull(item.getRegionImage());
            assertTrue(item.getRegionImage().startsWith("data:image/png;base64,"));
        }
        assertEquals(1, renders.get(), "边框检测与缩略图共用同一次渲染");
    }

    @Test
    public void testBoxModeWithoutRasterizerUsesProximity() throws MenuParseException {
        PipelineConfig config = PipelineConfig.loadDefault().withModes(DetectionMode.BOX, null);
        ParseSession session = new ParseSession(config, Collections.singletonList(MenuFixtures.sampleMenuPage()));

        MenuParseResult result = pipeline.run(session);

        assertEquals(MenuFixtures.SAMPLE_ITEMS.length, result.getItems().size());
    }

    @Test
    public void testRasterizerFailureRecoveredLocally() throws MenuParseException {
        PageRasterizer failing = (pageIndex, scale) -> {
            throw new IOException("renderer crashed");
        };
        PipelineConfig config = PipelineConfig.loadDefault().withModes(DetectionMode.BOX, null);
        ParseSession session = new ParseSession(config, Collections.singletonList(MenuFixtures.sampleMenuPage()),
                failing, null);

        MenuParseResult result = pipeline.run(session);

        assertEquals(MenuFixtures.SAMPLE_ITEMS.length, result.getItems().size());
        for (MenuItem item : result.getItems()) {
            // 区域置信度 1.0 * 0.9 与三项检查 1.0 各占一半
            assertEquals(0.95, item.getConfidence(), 1e-9);
        }
        assertTrue(result.getLog().stream().anyMatch(e -> e.getFailureKind() == FailureKind.REGION_EXTRACTION));
    }

    @Test
    public void testEmptyDocumentRejected() {
        ParseSession session = new ParseSession(PipelineConfig.loadDefault(), Collections.emptyList());

        MenuParseException e = assertThrows(MenuParseException.class, () -> pipeline.run(session));
        assertEquals(FailureKind.INPUT, e.getKind());
        assertEquals(FailureKind.INPUT, session.getLogEntries().get(0).getFailureKind());
    }

    @Test
    public void testDocumentWithoutTokensRejected() {
        PageTokens blank = MenuFixtures.page(0, new ArrayList<>());
        ParseSession session = new ParseSession(PipelineConfig.loadDefault(), Arrays.asList(blank, blank));

        MenuParseException e = assertThrows(MenuParseException.class, () -> pipeline.run(session));
        assertEquals(FailureKind.INPUT, e.getKind());
    }

    @Test
    public void testCancelledBeforeStart() {
        ParseSession session = new ParseSession(PipelineConfig.loadDefault(),
                Collections.singletonList(MenuFixtures.sampleMenuPage()));
        session.cancel();

        assertThrows(CancellationException.class, () -> pipeline.run(session));
    }

    @Test
    public void testCancelledBetweenPages() {
        AtomicReference<ParseSession> holder = new AtomicReference<>();
        ProgressListener cancelOnDetection = snapshot -> {
            if (snapshot.getPhase() == ProcessingPhase.REGION_DETECTION) {
                holder.get().cancel();
            }
        };
        List<PageTokens> pages = Arrays.asList(
                MenuFixtures.page(0, MenuFixtures.sampleMenuTokens(0)),
                MenuFixtures.page(1, MenuFixtures.sampleMenuTokens(1)));
        ParseSession session = new ParseSession(PipelineConfig.loadDefault(), pages, null, cancelOnDetection);
        holder.set(session);

        assertThrows(CancellationException.class, () -> pipeline.run(session));
        long detected = session.getProgressHistory().stream()
                .filter(s -> s.getPhase() == ProcessingPhase.REGION_DETECTION)
                .count();
        assertEquals(1, detected, "取消后不再检测下一页");
    }
}
