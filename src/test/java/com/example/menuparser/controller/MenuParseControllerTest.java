package com.example.menuparser.controller;

import com.example.menuparser.service.MenuParseService;
import com.example.menuparser.util.menu.MenuParseException;
import com.example.menuparser.util.menu.MenuParseResult;
import com.example.menuparser.util.menu.dto.BootstrapSummary;
import com.example.menuparser.util.menu.dto.DetectionMode;
import com.example.menuparser.util.menu.dto.FailureKind;
import com.example.menuparser.util.menu.dto.MenuItem;
import com.example.menuparser.util.menu.dto.PipelineConfig;
import com.example.menuparser.util.menu.dto.ProcessingPhase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(MenuParseController.class)
public class MenuParseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MenuParseService menuParseService;

    private static MockMultipartFile pdf(String filename, byte[] content) {
        return new MockMultipartFile("file", filename, "application/pdf", content);
    }

    @Test
    public void testEmptyFileRejected() throws Exception {
        mockMvc.perform(multipart("/api/menu/parse").file(pdf("menu.pdf", new byte[0])))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("文件不能为空"));
        verifyNoInteractions(menuParseService);
    }

    @Test
    public void testNonPdfRejected() throws Exception {
        mockMvc.perform(multipart("/api/menu/parse").file(pdf("menu.docx", new byte[]{1, 2, 3})))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("只支持.pdf文件"));
    }

    @Test
    public void testUnknownDetectionModeRejected() throws Exception {
        mockMvc.perform(multipart("/api/menu/parse").file(pdf("menu.pdf", new byte[]{1, 2, 3}))
                        .param("detectionMode", "GRID"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("参数错误")));
        verifyNoInteractions(menuParseService);
    }

    @Test
    public void testParseFailureMapsTo422() throws Exception {
        when(menuParseService.parse(any(byte[].class), eq("menu.pdf"), isNull(), isNull()))
                .thenThrow(new MenuParseException(FailureKind.INPUT, "文档没有可用文本"));

        mockMvc.perform(multipart("/api/menu/parse").file(pdf("menu.pdf", new byte[]{1, 2, 3})))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.failureKind").value("INPUT"));
    }

    @Test
    public void testParseSuccess() throws Exception {
        MenuItem item = new MenuItem("region-0-50-700", "Caesar Salad", "Romaine hearts", 9.5, false,
                "Salads", 1, 0.9, 0, ProcessingPhase.ASSEMBLY, null, null);
        BootstrapSummary bootstrap = BootstrapSummary.builder()
                .iterations(1)
                .qualityHistory(Arrays.asList(0.9))
                .converged(true)
                .finalQuality(0.9)
                .regionItemCount(1)
                .stopReason("质量达标")
                .build();
        MenuParseResult result = MenuParseResult.builder()
                .sessionId("s-1")
                .items(Collections.singletonList(item))
                .bootstrap(bootstrap)
                .log(Collections.emptyList())
                .progress(Collections.emptyList())
                .pageCount(1)
                .tokenCount(3)
                .regionCount(1)
                .acceptedRegionCount(1)
                .build();
        when(menuParseService.parse(any(byte[].class), eq("menu.pdf"), eq(DetectionMode.BOX), isNull()))
                .thenReturn(result);

        mockMvc.perform(multipart("/api/menu/parse").file(pdf("menu.pdf", new byte[]{1, 2, 3}))
                        .param("detectionMode", "box"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.items[0].name").value("Caesar Salad"))
                .andExpect(jsonPath("$.items[0].price").value(9.5))
                .andExpect(jsonPath("$.items[0].category").value("Salads"))
                .andExpect(jsonPath("$.bootstrap.iterations").value(1))
                .andExpect(jsonPath("$.acceptedRegionCount").value(1));
    }

    @Test
    public void testConfigEndpoint() throws Exception {
        when(menuParseService.getPipelineConfig()).thenReturn(PipelineConfig.loadDefault());

        mockMvc.perform(get("/api/menu/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.config.yProximityEm").value(1.5))
                .andExpect(jsonPath("$.config.detectionMode").value("AUTO"));
    }
}
