package com.example.menuparser.util.pdf;

import com.example.menuparser.util.menu.dto.BoundingBox;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class PdfCoordinateUtilsTest {

    @Test
    public void testDocumentToImageFlipsAndPads() {
        BoundingBox box = new BoundingBox(50, 686, 260, 24);

        int[] rect = PdfCoordinateUtils.documentToImage(box, 792f, 2.0, 10.0, 1224, 1584);

        // 左上 (40, 792 - 710 - 10) * 2，宽高各加两倍留白
        assertArrayEquals(new int[]{80, 144, 560, 88}, rect);
    }

    @Test
    public void testDocumentToImageClipsToPage() {
        BoundingBox box = new BoundingBox(-20, 700, 100, 50);

        int[] rect = PdfCoordinateUtils.documentToImage(box, 792f, 1.0, 0.0, 612, 792);

        assertEquals(0, rect[0]);
        assertEquals(80, rect[2]);
    }

    @Test
    public void testDocumentToImageOutsidePage() {
        assertNull(PdfCoordinateUtils.documentToImage(new BoundingBox(50, -200, 100, 50), 792f, 1.0, 0.0, 612, 792));
    }

    @Test
    public void testImageToDocument() {
        BoundingBox box = PdfCoordinateUtils.imageToDocument(80, 144, 560, 88, 2.0, 792f);

        assertEquals(40, box.getX(), 1e-9);
        assertEquals(676, box.getY(), 1e-9);
        assertEquals(280, box.getWidth(), 1e-9);
        assertEquals(44, box.getHeight(), 1e-9);
    }
}
