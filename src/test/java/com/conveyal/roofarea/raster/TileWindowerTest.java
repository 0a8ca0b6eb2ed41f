package com.conveyal.roofarea.raster;

import com.conveyal.roofarea.RasterFixtures;
import com.conveyal.roofarea.RoofAreaException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TileWindowerTest {

    /** A grid of 5 rows by 4 columns, as its shape would be written in row-major order. */
    @Test
    public void fiveRowsByFourColumns () {
        List<Window> windows = toList(TileWindower.square(4, 5, 3, 1));
        assertEquals(new Window(0, 0, 3, 3), windows.get(0));
        Window last = windows.get(windows.size() - 1);
        assertEquals(2, last.width);
        assertEquals(1, last.height);
        assertEquals(new Window(2, 4, 2, 1), last);
        assertEquals(6, windows.size());
    }

    @Test
    public void fiveColumnsByFourRows () {
        List<Window> windows = toList(TileWindower.square(5, 4, 3, 1));
        List<Window> expected = List.of(
                new Window(0, 0, 3, 3), new Window(2, 0, 3, 3), new Window(4, 0, 1, 3),
                new Window(0, 2, 3, 2), new Window(2, 2, 3, 2), new Window(4, 2, 1, 2)
        );
        assertEquals(expected, windows);
    }

    @ParameterizedTest
    @CsvSource({
            "5, 4, 3, 1",
            "10, 10, 3, 0",
            "10, 10, 4, 3",
            "1, 1, 64, 32",
            "513, 300, 512, 32",
            "37, 29, 16, 8"
    })
    public void windowsCoverGridWithinBounds (int width, int height, int tile, int overlap) {
        TileWindower tiles = TileWindower.square(width, height, tile, overlap);
        int[] coverage = new int[width * height];
        int count = 0;
        for (Window window : tiles) {
            count += 1;
            assertTrue(window.fitsWithin(width, height), window + " exceeds grid");
            assertTrue(window.width <= tile && window.height <= tile);
            for (int row = window.rowOff; row < window.rowOff + window.height; row++) {
                for (int col = window.colOff; col < window.colOff + window.width; col++) {
                    coverage[row * width + col] += 1;
                }
            }
        }
        for (int i = 0; i < coverage.length; i++) {
            assertTrue(coverage[i] > 0, "Pixel " + i + " not covered");
        }
        assertEquals(tiles.size(), count);
    }

    @Test
    public void rectangularTiles () {
        List<Window> windows = toList(new TileWindower(10, 4, 5, 2, 1));
        assertEquals(new Window(0, 0, 5, 2), windows.get(0));
        assertEquals(new Window(4, 0, 5, 2), windows.get(1));
        assertEquals(new Window(8, 0, 2, 2), windows.get(2));
        assertEquals(new Window(0, 1, 5, 2), windows.get(3));
    }

    @Test
    public void overlapMustBeSmallerThanTile () {
        RoofAreaException e = assertThrows(RoofAreaException.class, () -> TileWindower.square(5, 4, 3, 3));
        assertEquals(RoofAreaException.Type.CONFIGURATION, e.type);
        assertTrue(e.getMessage().contains("overlap"));
        assertThrows(RoofAreaException.class, () -> new TileWindower(10, 10, 8, 3, 3));
        assertThrows(RoofAreaException.class, () -> TileWindower.square(10, 10, 3, -1));
        assertThrows(RoofAreaException.class, () -> TileWindower.square(10, 10, 0, 0));
    }

    @Test
    public void iterationRestarts () {
        TileWindower tiles = TileWindower.forRaster(RasterFixtures.brightSquare(), 4, 1);
        List<Window> first = toList(tiles);
        List<Window> second = tiles.stream().collect(Collectors.toList());
        assertEquals(first, second);
        assertEquals(16, first.size());
    }

    private static List<Window> toList (Iterable<Window> windows) {
        List<Window> list = new ArrayList<>();
        windows.forEach(list::add);
        return list;
    }

}
