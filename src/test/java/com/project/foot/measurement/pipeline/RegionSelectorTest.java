package com.project.foot.measurement.pipeline;

import org.junit.jupiter.api.Test;

import java.awt.Point;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RegionSelectorTest {
    private final RegionSelector selector = new RegionSelector();

    private static Contour square(int x, int y, int side) {
        return Contour.of(new Point(x, y), new Point(x, y + side), new Point(x + side, y + side), new Point(x + side, y));
    }

    @Test
    void picks_largest_area() {
        Contour small = square(0, 0, 10);
        Contour large = square(50, 50, 30);
        Contour medium = square(100, 0, 20);

        assertThat(selector.selectLargest(List.of(small, large, medium))).containsSame(large);
    }

    @Test
    void equal_areas_keep_first_encountered() {
        Contour first = square(0, 0, 10);
        Contour second = square(40, 0, 10);

        assertThat(selector.selectLargest(List.of(first, second))).containsSame(first);
        assertThat(selector.selectLargest(List.of(second, first))).containsSame(second);
    }

    @Test
    void zero_area_contour_is_still_selected_when_alone() {
        Contour line = Contour.of(new Point(0, 0), new Point(25, 0));

        assertThat(selector.selectLargest(List.of(line))).containsSame(line);
    }

    @Test
    void empty_input_selects_nothing() {
        assertThat(selector.selectLargest(List.of())).isEmpty();
    }
}
