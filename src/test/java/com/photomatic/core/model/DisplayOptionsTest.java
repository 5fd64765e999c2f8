package com.photomatic.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DisplayOptionsTest {

    @Test
    void everyOptionRoundTripsThroughWith() {
        for (DisplayOption option : DisplayOption.values()) {
            DisplayOptions on = DisplayOptions.defaults().with(option, true);
            DisplayOptions off = on.with(option, false);

            assertTrue(on.isEnabled(option), option.name());
            assertFalse(off.isEnabled(option), option.name());
        }
    }

    @Test
    void lightMatSwapsTextColor() {
        DisplayOptions light = DisplayOptions.defaults().with(DisplayOption.LIGHT_MAT, true);

        assertEquals(Mat.LIGHT, light.mat());
        assertEquals(0x666666, light.mat().textColor().getRGB() & 0xFFFFFF);
        assertEquals(0x999999, Mat.DARK.textColor().getRGB() & 0xFFFFFF);
    }
}
