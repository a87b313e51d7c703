package com.gentoro.reformat.model;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CropRectTest {
  private static final double EPS = 1e-9;

  @Test
  @DisplayName("Full detection tolerates tiny drift")
  void fullDetection() {
    assertTrue(CropRect.FULL.isFull());
    assertTrue(new CropRect(0.0005, 0, 0.9995, 1).isFull());
    assertFalse(new CropRect(0.01, 0, 0.99, 1).isFull());
  }

  @Test
  @DisplayName("Clamp keeps the rectangle inside the unit square with a minimum size")
  void clamp() {
    CropRect r = new CropRect(-0.2, 0.5, 2, 0).clamp();
    assertEquals(0, r.x(), EPS);
    assertEquals(0.5, r.y(), EPS);
    assertEquals(1, r.width(), EPS);
    assertEquals(CropRect.MIN_SIZE, r.height(), EPS);
  }

  @Test
  @DisplayName("Parse reads x,y,width,height")
  void parse() {
    assertEquals(new CropRect(0.1, 0.2, 0.3, 0.4), CropRect.parse(" 0.1, 0.2 ,0.3,0.4"));
    assertThrows(IllegalArgumentException.class, () -> CropRect.parse("0.1,0.2,0.3"));
    assertThrows(NumberFormatException.class, () -> CropRect.parse("a,b,c,d"));
  }

  @Test
  @DisplayName("Crop is effective only when active and not full")
  void cropEffectiveness() {
    assertFalse(Crop.NONE.isEffective());
    assertFalse(Crop.of(CropRect.FULL).isEffective());
    assertTrue(Crop.of(new CropRect(0, 0, 0.5, 0.5)).isEffective());
    assertFalse(new Crop(false, CropRatioPreset.FREE, new CropRect(0, 0, 0.5, 0.5)).isEffective());
  }

  @Test
  @DisplayName("Square preset on a landscape image trims the sides")
  void squareOnLandscape() {
    CropRect r = CropRatioPreset.SQUARE.centeredRect(1000, 800);
    assertEquals(0.1, r.x(), EPS);
    assertEquals(0, r.y(), EPS);
    assertEquals(0.8, r.width(), EPS);
    assertEquals(1, r.height(), EPS);
  }

  @Test
  @DisplayName("Wide preset on a less wide image trims top and bottom")
  void wideOnLandscape() {
    CropRect r = CropRatioPreset.LANDSCAPE_16_9.centeredRect(1000, 800);
    assertEquals(0, r.x(), EPS);
    assertEquals(1, r.width(), EPS);
    assertEquals(1.25 / (16.0 / 9), r.height(), EPS);
    assertEquals((1 - r.height()) / 2, r.y(), EPS);
  }

  @Test
  @DisplayName("Original and free presets keep the whole image")
  void unconstrainedPresets() {
    assertEquals(CropRect.FULL, CropRatioPreset.FREE.centeredRect(300, 200));
    CropRect original = CropRatioPreset.ORIGINAL.centeredRect(300, 200);
    assertTrue(original.isFull());
    assertEquals(0, CropRatioPreset.ORIGINAL.ratio(0, 200));
  }

  @Test
  @DisplayName("Presets are found by label or name")
  void fromLabel() {
    assertEquals(CropRatioPreset.PORTRAIT_4_5, CropRatioPreset.fromLabel("4:5"));
    assertEquals(CropRatioPreset.SQUARE, CropRatioPreset.fromLabel("square"));
    assertEquals(CropRatioPreset.ORIGINAL, CropRatioPreset.fromLabel(" "));
    assertThrows(IllegalArgumentException.class, () -> CropRatioPreset.fromLabel("5:7"));
  }
}
