package com.tscan.server.detect;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Region of the full frame that detection ran on. Serialized as [x, y, w, h].
 */
public class CropRect {

    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public CropRect(int x, int y, int width, int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static CropRect fullFrame(int width, int height) {
        return new CropRect(0, 0, width, height);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CropRect fromArray(int[] values) {
        if (values == null || values.length != 4) {
            throw new IllegalArgumentException("crop_rect must have 4 entries");
        }
        return new CropRect(values[0], values[1], values[2], values[3]);
    }

    @JsonValue
    public int[] toArray() {
        return new int[] { x, y, width, height };
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CropRect)) {
            return false;
        }
        CropRect other = (CropRect) o;
        return x == other.x && y == other.y && width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return "CropRect{" + x + "," + y + "," + width + "x" + height + "}";
    }
}
