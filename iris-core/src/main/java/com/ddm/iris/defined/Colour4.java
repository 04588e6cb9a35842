package com.ddm.iris.defined;

import jakarta.annotation.Nullable;

/**
 * 四通道颜色（RGBA），每个通道为 0-255 的 8 位整数。
 * <p>
 * 皮肤配置中的自定义颜色与 combo 调色板均以该类型存储。
 * 同时提供归一化（0.0-1.0）访问器，便于渲染侧直接使用。
 *
 * @author liyifei
 * @param r 红色通道
 * @param g 绿色通道
 * @param b 蓝色通道
 * @param a 透明度通道
 * @since 1.0
 */
public record Colour4(int r, int g, int b, int a) {

    public static final Colour4 RED = new Colour4(255, 0, 0, 255);
    public static final Colour4 WHITE = new Colour4(255, 255, 255, 255);
    public static final Colour4 BLACK = new Colour4(0, 0, 0, 255);

    public Colour4 {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
        checkChannel("a", a);
    }

    public Colour4(int r, int g, int b) {
        this(r, g, b, 255);
    }

    /**
     * 解析 {@code r,g,b} 或 {@code r,g,b,a} 形式的颜色字符串（skin.ini 的写法）。
     *
     * @param text 颜色文本
     * @return 解析后的颜色；格式不合法或通道越界时返回 null
     */
    @Nullable
    public static Colour4 parse(@Nullable String text) {
        if (text == null || text.isBlank()) return null;
        String[] parts = text.split(",");
        if (parts.length < 3 || parts.length > 4) return null;
        try {
            int r = Integer.parseInt(parts[0].trim());
            int g = Integer.parseInt(parts[1].trim());
            int b = Integer.parseInt(parts[2].trim());
            int a = parts.length == 4 ? Integer.parseInt(parts[3].trim()) : 255;
            return new Colour4(r, g, b, a);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public float red() {
        return r / 255f;
    }

    public float green() {
        return g / 255f;
    }

    public float blue() {
        return b / 255f;
    }

    public float alpha() {
        return a / 255f;
    }

    @Override
    public String toString() {
        return r + "," + g + "," + b + "," + a;
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Colour channel " + name + " out of range [0,255]: " + value);
        }
    }
}
