package com.localbrowser.thumbnail;

import java.awt.Color;
import java.awt.image.BufferedImage;

/**
 * 解码后的缩略图及其背景色。
 */
public record DecodedImage(BufferedImage image, Color background) {
}
