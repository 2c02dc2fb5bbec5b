package com.example.demo.deckgen.binder;

import com.example.demo.deckgen.exception.DocumentAssemblyException;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Crops an image around its center to a target aspect ratio and re-encodes it
 * as PNG.
 */
public final class CenterCrop {

    private CenterCrop() {
    }

    public static byte[] toAspect(byte[] imageBytes, double targetWidth, double targetHeight) {
        BufferedImage source = decode(imageBytes);
        BufferedImage cropped = crop(source, targetWidth / targetHeight);
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(cropped, "png", out)) {
                throw new DocumentAssemblyException("No PNG encoder available", null);
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new DocumentAssemblyException("Failed to encode cropped image", e);
        }
    }

    static BufferedImage crop(BufferedImage source, double targetRatio) {
        int width = source.getWidth();
        int height = source.getHeight();
        double ratio = (double) width / height;
        if (Math.abs(ratio - targetRatio) < 0.01) {
            return source;
        }
        if (ratio > targetRatio) {
            int cropWidth = Math.max(1, (int) Math.round(height * targetRatio));
            return source.getSubimage((width - cropWidth) / 2, 0, cropWidth, height);
        }
        int cropHeight = Math.max(1, (int) Math.round(width / targetRatio));
        return source.getSubimage(0, (height - cropHeight) / 2, width, cropHeight);
    }

    private static BufferedImage decode(byte[] bytes) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
            if (image == null) {
                throw new DocumentAssemblyException("Image data is not in a readable format", null);
            }
            return image;
        } catch (IOException e) {
            throw new DocumentAssemblyException("Failed to decode image", e);
        }
    }
}
