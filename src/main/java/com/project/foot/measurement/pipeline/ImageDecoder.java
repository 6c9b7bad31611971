package com.project.foot.measurement.pipeline;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Iterator;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;

/**
 * Turns an encoded buffer into a 3-channel BGR raster. Only a reader for the declared
 * encoding is consulted, so a JPEG labelled as PNG fails instead of being sniffed.
 */
public class ImageDecoder {

    public Mat decode(byte[] bytes, ImageEncoding encoding) throws ImageDecodeException {
        if (bytes == null || bytes.length == 0) {
            throw new ImageDecodeException("Empty image buffer");
        }
        BufferedImage image = read(bytes, encoding);
        if (image == null || image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new ImageDecodeException("Decoded " + encoding + " image is empty");
        }
        return bufferedImageToMat(image);
    }

    private BufferedImage read(byte[] bytes, ImageEncoding encoding) throws ImageDecodeException {
        Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName(encoding.formatName());
        if (!readers.hasNext()) {
            throw new ImageDecodeException("No image reader available for " + encoding);
        }
        ImageReader reader = readers.next();
        try (ImageInputStream in = new MemoryCacheImageInputStream(new ByteArrayInputStream(bytes))) {
            reader.setInput(in, true, true);
            return reader.read(0);
        } catch (IOException e) {
            throw new ImageDecodeException("Not a valid " + encoding + " image: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // corrupt payloads surface as unchecked exceptions from some ImageIO plugins
            throw new ImageDecodeException("Corrupt " + encoding + " image: " + e, e);
        } finally {
            reader.dispose();
        }
    }

    /**
     * Copies the colour channels into a BGR matrix. Alpha is dropped, not composited, so
     * transparent pixels keep their stored colour.
     */
    static Mat bufferedImageToMat(BufferedImage image) {
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        byte[] pixels = new byte[w * h * 3];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            pixels[3 * i] = (byte) (p & 0xFF);
            pixels[3 * i + 1] = (byte) ((p >> 8) & 0xFF);
            pixels[3 * i + 2] = (byte) ((p >> 16) & 0xFF);
        }
        Mat mat = new Mat(h, w, CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }
}
