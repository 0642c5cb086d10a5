package com.dococr.util;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.opencv_core.Mat;

public final class ImageUtils {

    private ImageUtils() {
    }

    /**
     * Copies an 8-bit grayscale or BGR Mat into a {@link BufferedImage} of the matching type.
     */
    public static BufferedImage matToBufferedImage(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Cannot convert an empty image");
        }
        Mat source = mat.isContinuous() ? mat : mat.clone();
        int type = BufferedImage.TYPE_3BYTE_BGR;
        if (source.channels() == 1) {
            type = BufferedImage.TYPE_BYTE_GRAY;
        }
        int bufferSize = source.channels() * source.cols() * source.rows();
        byte[] buffer = new byte[bufferSize];
        source.data().get(buffer);
        BufferedImage image = new BufferedImage(source.cols(), source.rows(), type);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(buffer, 0, target, 0, buffer.length);
        return image;
    }

    public static byte[] encodePng(Mat image) {
        try (BytePointer buffer = new BytePointer()) {
            boolean encoded = opencv_imgcodecs.imencode(".png", image, buffer);
            if (!encoded) {
                throw new IllegalStateException("Failed to encode image as PNG");
            }
            byte[] bytes = new byte[(int) buffer.limit()];
            buffer.get(bytes);
            return bytes;
        }
    }
}
