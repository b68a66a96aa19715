/*
 * XNAT DICOM Extractor
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.extractor.dicom;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Decodes native (uncompressed) single-sample pixel data into float arrays.
 *
 * <p>Frames are returned concatenated, each frame in row-major order
 * ({@code index = frame * rows * columns + row * columns + column}).</p>
 */
public final class PixelDataDecoder {

    private PixelDataDecoder() {
    }

    public static int frameCount(DicomDataset dataset) {
        return Math.max(1, dataset.getInt(DicomTag.NumberOfFrames, 1));
    }

    /**
     * Decode stored pixel values, applying the modality rescale when {@code rescale} is set.
     */
    public static float[] decode(DicomDataset dataset, boolean rescale) throws DicomFormatException {
        DicomElement pixelData = dataset.getElement(DicomTag.PixelData);
        if (pixelData == null) {
            throw new DicomFormatException("No pixel data");
        }
        if (pixelData.isEncapsulated()) {
            throw new DicomFormatException("Compressed pixel data is not supported");
        }
        int samples = dataset.getInt(DicomTag.SamplesPerPixel, 1);
        if (samples != 1) {
            throw new DicomFormatException("Only single-sample images are supported, found " + samples);
        }

        int rows = dataset.getInt(DicomTag.Rows, 0);
        int columns = dataset.getInt(DicomTag.Columns, 0);
        if (rows <= 0 || columns <= 0) {
            throw new DicomFormatException("Missing image dimensions");
        }
        int frames = frameCount(dataset);
        int bitsAllocated = dataset.getInt(DicomTag.BitsAllocated, 16);
        int bitsStored = dataset.getInt(DicomTag.BitsStored, bitsAllocated);
        boolean signed = dataset.getInt(DicomTag.PixelRepresentation, 0) == 1;

        long count = (long) rows * columns * frames;
        if (count > Integer.MAX_VALUE) {
            throw new DicomFormatException("Pixel data too large: " + count + " samples");
        }
        byte[] bytes = pixelData.getValue();
        long required = bitsAllocated == 1 ? (count + 7) / 8 : count * (bitsAllocated / 8);
        if (bytes.length < required) {
            throw new DicomFormatException("Pixel data truncated: expected " + required + " bytes, found " + bytes.length);
        }

        float[] values = new float[(int) count];
        switch (bitsAllocated) {
            case 1:
                // bits are packed continuously across frames, least significant bit first
                for (int i = 0; i < values.length; i++) {
                    values[i] = (bytes[i >>> 3] >>> (i & 7)) & 1;
                }
                break;
            case 8:
                for (int i = 0; i < values.length; i++) {
                    values[i] = signed ? bytes[i] : bytes[i] & 0xFF;
                }
                break;
            case 16: {
                ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
                int mask = bitsStored >= 16 ? 0xFFFF : (1 << bitsStored) - 1;
                for (int i = 0; i < values.length; i++) {
                    int raw = buffer.getShort() & mask;
                    values[i] = signed ? signExtend(raw, bitsStored) : raw;
                }
                break;
            }
            case 32: {
                ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
                for (int i = 0; i < values.length; i++) {
                    int raw = buffer.getInt();
                    values[i] = signed ? raw : (float) (raw & 0xFFFFFFFFL);
                }
                break;
            }
            default:
                throw new DicomFormatException("Unsupported Bits Allocated: " + bitsAllocated);
        }

        if (rescale) {
            double slope = dataset.getDouble(DicomTag.RescaleSlope, 1.0);
            double intercept = dataset.getDouble(DicomTag.RescaleIntercept, 0.0);
            if (slope != 1.0 || intercept != 0.0) {
                for (int i = 0; i < values.length; i++) {
                    values[i] = (float) (values[i] * slope + intercept);
                }
            }
        }
        return values;
    }

    private static int signExtend(int value, int bits) {
        if (bits >= 32) {
            return value;
        }
        int shift = 32 - bits;
        return (value << shift) >> shift;
    }
}
