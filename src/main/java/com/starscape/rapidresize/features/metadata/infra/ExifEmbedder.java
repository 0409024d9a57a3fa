package com.starscape.rapidresize.features.metadata.infra;

import com.starscape.rapidresize.features.transcode.domain.OutputFormat;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.write.TiffImageWriterLossy;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * Serializes EXIF output sets and splices them into encoded JPEG or PNG data.
 */
@Component
public class ExifEmbedder {

    /** APP1 marker, segment length and the "Exif\0\0" header around a JPEG EXIF block. */
    static final int JPEG_SEGMENT_OVERHEAD = 10;

    /** Chunk length, type and CRC around a PNG eXIf chunk. */
    static final int PNG_CHUNK_OVERHEAD = 12;

    private static final int PNG_SIGNATURE_LENGTH = 8;
    private static final byte[] EXIF_CHUNK_TYPE = "eXIf".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] IDAT_CHUNK_TYPE = "IDAT".getBytes(StandardCharsets.US_ASCII);

    /**
     * Serialize the set on its own to find out whether it can be written and how large it is.
     */
    public int serializedSize(TiffOutputSet outputSet) throws IOException {
        return serialize(outputSet).length;
    }

    /**
     * Bytes the container adds around an EXIF block of the given format.
     */
    public int containerOverhead(OutputFormat format) {
        return switch (format) {
            case JPEG -> JPEG_SEGMENT_OVERHEAD;
            case PNG -> PNG_CHUNK_OVERHEAD;
            default -> 0;
        };
    }

    /**
     * Insert the set into encoded image data. Image data is copied untouched.
     */
    public byte[] embed(byte[] imageBytes, OutputFormat format, TiffOutputSet outputSet) throws IOException {
        return switch (format) {
            case JPEG -> embedJpeg(imageBytes, outputSet);
            case PNG -> embedPng(imageBytes, outputSet);
            default -> throw new IOException(format + " output cannot carry EXIF");
        };
    }

    private byte[] embedJpeg(byte[] jpegBytes, TiffOutputSet outputSet) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(jpegBytes.length + 4096);
        new ExifRewriter().updateExifMetadataLossless(jpegBytes, out, outputSet);
        return out.toByteArray();
    }

    /**
     * Write the set as an eXIf chunk in front of the first IDAT chunk.
     */
    private byte[] embedPng(byte[] pngBytes, TiffOutputSet outputSet) throws IOException {
        int insertAt = firstImageDataChunk(pngBytes);
        byte[] tiff = serialize(outputSet);

        ByteArrayOutputStream out = new ByteArrayOutputStream(pngBytes.length + tiff.length + PNG_CHUNK_OVERHEAD);
        out.write(pngBytes, 0, insertAt);
        out.write(ByteBuffer.allocate(4).putInt(tiff.length).array());
        out.write(EXIF_CHUNK_TYPE);
        out.write(tiff);
        CRC32 crc = new CRC32();
        crc.update(EXIF_CHUNK_TYPE);
        crc.update(tiff);
        out.write(ByteBuffer.allocate(4).putInt((int) crc.getValue()).array());
        out.write(pngBytes, insertAt, pngBytes.length - insertAt);
        return out.toByteArray();
    }

    private static int firstImageDataChunk(byte[] pngBytes) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(pngBytes);
        int offset = PNG_SIGNATURE_LENGTH;
        while (offset + 8 <= pngBytes.length) {
            int length = buffer.getInt(offset);
            if (isChunkType(pngBytes, offset + 4, EXIF_CHUNK_TYPE)) {
                throw new IOException("PNG data already carries an eXIf chunk");
            }
            if (isChunkType(pngBytes, offset + 4, IDAT_CHUNK_TYPE)) {
                return offset;
            }
            if (length < 0 || length > pngBytes.length - offset) {
                break;
            }
            offset += length + PNG_CHUNK_OVERHEAD;
        }
        throw new IOException("No IDAT chunk found in PNG data");
    }

    private static boolean isChunkType(byte[] bytes, int offset, byte[] type) {
        for (int i = 0; i < type.length; i++) {
            if (bytes[offset + i] != type[i]) {
                return false;
            }
        }
        return true;
    }

    private static byte[] serialize(TiffOutputSet outputSet) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new TiffImageWriterLossy(outputSet.byteOrder).write(out, outputSet);
        return out.toByteArray();
    }
}
