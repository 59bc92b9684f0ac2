package com.smartgallery.app.analyze;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Optional;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.stream.ImageInputStream;

import org.w3c.dom.Node;

/**
 * Container header readers for the facts {@link FileAnalyzer} needs: WebP animation and size,
 * GIF frame delays, and MP4/MOV duration and track size. Nothing here decodes pixels.
 */
final class MediaProbe {

    record WebpInfo(boolean animated, PixelSize size, long durationMillis) {}

    record VideoInfo(double durationSeconds, PixelSize size) {}

    private static final int GIF_DEFAULT_DELAY_MS = 100;

    private MediaProbe() {}

    // --- WebP (RIFF) ---

    static Optional<WebpInfo> webp(Path file) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            byte[] header = new byte[12];
            if (raf.read(header) < 12
                    || !"RIFF".equals(ascii(header, 0))
                    || !"WEBP".equals(ascii(header, 8))) {
                return Optional.empty();
            }
            boolean animated = false;
            PixelSize size = null;
            long duration = 0;
            long pos = 12;
            long end = raf.length();
            byte[] chunkHeader = new byte[8];
            while (pos + 8 <= end) {
                raf.seek(pos);
                raf.readFully(chunkHeader);
                String fourcc = ascii(chunkHeader, 0);
                long len = le32(chunkHeader, 4);
                long payload = pos + 8;
                switch (fourcc) {
                    case "VP8X" -> {
                        byte[] b = read(raf, payload, 10);
                        animated = (b[0] & 0x02) != 0;
                        size = new PixelSize(le24(b, 4) + 1, le24(b, 7) + 1);
                    }
                    case "ANMF" -> {
                        byte[] b = read(raf, payload, 15);
                        duration += le24(b, 12);
                    }
                    case "VP8L" -> {
                        if (size == null) {
                            byte[] b = read(raf, payload, 5);
                            long bits = le32(b, 1);
                            size = new PixelSize((int) (bits & 0x3FFF) + 1, (int) ((bits >> 14) & 0x3FFF) + 1);
                        }
                    }
                    case "VP8 " -> {
                        if (size == null) {
                            byte[] b = read(raf, payload, 10);
                            size = new PixelSize(le16(b, 6) & 0x3FFF, le16(b, 8) & 0x3FFF);
                        }
                    }
                    default -> { }
                }
                pos = payload + len + (len & 1);
            }
            return Optional.of(new WebpInfo(animated, size, duration));
        }
    }

    // --- GIF ---

    /** Sum of frame delays; frames without a delay count as 100 ms. */
    static long gifDurationMillis(Path file) throws IOException {
        try (ImageInputStream in = ImageIO.createImageInputStream(file.toFile())) {
            if (in == null) return 0;
            Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("gif");
            if (!readers.hasNext()) return 0;
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, false, false);
                int frames = reader.getNumImages(true);
                if (frames <= 1) return 0;
                long total = 0;
                for (int i = 0; i < frames; i++) {
                    int delayCs = frameDelayCentis(reader.getImageMetadata(i));
                    total += delayCs > 0 ? delayCs * 10L : GIF_DEFAULT_DELAY_MS;
                }
                return total;
            } finally {
                reader.dispose();
            }
        }
    }

    private static int frameDelayCentis(IIOMetadata meta) {
        Node root = meta.getAsTree("javax_imageio_gif_image_1.0");
        for (Node n = root.getFirstChild(); n != null; n = n.getNextSibling()) {
            if ("GraphicControlExtension".equals(n.getNodeName())) {
                Node delay = n.getAttributes().getNamedItem("delayTime");
                return delay == null ? 0 : Integer.parseInt(delay.getNodeValue());
            }
        }
        return 0;
    }

    // --- ISO base media (mp4/mov) ---

    static Optional<VideoInfo> isoMedia(Path file) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            long[] moov = findBox(raf, 0, raf.length(), "moov");
            if (moov == null) return Optional.empty();

            double duration = 0;
            long[] mvhd = findBox(raf, moov[0], moov[1], "mvhd");
            if (mvhd != null) {
                byte[] b = read(raf, mvhd[0], 32);
                boolean v1 = b[0] == 1;
                long timescale = v1 ? be32(b, 20) : be32(b, 12);
                long units = v1 ? be64(b, 24) : be32(b, 16);
                if (timescale > 0) duration = (double) units / timescale;
            }

            PixelSize size = null;
            long pos = moov[0];
            while (size == null) {
                long[] trak = findBox(raf, pos, moov[1], "trak");
                if (trak == null) break;
                long[] tkhd = findBox(raf, trak[0], trak[1], "tkhd");
                if (tkhd != null) {
                    int off = read(raf, tkhd[0], 1)[0] == 1 ? 88 : 76;
                    if (tkhd[1] - tkhd[0] < off + 8) break;
                    byte[] b = read(raf, tkhd[0], off + 8);
                    int w = (int) (be32(b, off) >> 16);
                    int h = (int) (be32(b, off + 4) >> 16);
                    if (w > 0 && h > 0) size = new PixelSize(w, h);
                }
                pos = trak[1];
            }
            return Optional.of(new VideoInfo(duration, size));
        }
    }

    /** Payload [start, end) of the first child box of the given type inside [from, to). */
    private static long[] findBox(RandomAccessFile raf, long from, long to, String type) throws IOException {
        long pos = from;
        byte[] h = new byte[16];
        while (pos + 8 <= to) {
            raf.seek(pos);
            raf.readFully(h, 0, 8);
            long size = be32(h, 0);
            String name = ascii(h, 4);
            long headerLen = 8;
            if (size == 1) {
                raf.readFully(h, 8, 8);
                size = be64(h, 8);
                headerLen = 16;
            } else if (size == 0) {
                size = to - pos;
            }
            if (size < headerLen) return null;
            if (name.equals(type)) {
                return new long[] { pos + headerLen, Math.min(pos + size, to) };
            }
            pos += size;
        }
        return null;
    }

    // --- byte helpers ---

    private static byte[] read(RandomAccessFile raf, long pos, int n) throws IOException {
        byte[] b = new byte[n];
        raf.seek(pos);
        raf.readFully(b);
        return b;
    }

    private static String ascii(byte[] b, int off) {
        return new String(b, off, 4, StandardCharsets.US_ASCII);
    }

    private static int le16(byte[] b, int off) {
        return (b[off] & 0xFF) | (b[off + 1] & 0xFF) << 8;
    }

    private static int le24(byte[] b, int off) {
        return (b[off] & 0xFF) | (b[off + 1] & 0xFF) << 8 | (b[off + 2] & 0xFF) << 16;
    }

    private static long le32(byte[] b, int off) {
        return (le24(b, off) | (long) (b[off + 3] & 0xFF) << 24) & 0xFFFFFFFFL;
    }

    private static long be32(byte[] b, int off) {
        return ((long) (b[off] & 0xFF) << 24 | (b[off + 1] & 0xFF) << 16 | (b[off + 2] & 0xFF) << 8 | (b[off + 3] & 0xFF))
                & 0xFFFFFFFFL;
    }

    private static long be64(byte[] b, int off) {
        return be32(b, off) << 32 | be32(b, off + 4);
    }
}
