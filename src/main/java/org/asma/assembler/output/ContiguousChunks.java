package org.asma.assembler.output;

import org.asma.assembler.api.LoadedBytes;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges loaded content into contiguous areas and splits them into chunks of bounded size.
 * <p>
 * Content is merged only while each piece starts exactly where the previous one ended;
 * uninitialized storage between pieces starts a new area.
 */
final class ContiguousChunks {

    private ContiguousChunks() {}

    /**
     * @param content   The loaded content in source order.
     * @param chunkSize The maximum number of bytes per chunk.
     * @return The chunks in order.
     */
    static List<LoadedBytes> split(List<LoadedBytes> content, int chunkSize) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunk size must be positive: " + chunkSize);
        }
        List<LoadedBytes> chunks = new ArrayList<>();
        for (LoadedBytes area : merge(content)) {
            byte[] data = area.data();
            for (int from = 0; from < data.length; from += chunkSize) {
                int to = Math.min(from + chunkSize, data.length);
                byte[] chunk = new byte[to - from];
                System.arraycopy(data, from, chunk, 0, chunk.length);
                chunks.add(new LoadedBytes(area.address() + from, chunk));
            }
        }
        return chunks;
    }

    static List<LoadedBytes> merge(List<LoadedBytes> content) {
        List<LoadedBytes> areas = new ArrayList<>();
        long start = -1;
        long next = -1;
        ByteArrayOutputStream data = new ByteArrayOutputStream();
        for (LoadedBytes piece : content) {
            if (piece.data().length == 0) {
                continue;
            }
            if (start >= 0 && piece.address() != next) {
                areas.add(new LoadedBytes(start, data.toByteArray()));
                data.reset();
                start = -1;
            }
            if (start < 0) {
                start = piece.address();
                next = start;
            }
            data.writeBytes(piece.data());
            next += piece.data().length;
        }
        if (start >= 0) {
            areas.add(new LoadedBytes(start, data.toByteArray()));
        }
        return areas;
    }

    static String hex(byte[] data) {
        StringBuilder sb = new StringBuilder(data.length * 2);
        for (byte b : data) {
            sb.append(String.format("%02X", b & 0xFF));
        }
        return sb.toString();
    }
}
