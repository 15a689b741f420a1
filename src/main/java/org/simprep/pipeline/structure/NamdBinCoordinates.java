package org.simprep.pipeline.structure;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes NAMD binary coordinate and velocity files: a 4-byte atom count followed
 * by x, y, z as 8-byte doubles per atom, little-endian.
 */
public final class NamdBinCoordinates {

    private NamdBinCoordinates() {
    }

    /**
     * @param file binary coordinate file
     * @return positions as {@code [atom][xyz]}
     * @throws IOException if the file cannot be read or its size disagrees with its atom count
     */
    public static double[][] read(Path file) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(Files.readAllBytes(file)).order(ByteOrder.LITTLE_ENDIAN);
        if (buffer.remaining() < Integer.BYTES) {
            throw new IOException(file.getFileName() + ": too short for a binary coordinate file");
        }
        int natoms = buffer.getInt();
        long expected = (long) natoms * 3 * Double.BYTES;
        if (natoms < 0 || buffer.remaining() != expected) {
            throw new IOException(file.getFileName() + ": header announces " + natoms + " atoms but the file holds "
                + buffer.remaining() + " data bytes");
        }
        double[][] xyz = new double[natoms][3];
        for (int i = 0; i < natoms; i++) {
            xyz[i][0] = buffer.getDouble();
            xyz[i][1] = buffer.getDouble();
            xyz[i][2] = buffer.getDouble();
        }
        return xyz;
    }

    /**
     * @param file target file
     * @param xyz positions as {@code [atom][xyz]}
     * @throws IOException if the file cannot be written
     */
    public static void write(Path file, double[][] xyz) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(Integer.BYTES + xyz.length * 3 * Double.BYTES)
            .order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(xyz.length);
        for (double[] atom : xyz) {
            buffer.putDouble(atom[0]).putDouble(atom[1]).putDouble(atom[2]);
        }
        Files.write(file, buffer.array());
    }
}
