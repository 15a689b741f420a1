package org.simprep.pipeline.membrane;

/**
 * How many patch replicas make up the quilt along x and y.
 * <p>
 * The size is given either as an explicit replica count, as target lateral dimensions, or
 * implicitly by the lateral extent of a protein to embed plus a margin on each side.
 *
 * @param mode which of the fields below applies
 * @param nx replicas along x ({@link Mode#PATCHES})
 * @param ny replicas along y ({@link Mode#PATCHES})
 * @param dimX target length along x ({@link Mode#DIMENSIONS})
 * @param dimY target length along y ({@link Mode#DIMENSIONS})
 * @param margin lipid margin around the protein ({@link Mode#PROTEIN})
 */
public record QuiltSize(Mode mode, int nx, int ny, double dimX, double dimY, double margin) {

    public enum Mode { PATCHES, DIMENSIONS, PROTEIN }

    public static QuiltSize patches(int nx, int ny) {
        if (nx < 1 || ny < 1) {
            throw new IllegalArgumentException("Replica counts must be positive: " + nx + "x" + ny);
        }
        return new QuiltSize(Mode.PATCHES, nx, ny, 0, 0, 0);
    }

    public static QuiltSize dimensions(double x, double y) {
        if (!(x > 0) || !(y > 0)) {
            throw new IllegalArgumentException("Quilt dimensions must be positive: " + x + "x" + y);
        }
        return new QuiltSize(Mode.DIMENSIONS, 0, 0, x, y, 0);
    }

    public static QuiltSize aroundProtein(double margin) {
        return new QuiltSize(Mode.PROTEIN, 0, 0, 0, 0, margin);
    }

    /**
     * Resolves the replica counts.
     *
     * @param patchX patch length along x
     * @param patchY patch length along y
     * @param proteinExtent {minx, miny, minz, maxx, maxy, maxz} of the protein, or null if
     *                      there is none
     * @return {nx, ny}
     */
    public int[] resolve(double patchX, double patchY, double[] proteinExtent) {
        return switch (mode) {
            case PATCHES -> new int[]{nx, ny};
            case DIMENSIONS -> new int[]{(int) (dimX / patchX) + 1, (int) (dimY / patchY) + 1};
            case PROTEIN -> {
                if (proteinExtent == null) {
                    yield new int[]{1, 1};
                }
                double lx = proteinExtent[3] - proteinExtent[0] + 2 * margin;
                double ly = proteinExtent[4] - proteinExtent[1] + 2 * margin;
                yield new int[]{(int) (lx / patchX) + 1, (int) (ly / patchY) + 1};
            }
        };
    }
}
