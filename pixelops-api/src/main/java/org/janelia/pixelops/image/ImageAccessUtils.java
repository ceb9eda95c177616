package org.janelia.pixelops.image;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

public class ImageAccessUtils {

    /**
     * @param shape
     * @return the inclusive max interval bound.
     */
    public static long[] getMax(long[] shape) {
        long[] m = new long[shape.length];
        for (int d = 0; d < shape.length; d++) {
            m[d] = shape[d] - 1;
        }
        return m;
    }

    public static long getMaxSize(long[] shape) {
        long sz = 1;
        for (long d : shape) {
            sz *= d;
        }
        return sz;
    }

    /**
     * Count normalized samples into nbins bins.
     */
    public static <T extends RealType<T>> long[] histogram(RandomAccessibleInterval<T> image, int nbins) {
        long[] bins = new long[nbins];
        Cursor<T> cursor = Views.flatIterable(image).cursor();
        while (cursor.hasNext()) {
            int bin = PixelOps.toBin(cursor.next().getRealDouble(), nbins);
            bins[bin] = bins[bin] + 1;
        }
        return bins;
    }

}
