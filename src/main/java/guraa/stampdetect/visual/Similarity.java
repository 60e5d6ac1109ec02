package guraa.stampdetect.visual;

/**
 * Similarity measures over feature vectors. All are symmetric in their arguments.
 */
public final class Similarity {

    private Similarity() {
    }

    public static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Cosine of the angle between two vectors, in [-1, 1]. Two all-zero vectors count as
     * identical; a zero vector against a non-zero one scores 0.
     */
    public static double cosine(float[] a, float[] b) {
        int n = Math.min(a.length, b.length);
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < n; i++) {
            double ai = a[i];
            double bi = b[i];
            dot += ai * bi;
            normA += ai * ai;
            normB += bi * bi;
        }
        if (normA == 0 && normB == 0) {
            return 1.0;
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        double cos = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cos));
    }

    /**
     * Zero-mean normalized cross-correlation, clamped to [0, 1].
     */
    public static double ncc(float[] a, float[] b) {
        int n = Math.min(a.length, b.length);
        if (n == 0) {
            return 0.0;
        }
        double meanA = 0, meanB = 0;
        for (int i = 0; i < n; i++) {
            meanA += a[i];
            meanB += b[i];
        }
        meanA /= n;
        meanB /= n;

        double num = 0, denA = 0, denB = 0;
        for (int i = 0; i < n; i++) {
            double da = a[i] - meanA;
            double db = b[i] - meanB;
            num += da * db;
            denA += da * da;
            denB += db * db;
        }
        if (denA == 0 && denB == 0) {
            return 1.0;
        }
        return clamp01(num / (Math.sqrt(denA * denB) + 1e-8));
    }

    /**
     * Bhattacharyya coefficient of two normalized histograms, 1 for identical distributions.
     */
    public static double bhattacharyya(double[] p, double[] q) {
        int n = Math.min(p.length, q.length);
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += Math.sqrt(Math.max(0, p[i]) * Math.max(0, q[i]));
        }
        return clamp01(sum);
    }
}
