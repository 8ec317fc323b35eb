/**
 *
 */
package org.theseed.flatfile.stats;

/**
 * Base-composition statistics for a nucleotide sequence.  Counting is case-insensitive, and U is
 * counted with T.
 *
 * @author Bruce Parrello
 *
 */
public class SequenceStats {

    // FIELDS
    private final int length;
    private final int aCount;
    private final int cCount;
    private final int gCount;
    private final int tCount;
    private final int nCount;
    private final int otherCount;

    private SequenceStats(int length, int[] counts) {
        this.length = length;
        this.aCount = counts[0];
        this.cCount = counts[1];
        this.gCount = counts[2];
        this.tCount = counts[3];
        this.nCount = counts[4];
        this.otherCount = counts[5];
    }

    /**
     * Compute the statistics for a sequence.
     *
     * @param sequence	sequence to analyze
     *
     * @return the statistics object
     */
    public static SequenceStats of(String sequence) {
        int[] counts = new int[6];
        final int n = sequence.length();
        for (int i = 0; i < n; i++) {
            switch (Character.toUpperCase(sequence.charAt(i))) {
            case 'A' -> counts[0]++;
            case 'C' -> counts[1]++;
            case 'G' -> counts[2]++;
            case 'T', 'U' -> counts[3]++;
            case 'N' -> counts[4]++;
            default -> counts[5]++;
            }
        }
        return new SequenceStats(n, counts);
    }

    /**
     * @return the sequence length
     */
    public int getLength() {
        return this.length;
    }

    public int getACount() {
        return this.aCount;
    }

    public int getCCount() {
        return this.cCount;
    }

    public int getGCount() {
        return this.gCount;
    }

    /**
     * @return the number of T (or U) bases
     */
    public int getTCount() {
        return this.tCount;
    }

    public int getNCount() {
        return this.nCount;
    }

    /**
     * @return the number of characters that are not A, C, G, T, U, or N
     */
    public int getOtherCount() {
        return this.otherCount;
    }

    /**
     * @return the number of G and C bases
     */
    public int getGcCount() {
        return this.gCount + this.cCount;
    }

    /**
     * @return the percentage of the sequence that is G or C, or 0 for an empty sequence
     */
    public double getGcPercent() {
        return percent(this.getGcCount());
    }

    /**
     * @return the percentage of the sequence that is N, or 0 for an empty sequence
     */
    public double getNPercent() {
        return percent(this.nCount);
    }

    /**
     * @return a count as a percentage of the length
     *
     * @param count		count to convert
     */
    private double percent(int count) {
        double retVal = 0.0;
        if (this.length > 0)
            retVal = count * 100.0 / this.length;
        return retVal;
    }

}
