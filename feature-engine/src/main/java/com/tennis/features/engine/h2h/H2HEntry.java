package com.tennis.features.engine.h2h;

/**
 * Win tally of one unordered pair, stored in canonical (min id, max id) order.
 */
public class H2HEntry {

    private int winsForMin;
    private int winsForMax;

    public H2HEntry() {
    }

    private H2HEntry(int winsForMin, int winsForMax) {
        this.winsForMin = winsForMin;
        this.winsForMax = winsForMax;
    }

    void recordWin(boolean minWon) {
        if (minWon) {
            winsForMin++;
        } else {
            winsForMax++;
        }
    }

    public int getWinsForMin() { return winsForMin; }
    public int getWinsForMax() { return winsForMax; }

    H2HEntry copy() {
        return new H2HEntry(winsForMin, winsForMax);
    }
}
