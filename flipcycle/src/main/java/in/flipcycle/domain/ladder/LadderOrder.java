package in.flipcycle.domain.ladder;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * The aggregate entry ladder of one cycle.
 *
 * avgEntry, filledSize and filledValue cover filled rungs only and are
 * maintained by FillTracker. avgEntry is zero until the first fill.
 */
public record LadderOrder(
    String asset,
    List<LadderRung> rungs,
    BigDecimal totalCapital,
    BigDecimal avgEntry,
    BigDecimal filledSize,
    BigDecimal filledValue,
    BigDecimal hardStop,
    BigDecimal takeProfit
) {
    public LadderOrder {
        rungs = List.copyOf(rungs);
    }

    public static LadderOrder unfilled(String asset, List<LadderRung> rungs, BigDecimal totalCapital,
                                       BigDecimal hardStop, BigDecimal takeProfit) {
        return new LadderOrder(asset, rungs, totalCapital, BigDecimal.ZERO, BigDecimal.ZERO,
            BigDecimal.ZERO, hardStop, takeProfit);
    }

    public LadderRung rung(int index) {
        return rungs.get(index);
    }

    public int size() {
        return rungs.size();
    }

    public boolean hasFills() {
        return filledSize.signum() > 0;
    }

    public long filledCount() {
        return rungs.stream().filter(LadderRung::isFilled).count();
    }

    public boolean allFilled() {
        return rungs.stream().allMatch(LadderRung::isFilled);
    }

    public boolean hasOpenRungs() {
        return rungs.stream().anyMatch(LadderRung::isOpen);
    }

    /**
     * Replace a rung for order bookkeeping (placed, failed, cancelled). Fill
     * totals are untouched; fills go through FillTracker.
     */
    public LadderOrder withRung(int index, LadderRung rung) {
        if (rungs.get(index).isFilled() && !rung.isFilled()) {
            throw new IllegalStateException("Rung " + index + " is filled and cannot un-fill");
        }
        List<LadderRung> copy = new ArrayList<>(rungs);
        copy.set(index, rung);
        return new LadderOrder(asset, copy, totalCapital, avgEntry, filledSize, filledValue, hardStop, takeProfit);
    }
}
