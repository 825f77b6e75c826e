package net.gridcoord.core.model;

/** 작을수록 먼저 처리된다. 동점은 Matcher가 생성 시각(FIFO)으로 푼다. */
public record PriorityKey(double weightedUsage) implements Comparable<PriorityKey> {
    @Override
    public int compareTo(PriorityKey o) {
        return Double.compare(weightedUsage, o.weightedUsage);
    }
}
