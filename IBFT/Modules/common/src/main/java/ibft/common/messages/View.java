package ibft.common.messages;

public record View(long height, long round) implements Comparable<View> {

    public View {
        if (height < 0 || round < 0) {
            throw new IllegalArgumentException("view must be non-negative: (" + height + "," + round + ")");
        }
    }

    public View nextRound() { return new View(height, round + 1); }

    public View withRound(long r) { return new View(height, r); }

    @Override
    public int compareTo(View o) {
        int c = Long.compare(height, o.height);
        return c != 0 ? c : Long.compare(round, o.round);
    }

    @Override
    public String toString() { return "(" + height + "," + round + ")"; }
}
