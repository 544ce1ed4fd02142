package personal.pair.booking.domain.model;

public enum PairOperation {
    RESERVE("reserve"),
    CANCEL("cancel");

    private final String verb;

    PairOperation(String verb) {
        this.verb = verb;
    }

    public String verb() {
        return verb;
    }
}
