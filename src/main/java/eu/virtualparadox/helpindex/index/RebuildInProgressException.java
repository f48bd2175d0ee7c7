package eu.virtualparadox.helpindex.index;

public class RebuildInProgressException extends IllegalStateException {

    public RebuildInProgressException() {
        super("An index rebuild is already running");
    }
}
