package eu.virtualparadox.pdfrag.ingest.lifecycle.result;

/**
 * What a deletion did to one store.
 *
 * @param store   the store
 * @param outcome removed, nothing to remove, partially removed, or failed
 * @param count   number of removed items (records, files), {@code 0} if none
 * @param error   failure message, {@code null} unless {@code outcome} is {@link EOutcome#FAILED}
 *                or {@link EOutcome#PARTIAL}
 */
public record StoreOutcome(EStore store, EOutcome outcome, long count, String error) {

    public static StoreOutcome removed(final EStore store, final long count) {
        return new StoreOutcome(store, EOutcome.REMOVED, count, null);
    }

    public static StoreOutcome nothing(final EStore store) {
        return new StoreOutcome(store, EOutcome.NOTHING_TO_REMOVE, 0, null);
    }

    public static StoreOutcome partial(final EStore store, final long count, final String error) {
        return new StoreOutcome(store, EOutcome.PARTIAL, count, error);
    }

    public static StoreOutcome failed(final EStore store, final String error) {
        return new StoreOutcome(store, EOutcome.FAILED, 0, error);
    }

    /**
     * @return {@code true} if the store changed, including a partial removal
     */
    public boolean isRemoved() {
        return outcome == EOutcome.REMOVED || outcome == EOutcome.PARTIAL;
    }

    /**
     * @return {@code true} if the store failed, including a partial removal
     */
    public boolean isFailed() {
        return outcome == EOutcome.FAILED || outcome == EOutcome.PARTIAL;
    }
}
