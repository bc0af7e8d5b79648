package io.ringleader.store.type;

import lombok.Getter;

/**
 * A watch asked for history the store has already discarded.
 */
@Getter
public final class CompactedRevisionException extends RuntimeException {
    private final long requestedRevision;
    private final long compactRevision;

    public CompactedRevisionException(final long requestedRevision, final long compactRevision) {
        super("required revision " + requestedRevision + " has been compacted, oldest available is " + compactRevision);
        this.requestedRevision = requestedRevision;
        this.compactRevision = compactRevision;
    }
}
