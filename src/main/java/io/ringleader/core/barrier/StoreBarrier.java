package io.ringleader.core.barrier;

import io.ringleader.error.LeaderException;
import io.ringleader.path.KeyPaths;
import io.ringleader.store.model.KeyValue;
import io.ringleader.store.model.WatchEvent;
import io.ringleader.store.type.CoordinationStore;
import io.ringleader.store.type.StoreFutures;
import io.ringleader.store.type.StoreWatch;
import io.ringleader.store.type.WatchListener;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Barrier whose record lives at its key and whose arrivals live under
 * {@code <key>/arrived/<participant>}, all on the barrier lease.
 */
@Slf4j
final class StoreBarrier implements Barrier {
    private static final byte FORMAT_VERSION = 1;

    private final CoordinationStore store;
    private final String key;
    private final long leaseId;
    private final List<String> participants;
    private final String arrivalPrefix;

    StoreBarrier(final CoordinationStore store, final String key, final long leaseId, final List<String> participants) {
        this.store = store;
        this.key = key;
        this.leaseId = leaseId;
        this.participants = List.copyOf(participants);
        this.arrivalPrefix = KeyPaths.barrierArrivalPrefix(key);
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public long leaseId() {
        return leaseId;
    }

    @Override
    public List<String> participants() {
        return participants;
    }

    @Override
    public CompletableFuture<Void> arrive(final String participant) {
        if (!participants.contains(participant)) {
            return CompletableFuture.failedFuture(
                    new IllegalArgumentException(participant + " is not a participant of barrier " + key));
        }
        return store.put(KeyPaths.barrierArrivalKey(key, participant), new byte[0], leaseId)
                .thenApply(rev -> null);
    }

    @Override
    public CompletableFuture<Void> await() {
        final CompletableFuture<Void> done = new CompletableFuture<>();
        final Set<String> pending = ConcurrentHashMap.newKeySet();
        pending.addAll(participants);
        if (pending.isEmpty()) {
            done.complete(null);
            return done;
        }

        store.scan(key).whenComplete((scan, err) -> {
            if (err != null) {
                done.completeExceptionally(StoreFutures.translate(err, "barrier scan on " + key));
                return;
            }
            boolean present = false;
            for (final KeyValue kv : scan.keyValues()) {
                if (kv.key().equals(key)) {
                    present = true;
                } else if (kv.key().startsWith(arrivalPrefix)) {
                    arrived(kv.key(), pending, done);
                }
            }
            if (!present) {
                done.completeExceptionally(expired());
                return;
            }
            if (done.isDone()) return;

            // Continue from the scan revision so arrivals made meanwhile are replayed.
            final StoreWatch watch;
            try {
                watch = store.watch(key, scan.nextRevision(), new WatchListener() {
                    @Override
                    public void onEvent(final WatchEvent event) {
                        if (event.key().equals(key)) {
                            if (event.type() == WatchEvent.Type.DELETE) done.completeExceptionally(expired());
                        } else if (event.type() == WatchEvent.Type.PUT && event.key().startsWith(arrivalPrefix)) {
                            arrived(event.key(), pending, done);
                        }
                    }

                    @Override
                    public void onError(final Throwable error) {
                        done.completeExceptionally(StoreFutures.translate(error, "barrier watch on " + key));
                    }
                });
            } catch (final RuntimeException e) {
                done.completeExceptionally(StoreFutures.translate(e, "barrier watch on " + key));
                return;
            }
            done.whenComplete((v, e) -> watch.close());
        });
        return done;
    }

    private void arrived(final String arrivalKey,
                         final Set<String> pending,
                         final CompletableFuture<Void> done) {
        final String participant = arrivalKey.substring(arrivalPrefix.length());
        if (pending.remove(participant)) {
            log.debug("Barrier {}: {} arrived, {} pending", key, participant, pending.size());
            if (pending.isEmpty()) done.complete(null);
        }
    }

    private LeaderException expired() {
        return new LeaderException(LeaderException.Kind.BARRIER_TIMEOUT,
                "barrier " + key + " lease expired before every participant arrived");
    }

    byte[] encode() {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (final DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeByte(FORMAT_VERSION);
            out.writeLong(leaseId);
            out.writeInt(participants.size());
            for (final String p : participants) {
                out.writeUTF(p);
            }
        } catch (final IOException ioe) {
            throw new UncheckedIOException(ioe);
        }
        return bytes.toByteArray();
    }

    static StoreBarrier decode(final CoordinationStore store, final String key, final byte[] value) {
        try (final DataInputStream in = new DataInputStream(new ByteArrayInputStream(value))) {
            final byte version = in.readByte();
            if (version != FORMAT_VERSION) {
                throw new IOException("unknown barrier record version " + version);
            }
            final long leaseId = in.readLong();
            final int count = in.readInt();
            if (count < 0) throw new IOException("negative participant count");
            final List<String> participants = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                participants.add(in.readUTF());
            }
            if (in.available() > 0) throw new IOException("trailing bytes in barrier record");
            return new StoreBarrier(store, key, leaseId, participants);
        } catch (final IOException ioe) {
            throw new LeaderException(LeaderException.Kind.CORRUPTED_STATE, "unreadable barrier record at " + key, ioe);
        }
    }
}
