package io.ringleader.leader.state;

import io.ringleader.error.LeaderException;
import io.ringleader.model.ProducerId;
import lombok.experimental.UtilityClass;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary layout of the persisted {@link LeaderState}:
 * <pre>
 * byte formatVersion | byte tag | tag fields
 * </pre>
 * Strings are modified UTF-8, lists are an int count followed by the items.
 */
@UtilityClass
public final class LeaderStateCodec {
    private static final byte FORMAT_VERSION = 1;

    private static final byte TAG_INIT = 0;
    private static final byte TAG_LOST_PRODUCER = 1;
    private static final byte TAG_WAITING_BARRIER = 2;
    private static final byte TAG_COMPUTING_SELECTION = 3;
    private static final byte TAG_IDLE = 4;

    public byte[] encode(final LeaderState state) {
        final ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
        try (final DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeByte(FORMAT_VERSION);
            if (state instanceof LeaderState.Init) {
                out.writeByte(TAG_INIT);
            } else if (state instanceof LeaderState.LostProducer lost) {
                out.writeByte(TAG_LOST_PRODUCER);
                out.writeUTF(lost.lostProducerId().value());
                out.writeUTF(lost.executionId());
            } else if (state instanceof LeaderState.WaitingBarrier waiting) {
                out.writeByte(TAG_WAITING_BARRIER);
                out.writeLong(waiting.leaseId());
                out.writeUTF(waiting.barrierKey());
                out.writeInt(waiting.waitFor().size());
                for (final String k : waiting.waitFor()) {
                    out.writeUTF(k);
                }
            } else if (state instanceof LeaderState.ComputingProducerSelection) {
                out.writeByte(TAG_COMPUTING_SELECTION);
            } else if (state instanceof LeaderState.Idle idle) {
                out.writeByte(TAG_IDLE);
                out.writeUTF(idle.producerId().value());
                out.writeUTF(idle.executionId());
            } else {
                throw new IllegalArgumentException("Unknown leader state " + state);
            }
        } catch (final IOException ioe) {
            throw new UncheckedIOException(ioe);
        }
        return bytes.toByteArray();
    }

    /**
     * @throws LeaderException {@code CORRUPTED_STATE} on any malformed record
     */
    public LeaderState decode(final byte[] raw) {
        try (final DataInputStream in = new DataInputStream(new ByteArrayInputStream(raw))) {
            final byte version = in.readByte();
            if (version != FORMAT_VERSION) {
                throw new IOException("unsupported format version " + version);
            }
            final byte tag = in.readByte();
            final LeaderState state = switch (tag) {
                case TAG_INIT -> new LeaderState.Init();
                case TAG_LOST_PRODUCER -> new LeaderState.LostProducer(new ProducerId(in.readUTF()), in.readUTF());
                case TAG_WAITING_BARRIER -> {
                    final long leaseId = in.readLong();
                    final String barrierKey = in.readUTF();
                    final int count = in.readInt();
                    if (count < 0) throw new IOException("negative participant count " + count);
                    final List<String> waitFor = new ArrayList<>(Math.min(count, 1024));
                    for (int i = 0; i < count; i++) {
                        waitFor.add(in.readUTF());
                    }
                    yield new LeaderState.WaitingBarrier(leaseId, barrierKey, waitFor);
                }
                case TAG_COMPUTING_SELECTION -> new LeaderState.ComputingProducerSelection();
                case TAG_IDLE -> new LeaderState.Idle(new ProducerId(in.readUTF()), in.readUTF());
                default -> throw new IOException("unknown state tag " + tag);
            };
            if (in.available() > 0) {
                throw new IOException(in.available() + " trailing byte(s)");
            }
            return state;
        } catch (final IOException | IllegalArgumentException e) {
            throw new LeaderException(LeaderException.Kind.CORRUPTED_STATE, "undecodable leader state record", e);
        }
    }
}
